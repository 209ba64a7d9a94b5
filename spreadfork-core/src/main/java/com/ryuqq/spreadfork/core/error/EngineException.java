package com.ryuqq.spreadfork.core.error;

/**
 * Base type of every error the fork engine surfaces to callers.
 *
 * <p>Each instance carries the {@link ErrorKind}, the name of the operation that failed
 * and enough context (fork id, expected and actual version, path) for the caller to
 * construct a retry or a diagnostic message.</p>
 *
 * <p>Argument validation keeps using {@link IllegalArgumentException} and lifecycle or
 * limit violations use {@link IllegalStateException}; this hierarchy is reserved for the
 * engine's own failure taxonomy.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public abstract class EngineException extends RuntimeException {

    private final ErrorKind kind;
    private final String operation;

    protected EngineException(ErrorKind kind, String operation, String message) {
        this(kind, operation, message, null);
    }

    protected EngineException(ErrorKind kind, String operation, String message, Throwable cause) {
        super("[" + operation + "] " + message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        this.kind = kind;
        this.operation = operation;
    }

    /**
     * @return error classification
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return name of the failed operation (e.g. {@code create_fork})
     */
    public String operation() {
        return operation;
    }
}
