package com.ryuqq.spreadfork.core.error;

/**
 * Internal-consistency violation between the recalc lock table and the fork map.
 *
 * <p>Fatal: the caller cannot fix it by retrying.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public class LockTableCorruptionException extends EngineException {

    public LockTableCorruptionException(String operation, String message) {
        super(ErrorKind.LOCK_TABLE_CORRUPTION, operation, message);
    }
}
