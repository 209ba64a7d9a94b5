package com.ryuqq.spreadfork.testkit.contract;

import com.ryuqq.spreadfork.fork.storage.LocalForkStorage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Local storage with one-shot fault injection.
 *
 * <p><strong>Faults:</strong></p>
 * <ul>
 *   <li>{@link #failNextCopy(String)}: writes a truncated target, then throws</li>
 *   <li>{@link #failNextPromote(String)}: throws before moving the staged file</li>
 *   <li>{@link #beforeNextDigest(Runnable)}: runs a hook in the middle of fork creation,
 *       after the working copy exists and before the registry entry is inserted</li>
 * </ul>
 *
 * <p>Every fault fires once and then disarms itself.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public class FaultInjectingStorage extends LocalForkStorage {

    private final AtomicReference<String> copyFailure = new AtomicReference<>();
    private final AtomicReference<String> promoteFailure = new AtomicReference<>();
    private final AtomicReference<Runnable> digestHook = new AtomicReference<>();

    public void failNextCopy(String message) {
        copyFailure.set(message);
    }

    public void failNextPromote(String message) {
        promoteFailure.set(message);
    }

    public void beforeNextDigest(Runnable hook) {
        digestHook.set(hook);
    }

    @Override
    public void copy(Path source, Path target) throws IOException {
        String failure = copyFailure.getAndSet(null);
        if (failure != null) {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.writeString(target, "PK-partial");
            throw new IOException(failure);
        }
        super.copy(source, target);
    }

    @Override
    public void promote(Path staged, Path target) throws IOException {
        String failure = promoteFailure.getAndSet(null);
        if (failure != null) {
            throw new IOException(failure);
        }
        super.promote(staged, target);
    }

    @Override
    public String digest(Path path) throws IOException {
        Runnable hook = digestHook.getAndSet(null);
        if (hook != null) {
            hook.run();
        }
        return super.digest(path);
    }
}
