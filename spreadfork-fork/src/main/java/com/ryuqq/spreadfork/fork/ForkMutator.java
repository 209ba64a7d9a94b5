package com.ryuqq.spreadfork.fork;

import java.io.IOException;

/**
 * Mutation applied through {@link ForkRegistry#withForkMutVersioned}.
 *
 * <p>Throwing leaves the working copy and version untouched. {@link IOException} is
 * reported as an I/O failure, unchecked exceptions propagate as they are.</p>
 *
 * @param <T> result type
 * @author Spreadfork Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ForkMutator<T> {

    T apply(MutableFork fork) throws IOException;
}
