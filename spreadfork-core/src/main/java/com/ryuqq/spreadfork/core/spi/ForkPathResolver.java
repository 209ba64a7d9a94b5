package com.ryuqq.spreadfork.core.spi;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Looks up the working-copy location of a live fork.
 *
 * <p>Lets the workbook cache open a fork's working copy by fork id without depending on
 * the registry module.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ForkPathResolver {

    /**
     * No forks: every lookup is empty.
     */
    ForkPathResolver NONE = candidate -> Optional.empty();

    /**
     * @param candidate raw id as supplied by the caller
     * @return working-copy path when {@code candidate} names a live fork
     */
    Optional<Path> findForkPath(String candidate);
}
