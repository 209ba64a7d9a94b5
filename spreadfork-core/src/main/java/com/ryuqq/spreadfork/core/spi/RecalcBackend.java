package com.ryuqq.spreadfork.core.spi;

import java.io.IOException;
import java.nio.file.Path;

/**
 * External recalculation engine SPI.
 *
 * <p>Invoked per fork while that fork's recalc lock is held. The engine is assumed
 * non-reentrant on a given working file; it synchronously updates computed results in
 * place.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public interface RecalcBackend {

    /**
     * Recomputes formulas of the working copy in place.
     *
     * @param workPath fork working-copy location
     * @throws IOException if the engine fails or the file cannot be rewritten
     */
    void recalculate(Path workPath) throws IOException;

    /**
     * @return true when the engine is installed and usable
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * @return engine name reported in recalculation results
     */
    String name();
}
