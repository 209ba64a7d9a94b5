package com.ryuqq.spreadfork.core.spi;

import com.ryuqq.spreadfork.core.model.WorkbookId;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parsed-document loader SPI.
 *
 * <p>The engine never parses workbook content. The cache stores only the opaque handle
 * this loader returns and hands the same handle to every reader until the entry is
 * evicted.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: may be invoked concurrently for different ids, and occasionally for
 *       the same id when two cache misses race (the losing result is discarded)</li>
 *   <li>Called without any cache lock held; may block on I/O</li>
 * </ul>
 *
 * @param <H> parsed-document handle type
 * @author Spreadfork Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkbookLoader<H> {

    /**
     * Loads and parses the workbook at the given location.
     *
     * @param workbookId canonical workbook id
     * @param path resolved file location
     * @return parsed-document handle (never null)
     * @throws IOException if the file cannot be read or parsed
     */
    H load(WorkbookId workbookId, Path path) throws IOException;
}
