package com.ryuqq.spreadfork.core.spi;

import com.ryuqq.spreadfork.core.model.WorkbookId;

import java.nio.file.Path;

/**
 * Resolves the file a new fork is copied from.
 *
 * <p>The workbook cache implements this so fork creation sees the same id, alias and
 * fork-of-fork resolution as {@code open_workbook}.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SourceResolver {

    /**
     * @param workbookId workbook or fork id
     * @return absolute source location
     * @throws com.ryuqq.spreadfork.core.error.NotFoundException if the id is unknown
     * @throws com.ryuqq.spreadfork.core.error.IoFailureException if resolution needs a scan that fails
     */
    Path resolveSource(WorkbookId workbookId);
}
