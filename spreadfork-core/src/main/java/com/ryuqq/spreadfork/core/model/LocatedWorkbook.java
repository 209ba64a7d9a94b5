package com.ryuqq.spreadfork.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Result of resolving a workbook id or alias against the workspace.
 *
 * @param workbookId canonical workbook id
 * @param shortId case-insensitive alias
 * @param path absolute file location
 * @param modifiedAt last modification time, used to rank cache warming candidates
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record LocatedWorkbook(WorkbookId workbookId, String shortId, Path path, Instant modifiedAt) {

    public LocatedWorkbook {
        if (workbookId == null) {
            throw new IllegalArgumentException("workbookId cannot be null");
        }
        if (shortId == null || shortId.isBlank()) {
            throw new IllegalArgumentException("shortId cannot be null or blank");
        }
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (modifiedAt == null) {
            modifiedAt = Instant.EPOCH;
        }
    }
}
