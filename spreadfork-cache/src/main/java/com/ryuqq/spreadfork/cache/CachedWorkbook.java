package com.ryuqq.spreadfork.cache;

import com.ryuqq.spreadfork.core.model.WorkbookId;

import java.nio.file.Path;

/**
 * Workbook returned by {@link WorkbookCache#openWorkbook(String)}.
 *
 * <p>The handle stays usable after the entry is evicted; the cache never closes it.</p>
 *
 * @param workbookId canonical id (or fork id)
 * @param shortId alias shown to callers
 * @param path location the handle was loaded from
 * @param handle parsed document
 * @param <H> handle type
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record CachedWorkbook<H>(WorkbookId workbookId, String shortId, Path path, H handle) {
}
