package com.ryuqq.spreadfork.core.spi;

import com.ryuqq.spreadfork.core.model.LocatedWorkbook;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Source document storage SPI: discovers workbooks and resolves ids or aliases to files.
 *
 * <p>Both methods may scan the filesystem. Callers must not hold any lock while invoking
 * them.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public interface WorkbookLocator {

    /**
     * Resolves a canonical id or short alias (case-insensitive) to a workbook.
     *
     * @param idOrAlias canonical id or alias
     * @return located workbook, or empty if nothing matches
     * @throws IOException if the scan fails
     */
    Optional<LocatedWorkbook> locate(String idOrAlias) throws IOException;

    /**
     * Lists every workbook in the workspace.
     *
     * @return located workbooks (may be empty)
     * @throws IOException if the scan fails
     */
    List<LocatedWorkbook> discover() throws IOException;
}
