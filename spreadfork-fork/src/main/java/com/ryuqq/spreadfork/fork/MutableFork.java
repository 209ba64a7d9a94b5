package com.ryuqq.spreadfork.fork;

import com.ryuqq.spreadfork.core.model.EditRecord;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.core.model.WorkbookId;

import java.nio.file.Path;
import java.util.List;

/**
 * View of a fork handed to a {@link ForkMutator}.
 *
 * <p>The mutator writes to {@link #stagingPath()}, a private copy of the working file. The
 * staging file replaces the working copy only if the mutator returns normally; edits
 * recorded here are committed together with it.</p>
 *
 * <p>Valid only for the duration of the mutator call.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public interface MutableFork {

    ForkId forkId();

    WorkbookId workbookId();

    /**
     * @return file the mutator must write to
     */
    Path stagingPath();

    /**
     * @return current working copy, read-only for the mutator
     */
    Path workPath();

    /**
     * @return version the mutation was validated against
     */
    long version();

    /**
     * @return committed edits followed by the ones recorded in this mutation
     */
    List<EditRecord> edits();

    void recordEdit(EditRecord edit);

    /**
     * Keeps the first {@code count} edits and drops the rest.
     *
     * @param count number of edits to keep
     */
    void truncateEdits(int count);
}
