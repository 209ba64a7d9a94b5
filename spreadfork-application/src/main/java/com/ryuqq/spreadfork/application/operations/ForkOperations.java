package com.ryuqq.spreadfork.application.operations;

import com.ryuqq.spreadfork.cache.CacheStats;
import com.ryuqq.spreadfork.cache.CachedWorkbook;
import com.ryuqq.spreadfork.core.model.Checkpoint;
import com.ryuqq.spreadfork.core.model.CheckpointId;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.core.model.ForkSummary;
import com.ryuqq.spreadfork.core.model.RecalcResult;
import com.ryuqq.spreadfork.core.outcome.Outcome;
import com.ryuqq.spreadfork.fork.ForkMutator;
import com.ryuqq.spreadfork.fork.lock.RecalcLease;

import java.nio.file.Path;
import java.util.List;

/**
 * Operation surface of the fork engine.
 *
 * <p>Every call returns an {@link Outcome} instead of throwing. Callers branch on the
 * three shapes the same way for every operation:</p>
 *
 * <p><strong>Outcome mapping:</strong></p>
 * <ul>
 *   <li>{@code Ok}: the operation completed, {@code value()} carries the result</li>
 *   <li>{@code Retry}: version conflict or lock timeout. For a version conflict
 *       {@code currentVersion()} is the version to retry against.</li>
 *   <li>{@code Fail}: {@code NOT_FOUND}, {@code IO_FAILURE}, {@code INVALID_REQUEST},
 *       {@code INVALID_STATE} or {@code LOCK_TABLE_CORRUPTION}</li>
 * </ul>
 *
 * <p><strong>Typical flow:</strong></p>
 * <pre>
 * Outcome&lt;ForkId&gt; created = operations.createFork("wb-7k2m9xq4ab");
 * ForkId forkId = created.valueOrNull();
 *
 * long version = 0;
 * Outcome&lt;Void&gt; edited = operations.editFork(forkId, version, fork -&gt; {
 *     writer.setCell(fork.stagingPath(), "Sheet1", "B2", "42");
 *     fork.recordEdit(EditRecord.value("Sheet1", "B2", "42"));
 *     return null;
 * });
 * if (edited instanceof Retry&lt;Void&gt; retry) {
 *     version = retry.currentVersion();   // re-read and try again
 * }
 *
 * operations.recalculate(forkId);
 * operations.saveFork(forkId, Path.of("out/budget-v2.xlsx"), true);
 * </pre>
 *
 * <p><strong>Cache coherence:</strong> operations that rewrite a file on disk (edits,
 * restores, recalculation, save over a path) evict any cached handle for that path, so a
 * later {@link #openWorkbook(String)} reloads fresh content.</p>
 *
 * @param <H> parsed workbook handle type of the underlying cache
 * @author Spreadfork Team
 * @since 1.0.0
 */
public interface ForkOperations<H> {

    /**
     * Creates a fork of a workspace workbook.
     *
     * @param workbookIdOrAlias canonical id ({@code wb-...}) or its short alias
     * @return new fork id
     */
    Outcome<ForkId> createFork(String workbookIdOrAlias);

    /**
     * Writes the working copy to {@code target} (or back over the base when null).
     *
     * @param forkId fork id
     * @param target destination, or null for the base file
     * @param dropFork whether the fork ends after saving
     * @return saved path
     */
    Outcome<Path> saveFork(ForkId forkId, Path target, boolean dropFork);

    /**
     * Drops the fork and its files without saving.
     */
    Outcome<Void> discardFork(ForkId forkId);

    /**
     * Snapshots the working copy. The version does not change.
     */
    Outcome<Checkpoint> checkpointFork(ForkId forkId, String label);

    Outcome<List<Checkpoint>> listCheckpoints(ForkId forkId);

    /**
     * Restores a checkpoint snapshot under the optimistic version check.
     *
     * @param forkId fork id
     * @param expectedVersion version the caller last observed
     * @param checkpointId checkpoint to restore
     * @return restored checkpoint
     */
    Outcome<Checkpoint> restoreCheckpoint(ForkId forkId, long expectedVersion, CheckpointId checkpointId);

    Outcome<Void> deleteCheckpoint(ForkId forkId, CheckpointId checkpointId);

    /**
     * Runs a versioned mutation against the fork.
     *
     * <p>The mutator is invoked at most once and only when {@code expectedVersion} equals
     * the current version. On success the version increases by exactly one.</p>
     *
     * @param forkId fork id
     * @param expectedVersion version the caller last observed
     * @param mutator edit applied to the staging copy
     * @param <T> mutator result type
     * @return mutator result
     */
    <T> Outcome<T> editFork(ForkId forkId, long expectedVersion, ForkMutator<T> mutator);

    /**
     * Recalculates the fork's working copy with the configured backend.
     * Serialized per fork, concurrent across forks.
     */
    Outcome<RecalcResult> recalculate(ForkId forkId);

    /**
     * Hands out a lease on the fork's recalculation lock. The caller must close it.
     */
    Outcome<RecalcLease> acquireRecalcLock(ForkId forkId);

    /**
     * Prunes the fork's recalculation lock entry when nobody references it.
     *
     * @return true when no entry remains for the fork
     */
    Outcome<Boolean> releaseRecalcLock(ForkId forkId);

    Outcome<List<ForkSummary>> listForks();

    Outcome<ForkSummary> getFork(ForkId forkId);

    Outcome<Path> getForkPath(ForkId forkId);

    /**
     * Opens a workbook through the LRU cache. Fork ids resolve to their working copies.
     */
    Outcome<CachedWorkbook<H>> openWorkbook(String workbookIdOrAlias);

    Outcome<Boolean> closeWorkbook(String workbookIdOrAlias);

    /**
     * Drops the cached handle whose file is {@code path}.
     *
     * @return true when an entry was evicted
     */
    Outcome<Boolean> evictByPath(Path path);

    Outcome<Path> resolveWorkbookPath(String workbookIdOrAlias);

    Outcome<CacheStats> cacheStats();
}
