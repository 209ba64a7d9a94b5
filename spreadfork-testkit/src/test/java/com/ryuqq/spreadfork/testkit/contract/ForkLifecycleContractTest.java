package com.ryuqq.spreadfork.testkit.contract;

import com.ryuqq.spreadfork.adapter.runner.ForkReaper;
import com.ryuqq.spreadfork.adapter.runner.ReaperConfig;
import com.ryuqq.spreadfork.core.config.ForkConfig;
import com.ryuqq.spreadfork.core.model.Checkpoint;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.core.model.ForkSummary;
import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.core.outcome.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: fork lifecycle from creation to save, discard or expiry.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Forks past their TTL are reaped with their files and checkpoints</li>
 *   <li>Saving is refused once the base changed underneath the fork</li>
 *   <li>Checkpoint restore rolls content and edit log back and bumps the version</li>
 *   <li>Forks can be forked again and addressed through the cache by fork id</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
class ForkLifecycleContractTest extends AbstractEngineContractTest {

    private static final Instant BASE_TIME = Instant.parse("2024-02-01T12:00:00Z");

    private WorkbookId baseId;

    @Override
    protected ForkConfig forkConfig(TestWorkspace workspace) {
        return super.forkConfig(workspace)
            .withTtl(Duration.ofMinutes(30))
            .withMaxCheckpointsPerFork(3);
    }

    @BeforeEach
    void writeBase() {
        workspace.write("budget.xlsx", "base", BASE_TIME);
        baseId = workspace.idOf("budget.xlsx");
    }

    private Path basePath() {
        return workspace.workspaceDir().resolve("budget.xlsx");
    }

    // ============================================================
    // Expiry
    // ============================================================

    @Test
    void testReaper_WhenTtlElapsed_ForkAndSnapshotsRemoved() {
        // Given
        ForkId stale = newFork(baseId);
        assertOk(operations.checkpointFork(stale, "before expiry"));
        clock.advance(Duration.ofMinutes(20));
        ForkId fresh = newFork(baseId);
        clock.advance(Duration.ofMinutes(15));
        ForkReaper reaper = new ForkReaper(registry, new ReaperConfig());

        // When
        List<ForkId> reaped = reaper.scan();

        // Then
        assertEquals(List.of(stale), reaped);
        assertFail(operations.getFork(stale), "NOT_FOUND");
        assertOk(operations.getFork(fresh));
        assertTrue(TestWorkspace.fileNames(workspace.checkpointDir()).isEmpty(),
            "Checkpoint snapshots of the reaped fork should be deleted");
        assertNoForkResidue();
    }

    @Test
    void testCreate_WhenExpiredForksExist_ExpiredOnesEvictedFirst() {
        // Given
        ForkId old = newFork(baseId);
        clock.advance(Duration.ofHours(1));

        // When
        ForkId created = newFork(baseId);

        // Then
        List<ForkSummary> live = assertOk(operations.listForks());
        assertEquals(1, live.size());
        assertEquals(created, live.get(0).forkId());
        assertFalse(registry.contains(old));
    }

    // ============================================================
    // Save
    // ============================================================

    @Test
    void testSave_WhenBaseModifiedAfterFork_InvalidStateAndBaseKept() {
        // Given
        ForkId forkId = newFork(baseId);
        assertOk(operations.editFork(forkId, 0, appending("+mine")));
        workspace.write("budget.xlsx", "theirs", BASE_TIME.plusSeconds(30));

        // When
        Outcome<Path> outcome = operations.saveFork(forkId, null, false);

        // Then
        assertTrue(assertFail(outcome, "INVALID_STATE").message().contains("base file modified"));
        assertEquals("PKtheirs", TestWorkspace.read(basePath()));
        assertVersion(forkId, 1);
    }

    @Test
    void testSave_WhenTargetIsNewPath_BaseUntouchedAndForkKept() {
        // Given
        ForkId forkId = newFork(baseId);
        assertOk(operations.editFork(forkId, 0, appending("+draft")));
        Path target = workspace.workspaceDir().resolve("exports/budget-v2.xlsx");

        // When
        Path saved = assertOk(operations.saveFork(forkId, target, false));

        // Then
        assertEquals(target, saved);
        assertEquals("PKbase+draft", TestWorkspace.read(target));
        assertEquals("PKbase", TestWorkspace.read(basePath()));
        assertOk(operations.getFork(forkId));
        assertEquals(List.of("budget-v2.xlsx"), TestWorkspace.fileNames(target.getParent()),
            "No temporary file should remain next to the target");
    }

    @Test
    void testSave_WhenSavedOverBaseTwice_SecondSaveAccepted() {
        // Given
        ForkId forkId = newFork(baseId);
        assertOk(operations.editFork(forkId, 0, appending("+one")));
        assertOk(operations.saveFork(forkId, null, false));

        // When: the fork's own save must not count as a foreign base change
        assertOk(operations.editFork(forkId, 1, appending("+two")));
        Outcome<Path> second = operations.saveFork(forkId, null, false);

        // Then
        assertOk(second);
        assertEquals("PKbase+one+two", TestWorkspace.read(basePath()));
    }

    @Test
    void testSave_WhenExtensionNotAllowed_InvalidRequest() {
        // Given
        ForkId forkId = newFork(baseId);

        // When
        Outcome<Path> outcome = operations.saveFork(forkId, workspace.workspaceDir().resolve("budget.csv"), false);

        // Then
        assertFail(outcome, "INVALID_REQUEST");
        assertOk(operations.getFork(forkId));
    }

    // ============================================================
    // Checkpoints
    // ============================================================

    @Test
    void testRestore_WhenCheckpointTaken_ContentAndEditLogRolledBack() {
        // Given
        ForkId forkId = newFork(baseId);
        assertOk(operations.editFork(forkId, 0, appending("+a")));
        Checkpoint checkpoint = assertOk(operations.checkpointFork(forkId, "after a"));
        assertOk(operations.editFork(forkId, 1, appending("+b")));
        assertOk(operations.editFork(forkId, 2, appending("+c")));

        // When
        Checkpoint restored = assertOk(operations.restoreCheckpoint(forkId, 3, checkpoint.checkpointId()));

        // Then
        assertEquals(checkpoint.checkpointId(), restored.checkpointId());
        ForkSummary summary = assertOk(operations.getFork(forkId));
        assertEquals(4, summary.version(), "Restore is a mutation and bumps the version");
        assertEquals(1, summary.editCount());
        assertEquals("PKbase+a", TestWorkspace.read(summary.workPath()));
        assertEquals(1, assertOk(operations.listCheckpoints(forkId)).size(), "Checkpoint survives restore");
    }

    @Test
    void testRestore_WhenVersionStale_RetryAndContentUnchanged() {
        // Given
        ForkId forkId = newFork(baseId);
        Checkpoint checkpoint = assertOk(operations.checkpointFork(forkId, null));
        assertOk(operations.editFork(forkId, 0, appending("+a")));

        // When
        Outcome<Checkpoint> outcome = operations.restoreCheckpoint(forkId, 0, checkpoint.checkpointId());

        // Then
        assertEquals(1L, assertRetry(outcome, "VERSION_CONFLICT").currentVersion());
        assertEquals("PKbase+a", TestWorkspace.read(assertOk(operations.getForkPath(forkId))));
    }

    @Test
    void testCheckpoint_WhenLimitReached_InvalidStateUntilOneDeleted() {
        // Given
        ForkId forkId = newFork(baseId);
        Checkpoint first = assertOk(operations.checkpointFork(forkId, "1"));
        assertOk(operations.checkpointFork(forkId, "2"));
        assertOk(operations.checkpointFork(forkId, "3"));

        // When
        Outcome<Checkpoint> rejected = operations.checkpointFork(forkId, "4");

        // Then
        assertFail(rejected, "INVALID_STATE");
        assertOk(operations.deleteCheckpoint(forkId, first.checkpointId()));
        assertOk(operations.checkpointFork(forkId, "4"));
        assertEquals(3, TestWorkspace.fileNames(workspace.checkpointDir()).size());
    }

    @Test
    void testDiscard_WhenCheckpointsExist_AllFilesRemoved() {
        // Given
        ForkId forkId = newFork(baseId);
        assertOk(operations.checkpointFork(forkId, "keep?"));
        assertOk(operations.editFork(forkId, 0, appending("+x")));

        // When
        assertOk(operations.discardFork(forkId));

        // Then
        assertTrue(TestWorkspace.fileNames(workspace.checkpointDir()).isEmpty());
        assertEquals("PKbase", TestWorkspace.read(basePath()));
        assertFail(operations.discardFork(forkId), "NOT_FOUND");
        assertNoForkResidue();
    }

    // ============================================================
    // Fork of fork
    // ============================================================

    @Test
    void testCreate_WhenSourceIsFork_CopiesCurrentWorkingCopy() {
        // Given
        ForkId parent = newFork(baseId);
        assertOk(operations.editFork(parent, 0, appending("+parent")));

        // When
        ForkId child = assertOk(operations.createFork(parent.getValue()));

        // Then
        ForkSummary summary = assertOk(operations.getFork(child));
        Path parentPath = assertOk(operations.getForkPath(parent));
        assertEquals(parentPath, summary.basePath());
        assertEquals("PKbase+parent", TestWorkspace.read(summary.workPath()));
        assertEquals(parentPath, assertOk(operations.resolveWorkbookPath(parent.getValue())));
    }
}
