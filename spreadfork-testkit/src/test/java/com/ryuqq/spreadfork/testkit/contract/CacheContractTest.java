package com.ryuqq.spreadfork.testkit.contract;

import com.ryuqq.spreadfork.cache.CacheStats;
import com.ryuqq.spreadfork.cache.CachedWorkbook;
import com.ryuqq.spreadfork.cache.warming.CacheWarmingResult;
import com.ryuqq.spreadfork.core.config.CacheConfig;
import com.ryuqq.spreadfork.core.config.CacheWarmingConfig;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.core.outcome.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: workbook cache residency and coherence.
 *
 * <p>Runs with capacity 2.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A, B, C then B, D → resident {D, B}, 5 operations, 1 hit</li>
 *   <li>Hit rate is 0.0 before any operation and H/(H+M) afterwards</li>
 *   <li>Concurrent misses on one key store a single entry</li>
 *   <li>Mutations, saves and evict-by-path drop stale handles</li>
 *   <li>Warming loads the most recently modified workbooks up to its limit</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
class CacheContractTest extends AbstractEngineContractTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private WorkbookId idA;
    private WorkbookId idB;
    private WorkbookId idC;
    private WorkbookId idD;

    @Override
    protected CacheConfig cacheConfig() {
        return new CacheConfig(2);
    }

    @BeforeEach
    void writeWorkbooks() {
        workspace.write("a.xlsx", "A", T0);
        workspace.write("b.xlsx", "B", T0.plusSeconds(60));
        workspace.write("c.xlsx", "C", T0.plusSeconds(120));
        workspace.write("d.xlsx", "D", T0.plusSeconds(180));
        idA = workspace.idOf("a.xlsx");
        idB = workspace.idOf("b.xlsx");
        idC = workspace.idOf("c.xlsx");
        idD = workspace.idOf("d.xlsx");
    }

    private CachedWorkbook<String> open(WorkbookId id) {
        return assertOk(operations.openWorkbook(id.getValue()));
    }

    @Test
    void testLru_WhenOpeningABCThenBD_ResidentDAndB() {
        // Given
        assertEquals(0.0, cache.hitRate(), "Hit rate with no operations must be 0.0");

        // When
        open(idA);
        open(idB);
        open(idC);
        assertEquals(List.of(idC, idB), cache.residentIds());
        open(idB);
        open(idD);

        // Then
        assertEquals(List.of(idD, idB), cache.residentIds());
        CacheStats stats = assertOk(operations.cacheStats());
        assertEquals(5, stats.operations());
        assertEquals(1, stats.hits());
        assertEquals(4, stats.misses());
        assertEquals(2, stats.size());
        assertEquals(0.2, stats.hitRate(), 1e-9);
    }

    @Test
    void testLru_WhenMoreDistinctIdsThanCapacity_KeepsMostRecentlyUsed() {
        // When
        for (WorkbookId id : List.of(idA, idB, idC, idD, idA)) {
            open(id);
        }

        // Then
        assertEquals(2, cache.cacheStats().size());
        assertEquals(List.of(idA, idD), cache.residentIds());
        assertFalse(cache.isCached(idB));
        assertFalse(cache.isCached(idC));
        assertEquals(2, loader.loadCount(idA), "A was evicted once and reloaded");
    }

    @Test
    void testHitRate_WhenRepeatedOpensAndAliases_HitsOverHitsPlusMisses() {
        // Given
        String aliasA = idA.getValue().substring("wb-".length()).toUpperCase();

        // When
        open(idA);
        assertOk(operations.openWorkbook(aliasA));
        open(idA);
        open(idB);

        // Then
        CacheStats stats = cache.cacheStats();
        assertEquals(2, stats.hits());
        assertEquals(2, stats.misses());
        assertEquals(0.5, cache.hitRate(), 1e-9);
        assertEquals(1, loader.loadCount(idA), "Alias must resolve to the cached entry");
    }

    @Test
    void testMiss_WhenLoadFails_IoFailureAndNothingCached() {
        // Given
        loader.failOn("c.xlsx");

        // When
        Outcome<CachedWorkbook<String>> outcome = operations.openWorkbook(idC.getValue());

        // Then
        assertTrue(assertFail(outcome, "IO_FAILURE").cause().contains("corrupt workbook: c.xlsx"));
        assertFalse(cache.isCached(idC));
        assertEquals(1, cache.cacheStats().misses());
    }

    @Test
    void testMiss_WhenConcurrentOnSameKey_SingleEntryStored() throws Exception {
        // Given
        loader.setLoadDelayMs(100);
        int readers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(readers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CachedWorkbook<String>>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < readers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return open(idA);
                }));
            }
            start.countDown();
            for (Future<CachedWorkbook<String>> future : futures) {
                assertEquals("PKA", future.get(30, TimeUnit.SECONDS).handle());
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertEquals(List.of(idA), cache.residentIds());
        assertEquals(1, cache.cacheStats().size());
        assertEquals(readers, cache.cacheStats().operations());
    }

    @Test
    void testCoherence_WhenForkEdited_NextOpenSeesNewContent() {
        // Given
        ForkId forkId = newFork(idA);
        assertEquals("PKA", assertOk(operations.openWorkbook(forkId.getValue())).handle());

        // When
        assertOk(operations.editFork(forkId, 0, appending("+edit")));

        // Then
        assertEquals("PKA+edit", assertOk(operations.openWorkbook(forkId.getValue())).handle());
    }

    @Test
    void testCoherence_WhenForkSavedOverBase_BaseEntryDropped() {
        // Given
        open(idA);
        ForkId forkId = newFork(idA);
        assertOk(operations.editFork(forkId, 0, appending("+saved")));

        // When
        assertOk(operations.saveFork(forkId, null, true));

        // Then
        assertFalse(cache.isCached(idA));
        assertEquals("PKA+saved", open(idA).handle());
        assertFail(operations.getFork(forkId), "NOT_FOUND");
        assertNoForkResidue();
    }

    @Test
    void testEvictByPath_WhenCached_RemovedAndReportsTrueOnce() {
        // Given
        CachedWorkbook<String> cached = open(idB);

        // When
        boolean first = assertOk(operations.evictByPath(cached.path()));
        boolean second = assertOk(operations.evictByPath(cached.path()));

        // Then
        assertTrue(first);
        assertFalse(second);
        assertFalse(cache.isCached(idB));
    }

    @Test
    void testWarm_WhenLimitBelowWorkspaceSize_LoadsMostRecentlyModified() {
        // When
        CacheWarmingResult result = engine.warm(new CacheWarmingConfig().withMaxWorkbooks(2));

        // Then
        assertEquals(2, result.loaded());
        assertEquals(0, result.failed());
        assertTrue(cache.isCached(idD));
        assertTrue(cache.isCached(idC));
        assertFalse(cache.isCached(idA));
    }

    @Test
    void testWarm_WhenOneWorkbookBroken_FailureRecordedOthersLoaded() {
        // Given
        loader.failOn("d.xlsx");

        // When
        CacheWarmingResult result = engine.warm(
            new CacheWarmingConfig().withWorkbookIds(List.of(idD.getValue(), idB.getValue())));

        // Then
        assertEquals(1, result.loaded());
        assertEquals(1, result.failed());
        assertEquals(1, result.errors().size());
        assertTrue(cache.isCached(idB));
    }
}
