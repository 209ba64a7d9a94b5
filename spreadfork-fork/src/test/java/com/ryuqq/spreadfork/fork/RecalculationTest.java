package com.ryuqq.spreadfork.fork;

import com.ryuqq.spreadfork.core.config.ForkConfig;
import com.ryuqq.spreadfork.core.error.LockTimeoutException;
import com.ryuqq.spreadfork.core.error.NotFoundException;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.core.model.RecalcResult;
import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.core.spi.RecalcBackend;
import com.ryuqq.spreadfork.fork.lock.RecalcLease;
import com.ryuqq.spreadfork.fork.storage.LocalForkStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 재계산 직렬화와 락 테이블 정리 테스트.
 */
class RecalculationTest {

    @TempDir
    Path tempDir;

    private ForkRegistry registry;
    private ForkId forkA;
    private ForkId forkB;

    @BeforeEach
    void setUp() throws Exception {
        Path workspace = Files.createDirectories(tempDir.resolve("workspace"));
        Workbooks.write(workspace, "calc.xlsx", "calc");
        ForkConfig config = new ForkConfig()
            .withDirectories(tempDir.resolve("forks"), tempDir.resolve("checkpoints"))
            .withMaxForks(50)
            .withLockTimeouts(Duration.ofSeconds(5), Duration.ofSeconds(5));
        registry = new ForkRegistry(config, id -> workspace.resolve(id.getValue()),
            new LocalForkStorage(), Clock.systemUTC());
        forkA = registry.createFork(WorkbookId.of("calc.xlsx"));
        forkB = registry.createFork(WorkbookId.of("calc.xlsx"));
    }

    /**
     * 동시 실행 수를 기록하는 백엔드.
     */
    private static final class CountingBackend implements RecalcBackend {
        final AtomicInteger active = new AtomicInteger();
        final AtomicInteger maxActive = new AtomicInteger();
        final AtomicInteger calls = new AtomicInteger();
        final long sleepMs;

        CountingBackend(long sleepMs) {
            this.sleepMs = sleepMs;
        }

        @Override
        public void recalculate(Path workPath) throws IOException {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(sleepMs);
                Workbooks.append(workPath, "=");
                calls.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            } finally {
                active.decrementAndGet();
            }
        }

        @Override
        public String name() {
            return "counting";
        }
    }

    // ============================================================
    // 1. 같은 포크는 직렬화
    // ============================================================

    @Test
    void 같은포크동시재계산_직렬화() throws Exception {
        // given
        CountingBackend backend = new CountingBackend(100);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        List<Future<RecalcResult>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < 3; i++) {
            futures.add(pool.submit(() -> registry.recalculate(forkA, backend)));
        }
        for (Future<RecalcResult> future : futures) {
            assertThat(future.get(10, TimeUnit.SECONDS).backend()).isEqualTo("counting");
        }
        pool.shutdown();

        // then
        assertThat(backend.maxActive.get()).isEqualTo(1);
        assertThat(backend.calls.get()).isEqualTo(3);
        assertThat(Workbooks.read(registry.getForkPath(forkA))).isEqualTo("PKcalc===");
        assertThat(registry.getFork(forkA).version()).as("recalc does not bump the version").isZero();
    }

    // ============================================================
    // 2. 다른 포크는 병렬
    // ============================================================

    @Test
    void 다른포크동시재계산_병렬실행() throws Exception {
        // given: 두 재계산이 동시에 barrier에 도달해야만 통과
        CyclicBarrier barrier = new CyclicBarrier(2);
        RecalcBackend backend = new RecalcBackend() {
            @Override
            public void recalculate(Path workPath) throws IOException {
                try {
                    barrier.await(5, TimeUnit.SECONDS);
                    Workbooks.append(workPath, "=");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                } catch (BrokenBarrierException | TimeoutException e) {
                    throw new IOException("recalculations did not overlap", e);
                }
            }

            @Override
            public String name() {
                return "barrier";
            }
        };
        ExecutorService pool = Executors.newFixedThreadPool(2);

        // when
        Future<RecalcResult> a = pool.submit(() -> registry.recalculate(forkA, backend));
        Future<RecalcResult> b = pool.submit(() -> registry.recalculate(forkB, backend));

        // then
        assertThat(a.get(10, TimeUnit.SECONDS).forkId()).isEqualTo(forkA);
        assertThat(b.get(10, TimeUnit.SECONDS).forkId()).isEqualTo(forkB);
        assertThat(Workbooks.read(registry.getForkPath(forkA))).isEqualTo("PKcalc=");
        assertThat(Workbooks.read(registry.getForkPath(forkB))).isEqualTo("PKcalc=");
        pool.shutdown();
    }

    @Test
    void 재계산락을다른스레드가보유_LockTimeout() throws Exception {
        // given
        Path workspace = tempDir.resolve("workspace");
        ForkConfig impatient = new ForkConfig()
            .withDirectories(tempDir.resolve("forks2"), tempDir.resolve("checkpoints2"))
            .withLockTimeouts(Duration.ofSeconds(5), Duration.ofMillis(100));
        ForkRegistry other = new ForkRegistry(impatient, id -> workspace.resolve(id.getValue()),
            new LocalForkStorage(), Clock.systemUTC());
        ForkId forkId = other.createFork(WorkbookId.of("calc.xlsx"));
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<?> holder = pool.submit(() -> {
            try (RecalcLease lease = other.acquireRecalcLock(forkId)) {
                lease.lock(Duration.ofSeconds(1));
                locked.countDown();
                release.await(5, TimeUnit.SECONDS);
            }
            return null;
        });
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        // when & then
        assertThatThrownBy(() -> other.recalculate(forkId, new CountingBackend(0)))
            .isInstanceOf(LockTimeoutException.class);
        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        pool.shutdown();
        assertThat(other.recalcLockTable().referenceCount(forkId)).isZero();
    }

    @Test
    void 사용불가백엔드_IllegalState() {
        RecalcBackend unavailable = new RecalcBackend() {
            @Override
            public void recalculate(Path workPath) {
                throw new AssertionError("must not run");
            }

            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public String name() {
                return "offline";
            }
        };

        assertThatThrownBy(() -> registry.recalculate(forkA, unavailable))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("offline");
    }

    // ============================================================
    // 3. 락 테이블 정리
    // ============================================================

    @Test
    void lease닫기_엔트리는포크가살아있는동안유지_release로정리() {
        // given
        try (RecalcLease lease = registry.acquireRecalcLock(forkA)) {
            assertThat(lease.lock(Duration.ofSeconds(1))).isTrue();

            // when: 참조 중에는 정리되지 않음
            assertThat(registry.releaseRecalcLock(forkA)).isFalse();
        }

        // then
        assertThat(registry.recalcLockTable().contains(forkA)).isTrue();
        assertThat(registry.releaseRecalcLock(forkA)).isTrue();
        assertThat(registry.recalcLockTable().contains(forkA)).isFalse();
    }

    @Test
    void 보유중포크삭제_lease닫으면엔트리제거() {
        // given
        RecalcLease lease = registry.acquireRecalcLock(forkA);

        // when
        registry.deleteFork(forkA);
        assertThat(registry.recalcLockTable().contains(forkA)).isTrue();
        lease.close();

        // then
        assertThat(registry.recalcLockTable().contains(forkA)).isFalse();
        registry.verifyLockTable();
    }

    @Test
    void 삭제된포크_acquireRecalcLock_NotFound_엔트리남지않음() {
        // given
        registry.deleteFork(forkA);

        // when & then
        assertThatThrownBy(() -> registry.acquireRecalcLock(forkA)).isInstanceOf(NotFoundException.class);
        assertThat(registry.recalcLockTable().contains(forkA)).isFalse();
    }

    @Test
    void 생성삭제와재계산락경쟁_정착후포크없는엔트리없음() throws Exception {
        // given
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<ForkId> created = new ArrayList<>();

        // when
        for (int round = 0; round < 30; round++) {
            ForkId forkId = registry.createFork(WorkbookId.of("calc.xlsx"));
            created.add(forkId);
            CountDownLatch start = new CountDownLatch(1);
            Future<?> locker = pool.submit(() -> {
                start.await();
                try (RecalcLease lease = registry.acquireRecalcLock(forkId)) {
                    lease.lock(Duration.ofSeconds(1));
                } catch (NotFoundException e) {
                    // deleted first
                }
                return null;
            });
            Future<?> deleter = pool.submit(() -> {
                start.await();
                registry.deleteFork(forkId);
                return null;
            });
            start.countDown();
            locker.get(5, TimeUnit.SECONDS);
            deleter.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        for (ForkId forkId : created) {
            assertThat(registry.recalcLockTable().contains(forkId)).isFalse();
        }
        registry.verifyLockTable();
    }

    @Test
    void 생성재계산삭제반복중_verifyLockTable_오탐없음() throws Exception {
        // given
        int cycles = 500;
        AtomicBoolean churning = new AtomicBoolean(true);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<?> churner = pool.submit(() -> {
            try {
                for (int i = 0; i < cycles; i++) {
                    ForkId forkId = registry.createFork(WorkbookId.of("calc.xlsx"));
                    RecalcLease lease = registry.acquireRecalcLock(forkId);
                    lease.close();
                    registry.deleteFork(forkId);
                }
            } finally {
                churning.set(false);
            }
            return null;
        });

        // when: 삭제 도중의 포크를 고아 엔트리로 보고하면 안 됨
        int checks = 0;
        do {
            registry.verifyLockTable();
            checks++;
        } while (churning.get());
        churner.get(60, TimeUnit.SECONDS);
        pool.shutdown();

        // then
        assertThat(checks).isPositive();
        registry.verifyLockTable();
        assertThat(registry.forkCount()).isEqualTo(2);
        assertThat(registry.recalcLockTable().size()).isZero();
    }
}
