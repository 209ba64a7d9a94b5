package com.ryuqq.spreadfork.application.operations;

import com.ryuqq.spreadfork.cache.CacheStats;
import com.ryuqq.spreadfork.cache.CachedWorkbook;
import com.ryuqq.spreadfork.cache.WorkbookCache;
import com.ryuqq.spreadfork.core.error.EngineException;
import com.ryuqq.spreadfork.core.error.LockTableCorruptionException;
import com.ryuqq.spreadfork.core.error.LockTimeoutException;
import com.ryuqq.spreadfork.core.error.VersionConflictException;
import com.ryuqq.spreadfork.core.model.Checkpoint;
import com.ryuqq.spreadfork.core.model.CheckpointId;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.core.model.ForkSummary;
import com.ryuqq.spreadfork.core.model.RecalcResult;
import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.core.outcome.Fail;
import com.ryuqq.spreadfork.core.outcome.Ok;
import com.ryuqq.spreadfork.core.outcome.Outcome;
import com.ryuqq.spreadfork.core.outcome.Retry;
import com.ryuqq.spreadfork.core.spi.RecalcBackend;
import com.ryuqq.spreadfork.fork.ForkMutator;
import com.ryuqq.spreadfork.fork.ForkRegistry;
import com.ryuqq.spreadfork.fork.lock.RecalcLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link ForkOperations} 기본 구현.
 *
 * <p>ForkRegistry와 WorkbookCache를 조합하고, 엔진 예외를 Outcome으로 변환합니다.</p>
 *
 * <p><strong>예외 변환 규칙:</strong></p>
 * <ul>
 *   <li>VersionConflictException → Retry(VERSION_CONFLICT, currentVersion)</li>
 *   <li>LockTimeoutException → Retry(LOCK_TIMEOUT)</li>
 *   <li>LockTableCorruptionException → Fail(LOCK_TABLE_CORRUPTION), ERROR 로그</li>
 *   <li>그 외 EngineException → Fail(ErrorKind 이름)</li>
 *   <li>IllegalArgumentException → Fail(INVALID_REQUEST)</li>
 *   <li>IllegalStateException → Fail(INVALID_STATE)</li>
 * </ul>
 *
 * <p>그 밖의 RuntimeException은 변환하지 않고 그대로 전파합니다 (mutator 버그 등).</p>
 *
 * <p><strong>캐시 정합성:</strong> 디스크 내용을 바꾸는 연산이 성공하면 해당 경로의
 * 캐시 엔트리를 제거합니다. 제거된 핸들은 닫지 않습니다.</p>
 *
 * @param <H> 워크북 핸들 타입
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class DefaultForkOperations<H> implements ForkOperations<H> {

    private static final Logger log = LoggerFactory.getLogger(DefaultForkOperations.class);

    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INVALID_STATE = "INVALID_STATE";

    private final ForkRegistry registry;
    private final WorkbookCache<H> cache;
    private final RecalcBackend recalcBackend;

    /**
     * 생성자.
     *
     * @param registry 포크 레지스트리
     * @param cache 워크북 캐시
     * @param recalcBackend 재계산 엔진
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultForkOperations(ForkRegistry registry, WorkbookCache<H> cache, RecalcBackend recalcBackend) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (recalcBackend == null) {
            throw new IllegalArgumentException("recalcBackend cannot be null");
        }
        this.registry = registry;
        this.cache = cache;
        this.recalcBackend = recalcBackend;
    }

    // ============================================================
    // Fork lifecycle
    // ============================================================

    @Override
    public Outcome<ForkId> createFork(String workbookIdOrAlias) {
        return execute("create_fork", () -> {
            WorkbookId requested = WorkbookId.of(workbookIdOrAlias);
            return registry.createFork(cache.canonicalId(requested.getValue()));
        });
    }

    @Override
    public Outcome<Path> saveFork(ForkId forkId, Path target, boolean dropFork) {
        return execute("save_fork", () -> {
            ForkSummary fork = registry.getFork(forkId);
            Path saved = registry.saveFork(forkId, target != null ? target : fork.basePath(), dropFork);
            evictQuietly(saved);
            if (dropFork) {
                evictQuietly(fork.workPath());
            }
            return saved;
        });
    }

    @Override
    public Outcome<Void> discardFork(ForkId forkId) {
        return execute("discard_fork", () -> {
            Path workPath = registry.getForkPath(forkId);
            registry.discardFork(forkId);
            evictQuietly(workPath);
            return null;
        });
    }

    @Override
    public Outcome<List<ForkSummary>> listForks() {
        return execute("list_forks", registry::listForks);
    }

    @Override
    public Outcome<ForkSummary> getFork(ForkId forkId) {
        return execute("get_fork", () -> registry.getFork(forkId));
    }

    @Override
    public Outcome<Path> getForkPath(ForkId forkId) {
        return execute("get_fork_path", () -> registry.getForkPath(forkId));
    }

    // ============================================================
    // Versioned mutation
    // ============================================================

    @Override
    public <T> Outcome<T> editFork(ForkId forkId, long expectedVersion, ForkMutator<T> mutator) {
        return execute("edit_fork", () -> {
            Path workPath = registry.getForkPath(forkId);
            T result = registry.withForkMutVersioned(forkId, expectedVersion, mutator);
            evictQuietly(workPath);
            return result;
        });
    }

    // ============================================================
    // Checkpoints
    // ============================================================

    @Override
    public Outcome<Checkpoint> checkpointFork(ForkId forkId, String label) {
        return execute("checkpoint_fork", () -> registry.createCheckpoint(forkId, label));
    }

    @Override
    public Outcome<List<Checkpoint>> listCheckpoints(ForkId forkId) {
        return execute("list_checkpoints", () -> registry.listCheckpoints(forkId));
    }

    @Override
    public Outcome<Checkpoint> restoreCheckpoint(ForkId forkId, long expectedVersion, CheckpointId checkpointId) {
        return execute("restore_checkpoint", () -> {
            Path workPath = registry.getForkPath(forkId);
            Checkpoint restored = registry.restoreCheckpoint(forkId, expectedVersion, checkpointId);
            evictQuietly(workPath);
            return restored;
        });
    }

    @Override
    public Outcome<Void> deleteCheckpoint(ForkId forkId, CheckpointId checkpointId) {
        return execute("delete_checkpoint", () -> {
            registry.deleteCheckpoint(forkId, checkpointId);
            return null;
        });
    }

    // ============================================================
    // Recalculation
    // ============================================================

    @Override
    public Outcome<RecalcResult> recalculate(ForkId forkId) {
        return execute("recalculate", () -> {
            Path workPath = registry.getForkPath(forkId);
            RecalcResult result = registry.recalculate(forkId, recalcBackend);
            evictQuietly(workPath);
            return result;
        });
    }

    @Override
    public Outcome<RecalcLease> acquireRecalcLock(ForkId forkId) {
        return execute("acquire_recalc_lock", () -> registry.acquireRecalcLock(forkId));
    }

    @Override
    public Outcome<Boolean> releaseRecalcLock(ForkId forkId) {
        return execute("release_recalc_lock", () -> registry.releaseRecalcLock(forkId));
    }

    // ============================================================
    // Workbook cache
    // ============================================================

    @Override
    public Outcome<CachedWorkbook<H>> openWorkbook(String workbookIdOrAlias) {
        return execute("open_workbook", () -> cache.openWorkbook(workbookIdOrAlias));
    }

    @Override
    public Outcome<Boolean> closeWorkbook(String workbookIdOrAlias) {
        return execute("close_workbook", () -> cache.closeWorkbook(workbookIdOrAlias));
    }

    @Override
    public Outcome<Boolean> evictByPath(Path path) {
        return execute("evict_by_path", () -> cache.evictByPath(path));
    }

    @Override
    public Outcome<Path> resolveWorkbookPath(String workbookIdOrAlias) {
        return execute("resolve_workbook_path", () -> cache.resolveWorkbookPath(workbookIdOrAlias));
    }

    @Override
    public Outcome<CacheStats> cacheStats() {
        return execute("cache_stats", cache::cacheStats);
    }

    // ============================================================
    // Outcome mapping
    // ============================================================

    /**
     * 작업을 실행하고 결과를 Outcome으로 변환합니다.
     *
     * @param operation 연산 이름 (Outcome에 기록)
     * @param action 실행할 작업
     * @param <T> 결과 타입
     * @return Ok, Retry 또는 Fail
     */
    private <T> Outcome<T> execute(String operation, Supplier<T> action) {
        try {
            return Ok.of(operation, action.get());
        } catch (VersionConflictException e) {
            log.debug("{} rejected: fork {} expected v{} but is at v{}",
                operation, e.forkId().getValue(), e.expectedVersion(), e.currentVersion());
            return new Retry<>(operation, e.kind().name(), e.getMessage(), e.currentVersion());
        } catch (LockTimeoutException e) {
            log.warn("{} timed out waiting {}ms for fork {}",
                operation, e.timeout().toMillis(), e.forkId().getValue());
            return new Retry<>(operation, e.kind().name(), e.getMessage(), null);
        } catch (LockTableCorruptionException e) {
            log.error("{} detected recalc lock table corruption", operation, e);
            return new Fail<>(operation, e.kind().name(), e.getMessage(), null);
        } catch (EngineException e) {
            log.debug("{} failed: {}", operation, e.getMessage());
            return new Fail<>(operation, e.kind().name(), e.getMessage(), causeOf(e));
        } catch (IllegalArgumentException e) {
            return new Fail<>(operation, INVALID_REQUEST, messageOf(e), null);
        } catch (IllegalStateException e) {
            return new Fail<>(operation, INVALID_STATE, messageOf(e), null);
        }
    }

    /**
     * 캐시 제거. 원래 연산은 이미 성공했으므로 제거 실패가 결과를 바꾸지 않습니다.
     */
    private void evictQuietly(Path path) {
        try {
            if (cache.evictByPath(path)) {
                log.debug("evicted cached workbook at {}", path);
            }
        } catch (RuntimeException e) {
            log.warn("cache eviction failed for {}", path, e);
        }
    }

    private static String causeOf(Throwable e) {
        Throwable cause = e.getCause();
        if (cause == null) {
            return null;
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private static String messageOf(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
