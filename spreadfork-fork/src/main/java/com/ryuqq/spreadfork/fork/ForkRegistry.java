package com.ryuqq.spreadfork.fork;

import com.ryuqq.spreadfork.core.config.ForkConfig;
import com.ryuqq.spreadfork.core.error.IoFailureException;
import com.ryuqq.spreadfork.core.error.LockTableCorruptionException;
import com.ryuqq.spreadfork.core.error.LockTimeoutException;
import com.ryuqq.spreadfork.core.error.NotFoundException;
import com.ryuqq.spreadfork.core.error.VersionConflictException;
import com.ryuqq.spreadfork.core.model.Checkpoint;
import com.ryuqq.spreadfork.core.model.CheckpointId;
import com.ryuqq.spreadfork.core.model.EditRecord;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.core.model.ForkSummary;
import com.ryuqq.spreadfork.core.model.RecalcResult;
import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.core.spi.ForkPathResolver;
import com.ryuqq.spreadfork.core.spi.RecalcBackend;
import com.ryuqq.spreadfork.core.spi.SourceResolver;
import com.ryuqq.spreadfork.core.statemachine.ForkState;
import com.ryuqq.spreadfork.fork.guard.CheckpointGuard;
import com.ryuqq.spreadfork.fork.guard.ForkCreationGuard;
import com.ryuqq.spreadfork.fork.guard.TempFileGuard;
import com.ryuqq.spreadfork.fork.lock.RecalcLease;
import com.ryuqq.spreadfork.fork.lock.RecalcLockTable;
import com.ryuqq.spreadfork.fork.storage.ForkStorage;
import com.ryuqq.spreadfork.fork.storage.LocalForkStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 포크 레지스트리.
 *
 * <p>활성 포크(작업본)를 소유하고, 포크에 대한 모든 쓰기를 낙관적 버전 검사로
 * 보호합니다.</p>
 *
 * <p><strong>락 구조:</strong></p>
 * <pre>
 * structureLock (ReentrantReadWriteLock, non-fair)
 *   └─ forks 맵 접근에만 사용, I/O 중에는 절대 보유하지 않음
 * ForkContext.mutationLock (ReentrantLock, 포크별)
 *   └─ 변경/저장/재계산/삭제 직렬화, lockTimeout 동안만 대기
 * RecalcLockTable (포크별 fair lock, 참조 카운트)
 *   └─ 재계산 직렬화
 * </pre>
 *
 * <p><strong>변경 흐름 ({@link #withForkMutVersioned}):</strong></p>
 * <pre>
 * 1. read lock으로 컨텍스트 조회 후 즉시 해제
 * 2. 포크 mutationLock 획득 (lockTimeout)
 * 3. 버전 검증 → 불일치 시 VersionConflictException (mutator 호출 안 함)
 * 4. 작업본 → 스테이징 파일 복사 (TempFileGuard)
 * 5. mutator 실행
 * 6. 스테이징 → 작업본 원자적 이동, 편집 로그 커밋, 버전 증가
 * </pre>
 *
 * <p>생성자 외에는 전역 상태가 없으므로 테스트마다 새 인스턴스를 만들어 사용합니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class ForkRegistry implements ForkPathResolver {

    private static final Logger log = LoggerFactory.getLogger(ForkRegistry.class);

    static final String OP_CREATE = "create_fork";
    static final String OP_GET = "get_fork";
    static final String OP_MUTATE = "with_fork_mut_versioned";
    static final String OP_DELETE = "delete_fork";
    static final String OP_SAVE = "save_fork";
    static final String OP_DISCARD = "discard_fork";
    static final String OP_CHECKPOINT = "checkpoint_fork";
    static final String OP_DELETE_CHECKPOINT = "delete_checkpoint";
    static final String OP_RESTORE = "restore_checkpoint";
    static final String OP_RECALC = "recalculate";
    static final String OP_RECALC_LOCK = "acquire_recalc_lock";
    static final String OP_VERIFY = "verify_lock_table";

    private static final byte[] ZIP_MAGIC = {'P', 'K'};

    private final ForkConfig config;
    private final SourceResolver sourceResolver;
    private final ForkStorage storage;
    private final Clock clock;

    private final ReentrantReadWriteLock structureLock = new ReentrantReadWriteLock();
    private final Map<ForkId, ForkContext> forks = new HashMap<>();
    private final RecalcLockTable recalcLocks = new RecalcLockTable();

    /**
     * 로컬 파일시스템과 시스템 시계를 사용하는 생성자.
     *
     * @param config 포크 설정
     * @param sourceResolver 원본 경로 해석기 (보통 WorkbookCache)
     */
    public ForkRegistry(ForkConfig config, SourceResolver sourceResolver) {
        this(config, sourceResolver, new LocalForkStorage(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 포크 설정
     * @param sourceResolver 원본 경로 해석기
     * @param storage 파일 연산
     * @param clock TTL 판단용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws IoFailureException 작업 디렉토리를 만들 수 없는 경우
     */
    public ForkRegistry(ForkConfig config, SourceResolver sourceResolver, ForkStorage storage, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sourceResolver == null) {
            throw new IllegalArgumentException("sourceResolver cannot be null");
        }
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.sourceResolver = sourceResolver;
        this.storage = storage;
        this.clock = clock;
        try {
            storage.createDirectories(config.forkDir());
            storage.createDirectories(config.checkpointDir());
        } catch (IOException e) {
            throw new IoFailureException("fork_registry", "cannot create fork directories", e);
        }
    }

    public ForkConfig config() {
        return config;
    }

    // ========================================
    // 생성 / 조회
    // ========================================

    /**
     * 원본 워크북의 작업본을 만들고 새 포크를 등록합니다.
     *
     * @param workbookId 원본 워크북 ID (포크 ID도 허용, fork-of-fork)
     * @return 새 포크 ID (버전 0)
     * @throws IllegalStateException 포크 개수 제한에 도달한 경우
     * @throws IllegalArgumentException 허용되지 않은 확장자이거나 파일이 너무 큰 경우
     * @throws NotFoundException 원본을 찾을 수 없는 경우
     * @throws IoFailureException 복사 실패 (부분 생성물은 모두 정리됨)
     */
    public ForkId createFork(WorkbookId workbookId) {
        if (workbookId == null) {
            throw new IllegalArgumentException("workbookId cannot be null");
        }
        evictExpired();
        ensureCapacity();

        Path basePath = sourceResolver.resolveSource(workbookId);
        String extension = validateSource(basePath);

        ForkId forkId = ForkId.generate();
        Path workPath = config.forkDir().resolve(forkId.getValue() + "." + extension);

        try (ForkCreationGuard guard = new ForkCreationGuard(this::removeEntry, forkId, workPath, storage)) {
            FileTime baseModifiedAt = storage.lastModified(basePath);
            storage.copy(basePath, workPath);
            String digest = storage.digest(workPath);
            ForkContext context = new ForkContext(forkId, workbookId, basePath, workPath,
                clock.instant(), digest, baseModifiedAt);
            insert(context);
            guard.disarm();
            log.debug("fork created: {} from {} ({})", forkId.getValue(), workbookId.getValue(), basePath);
            return forkId;
        } catch (IOException e) {
            throw new IoFailureException(OP_CREATE, "cannot create fork from " + basePath, e);
        }
    }

    /**
     * @param forkId 포크 ID
     * @return 작업본 경로
     * @throws NotFoundException 포크가 없는 경우
     */
    public Path getForkPath(ForkId forkId) {
        return lookup(OP_GET, forkId).workPath();
    }

    /**
     * @param forkId 포크 ID
     * @return 현재 상태 스냅샷
     * @throws NotFoundException 포크가 없는 경우
     */
    public ForkSummary getFork(ForkId forkId) {
        return lookup(OP_GET, forkId).toSummary();
    }

    public boolean contains(ForkId forkId) {
        structureLock.readLock().lock();
        try {
            return forks.containsKey(forkId);
        } finally {
            structureLock.readLock().unlock();
        }
    }

    @Override
    public Optional<Path> findForkPath(String candidate) {
        ForkId forkId;
        try {
            forkId = ForkId.of(candidate);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        structureLock.readLock().lock();
        try {
            ForkContext context = forks.get(forkId);
            return context == null ? Optional.empty() : Optional.of(context.workPath());
        } finally {
            structureLock.readLock().unlock();
        }
    }

    /**
     * @return 생성 시각 순 스냅샷 (이후 변경이 반영되지 않음)
     */
    public List<ForkSummary> listForks() {
        List<ForkContext> snapshot = snapshotContexts();
        List<ForkSummary> summaries = new ArrayList<>(snapshot.size());
        for (ForkContext context : snapshot) {
            summaries.add(context.toSummary());
        }
        summaries.sort(Comparator.comparing(ForkSummary::createdAt));
        return List.copyOf(summaries);
    }

    public int forkCount() {
        structureLock.readLock().lock();
        try {
            return forks.size();
        } finally {
            structureLock.readLock().unlock();
        }
    }

    // ========================================
    // 버전 기반 변경
    // ========================================

    /**
     * 포크에 대한 유일한 변경 경로.
     *
     * <p>버전이 일치하면 mutator를 스테이징 파일에 대해 한 번 실행하고, 정상 반환 시에만
     * 작업본을 교체하고 버전을 1 올립니다. 버전이 다르면 mutator는 호출되지 않습니다.</p>
     *
     * @param forkId 포크 ID
     * @param expectedVersion 호출자가 마지막으로 관찰한 버전
     * @param mutator 스테이징 파일을 수정하는 함수
     * @param <T> 결과 타입
     * @return mutator 결과
     * @throws NotFoundException 포크가 없거나 종료된 경우
     * @throws VersionConflictException 버전 불일치 (현재 버전 포함)
     * @throws LockTimeoutException lockTimeout 안에 포크 락을 얻지 못한 경우
     * @throws IoFailureException 스테이징/승격 또는 mutator의 I/O 실패
     */
    public <T> T withForkMutVersioned(ForkId forkId, long expectedVersion, ForkMutator<T> mutator) {
        if (mutator == null) {
            throw new IllegalArgumentException("mutator cannot be null");
        }
        return mutate(OP_MUTATE, forkId, expectedVersion, mutator);
    }

    private <T> T mutate(String operation, ForkId forkId, long expectedVersion, ForkMutator<T> mutator) {
        ForkContext context = lookup(operation, forkId);
        lockForMutation(operation, context);
        try {
            ensureLive(operation, context);
            try {
                context.validateVersion(operation, expectedVersion);
            } catch (VersionConflictException e) {
                log.debug("version conflict on {}: expected={}, current={}",
                    forkId.getValue(), e.expectedVersion(), e.currentVersion());
                throw e;
            }

            Path staging = stagingPathFor(context);
            try (TempFileGuard stagingGuard = new TempFileGuard(staging, storage)) {
                storage.copy(context.workPath(), staging);
                StagedMutation view = new StagedMutation(context, staging);
                T result = mutator.apply(view);
                storage.promote(staging, context.workPath());
                stagingGuard.disarm();
                context.commitEdits(view.pendingEdits);
                long newVersion = context.incrementVersion();
                log.debug("fork {} mutated by {}: version {} -> {}",
                    forkId.getValue(), operation, expectedVersion, newVersion);
                return result;
            } catch (IOException e) {
                throw new IoFailureException(operation, "mutation failed for fork " + forkId.getValue(), e);
            }
        } finally {
            context.mutationLock().unlock();
        }
    }

    // ========================================
    // 삭제 / 저장 / 폐기
    // ========================================

    /**
     * 포크를 제거합니다. 맵에서 먼저 빼고 파일 삭제는 락 밖에서 수행합니다.
     *
     * @param forkId 포크 ID
     * @throws NotFoundException 포크가 없는 경우
     * @throws IoFailureException 작업본 또는 스냅샷 삭제 실패 (엔트리는 이미 제거됨)
     */
    public void deleteFork(ForkId forkId) {
        ForkContext context = lookup(OP_DELETE, forkId);
        lockForMutation(OP_DELETE, context);
        try {
            retire(OP_DELETE, context, ForkState.DISCARDED);
        } finally {
            context.mutationLock().unlock();
        }
    }

    /**
     * 작업본을 대상 경로에 저장합니다.
     *
     * @param forkId 포크 ID
     * @param target 저장 경로 (원본 경로면 원본 덮어쓰기)
     * @param dropFork true면 저장 후 포크 제거
     * @return 저장된 경로
     * @throws IllegalArgumentException 허용되지 않은 확장자
     * @throws IllegalStateException 원본이 포크 생성 이후 변경된 경우
     * @throws NotFoundException 포크가 없는 경우
     * @throws IoFailureException 저장 실패 (임시 파일은 정리됨)
     */
    public Path saveFork(ForkId forkId, Path target, boolean dropFork) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (!config.isAllowed(target)) {
            throw new IllegalArgumentException("target extension not allowed: " + target.getFileName()
                + " (allowed: " + config.allowedExtensions() + ")");
        }
        ForkContext context = lookup(OP_SAVE, forkId);
        lockForMutation(OP_SAVE, context);
        try {
            ensureLive(OP_SAVE, context);
            Path temp = target.toAbsolutePath().resolveSibling(
                "." + target.getFileName() + ".tmp-" + UUID.randomUUID());
            try {
                context.validateBaseUnchanged(storage);
                try (TempFileGuard tempGuard = new TempFileGuard(temp, storage)) {
                    storage.copy(context.workPath(), temp);
                    storage.promote(temp, target);
                    tempGuard.disarm();
                }
                if (isSameFile(target, context.basePath())) {
                    context.rebase(storage.digest(target), storage.lastModified(target));
                }
            } catch (IOException e) {
                throw new IoFailureException(OP_SAVE, "cannot save fork " + forkId.getValue() + " to " + target, e);
            }
            log.debug("fork {} saved to {} (drop={})", forkId.getValue(), target, dropFork);
            if (dropFork) {
                retire(OP_SAVE, context, ForkState.SAVED);
            }
            return target;
        } finally {
            context.mutationLock().unlock();
        }
    }

    /**
     * 변경 내용을 버리고 포크를 제거합니다.
     *
     * @param forkId 포크 ID
     * @throws NotFoundException 포크가 없는 경우
     */
    public void discardFork(ForkId forkId) {
        ForkContext context = lookup(OP_DISCARD, forkId);
        lockForMutation(OP_DISCARD, context);
        try {
            retire(OP_DISCARD, context, ForkState.DISCARDED);
        } finally {
            context.mutationLock().unlock();
        }
    }

    /**
     * TTL이 지난 포크를 제거합니다.
     *
     * <p>개별 포크 제거 실패는 로그만 남기고 다음 포크로 진행합니다.</p>
     *
     * @return 제거된 포크 ID 목록
     */
    public List<ForkId> evictExpired() {
        Instant now = clock.instant();
        List<ForkContext> expired = new ArrayList<>();
        for (ForkContext context : snapshotContexts()) {
            if (context.isExpired(config.ttl(), now)) {
                expired.add(context);
            }
        }

        List<ForkId> evicted = new ArrayList<>();
        for (ForkContext context : expired) {
            try {
                deleteFork(context.forkId());
                evicted.add(context.forkId());
            } catch (NotFoundException e) {
                log.debug("expired fork {} already removed", context.forkId().getValue());
            } catch (RuntimeException e) {
                log.warn("Failed to evict expired fork {}: {}", context.forkId().getValue(), e.getMessage(), e);
            }
        }
        if (!evicted.isEmpty()) {
            log.info("Evicted {} expired forks", evicted.size());
        }
        return List.copyOf(evicted);
    }

    // ========================================
    // 체크포인트
    // ========================================

    /**
     * 현재 작업본의 스냅샷을 체크포인트로 저장합니다. 버전은 바뀌지 않습니다.
     *
     * @param forkId 포크 ID
     * @param label 설명 (null 허용)
     * @return 생성된 체크포인트
     * @throws IllegalStateException 체크포인트 개수 제한에 도달한 경우
     */
    public Checkpoint createCheckpoint(ForkId forkId, String label) {
        ForkContext context = lookup(OP_CHECKPOINT, forkId);
        lockForMutation(OP_CHECKPOINT, context);
        try {
            ensureLive(OP_CHECKPOINT, context);
            if (context.checkpointCount() >= config.maxCheckpointsPerFork()) {
                throw new IllegalStateException("checkpoint limit reached for fork " + forkId.getValue()
                    + " (" + config.maxCheckpointsPerFork() + ")");
            }
            CheckpointId checkpointId = CheckpointId.generate();
            String extension = ForkConfig.extensionOf(context.workPath());
            Path snapshot = config.checkpointDir().resolve(
                forkId.getValue() + "_" + checkpointId.getValue() + "." + extension);

            try (CheckpointGuard guard = new CheckpointGuard(snapshot, storage)) {
                storage.copy(context.workPath(), snapshot);
                Checkpoint checkpoint = new Checkpoint(checkpointId, forkId, snapshot, label,
                    clock.instant(), context.version(), context.edits().size());
                context.addCheckpoint(checkpoint);
                guard.disarm();
                log.debug("checkpoint {} created for fork {} at version {}",
                    checkpointId.getValue(), forkId.getValue(), checkpoint.forkVersion());
                return checkpoint;
            } catch (IOException e) {
                throw new IoFailureException(OP_CHECKPOINT, "cannot snapshot fork " + forkId.getValue(), e);
            }
        } finally {
            context.mutationLock().unlock();
        }
    }

    public List<Checkpoint> listCheckpoints(ForkId forkId) {
        return lookup("list_checkpoints", forkId).checkpoints();
    }

    /**
     * @throws NotFoundException 포크나 체크포인트가 없는 경우
     * @throws IoFailureException 스냅샷 삭제 실패 (레코드는 이미 제거됨)
     */
    public void deleteCheckpoint(ForkId forkId, CheckpointId checkpointId) {
        if (checkpointId == null) {
            throw new IllegalArgumentException("checkpointId cannot be null");
        }
        ForkContext context = lookup(OP_DELETE_CHECKPOINT, forkId);
        lockForMutation(OP_DELETE_CHECKPOINT, context);
        try {
            Checkpoint checkpoint = context.findCheckpoint(checkpointId)
                .orElseThrow(() -> NotFoundException.checkpoint(OP_DELETE_CHECKPOINT, forkId, checkpointId));
            context.removeCheckpoint(checkpointId);
            try {
                storage.deleteIfExists(checkpoint.snapshotPath());
            } catch (IOException e) {
                throw new IoFailureException(OP_DELETE_CHECKPOINT,
                    "cannot delete snapshot " + checkpoint.snapshotPath(), e);
            }
        } finally {
            context.mutationLock().unlock();
        }
    }

    /**
     * 체크포인트 스냅샷으로 작업본을 되돌립니다. 일반 변경과 같이 버전이 1 증가합니다.
     *
     * @param forkId 포크 ID
     * @param expectedVersion 예상 버전
     * @param checkpointId 체크포인트 ID
     * @return 복원한 체크포인트
     * @throws IllegalStateException 스냅샷이 비었거나 손상된 경우
     * @throws IoFailureException 스냅샷이 없거나 복사 실패
     */
    public Checkpoint restoreCheckpoint(ForkId forkId, long expectedVersion, CheckpointId checkpointId) {
        if (checkpointId == null) {
            throw new IllegalArgumentException("checkpointId cannot be null");
        }
        Checkpoint checkpoint = lookup(OP_RESTORE, forkId).findCheckpoint(checkpointId)
            .orElseThrow(() -> NotFoundException.checkpoint(OP_RESTORE, forkId, checkpointId));

        return mutate(OP_RESTORE, forkId, expectedVersion, fork -> {
            validateSnapshot(checkpoint.snapshotPath());
            storage.copy(checkpoint.snapshotPath(), fork.stagingPath());
            fork.truncateEdits(checkpoint.editCount());
            return checkpoint;
        });
    }

    private void validateSnapshot(Path snapshot) throws IOException {
        if (!storage.exists(snapshot)) {
            throw new NoSuchFileException(snapshot.toString(), null, "checkpoint snapshot missing");
        }
        if (storage.size(snapshot) == 0) {
            throw new IllegalStateException("checkpoint snapshot is empty: " + snapshot);
        }
        String extension = ForkConfig.extensionOf(snapshot);
        if ("xlsx".equals(extension) || "xlsm".equals(extension)) {
            byte[] header = storage.readHeader(snapshot, ZIP_MAGIC.length);
            if (header.length < ZIP_MAGIC.length || header[0] != ZIP_MAGIC[0] || header[1] != ZIP_MAGIC[1]) {
                throw new IllegalStateException("checkpoint snapshot is not a valid " + extension + " file: " + snapshot);
            }
        }
    }

    // ========================================
    // 재계산
    // ========================================

    /**
     * 포크의 재계산 락 참조를 얻습니다. 락 자체는 잡지 않습니다.
     *
     * @param forkId 포크 ID
     * @return lease (try-with-resources로 닫을 것)
     * @throws NotFoundException 포크가 없는 경우
     */
    public RecalcLease acquireRecalcLock(ForkId forkId) {
        lookup(OP_RECALC_LOCK, forkId);
        RecalcLease lease = recalcLocks.acquire(forkId);
        if (!contains(forkId)) {
            // deleted between lookup and acquire: make the entry go away with the lease
            recalcLocks.retire(forkId);
            lease.close();
            throw NotFoundException.fork(OP_RECALC_LOCK, forkId);
        }
        return lease;
    }

    /**
     * 참조가 없으면 재계산 락 엔트리를 정리합니다. 아직 참조 중이면 아무것도 하지 않습니다.
     *
     * @param forkId 포크 ID
     * @return 호출 후 엔트리가 없으면 true
     */
    public boolean releaseRecalcLock(ForkId forkId) {
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        return recalcLocks.prune(forkId);
    }

    /**
     * 재계산 락과 포크 mutationLock을 모두 잡은 상태로 백엔드를 실행합니다.
     * 버전은 바뀌지 않습니다.
     *
     * @param forkId 포크 ID
     * @param backend 재계산 엔진
     * @return 실행 결과
     * @throws LockTimeoutException recalcTimeout 안에 재계산 락을 얻지 못한 경우
     * @throws IllegalStateException 백엔드를 사용할 수 없는 경우
     */
    public RecalcResult recalculate(ForkId forkId, RecalcBackend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (!backend.isAvailable()) {
            throw new IllegalStateException("recalc backend not available: " + backend.name());
        }
        ForkContext context = lookup(OP_RECALC, forkId);
        try (RecalcLease lease = acquireRecalcLock(forkId)) {
            if (!lease.lock(config.recalcTimeout())) {
                throw new LockTimeoutException(OP_RECALC, forkId, config.recalcTimeout());
            }
            lockForMutation(OP_RECALC, context);
            try {
                ensureLive(OP_RECALC, context);
                long started = System.nanoTime();
                backend.recalculate(context.workPath());
                long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                log.debug("fork {} recalculated by {} in {}ms", forkId.getValue(), backend.name(), durationMs);
                return new RecalcResult(forkId, durationMs, backend.name());
            } catch (IOException e) {
                throw new IoFailureException(OP_RECALC, "recalculation failed for fork " + forkId.getValue(), e);
            } finally {
                context.mutationLock().unlock();
            }
        }
    }

    /**
     * 재계산 락 테이블 무결성 검사.
     *
     * @throws LockTableCorruptionException 참조 없는 엔트리의 포크가 존재하지 않는 경우
     */
    public void verifyLockTable() {
        // 엔트리 수집과 포크 확인을 같은 read lock 안에서: 제거 중인 포크가 고아로 보이지 않음
        structureLock.readLock().lock();
        try {
            for (ForkId forkId : recalcLocks.unreferencedKeys()) {
                if (!forks.containsKey(forkId)) {
                    throw new LockTableCorruptionException(OP_VERIFY,
                        "orphan recalc lock entry for missing fork " + forkId.getValue());
                }
            }
        } finally {
            structureLock.readLock().unlock();
        }
    }

    public RecalcLockTable recalcLockTable() {
        return recalcLocks;
    }

    // ========================================
    // 내부
    // ========================================

    private ForkContext lookup(String operation, ForkId forkId) {
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        structureLock.readLock().lock();
        try {
            ForkContext context = forks.get(forkId);
            if (context == null) {
                throw NotFoundException.fork(operation, forkId);
            }
            return context;
        } finally {
            structureLock.readLock().unlock();
        }
    }

    private List<ForkContext> snapshotContexts() {
        structureLock.readLock().lock();
        try {
            return new ArrayList<>(forks.values());
        } finally {
            structureLock.readLock().unlock();
        }
    }

    private void ensureCapacity() {
        if (forkCount() >= config.maxForks()) {
            throw new IllegalStateException("fork limit reached (" + config.maxForks() + ")");
        }
    }

    private String validateSource(Path basePath) {
        String extension = ForkConfig.extensionOf(basePath);
        if (!config.isAllowed(basePath)) {
            throw new IllegalArgumentException("extension not allowed: " + basePath.getFileName()
                + " (allowed: " + config.allowedExtensions() + ")");
        }
        if (!storage.exists(basePath)) {
            throw NotFoundException.workbook(OP_CREATE, basePath.toString());
        }
        long size;
        try {
            size = storage.size(basePath);
        } catch (IOException e) {
            throw new IoFailureException(OP_CREATE, "cannot stat " + basePath, e);
        }
        if (size > config.maxFileSizeBytes()) {
            throw new IllegalArgumentException("file too large: " + size + " bytes (max "
                + config.maxFileSizeBytes() + ")");
        }
        return extension;
    }

    private void insert(ForkContext context) {
        structureLock.writeLock().lock();
        try {
            if (forks.size() >= config.maxForks()) {
                throw new IllegalStateException("fork limit reached (" + config.maxForks() + ")");
            }
            forks.put(context.forkId(), context);
        } finally {
            structureLock.writeLock().unlock();
        }
    }

    private boolean removeEntry(ForkId forkId) {
        structureLock.writeLock().lock();
        try {
            return forks.remove(forkId) != null;
        } finally {
            structureLock.writeLock().unlock();
        }
    }

    private void lockForMutation(String operation, ForkContext context) {
        boolean acquired;
        try {
            acquired = context.mutationLock().tryLock(config.lockTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for fork " + context.forkId().getValue(), e);
        }
        if (!acquired) {
            throw new LockTimeoutException(operation, context.forkId(), config.lockTimeout());
        }
    }

    /**
     * mutationLock을 잡은 뒤 호출: 그 사이 포크가 제거되었으면 NotFound.
     */
    private void ensureLive(String operation, ForkContext context) {
        if (context.state().isTerminal()) {
            throw NotFoundException.fork(operation, context.forkId());
        }
        structureLock.readLock().lock();
        try {
            if (forks.get(context.forkId()) != context) {
                throw NotFoundException.fork(operation, context.forkId());
            }
        } finally {
            structureLock.readLock().unlock();
        }
    }

    /**
     * mutationLock을 잡은 상태에서 호출. 엔트리와 재계산 락 엔트리 제거는 write lock 안에서,
     * 파일 삭제는 락 밖에서 수행합니다.
     */
    private void retire(String operation, ForkContext context, ForkState terminal) {
        ForkId forkId = context.forkId();
        structureLock.writeLock().lock();
        try {
            if (forks.get(forkId) != context) {
                throw NotFoundException.fork(operation, forkId);
            }
            forks.remove(forkId);
            recalcLocks.retire(forkId);
        } finally {
            structureLock.writeLock().unlock();
        }
        context.transitionTo(terminal);

        List<Path> files = new ArrayList<>(context.drainCheckpointPaths());
        files.add(0, context.workPath());
        IOException failure = null;
        for (Path file : files) {
            try {
                storage.deleteIfExists(file);
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        log.debug("fork {} removed ({})", forkId.getValue(), terminal);
        if (failure != null) {
            throw new IoFailureException(operation, "fork " + forkId.getValue() + " removed but files remain", failure);
        }
    }

    private Path stagingPathFor(ForkContext context) {
        String extension = ForkConfig.extensionOf(context.workPath());
        return config.forkDir().resolve(
            context.forkId().getValue() + ".staging-" + UUID.randomUUID() + "." + extension);
    }

    private static boolean isSameFile(Path a, Path b) {
        return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }

    /**
     * {@link MutableFork} 구현. 편집 로그 변경은 커밋 전까지 이 객체에만 쌓입니다.
     */
    private static final class StagedMutation implements MutableFork {

        private final ForkContext context;
        private final Path stagingPath;
        private final List<EditRecord> pendingEdits;

        StagedMutation(ForkContext context, Path stagingPath) {
            this.context = context;
            this.stagingPath = stagingPath;
            this.pendingEdits = new ArrayList<>(context.edits());
        }

        @Override
        public ForkId forkId() {
            return context.forkId();
        }

        @Override
        public WorkbookId workbookId() {
            return context.workbookId();
        }

        @Override
        public Path stagingPath() {
            return stagingPath;
        }

        @Override
        public Path workPath() {
            return context.workPath();
        }

        @Override
        public long version() {
            return context.version();
        }

        @Override
        public List<EditRecord> edits() {
            return List.copyOf(pendingEdits);
        }

        @Override
        public void recordEdit(EditRecord edit) {
            if (edit == null) {
                throw new IllegalArgumentException("edit cannot be null");
            }
            pendingEdits.add(edit);
        }

        @Override
        public void truncateEdits(int count) {
            if (count < 0) {
                throw new IllegalArgumentException("count cannot be negative: " + count);
            }
            while (pendingEdits.size() > count) {
                pendingEdits.remove(pendingEdits.size() - 1);
            }
        }
    }
}
