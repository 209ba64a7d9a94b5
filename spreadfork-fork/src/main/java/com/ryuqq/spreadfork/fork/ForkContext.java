package com.ryuqq.spreadfork.fork;

import com.ryuqq.spreadfork.core.error.VersionConflictException;
import com.ryuqq.spreadfork.core.model.Checkpoint;
import com.ryuqq.spreadfork.core.model.CheckpointId;
import com.ryuqq.spreadfork.core.model.EditRecord;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.core.model.ForkSummary;
import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.core.statemachine.ForkState;
import com.ryuqq.spreadfork.core.statemachine.ForkStateTransition;
import com.ryuqq.spreadfork.fork.storage.ForkStorage;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 포크 하나의 상태.
 *
 * <p>{@link ForkRegistry}가 독점적으로 소유하며, 호출자는 {@link ForkId}나
 * {@link ForkSummary} 스냅샷만 받습니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>{@code version}: {@link AtomicLong}, 읽기는 락 없이 수행</li>
 *   <li>{@code mutationLock}: 같은 포크에 대한 쓰기(변경, 저장, 재계산, 삭제)를 직렬화</li>
 *   <li>편집 로그와 상태는 mutationLock을 잡은 스레드만 변경 (읽기는 volatile 스냅샷)</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class ForkContext {

    private final ForkId forkId;
    private final WorkbookId workbookId;
    private final Path basePath;
    private final Path workPath;
    private final Instant createdAt;
    private volatile String baseDigest;
    private volatile FileTime baseModifiedAt;

    private final AtomicLong version = new AtomicLong(0L);
    private final ReentrantLock mutationLock = new ReentrantLock();
    private final CopyOnWriteArrayList<Checkpoint> checkpoints = new CopyOnWriteArrayList<>();
    private volatile List<EditRecord> edits = List.of();
    private volatile ForkState state = ForkState.CREATED;

    ForkContext(ForkId forkId, WorkbookId workbookId, Path basePath, Path workPath,
                Instant createdAt, String baseDigest, FileTime baseModifiedAt) {
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        if (workbookId == null) {
            throw new IllegalArgumentException("workbookId cannot be null");
        }
        if (basePath == null) {
            throw new IllegalArgumentException("basePath cannot be null");
        }
        if (workPath == null) {
            throw new IllegalArgumentException("workPath cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        this.forkId = forkId;
        this.workbookId = workbookId;
        this.basePath = basePath;
        this.workPath = workPath;
        this.createdAt = createdAt;
        this.baseDigest = baseDigest;
        this.baseModifiedAt = baseModifiedAt;
    }

    public ForkId forkId() {
        return forkId;
    }

    public WorkbookId workbookId() {
        return workbookId;
    }

    public Path basePath() {
        return basePath;
    }

    public Path workPath() {
        return workPath;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public ForkState state() {
        return state;
    }

    /**
     * 현재 버전 (락 없이 읽기).
     *
     * @return 성공한 변경 횟수
     */
    public long version() {
        return version.get();
    }

    /**
     * 변경이 적용된 뒤 정확히 한 번 호출됩니다.
     *
     * @return 증가된 버전
     */
    long incrementVersion() {
        long next = version.incrementAndGet();
        if (state == ForkState.CREATED) {
            state = ForkStateTransition.transition(state, ForkState.MODIFIED);
        }
        return next;
    }

    /**
     * 예상 버전 검증. 상태를 바꾸지 않습니다.
     *
     * @param operation 오류 메시지용 작업 이름
     * @param expected 호출자가 마지막으로 관찰한 버전
     * @throws VersionConflictException 현재 버전과 다른 경우
     */
    public void validateVersion(String operation, long expected) {
        long current = version.get();
        if (current != expected) {
            throw new VersionConflictException(operation, forkId, expected, current);
        }
    }

    public void validateVersion(long expected) {
        validateVersion("validate_version", expected);
    }

    /**
     * @param ttl 포크 수명
     * @param now 기준 시각
     * @return 생성 시각이 ttl보다 오래된 경우 true
     */
    public boolean isExpired(Duration ttl, Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }

    /**
     * 원본 파일이 포크 생성 이후 바뀌지 않았는지 확인합니다.
     *
     * @param storage 스토리지
     * @throws IOException 원본을 읽을 수 없는 경우
     * @throws IllegalStateException 수정 시각이나 내용 다이제스트가 달라진 경우
     */
    public void validateBaseUnchanged(ForkStorage storage) throws IOException {
        if (!storage.exists(basePath)) {
            throw new IllegalStateException("base file no longer exists: " + basePath);
        }
        FileTime modified = storage.lastModified(basePath);
        if (baseModifiedAt != null && !baseModifiedAt.equals(modified)) {
            throw new IllegalStateException("base file modified since fork creation: " + basePath);
        }
        if (baseDigest != null && !baseDigest.equals(storage.digest(basePath))) {
            throw new IllegalStateException("base file modified since fork creation: " + basePath);
        }
    }

    /**
     * 원본을 덮어쓴 저장 이후 기준점을 갱신합니다.
     */
    void rebase(String digest, FileTime modifiedAt) {
        this.baseDigest = digest;
        this.baseModifiedAt = modifiedAt;
    }

    ReentrantLock mutationLock() {
        return mutationLock;
    }

    void transitionTo(ForkState next) {
        this.state = ForkStateTransition.transition(state, next);
    }

    // ========================================
    // 편집 로그
    // ========================================

    public List<EditRecord> edits() {
        return edits;
    }

    void commitEdits(List<EditRecord> committed) {
        this.edits = List.copyOf(committed);
    }

    // ========================================
    // 체크포인트
    // ========================================

    public List<Checkpoint> checkpoints() {
        return List.copyOf(checkpoints);
    }

    public Optional<Checkpoint> findCheckpoint(CheckpointId checkpointId) {
        for (Checkpoint checkpoint : checkpoints) {
            if (checkpoint.checkpointId().equals(checkpointId)) {
                return Optional.of(checkpoint);
            }
        }
        return Optional.empty();
    }

    int checkpointCount() {
        return checkpoints.size();
    }

    void addCheckpoint(Checkpoint checkpoint) {
        checkpoints.add(checkpoint);
    }

    boolean removeCheckpoint(CheckpointId checkpointId) {
        return checkpoints.removeIf(c -> c.checkpointId().equals(checkpointId));
    }

    /**
     * 삭제할 스냅샷 경로를 꺼내고 목록을 비웁니다.
     */
    List<Path> drainCheckpointPaths() {
        List<Path> paths = new ArrayList<>();
        for (Checkpoint checkpoint : checkpoints) {
            paths.add(checkpoint.snapshotPath());
        }
        checkpoints.clear();
        return paths;
    }

    public ForkSummary toSummary() {
        return new ForkSummary(forkId, workbookId, basePath, workPath, version.get(), createdAt,
            edits.size(), checkpoints.size());
    }
}
