package com.ryuqq.spreadfork.fork.guard;

import com.ryuqq.spreadfork.fork.storage.ForkStorage;

import java.nio.file.Path;

/**
 * 체크포인트 스냅샷 가드.
 *
 * <p>스냅샷 파일은 복사되었지만 체크포인트 레코드가 등록되지 않은 경우, 고아가 된
 * 스냅샷을 삭제합니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class CheckpointGuard extends ScopedGuard {

    private final Path snapshotPath;
    private final ForkStorage storage;

    public CheckpointGuard(Path snapshotPath, ForkStorage storage) {
        if (snapshotPath == null) {
            throw new IllegalArgumentException("snapshotPath cannot be null");
        }
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        this.snapshotPath = snapshotPath;
        this.storage = storage;
    }

    public Path snapshotPath() {
        return snapshotPath;
    }

    public void disarm() {
        disarmGuard();
    }

    @Override
    protected void rollback() throws Exception {
        storage.deleteIfExists(snapshotPath);
    }

    @Override
    protected String describe() {
        return "checkpoint snapshot " + snapshotPath;
    }
}
