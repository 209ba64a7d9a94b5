package com.ryuqq.spreadfork.fork.guard;

import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.fork.storage.ForkStorage;

import java.nio.file.Path;

/**
 * 포크 생성 가드.
 *
 * <p>ID 할당 이후의 생성 과정(복사, 다이제스트, 등록)을 감쌉니다. 등록까지 끝나기 전에
 * 블록을 벗어나면 레지스트리 엔트리와 작업 파일을 모두 제거해서 반쯤 만들어진 포크가
 * 남지 않게 합니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class ForkCreationGuard extends ScopedGuard {

    private final ForkEntryRemover registry;
    private final ForkId forkId;
    private final Path workPath;
    private final ForkStorage storage;

    public ForkCreationGuard(ForkEntryRemover registry, ForkId forkId, Path workPath, ForkStorage storage) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        if (workPath == null) {
            throw new IllegalArgumentException("workPath cannot be null");
        }
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        this.registry = registry;
        this.forkId = forkId;
        this.workPath = workPath;
        this.storage = storage;
    }

    public ForkId forkId() {
        return forkId;
    }

    public void disarm() {
        disarmGuard();
    }

    @Override
    protected void rollback() throws Exception {
        // entry first so no reader resolves a path that is about to disappear
        registry.removeEntry(forkId);
        storage.deleteIfExists(workPath);
    }

    @Override
    protected String describe() {
        return "fork creation " + forkId.getValue() + " (" + workPath + ")";
    }
}
