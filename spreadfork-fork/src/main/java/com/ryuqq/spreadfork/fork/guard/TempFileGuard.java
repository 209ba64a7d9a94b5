package com.ryuqq.spreadfork.fork.guard;

import com.ryuqq.spreadfork.fork.storage.ForkStorage;

import java.nio.file.Path;

/**
 * 임시 파일 가드.
 *
 * <p>스테이징 파일이나 저장용 임시 파일을 감쌉니다. 성공적으로 승격(promote)된 뒤
 * {@link #disarm()}으로 경로를 돌려받고, 그 전에 블록을 벗어나면 파일을 삭제합니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class TempFileGuard extends ScopedGuard {

    private final Path path;
    private final ForkStorage storage;

    /**
     * @param path 보호할 임시 파일 경로 (아직 존재하지 않아도 됨)
     * @param storage 삭제에 사용할 스토리지
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TempFileGuard(Path path, ForkStorage storage) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        this.path = path;
        this.storage = storage;
    }

    public Path path() {
        return path;
    }

    /**
     * @return 보호하던 경로
     */
    public Path disarm() {
        disarmGuard();
        return path;
    }

    @Override
    protected void rollback() throws Exception {
        storage.deleteIfExists(path);
    }

    @Override
    protected String describe() {
        return "temp file " + path;
    }
}
