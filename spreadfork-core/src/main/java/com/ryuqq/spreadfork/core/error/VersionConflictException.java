package com.ryuqq.spreadfork.core.error;

import com.ryuqq.spreadfork.core.model.ForkId;

/**
 * 낙관적 버전 검사 실패.
 *
 * <p>현재 버전을 함께 전달하므로 호출자는 상태를 다시 읽은 뒤
 * {@link #currentVersion()}으로 재시도할 수 있습니다. 치명적 오류로 취급하지 않습니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public class VersionConflictException extends EngineException {

    private final ForkId forkId;
    private final long expectedVersion;
    private final long currentVersion;

    public VersionConflictException(String operation, ForkId forkId, long expectedVersion, long currentVersion) {
        super(ErrorKind.VERSION_CONFLICT, operation,
            String.format("version conflict on fork %s: expected %d, current %d",
                forkId.getValue(), expectedVersion, currentVersion));
        this.forkId = forkId;
        this.expectedVersion = expectedVersion;
        this.currentVersion = currentVersion;
    }

    public ForkId forkId() {
        return forkId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long currentVersion() {
        return currentVersion;
    }
}
