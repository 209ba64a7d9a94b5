package com.ryuqq.spreadfork.core.error;

import com.ryuqq.spreadfork.core.model.ForkId;

import java.time.Duration;

/**
 * 포크 단위 락(변경 락 또는 재계산 락)을 제한 시간 안에 얻지 못함.
 *
 * <p>재시도 가능 오류입니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public class LockTimeoutException extends EngineException {

    private final ForkId forkId;
    private final Duration timeout;

    public LockTimeoutException(String operation, ForkId forkId, Duration timeout) {
        super(ErrorKind.LOCK_TIMEOUT, operation,
            "timed out after " + timeout.toMillis() + "ms waiting for lock on fork " + forkId.getValue());
        this.forkId = forkId;
        this.timeout = timeout;
    }

    public ForkId forkId() {
        return forkId;
    }

    public Duration timeout() {
        return timeout;
    }
}
