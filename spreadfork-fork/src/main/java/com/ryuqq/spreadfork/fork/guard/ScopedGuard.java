package com.ryuqq.spreadfork.fork.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 롤백 가드의 공통 골격.
 *
 * <p>try-with-resources 블록 안에서 작업이 끝까지 성공하면 {@link #disarm()}을 호출하고,
 * 그렇지 않으면 {@link #close()}가 {@link #rollback()}을 실행합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>생성 시 I/O를 수행하지 않음</li>
 *   <li>{@code close()}는 절대 예외를 던지지 않음 (정리 실패는 WARN 로그)</li>
 *   <li>롤백은 최대 한 번만 실행</li>
 * </ul>
 *
 * <p>단일 스레드(가드를 연 스레드) 안에서만 사용합니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public abstract class ScopedGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScopedGuard.class);

    private boolean armed = true;

    /**
     * 작업 성공을 표시합니다. 이후 {@link #close()}는 아무것도 하지 않습니다.
     */
    public final void disarmGuard() {
        this.armed = false;
    }

    public final boolean isArmed() {
        return armed;
    }

    @Override
    public final void close() {
        if (!armed) {
            return;
        }
        armed = false;
        log.debug("guard rollback: {}", describe());
        try {
            rollback();
        } catch (Exception e) {
            log.warn("guard cleanup failed: {}", describe(), e);
        }
    }

    /**
     * 무장 상태에서 닫힐 때 실행되는 정리 작업.
     *
     * @throws Exception 정리 실패 (로그만 남기고 전파하지 않음)
     */
    protected abstract void rollback() throws Exception;

    /**
     * @return 로그용 설명
     */
    protected abstract String describe();
}
