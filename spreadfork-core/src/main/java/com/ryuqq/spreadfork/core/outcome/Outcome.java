package com.ryuqq.spreadfork.core.outcome;

/**
 * 엔진 작업의 실행 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨 (결과 값 포함)</li>
 *   <li>{@link Retry}: 버전 충돌 또는 락 대기 초과, 최신 상태를 읽고 재시도 가능</li>
 *   <li>{@link Fail}: NOT_FOUND, IO_FAILURE 등 재시도해도 성공할 수 없는 실패</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;Long&gt; outcome = operations.editFork(forkId, 1, edits);
 * if (outcome instanceof Retry&lt;Long&gt; retry) {
 *     // retry.currentVersion()으로 다시 시도
 * }
 * </pre>
 *
 * @param <T> 성공 시 결과 타입
 * @author Spreadfork Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Retry, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 성공 값 조회.
     *
     * @return 성공 시 결과 값, 그 외에는 null
     */
    default T valueOrNull() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        return null;
    }
}
