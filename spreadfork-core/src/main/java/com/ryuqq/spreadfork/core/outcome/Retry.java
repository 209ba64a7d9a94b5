package com.ryuqq.spreadfork.core.outcome;

/**
 * 재시도 가능한 실패.
 *
 * <p>낙관적 버전 검사 실패(VERSION_CONFLICT)나 포크 락 대기 초과(LOCK_TIMEOUT)를 나타냅니다.
 * 버전 충돌인 경우 현재 버전을 포함하므로 호출자는 상태를 다시 읽고 재시도할 수 있습니다.</p>
 *
 * @param operation 작업 이름
 * @param errorCode 오류 코드 (VERSION_CONFLICT, LOCK_TIMEOUT)
 * @param reason 재시도 사유
 * @param currentVersion 현재 포크 버전 (버전 충돌이 아니면 null)
 * @param <T> 성공 시 결과 타입
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record Retry<T>(
    String operation,
    String errorCode,
    String reason,
    Long currentVersion
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (currentVersion != null && currentVersion < 0) {
            throw new IllegalArgumentException("currentVersion must be non-negative (current: " + currentVersion + ")");
        }
    }
}
