package com.ryuqq.spreadfork.core.error;

/**
 * 엔진 오류 분류.
 *
 * <p><strong>재시도 가능 여부:</strong></p>
 * <ul>
 *   <li>VERSION_CONFLICT, LOCK_TIMEOUT: 호출자가 최신 상태를 다시 읽고 재시도</li>
 *   <li>LOCK_TABLE_CORRUPTION: 내부 일관성 위반, 재시도 불가 (치명적)</li>
 *   <li>그 외: 요청 자체를 수정해야 함</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 알 수 없는 포크/워크북/체크포인트 ID.
     */
    NOT_FOUND,

    /**
     * 낙관적 버전 검사 실패.
     */
    VERSION_CONFLICT,

    /**
     * 파일 복사/삭제/이동 실패.
     */
    IO_FAILURE,

    /**
     * 재계산 락 테이블과 포크 맵 사이의 불일치.
     */
    LOCK_TABLE_CORRUPTION,

    /**
     * 캐시 용량 설정 오류 (0 이하).
     */
    CACHE_CAPACITY_MISCONFIGURED,

    /**
     * 락 획득 대기 시간 초과.
     */
    LOCK_TIMEOUT;

    /**
     * 호출자가 재시도로 복구할 수 있는 오류인지 확인.
     *
     * @return VERSION_CONFLICT 또는 LOCK_TIMEOUT인 경우 true
     */
    public boolean isRetryable() {
        return this == VERSION_CONFLICT || this == LOCK_TIMEOUT;
    }

    /**
     * 치명적 오류인지 확인.
     *
     * @return LOCK_TABLE_CORRUPTION인 경우 true
     */
    public boolean isFatal() {
        return this == LOCK_TABLE_CORRUPTION;
    }
}
