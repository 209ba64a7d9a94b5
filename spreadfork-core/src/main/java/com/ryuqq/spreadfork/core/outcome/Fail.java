package com.ryuqq.spreadfork.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>NOT_FOUND: 알 수 없는 포크/워크북/체크포인트</li>
 *   <li>IO_FAILURE: 파일 복사/삭제/이동 실패</li>
 *   <li>INVALID_REQUEST: 잘못된 파라미터 (확장자, 파일 크기 등)</li>
 *   <li>INVALID_STATE: 포크 수 제한, 원본 변경, 종료 상태 등</li>
 *   <li>LOCK_TABLE_CORRUPTION: 내부 일관성 위반 (치명적)</li>
 * </ul>
 *
 * @param operation 작업 이름
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 * @param <T> 성공 시 결과 타입
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record Fail<T>(
    String operation,
    String errorCode,
    String message,
    String cause
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operation, errorCode, message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param operation 작업 이름
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param <T> 성공 시 결과 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> of(String operation, String errorCode, String message) {
        return new Fail<>(operation, errorCode, message, null);
    }
}
