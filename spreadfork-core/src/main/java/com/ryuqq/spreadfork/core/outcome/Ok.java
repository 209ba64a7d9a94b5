package com.ryuqq.spreadfork.core.outcome;

/**
 * 성공 결과.
 *
 * @param operation 작업 이름 (예: create_fork)
 * @param value 결과 값 (반환 값이 없는 작업은 null)
 * @param <T> 결과 타입
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record Ok<T>(
    String operation,
    T value
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operation이 null이거나 빈 문자열인 경우
     */
    public Ok {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        // value는 null 허용
    }

    /**
     * 성공 결과 생성.
     *
     * @param operation 작업 이름
     * @param value 결과 값
     * @param <T> 결과 타입
     * @return Ok 인스턴스
     */
    public static <T> Ok<T> of(String operation, T value) {
        return new Ok<>(operation, value);
    }
}
