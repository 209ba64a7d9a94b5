package com.ryuqq.spreadfork.core.model;

import java.util.UUID;

/**
 * 포크(격리된 작업 사본)의 전역 고유 식별자.
 *
 * <p>프로세스 수명 동안 재사용되지 않습니다. {@link #generate()}는 랜덤 UUID를 사용합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class ForkId {

    private final String value;

    private ForkId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ForkId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ForkId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("ForkId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ForkId 생성.
     *
     * @param value ForkId 값
     * @return ForkId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ForkId of(String value) {
        return new ForkId(value);
    }

    /**
     * 새 ForkId 발급 (UUID 기반).
     *
     * @return 새 ForkId
     */
    public static ForkId generate() {
        return new ForkId(UUID.randomUUID().toString());
    }

    /**
     * ForkId 값 조회.
     *
     * @return ForkId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ForkId forkId = (ForkId) o;
        return value.equals(forkId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ForkId{" + value + '}';
    }
}
