package com.ryuqq.spreadfork.core.model;

/**
 * 원본 워크북의 식별자.
 *
 * <p>워크스페이스 스캔으로 생성되는 정규 ID({@code wb-} 접두사 + base32 토큰)나
 * 포크 ID처럼 캐시에서 열 수 있는 모든 문서를 가리킵니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class WorkbookId {

    private final String value;

    private WorkbookId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkbookId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("WorkbookId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9.\\-_]+$")) {
            throw new IllegalArgumentException("WorkbookId contains invalid characters. Only alphanumeric, dot, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * WorkbookId 생성.
     *
     * @param value WorkbookId 값
     * @return WorkbookId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static WorkbookId of(String value) {
        return new WorkbookId(value);
    }

    /**
     * 포크 ID를 워크북 ID로 취급 (포크의 포크 생성, 포크 작업본 열기).
     *
     * @param forkId 포크 ID
     * @return 같은 값을 가진 WorkbookId
     */
    public static WorkbookId of(ForkId forkId) {
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        return new WorkbookId(forkId.getValue());
    }

    /**
     * WorkbookId 값 조회.
     *
     * @return WorkbookId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkbookId that = (WorkbookId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "WorkbookId{" + value + '}';
    }
}
