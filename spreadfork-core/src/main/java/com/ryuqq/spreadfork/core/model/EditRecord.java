package com.ryuqq.spreadfork.core.model;

import java.time.Instant;

/**
 * 포크에 적용된 단일 셀 편집 기록.
 *
 * <p>편집 로그는 versioned mutation이 성공한 경우에만 커밋됩니다.</p>
 *
 * @param timestamp 편집 시각
 * @param sheet 시트 이름
 * @param address 셀 주소 (예: A1)
 * @param value 입력 값 또는 수식 본문
 * @param formula 수식 여부
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record EditRecord(
    Instant timestamp,
    String sheet,
    String address,
    String value,
    boolean formula
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException timestamp, sheet, address가 누락된 경우
     */
    public EditRecord {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (sheet == null || sheet.isBlank()) {
            throw new IllegalArgumentException("sheet cannot be null or blank");
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address cannot be null or blank");
        }
        if (value == null) {
            value = "";
        }
    }

    /**
     * 값 편집 생성.
     *
     * @param sheet 시트 이름
     * @param address 셀 주소
     * @param value 값
     * @return EditRecord
     */
    public static EditRecord value(String sheet, String address, String value) {
        return new EditRecord(Instant.now(), sheet, address, value, false);
    }

    /**
     * 수식 편집 생성.
     *
     * @param sheet 시트 이름
     * @param address 셀 주소
     * @param formula 수식 본문
     * @return EditRecord
     */
    public static EditRecord formula(String sheet, String address, String formula) {
        return new EditRecord(Instant.now(), sheet, address, formula, true);
    }
}
