package com.ryuqq.spreadfork.core.config;

import java.time.Duration;
import java.util.List;

/**
 * 캐시 워밍 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 워밍 실행 여부 (기본 true)</li>
 *   <li>maxWorkbooks: 미리 로드할 최대 워크북 수 (기본 5)</li>
 *   <li>timeout: 워밍 전체 시간 한도 (기본 30초)</li>
 *   <li>workbookIds: 명시적 대상 (비어 있으면 최근 수정된 워크북 자동 선택)</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 * @param enabled 워밍 실행 여부
 * @param maxWorkbooks 최대 워크북 수 (1 이상)
 * @param timeout 시간 한도 (양수)
 * @param workbookIds 명시적 대상 ID 목록
 */
public record CacheWarmingConfig(boolean enabled, int maxWorkbooks, Duration timeout, List<String> workbookIds) {

    /**
     * 기본 설정 생성자.
     */
    public CacheWarmingConfig() {
        this(true, 5, Duration.ofSeconds(30), List.of());
    }

    public CacheWarmingConfig {
        if (maxWorkbooks <= 0) {
            throw new IllegalArgumentException("maxWorkbooks must be positive (current: " + maxWorkbooks + ")");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        workbookIds = workbookIds == null ? List.of() : List.copyOf(workbookIds);
    }

    /**
     * 워밍을 끈 새 인스턴스 생성.
     *
     * @return 새 CacheWarmingConfig 인스턴스
     */
    public CacheWarmingConfig disabled() {
        return new CacheWarmingConfig(false, maxWorkbooks, timeout, workbookIds);
    }

    /**
     * 대상 ID만 변경한 새 인스턴스 생성.
     *
     * @param workbookIds 명시적 대상
     * @return 새 CacheWarmingConfig 인스턴스
     */
    public CacheWarmingConfig withWorkbookIds(List<String> workbookIds) {
        return new CacheWarmingConfig(enabled, maxWorkbooks, timeout, workbookIds);
    }

    /**
     * maxWorkbooks만 변경한 새 인스턴스 생성.
     *
     * @param maxWorkbooks 최대 워크북 수
     * @return 새 CacheWarmingConfig 인스턴스
     */
    public CacheWarmingConfig withMaxWorkbooks(int maxWorkbooks) {
        return new CacheWarmingConfig(enabled, maxWorkbooks, timeout, workbookIds);
    }
}
