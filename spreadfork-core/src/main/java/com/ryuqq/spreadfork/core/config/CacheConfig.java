package com.ryuqq.spreadfork.core.config;

import com.ryuqq.spreadfork.core.error.CacheCapacityMisconfiguredException;

/**
 * 워크북 캐시 설정 (불변 record).
 *
 * @author Spreadfork Team
 * @since 1.0.0
 * @param capacity 최대 보관 워크북 수 (1 이상, 기본 5)
 */
public record CacheConfig(int capacity) {

    public static final int DEFAULT_CAPACITY = 5;

    /**
     * 기본 설정 생성자 (capacity=5).
     */
    public CacheConfig() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws CacheCapacityMisconfiguredException capacity가 1 미만인 경우
     */
    public CacheConfig {
        if (capacity < 1) {
            throw new CacheCapacityMisconfiguredException(capacity);
        }
    }
}
