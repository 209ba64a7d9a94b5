package com.ryuqq.spreadfork.cache;

/**
 * 캐시 통계 스냅샷.
 *
 * @param operations openWorkbook 호출 수
 * @param hits 캐시 적중 수
 * @param misses 캐시 미스 수
 * @param size 현재 엔트리 수
 * @param capacity 최대 엔트리 수
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record CacheStats(long operations, long hits, long misses, int size, int capacity) {

    /**
     * @return hits / operations, 호출이 없으면 0.0
     */
    public double hitRate() {
        return operations == 0 ? 0.0 : (double) hits / operations;
    }
}
