package com.ryuqq.spreadfork.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 캐시 엔트리. 최근 사용 시각은 전역 틱 값으로 기록하며, 적중 시 read lock만 잡은 채
 * 원자적으로 갱신합니다.
 */
final class CacheEntry<H> {

    private final CachedWorkbook<H> workbook;
    private final AtomicLong lastAccess;

    CacheEntry(CachedWorkbook<H> workbook, long tick) {
        this.workbook = workbook;
        this.lastAccess = new AtomicLong(tick);
    }

    CachedWorkbook<H> workbook() {
        return workbook;
    }

    long lastAccess() {
        return lastAccess.get();
    }

    void touch(long tick) {
        lastAccess.accumulateAndGet(tick, Math::max);
    }
}
