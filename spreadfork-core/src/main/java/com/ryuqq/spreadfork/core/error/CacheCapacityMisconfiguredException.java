package com.ryuqq.spreadfork.core.error;

/**
 * 캐시 용량이 1 미만으로 설정됨. 첫 삽입이 아니라 생성 시점에 발생합니다.
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public class CacheCapacityMisconfiguredException extends EngineException {

    private final int capacity;

    public CacheCapacityMisconfiguredException(int capacity) {
        super(ErrorKind.CACHE_CAPACITY_MISCONFIGURED, "workbook_cache",
            "cache capacity must be positive (current: " + capacity + ")");
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }
}
