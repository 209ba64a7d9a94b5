package com.ryuqq.spreadfork.cache.warming;

import java.util.List;

/**
 * 캐시 워밍 결과.
 *
 * @param loaded 적재 성공 수
 * @param failed 적재 실패 수
 * @param durationMs 소요 시간
 * @param errors 실패 메시지 ("id: message")
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record CacheWarmingResult(int loaded, int failed, long durationMs, List<String> errors) {

    public CacheWarmingResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static CacheWarmingResult empty() {
        return new CacheWarmingResult(0, 0, 0L, List.of());
    }
}
