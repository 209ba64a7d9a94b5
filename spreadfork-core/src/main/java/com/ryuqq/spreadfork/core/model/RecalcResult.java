package com.ryuqq.spreadfork.core.model;

/**
 * 외부 재계산 엔진의 실행 결과.
 *
 * @param forkId 재계산된 포크
 * @param durationMs 소요 시간 (밀리초)
 * @param backend 엔진 이름
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record RecalcResult(ForkId forkId, long durationMs, String backend) {

    public RecalcResult {
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs cannot be negative: " + durationMs);
        }
        if (backend == null || backend.isBlank()) {
            throw new IllegalArgumentException("backend cannot be null or blank");
        }
    }
}
