package com.ryuqq.spreadfork.adapter.runner;

/**
 * ForkReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>initialDelayMs: 첫 스캔까지 대기 (기본 60000ms = 1분)</li>
 *   <li>scanIntervalMs: 스캔 주기 (기본 300000ms = 5분)</li>
 *   <li>verifyLockTable: 스캔마다 재계산 락 테이블 검사 여부 (기본 true)</li>
 * </ul>
 *
 * <p>포크 TTL 자체는 {@code ForkConfig.ttl}이 정합니다. 스캔 주기가 TTL보다 길면
 * 만료된 포크가 최대 한 주기만큼 더 남아 있을 수 있습니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 * @param initialDelayMs 첫 스캔 지연 (밀리초, 0 이상)
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param verifyLockTable 락 테이블 검사 여부
 */
public record ReaperConfig(
    long initialDelayMs,
    long scanIntervalMs,
    boolean verifyLockTable
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: initialDelayMs=60000ms (1분), scanIntervalMs=300000ms (5분),
     * verifyLockTable=true</p>
     */
    public ReaperConfig() {
        this(60000, 300000, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReaperConfig {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs must not be negative (current: " + initialDelayMs + ")"
            );
        }
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
    }

    /**
     * initialDelayMs만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withInitialDelayMs(long initialDelayMs) {
        return new ReaperConfig(initialDelayMs, scanIntervalMs, verifyLockTable);
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(initialDelayMs, scanIntervalMs, verifyLockTable);
    }

    /**
     * verifyLockTable만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withVerifyLockTable(boolean verifyLockTable) {
        return new ReaperConfig(initialDelayMs, scanIntervalMs, verifyLockTable);
    }
}
