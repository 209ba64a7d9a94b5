/**
 * Runner Adapter Layer - 백그라운드 정리 작업.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.spreadfork.adapter.runner.ForkReaper} - 만료 포크 정리와 락 테이블 검사</li>
 *   <li>{@link com.ryuqq.spreadfork.adapter.runner.ReaperConfig} - 스캔 주기 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ForkReaper)
 *   ↓ depends on
 * fork (ForkRegistry.evictExpired, verifyLockTable)
 *   ↓ depends on
 * core (ForkId, ForkConfig, LockTableCorruptionException)
 * </pre>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
package com.ryuqq.spreadfork.adapter.runner;
