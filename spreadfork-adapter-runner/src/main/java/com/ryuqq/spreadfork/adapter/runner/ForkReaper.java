package com.ryuqq.spreadfork.adapter.runner;

import com.ryuqq.spreadfork.core.error.LockTableCorruptionException;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.fork.ForkRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ForkReaper 컴포넌트.
 *
 * <p>TTL이 지난 포크를 정리하고 재계산 락 테이블의 무결성을 검사합니다.</p>
 *
 * <p><strong>정리 시나리오:</strong></p>
 * <pre>
 * 1. 클라이언트가 포크 생성 후 save/discard 없이 이탈
 * 2. 작업본 파일과 체크포인트 스냅샷이 디스크에 남음
 * 3. ForkReaper가 주기적 스캔 (예: 5분마다)
 * 4. createdAt + ttl을 넘긴 포크 발견
 * 5. deleteFork: 진행 중 변경이 끝난 뒤 제거, 파일 삭제, 락 엔트리 정리
 * 6. verifyLockTable: 살아있는 포크가 없는 미참조 락 엔트리가 있으면 손상으로 보고
 * </pre>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>만료 포크 제거 (개별 실패는 레지스트리가 로그 후 계속 진행)</li>
 *   <li>락 테이블 검사 (손상은 ERROR 로그, 다음 스캔은 계속 실행)</li>
 *   <li>스케줄 실행 시작/중지</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class ForkReaper {

    private static final Logger log = LoggerFactory.getLogger(ForkReaper.class);

    private final ForkRegistry registry;
    private final ReaperConfig config;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong scans = new AtomicLong();
    private final AtomicLong corruptions = new AtomicLong();
    private volatile ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param registry 포크 레지스트리
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ForkReaper(ForkRegistry registry, ReaperConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
    }

    /**
     * 만료 포크 정리 및 락 테이블 검사.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. registry.evictExpired() → [ForkId1, ForkId2, ...]
     * 2. verifyLockTable 설정 시 registry.verifyLockTable()
     * 3. 결과 로깅
     * </pre>
     *
     * @return 이번 스캔에서 제거된 포크 ID
     * @throws LockTableCorruptionException 락 테이블 검사에 실패한 경우
     */
    public List<ForkId> scan() {
        log.info("Fork reaper scan started");

        // 1. 만료 포크 제거
        List<ForkId> expired = registry.evictExpired();

        // 2. 락 테이블 검사
        if (config.verifyLockTable()) {
            registry.verifyLockTable();
        }

        // 3. 결과 로깅
        scans.incrementAndGet();
        log.info("Fork reaper scan completed: {} expired forks removed, {} live",
            expired.size(), registry.forkCount());
        return expired;
    }

    /**
     * 주기 실행 시작. 이미 실행 중이면 아무것도 하지 않습니다.
     *
     * @return 이번 호출로 시작되었으면 true
     */
    public synchronized boolean start() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "spreadfork-fork-reaper");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::scheduledScan,
            config.initialDelayMs(), config.scanIntervalMs(), TimeUnit.MILLISECONDS);
        this.scheduler = executor;
        log.info("Fork reaper started: initialDelay={}ms, interval={}ms",
            config.initialDelayMs(), config.scanIntervalMs());
        return true;
    }

    /**
     * 주기 실행 중지.
     *
     * <p>진행 중인 스캔이 끝날 때까지 최대 30초 대기합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public synchronized void stop() throws InterruptedException {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledExecutorService executor = scheduler;
        scheduler = null;
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
        log.info("Fork reaper stopped after {} scans", scans.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return 완료된 스캔 수
     */
    public long completedScans() {
        return scans.get();
    }

    /**
     * @return 락 테이블 손상이 감지된 스캔 수
     */
    public long detectedCorruptions() {
        return corruptions.get();
    }

    /**
     * 스케줄 스레드에서 실행되는 스캔.
     *
     * <p>예외가 스케줄러 밖으로 나가면 이후 실행이 모두 취소되므로 여기서 기록만 합니다.</p>
     */
    private void scheduledScan() {
        try {
            scan();
        } catch (LockTableCorruptionException e) {
            corruptions.incrementAndGet();
            log.error("Fork reaper detected recalc lock table corruption", e);
        } catch (RuntimeException e) {
            log.error("Fork reaper scan failed", e);
        }
    }
}
