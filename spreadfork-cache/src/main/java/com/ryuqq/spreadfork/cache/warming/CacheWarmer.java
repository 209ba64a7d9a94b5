package com.ryuqq.spreadfork.cache.warming;

import com.ryuqq.spreadfork.cache.WorkbookCache;
import com.ryuqq.spreadfork.core.config.CacheWarmingConfig;
import com.ryuqq.spreadfork.core.error.EngineException;
import com.ryuqq.spreadfork.core.model.LocatedWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 캐시 워밍 컴포넌트.
 *
 * <p>서버 시작 직후 자주 쓰이는 워크북을 미리 적재해서 첫 요청의 지연을 없앱니다.</p>
 *
 * <p><strong>대상 선정:</strong></p>
 * <ul>
 *   <li>{@link CacheWarmingConfig#workbookIds()}가 있으면 그 목록</li>
 *   <li>없으면 작업 공간에서 최근 수정된 순서</li>
 *   <li>어느 쪽이든 {@code maxWorkbooks}개까지</li>
 * </ul>
 *
 * <p>개별 워크북 실패는 결과에 기록하고 계속 진행합니다. timeout을 넘기면 남은 대상은
 * 건너뜁니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class CacheWarmer {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmer.class);

    private final WorkbookCache<?> cache;

    public CacheWarmer(WorkbookCache<?> cache) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        this.cache = cache;
    }

    /**
     * 워밍 실행.
     *
     * @param config 워밍 설정
     * @return 결과 (예외를 던지지 않음)
     */
    public CacheWarmingResult warm(CacheWarmingConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (!config.enabled()) {
            log.debug("cache warming disabled");
            return CacheWarmingResult.empty();
        }

        long started = System.nanoTime();
        long deadline = started + config.timeout().toNanos();
        log.info("Cache warming started: maxWorkbooks={}, timeout={}ms",
            config.maxWorkbooks(), config.timeout().toMillis());

        int loaded = 0;
        int failed = 0;
        List<String> errors = new ArrayList<>();

        List<String> targets;
        try {
            targets = selectTargets(config);
        } catch (EngineException e) {
            log.warn("Cache warming could not discover workbooks: {}", e.getMessage());
            errors.add("discover: " + e.getMessage());
            return new CacheWarmingResult(0, 1, elapsedMs(started), errors);
        }

        for (String workbookId : targets) {
            if (System.nanoTime() - deadline >= 0) {
                log.warn("Cache warming timeout reached, stopping early: loaded={}, failed={}", loaded, failed);
                break;
            }
            try {
                cache.openWorkbook(workbookId);
                loaded++;
                log.debug("warmed workbook {}", workbookId);
            } catch (RuntimeException e) {
                failed++;
                errors.add(workbookId + ": " + e.getMessage());
                log.warn("Failed to warm workbook {}: {}", workbookId, e.getMessage());
            }
        }

        CacheWarmingResult result = new CacheWarmingResult(loaded, failed, elapsedMs(started), errors);
        log.info("Cache warming completed: loaded={}, failed={}, durationMs={}",
            loaded, failed, result.durationMs());
        return result;
    }

    private List<String> selectTargets(CacheWarmingConfig config) {
        List<String> ids = new ArrayList<>();
        if (!config.workbookIds().isEmpty()) {
            ids.addAll(config.workbookIds());
        } else {
            // listWorkbooks는 최근 수정 순으로 정렬되어 있음
            for (LocatedWorkbook located : cache.listWorkbooks()) {
                ids.add(located.workbookId().getValue());
            }
        }
        return ids.size() > config.maxWorkbooks() ? ids.subList(0, config.maxWorkbooks()) : ids;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
