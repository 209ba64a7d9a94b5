package com.ryuqq.spreadfork.application.engine;

import com.ryuqq.spreadfork.application.operations.DefaultForkOperations;
import com.ryuqq.spreadfork.application.operations.ForkOperations;
import com.ryuqq.spreadfork.cache.WorkbookCache;
import com.ryuqq.spreadfork.cache.warming.CacheWarmer;
import com.ryuqq.spreadfork.cache.warming.CacheWarmingResult;
import com.ryuqq.spreadfork.core.config.CacheConfig;
import com.ryuqq.spreadfork.core.config.CacheWarmingConfig;
import com.ryuqq.spreadfork.core.config.ForkConfig;
import com.ryuqq.spreadfork.core.spi.RecalcBackend;
import com.ryuqq.spreadfork.core.spi.WorkbookLoader;
import com.ryuqq.spreadfork.core.spi.WorkbookLocator;
import com.ryuqq.spreadfork.fork.ForkRegistry;
import com.ryuqq.spreadfork.fork.storage.ForkStorage;
import com.ryuqq.spreadfork.fork.storage.LocalForkStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * 캐시, 레지스트리, 연산 표면을 한 번에 조립합니다.
 *
 * <p><strong>조립 순서:</strong></p>
 * <pre>
 * 1. DeferredForkPathResolver 생성 (미연결)
 * 2. WorkbookCache(cacheConfig, loader, locator, deferred)
 * 3. ForkRegistry(forkConfig, cache)     ← 캐시가 SourceResolver
 * 4. deferred.bind(registry)             ← 이제 캐시가 포크 ID를 작업본으로 해석
 * 5. DefaultForkOperations(registry, cache, backend)
 * </pre>
 *
 * <p>전역 상태는 없습니다. 테스트마다 새 엔진을 만들어도 됩니다.</p>
 *
 * @param <H> 워크북 핸들 타입
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class SpreadforkEngine<H> {

    private static final Logger log = LoggerFactory.getLogger(SpreadforkEngine.class);

    private final ForkRegistry registry;
    private final WorkbookCache<H> cache;
    private final ForkOperations<H> operations;
    private final CacheWarmer warmer;

    private SpreadforkEngine(ForkRegistry registry, WorkbookCache<H> cache, ForkOperations<H> operations) {
        this.registry = registry;
        this.cache = cache;
        this.operations = operations;
        this.warmer = new CacheWarmer(cache);
    }

    /**
     * 재계산 엔진 없이 조립. recalculate는 INVALID_STATE로 실패합니다.
     */
    public static <H> SpreadforkEngine<H> create(ForkConfig forkConfig, CacheConfig cacheConfig,
                                                 WorkbookLoader<H> loader, WorkbookLocator locator) {
        return create(forkConfig, cacheConfig, loader, locator, new NoRecalcBackend());
    }

    /**
     * 엔진 조립.
     *
     * @param forkConfig 포크 설정
     * @param cacheConfig 캐시 설정
     * @param loader 워크북 파서
     * @param locator 워크스페이스 탐색기
     * @param recalcBackend 재계산 엔진
     * @param <H> 워크북 핸들 타입
     * @return 조립된 엔진
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <H> SpreadforkEngine<H> create(ForkConfig forkConfig, CacheConfig cacheConfig,
                                                 WorkbookLoader<H> loader, WorkbookLocator locator,
                                                 RecalcBackend recalcBackend) {
        return create(forkConfig, cacheConfig, loader, locator, recalcBackend,
            new LocalForkStorage(), Clock.systemUTC());
    }

    /**
     * 파일 연산과 시계까지 지정하는 조립 (장애 주입, TTL 테스트용).
     *
     * @param storage 포크 파일 연산
     * @param clock TTL 판단용 시계
     */
    public static <H> SpreadforkEngine<H> create(ForkConfig forkConfig, CacheConfig cacheConfig,
                                                 WorkbookLoader<H> loader, WorkbookLocator locator,
                                                 RecalcBackend recalcBackend, ForkStorage storage, Clock clock) {
        if (recalcBackend == null) {
            throw new IllegalArgumentException("recalcBackend cannot be null");
        }
        DeferredForkPathResolver forkPaths = new DeferredForkPathResolver();
        WorkbookCache<H> cache = new WorkbookCache<>(cacheConfig, loader, locator, forkPaths);
        ForkRegistry registry = new ForkRegistry(forkConfig, cache, storage, clock);
        forkPaths.bind(registry);
        ForkOperations<H> operations = new DefaultForkOperations<>(registry, cache, recalcBackend);
        log.info("spreadfork engine ready: cache capacity={}, maxForks={}, recalc backend={}",
            cache.capacity(), forkConfig.maxForks(), recalcBackend.name());
        return new SpreadforkEngine<>(registry, cache, operations);
    }

    /**
     * 캐시 예열. 실패는 결과에 기록되고 예외로 던져지지 않습니다.
     */
    public CacheWarmingResult warm(CacheWarmingConfig config) {
        return warmer.warm(config);
    }

    public ForkOperations<H> operations() {
        return operations;
    }

    public ForkRegistry registry() {
        return registry;
    }

    public WorkbookCache<H> cache() {
        return cache;
    }

    /**
     * 재계산 엔진이 설치되지 않은 환경용.
     */
    private static final class NoRecalcBackend implements RecalcBackend {

        @Override
        public void recalculate(Path workPath) throws IOException {
            throw new IOException("no recalculation engine installed");
        }

        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public String name() {
            return "none";
        }
    }
}
