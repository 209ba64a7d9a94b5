package com.ryuqq.spreadfork.application.engine;

import com.ryuqq.spreadfork.core.spi.ForkPathResolver;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 나중에 연결되는 ForkPathResolver.
 *
 * <p>WorkbookCache는 생성 시 ForkPathResolver가 필요하고, ForkRegistry는 생성 시
 * SourceResolver(=캐시)가 필요합니다. 이 순환을 끊기 위해 캐시에는 이 객체를 먼저 넘기고,
 * 레지스트리 생성 후 {@link #bind(ForkPathResolver)}로 연결합니다.</p>
 *
 * <p>연결 전에는 모든 조회가 비어 있습니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class DeferredForkPathResolver implements ForkPathResolver {

    private volatile ForkPathResolver delegate = ForkPathResolver.NONE;
    private volatile boolean bound;

    /**
     * 실제 resolver 연결 (한 번만 허용).
     *
     * @param resolver 포크 경로 조회 대상 (보통 ForkRegistry)
     * @throws IllegalArgumentException resolver가 null인 경우
     * @throws IllegalStateException 이미 연결된 경우
     */
    public synchronized void bind(ForkPathResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        if (bound) {
            throw new IllegalStateException("fork path resolver already bound");
        }
        this.delegate = resolver;
        this.bound = true;
    }

    public boolean isBound() {
        return bound;
    }

    @Override
    public Optional<Path> findForkPath(String candidate) {
        return delegate.findForkPath(candidate);
    }
}
