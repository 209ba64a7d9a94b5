package com.ryuqq.spreadfork.application.engine;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeferredForkPathResolverTest {

    @Test
    void 연결전_모든조회가비어있음() {
        DeferredForkPathResolver resolver = new DeferredForkPathResolver();

        assertThat(resolver.isBound()).isFalse();
        assertThat(resolver.findForkPath("fork-1")).isEmpty();
    }

    @Test
    void 연결후_위임() {
        // given
        DeferredForkPathResolver resolver = new DeferredForkPathResolver();
        Path workPath = Path.of("/forks/fork-1.xlsx");

        // when
        resolver.bind(candidate -> "fork-1".equals(candidate) ? Optional.of(workPath) : Optional.empty());

        // then
        assertThat(resolver.isBound()).isTrue();
        assertThat(resolver.findForkPath("fork-1")).contains(workPath);
        assertThat(resolver.findForkPath("fork-2")).isEmpty();
    }

    @Test
    void 두번연결_IllegalState() {
        DeferredForkPathResolver resolver = new DeferredForkPathResolver();
        resolver.bind(candidate -> Optional.empty());

        assertThatThrownBy(() -> resolver.bind(candidate -> Optional.empty()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already bound");
        assertThatThrownBy(() -> new DeferredForkPathResolver().bind(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
