package com.ryuqq.spreadfork.fork;

import com.ryuqq.spreadfork.core.config.ForkConfig;
import com.ryuqq.spreadfork.core.error.IoFailureException;
import com.ryuqq.spreadfork.core.error.NotFoundException;
import com.ryuqq.spreadfork.core.model.EditRecord;
import com.ryuqq.spreadfork.core.model.ForkId;
import com.ryuqq.spreadfork.core.model.ForkSummary;
import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.fork.storage.LocalForkStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ForkRegistry 생성/조회/저장/폐기/만료 테스트.
 */
class ForkRegistryTest {

    @TempDir
    Path tempDir;

    private Path workspace;
    private ForkConfig config;
    private MutableClock clock;
    private ForkRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        workspace = Files.createDirectories(tempDir.resolve("workspace"));
        config = new ForkConfig().withDirectories(tempDir.resolve("forks"), tempDir.resolve("checkpoints"));
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = newRegistry(config);
    }

    private ForkRegistry newRegistry(ForkConfig forkConfig) {
        return new ForkRegistry(forkConfig, id -> workspace.resolve(id.getValue()), new LocalForkStorage(), clock);
    }

    // ============================================================
    // 생성 / 조회
    // ============================================================

    @Test
    void createFork_원본복사_버전0으로등록() {
        // given
        Path base = Workbooks.write(workspace, "budget.xlsx", "base");

        // when
        ForkId forkId = registry.createFork(WorkbookId.of("budget.xlsx"));

        // then
        ForkSummary summary = registry.getFork(forkId);
        assertThat(summary.version()).isZero();
        assertThat(summary.basePath()).isEqualTo(base);
        assertThat(summary.workPath()).startsWith(config.forkDir());
        assertThat(summary.workPath().getFileName().toString()).endsWith(".xlsx");
        assertThat(Workbooks.read(registry.getForkPath(forkId))).isEqualTo("PKbase");
    }

    @Test
    void createFork_원본없음_NotFound() {
        assertThatThrownBy(() -> registry.createFork(WorkbookId.of("missing.xlsx")))
            .isInstanceOf(NotFoundException.class);
        assertThat(registry.forkCount()).isZero();
    }

    @Test
    void createFork_허용되지않은확장자_IllegalArgument() {
        // given
        Workbooks.write(workspace, "notes.txt", "text");

        // when & then
        assertThatThrownBy(() -> registry.createFork(WorkbookId.of("notes.txt")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("extension not allowed");
    }

    @Test
    void createFork_파일크기초과_IllegalArgument() {
        // given
        registry = newRegistry(config.withMaxFileSizeBytes(4));
        Workbooks.write(workspace, "big.xlsx", "0123456789");

        // when & then
        assertThatThrownBy(() -> registry.createFork(WorkbookId.of("big.xlsx")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("file too large");
    }

    @Test
    void createFork_포크개수제한_IllegalState() {
        // given
        registry = newRegistry(config.withMaxForks(2));
        Workbooks.write(workspace, "a.xlsx", "a");
        registry.createFork(WorkbookId.of("a.xlsx"));
        registry.createFork(WorkbookId.of("a.xlsx"));

        // when & then
        assertThatThrownBy(() -> registry.createFork(WorkbookId.of("a.xlsx")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("fork limit reached");
        assertThat(registry.forkCount()).isEqualTo(2);
    }

    @Test
    void getForkPath_없는포크_NotFound() {
        assertThatThrownBy(() -> registry.getForkPath(ForkId.of("nope")))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("nope");
    }

    @Test
    void findForkPath_포크ID면작업본경로_아니면empty() {
        // given
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));

        // when & then
        assertThat(registry.findForkPath(forkId.getValue())).contains(registry.getForkPath(forkId));
        assertThat(registry.findForkPath("a.xlsx")).isEmpty();
        assertThat(registry.findForkPath("not a fork id!")).isEmpty();
    }

    @Test
    void listForks_스냅샷_생성순() {
        // given
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId first = registry.createFork(WorkbookId.of("a.xlsx"));
        clock.advance(Duration.ofSeconds(1));
        ForkId second = registry.createFork(WorkbookId.of("a.xlsx"));

        // when
        List<ForkSummary> forks = registry.listForks();
        registry.deleteFork(first);

        // then
        assertThat(forks).extracting(ForkSummary::forkId).containsExactly(first, second);
        assertThat(registry.listForks()).extracting(ForkSummary::forkId).containsExactly(second);
    }

    // ============================================================
    // 삭제 / 폐기
    // ============================================================

    @Test
    void deleteFork_엔트리와작업본제거() {
        // given
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));
        Path workPath = registry.getForkPath(forkId);

        // when
        registry.deleteFork(forkId);

        // then
        assertThat(registry.contains(forkId)).isFalse();
        assertThat(workPath).doesNotExist();
        assertThatThrownBy(() -> registry.deleteFork(forkId)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void discardFork_이후변경시도_NotFound() {
        // given
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));

        // when
        registry.discardFork(forkId);

        // then
        assertThatThrownBy(() -> registry.withForkMutVersioned(forkId, 0, fork -> "x"))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.discardFork(forkId)).isInstanceOf(NotFoundException.class);
    }

    // ============================================================
    // 저장
    // ============================================================

    @Test
    void saveFork_새경로에저장_포크유지() {
        // given
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));
        registry.withForkMutVersioned(forkId, 0, fork -> {
            Workbooks.append(fork.stagingPath(), "+edit");
            return null;
        });
        Path target = workspace.resolve("out.xlsx");

        // when
        Path saved = registry.saveFork(forkId, target, false);

        // then
        assertThat(saved).isEqualTo(target);
        assertThat(Workbooks.read(target)).isEqualTo("PKa+edit");
        assertThat(registry.contains(forkId)).isTrue();
        assertThat(Workbooks.fileNames(workspace))
            .as("no temp file left next to the target")
            .containsExactlyInAnyOrder("a.xlsx", "out.xlsx");
    }

    @Test
    void saveFork_dropFork_저장후포크제거() {
        // given
        Path base = Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));
        Path workPath = registry.getForkPath(forkId);
        registry.withForkMutVersioned(forkId, 0, fork -> {
            Workbooks.append(fork.stagingPath(), "+saved");
            return null;
        });

        // when
        registry.saveFork(forkId, base, true);

        // then
        assertThat(Workbooks.read(base)).isEqualTo("PKa+saved");
        assertThat(registry.contains(forkId)).isFalse();
        assertThat(workPath).doesNotExist();
    }

    @Test
    void saveFork_원본덮어쓰기후_다시저장가능() {
        // given
        Path base = Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));
        registry.saveFork(forkId, base, false);

        // when
        registry.saveFork(forkId, base, false);

        // then
        assertThat(Workbooks.read(base)).isEqualTo("PKa");
    }

    @Test
    void saveFork_원본이변경됨_IllegalState() throws Exception {
        // given
        Path base = Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));
        Files.writeString(base, "PKchanged elsewhere");
        Files.setLastModifiedTime(base, FileTime.from(Instant.now().plusSeconds(60)));

        // when & then
        assertThatThrownBy(() -> registry.saveFork(forkId, base, true))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("base file modified since fork creation");
        assertThat(registry.contains(forkId)).isTrue();
        assertThat(Workbooks.read(base)).isEqualTo("PKchanged elsewhere");
    }

    @Test
    void saveFork_허용되지않은대상확장자_IllegalArgument() {
        // given
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));

        // when & then
        assertThatThrownBy(() -> registry.saveFork(forkId, workspace.resolve("out.csv"), false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void saveFork_대상디렉토리없음_부모디렉토리생성() {
        // given
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));
        Path target = workspace.resolve("missing-dir").resolve("out.xlsx");

        // when
        registry.saveFork(forkId, target, false);

        // then: 부모 디렉토리는 복사 시 생성됨
        assertThat(target).exists();
    }

    // ============================================================
    // TTL
    // ============================================================

    @Test
    void evictExpired_TTL초과포크만제거() {
        // given
        registry = newRegistry(config.withTtl(Duration.ofMinutes(10)));
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId old = registry.createFork(WorkbookId.of("a.xlsx"));
        clock.advance(Duration.ofMinutes(8));
        ForkId fresh = registry.createFork(WorkbookId.of("a.xlsx"));
        clock.advance(Duration.ofMinutes(3));

        // when
        List<ForkId> evicted = registry.evictExpired();

        // then
        assertThat(evicted).containsExactly(old);
        assertThat(registry.contains(old)).isFalse();
        assertThat(registry.contains(fresh)).isTrue();
    }

    @Test
    void createFork_만료포크정리후_제한내생성() {
        // given
        registry = newRegistry(config.withMaxForks(1).withTtl(Duration.ofMinutes(1)));
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId expired = registry.createFork(WorkbookId.of("a.xlsx"));
        clock.advance(Duration.ofMinutes(2));

        // when
        ForkId created = registry.createFork(WorkbookId.of("a.xlsx"));

        // then
        assertThat(registry.contains(expired)).isFalse();
        assertThat(registry.contains(created)).isTrue();
    }

    // ============================================================
    // fork-of-fork
    // ============================================================

    @Test
    void createFork_포크ID로생성_작업본을원본으로사용() {
        // given
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId parent = registry.createFork(WorkbookId.of("a.xlsx"));
        registry.withForkMutVersioned(parent, 0, fork -> {
            Workbooks.append(fork.stagingPath(), "+parent");
            fork.recordEdit(EditRecord.value("Sheet1", "A1", "1"));
            return null;
        });
        ForkRegistry chained = new ForkRegistry(config,
            id -> registry.findForkPath(id.getValue()).orElseGet(() -> workspace.resolve(id.getValue())),
            new LocalForkStorage(), clock);

        // when
        ForkId child = chained.createFork(WorkbookId.of(parent));

        // then
        assertThat(Workbooks.read(chained.getForkPath(child))).isEqualTo("PKa+parent");
        assertThat(chained.getFork(child).basePath()).isEqualTo(registry.getForkPath(parent));
    }

    @Test
    void config_기본허용확장자() {
        assertThat(config.allowedExtensions()).isEqualTo(Set.of("xlsx", "xlsm"));
    }

    @Test
    void deleteFork_체크포인트스냅샷도삭제() {
        // given
        Workbooks.write(workspace, "a.xlsx", "a");
        ForkId forkId = registry.createFork(WorkbookId.of("a.xlsx"));
        Path snapshot = registry.createCheckpoint(forkId, "before").snapshotPath();

        // when
        registry.deleteFork(forkId);

        // then
        assertThat(snapshot).doesNotExist();
        assertThat(Workbooks.countFiles(config.checkpointDir())).isZero();
        assertThat(Workbooks.countFiles(config.forkDir())).isZero();
    }

    @Test
    void ioFailure_작업디렉토리생성실패() throws Exception {
        // given: forkDir 위치에 일반 파일이 있음
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        ForkConfig broken = config.withDirectories(blocker.resolve("forks"), tempDir.resolve("cp"));

        // when & then
        assertThatThrownBy(() -> newRegistry(broken)).isInstanceOf(IoFailureException.class);
    }
}
