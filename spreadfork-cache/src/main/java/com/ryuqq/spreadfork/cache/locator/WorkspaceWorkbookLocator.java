package com.ryuqq.spreadfork.cache.locator;

import com.ryuqq.spreadfork.core.config.ForkConfig;
import com.ryuqq.spreadfork.core.model.LocatedWorkbook;
import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.core.spi.WorkbookLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 작업 공간 디렉토리를 탐색하는 {@link WorkbookLocator}.
 *
 * <p>루트가 일반 파일이면 단일 워크북 모드로 동작해서 그 파일만 대상으로 합니다.
 * 탐색은 호출 스레드에서 수행되며, 호출자({@code WorkbookCache})는 이때 어떤 락도 잡지
 * 않습니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public class WorkspaceWorkbookLocator implements WorkbookLocator {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceWorkbookLocator.class);

    private final Path root;
    private final Set<String> extensions;
    private final int maxDepth;

    public WorkspaceWorkbookLocator(Path root, Set<String> extensions) {
        this(root, extensions, Integer.MAX_VALUE);
    }

    /**
     * @param root 작업 공간 루트 디렉토리 또는 단일 워크북 파일
     * @param extensions 허용 확장자 (점 없이, 대소문자 무관)
     * @param maxDepth 최대 탐색 깊이
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public WorkspaceWorkbookLocator(Path root, Set<String> extensions, int maxDepth) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("extensions cannot be null or empty");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive (current: " + maxDepth + ")");
        }
        this.root = root.toAbsolutePath().normalize();
        this.extensions = extensions.stream()
            .map(e -> e.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        this.maxDepth = maxDepth;
    }

    public Path root() {
        return root;
    }

    @Override
    public Optional<LocatedWorkbook> locate(String idOrAlias) throws IOException {
        if (idOrAlias == null) {
            throw new IllegalArgumentException("idOrAlias cannot be null");
        }
        String candidate = idOrAlias.toLowerCase(Locale.ROOT);
        try (Stream<Path> files = candidates()) {
            Iterator<Path> it = files.iterator();
            while (it.hasNext()) {
                LocatedWorkbook located = describe(it.next());
                if (located.workbookId().getValue().equals(candidate) || located.shortId().equals(candidate)) {
                    return Optional.of(located);
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        log.debug("workbook {} not found under {}", idOrAlias, root);
        return Optional.empty();
    }

    @Override
    public List<LocatedWorkbook> discover() throws IOException {
        List<LocatedWorkbook> found = new ArrayList<>();
        try (Stream<Path> files = candidates()) {
            Iterator<Path> it = files.iterator();
            while (it.hasNext()) {
                found.add(describe(it.next()));
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return found;
    }

    private Stream<Path> candidates() throws IOException {
        if (Files.isRegularFile(root)) {
            return Stream.of(root);
        }
        return Files.walk(root, maxDepth)
            .filter(Files::isRegularFile)
            .filter(p -> extensions.contains(ForkConfig.extensionOf(p)))
            .sorted();
    }

    private static LocatedWorkbook describe(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        WorkbookId id = WorkbookIds.compute(path, attrs.size(), attrs.lastModifiedTime());
        return new LocatedWorkbook(id, WorkbookIds.shortIdOf(id), path, attrs.lastModifiedTime().toInstant());
    }
}
