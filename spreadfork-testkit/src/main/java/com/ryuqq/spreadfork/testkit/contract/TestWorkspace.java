package com.ryuqq.spreadfork.testkit.contract;

import com.ryuqq.spreadfork.cache.locator.WorkbookIds;
import com.ryuqq.spreadfork.cache.locator.WorkspaceWorkbookLocator;
import com.ryuqq.spreadfork.core.config.ForkConfig;
import com.ryuqq.spreadfork.core.model.WorkbookId;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Throwaway directory layout for engine tests.
 *
 * <pre>
 * root/
 *   workspace/     source workbooks
 *   forks/         working copies
 *   checkpoints/   checkpoint snapshots
 * </pre>
 *
 * <p>Workbooks are plain text files starting with {@code PK}, which is enough for the
 * engine's snapshot header check. Methods wrap {@link IOException} in
 * {@link UncheckedIOException} so test bodies stay free of checked exceptions.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class TestWorkspace {

    private final Path workspaceDir;
    private final Path forkDir;
    private final Path checkpointDir;

    public TestWorkspace(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        this.workspaceDir = root.resolve("workspace").toAbsolutePath().normalize();
        this.forkDir = root.resolve("forks").toAbsolutePath().normalize();
        this.checkpointDir = root.resolve("checkpoints").toAbsolutePath().normalize();
        try {
            Files.createDirectories(workspaceDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Path workspaceDir() {
        return workspaceDir;
    }

    public Path forkDir() {
        return forkDir;
    }

    public Path checkpointDir() {
        return checkpointDir;
    }

    /**
     * @return default fork configuration pointing at this layout
     */
    public ForkConfig forkConfig() {
        return new ForkConfig().withDirectories(forkDir, checkpointDir);
    }

    public WorkspaceWorkbookLocator locator() {
        return new WorkspaceWorkbookLocator(workspaceDir, Set.of("xlsx", "xlsm"));
    }

    /**
     * Writes {@code PK + body} to {@code workspace/name}.
     *
     * @return absolute path of the workbook
     */
    public Path write(String name, String body) {
        Path path = workspaceDir.resolve(name);
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, "PK" + body);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return path;
    }

    /**
     * Same as {@link #write(String, String)} with a fixed modification time, so ordering by
     * recency is deterministic.
     */
    public Path write(String name, String body, Instant modifiedAt) {
        Path path = write(name, body);
        try {
            Files.setLastModifiedTime(path, FileTime.from(modifiedAt));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return path;
    }

    /**
     * Computes the canonical workbook id the locator will report for {@code name}.
     */
    public WorkbookId idOf(String name) {
        Path path = workspaceDir.resolve(name);
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return WorkbookIds.compute(path, attrs.size(), attrs.lastModifiedTime());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String read(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void append(Path path, String text) throws IOException {
        Files.writeString(path, text, StandardOpenOption.APPEND);
    }

    /**
     * @return file names directly under {@code dir}, sorted; empty when the directory is missing
     */
    public static List<String> fileNames(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
