package com.ryuqq.spreadfork.fork;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 테스트용 워크북 파일 헬퍼. 내용은 ZIP 시그니처로 시작하는 텍스트입니다.
 */
final class Workbooks {

    private Workbooks() {
    }

    static Path write(Path dir, String fileName, String body) {
        try {
            Path file = dir.resolve(fileName);
            Files.writeString(file, "PK" + body, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static void append(Path file, String text) throws IOException {
        Files.writeString(file, read(file) + text, StandardCharsets.UTF_8);
    }

    static List<String> fileNames(Path dir) {
        try (var stream = Files.list(dir)) {
            return stream.map(p -> p.getFileName().toString()).collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static long countFiles(Path dir) {
        try (var stream = Files.list(dir)) {
            return stream.count();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
