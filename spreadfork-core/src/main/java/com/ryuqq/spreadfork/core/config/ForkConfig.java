package com.ryuqq.spreadfork.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 포크 레지스트리 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>forkDir: 작업본 디렉토리 (기본 {@code java.io.tmpdir}/spreadfork-forks)</li>
 *   <li>checkpointDir: 체크포인트 스냅샷 디렉토리 (기본 {@code java.io.tmpdir}/spreadfork-checkpoints)</li>
 *   <li>ttl: 포크 유효 시간 (기본 1시간)</li>
 *   <li>maxForks: 동시에 존재할 수 있는 포크 수 (기본 10)</li>
 *   <li>maxCheckpointsPerFork: 포크당 체크포인트 수 (기본 10)</li>
 *   <li>maxFileSizeBytes: 원본 파일 최대 크기 (기본 100MB)</li>
 *   <li>allowedExtensions: 포크 가능한 확장자 (기본 xlsx, xlsm)</li>
 *   <li>lockTimeout: 포크 변경 락 대기 한도 (기본 30초)</li>
 *   <li>recalcTimeout: 재계산 락 대기 한도 (기본 60초)</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 * @param forkDir 작업본 디렉토리
 * @param checkpointDir 체크포인트 디렉토리
 * @param ttl 포크 유효 시간 (양수)
 * @param maxForks 최대 포크 수 (1 이상)
 * @param maxCheckpointsPerFork 포크당 최대 체크포인트 수 (1 이상)
 * @param maxFileSizeBytes 원본 파일 최대 크기 (양수)
 * @param allowedExtensions 허용 확장자 (소문자, 점 제외)
 * @param lockTimeout 포크 변경 락 대기 한도 (양수)
 * @param recalcTimeout 재계산 락 대기 한도 (양수)
 */
public record ForkConfig(
    Path forkDir,
    Path checkpointDir,
    Duration ttl,
    int maxForks,
    int maxCheckpointsPerFork,
    long maxFileSizeBytes,
    Set<String> allowedExtensions,
    Duration lockTimeout,
    Duration recalcTimeout
) {

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final int DEFAULT_MAX_FORKS = 10;
    public static final int DEFAULT_MAX_CHECKPOINTS = 10;
    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 100L * 1024 * 1024;

    /**
     * 기본 설정 생성자.
     */
    public ForkConfig() {
        this(
            Path.of(System.getProperty("java.io.tmpdir"), "spreadfork-forks"),
            Path.of(System.getProperty("java.io.tmpdir"), "spreadfork-checkpoints"),
            DEFAULT_TTL,
            DEFAULT_MAX_FORKS,
            DEFAULT_MAX_CHECKPOINTS,
            DEFAULT_MAX_FILE_SIZE_BYTES,
            Set.of("xlsx", "xlsm"),
            Duration.ofSeconds(30),
            Duration.ofSeconds(60)
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ForkConfig {
        if (forkDir == null) {
            throw new IllegalArgumentException("forkDir cannot be null");
        }
        if (checkpointDir == null) {
            throw new IllegalArgumentException("checkpointDir cannot be null");
        }
        requirePositive("ttl", ttl);
        if (maxForks <= 0) {
            throw new IllegalArgumentException("maxForks must be positive (current: " + maxForks + ")");
        }
        if (maxCheckpointsPerFork <= 0) {
            throw new IllegalArgumentException(
                "maxCheckpointsPerFork must be positive (current: " + maxCheckpointsPerFork + ")"
            );
        }
        if (maxFileSizeBytes <= 0) {
            throw new IllegalArgumentException("maxFileSizeBytes must be positive (current: " + maxFileSizeBytes + ")");
        }
        if (allowedExtensions == null || allowedExtensions.isEmpty()) {
            throw new IllegalArgumentException("allowedExtensions cannot be null or empty");
        }
        requirePositive("lockTimeout", lockTimeout);
        requirePositive("recalcTimeout", recalcTimeout);
        allowedExtensions = allowedExtensions.stream()
            .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    /**
     * 파일 확장자가 허용 목록에 있는지 확인.
     *
     * @param path 검사할 경로
     * @return 허용 여부
     */
    public boolean isAllowed(Path path) {
        return allowedExtensions.contains(extensionOf(path));
    }

    /**
     * 경로의 확장자 추출 (소문자, 점 제외, 없으면 빈 문자열).
     *
     * @param path 경로
     * @return 확장자
     */
    public static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * 디렉토리만 변경한 새 인스턴스 생성.
     *
     * @param forkDir 새 작업본 디렉토리
     * @param checkpointDir 새 체크포인트 디렉토리
     * @return 새 ForkConfig 인스턴스
     */
    public ForkConfig withDirectories(Path forkDir, Path checkpointDir) {
        return new ForkConfig(forkDir, checkpointDir, ttl, maxForks, maxCheckpointsPerFork,
            maxFileSizeBytes, allowedExtensions, lockTimeout, recalcTimeout);
    }

    /**
     * ttl만 변경한 새 인스턴스 생성.
     *
     * @param ttl 새 유효 시간
     * @return 새 ForkConfig 인스턴스
     */
    public ForkConfig withTtl(Duration ttl) {
        return new ForkConfig(forkDir, checkpointDir, ttl, maxForks, maxCheckpointsPerFork,
            maxFileSizeBytes, allowedExtensions, lockTimeout, recalcTimeout);
    }

    /**
     * maxForks만 변경한 새 인스턴스 생성.
     *
     * @param maxForks 새 최대 포크 수
     * @return 새 ForkConfig 인스턴스
     */
    public ForkConfig withMaxForks(int maxForks) {
        return new ForkConfig(forkDir, checkpointDir, ttl, maxForks, maxCheckpointsPerFork,
            maxFileSizeBytes, allowedExtensions, lockTimeout, recalcTimeout);
    }

    /**
     * maxCheckpointsPerFork만 변경한 새 인스턴스 생성.
     *
     * @param maxCheckpointsPerFork 새 최대 체크포인트 수
     * @return 새 ForkConfig 인스턴스
     */
    public ForkConfig withMaxCheckpointsPerFork(int maxCheckpointsPerFork) {
        return new ForkConfig(forkDir, checkpointDir, ttl, maxForks, maxCheckpointsPerFork,
            maxFileSizeBytes, allowedExtensions, lockTimeout, recalcTimeout);
    }

    /**
     * maxFileSizeBytes만 변경한 새 인스턴스 생성.
     *
     * @param maxFileSizeBytes 새 최대 파일 크기
     * @return 새 ForkConfig 인스턴스
     */
    public ForkConfig withMaxFileSizeBytes(long maxFileSizeBytes) {
        return new ForkConfig(forkDir, checkpointDir, ttl, maxForks, maxCheckpointsPerFork,
            maxFileSizeBytes, allowedExtensions, lockTimeout, recalcTimeout);
    }

    /**
     * allowedExtensions만 변경한 새 인스턴스 생성.
     *
     * @param allowedExtensions 새 허용 확장자
     * @return 새 ForkConfig 인스턴스
     */
    public ForkConfig withAllowedExtensions(Set<String> allowedExtensions) {
        return new ForkConfig(forkDir, checkpointDir, ttl, maxForks, maxCheckpointsPerFork,
            maxFileSizeBytes, allowedExtensions, lockTimeout, recalcTimeout);
    }

    /**
     * 락 대기 한도만 변경한 새 인스턴스 생성.
     *
     * @param lockTimeout 포크 변경 락 대기 한도
     * @param recalcTimeout 재계산 락 대기 한도
     * @return 새 ForkConfig 인스턴스
     */
    public ForkConfig withLockTimeouts(Duration lockTimeout, Duration recalcTimeout) {
        return new ForkConfig(forkDir, checkpointDir, ttl, maxForks, maxCheckpointsPerFork,
            maxFileSizeBytes, allowedExtensions, lockTimeout, recalcTimeout);
    }
}
