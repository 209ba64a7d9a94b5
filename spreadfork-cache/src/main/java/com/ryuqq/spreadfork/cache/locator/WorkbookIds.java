package com.ryuqq.spreadfork.cache.locator;

import com.ryuqq.spreadfork.core.model.WorkbookId;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * 워크북 ID 계산.
 *
 * <p>정식 ID는 {@code wb-} 접두사 + 10자리 base32 토큰입니다. 토큰은
 * SHA-256(경로 문자열, 파일 크기(little-endian 8바이트), 수정 시각(RFC 3339, 마이크로초))의
 * 앞 8바이트를 big-endian 정수로 읽어 상위 비트부터 5비트씩 인코딩합니다.
 * 파일이 바뀌면(크기 또는 수정 시각) ID도 바뀝니다.</p>
 *
 * <p>짧은 별칭은 정식 ID에서 {@code wb-}를 뗀 값입니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class WorkbookIds {

    public static final String PREFIX = "wb-";

    private static final char[] ALPHABET = "23456789abcdefghijkmnpqrstuvwxyz".toCharArray();
    private static final int TOKEN_LENGTH = 10;
    private static final DateTimeFormatter RFC3339_MICROS =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    // Utility class - prevent instantiation
    private WorkbookIds() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param path 워크북 경로
     * @param size 파일 크기
     * @param modifiedAt 수정 시각 (null이면 해시에서 제외)
     * @return 정식 워크북 ID
     */
    public static WorkbookId compute(Path path, long size, FileTime modifiedAt) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        MessageDigest sha256 = newSha256();
        sha256.update(path.toString().getBytes(StandardCharsets.UTF_8));
        sha256.update(ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(size).array());
        if (modifiedAt != null) {
            String stamp = RFC3339_MICROS.format(modifiedAt.toInstant().truncatedTo(ChronoUnit.MICROS));
            sha256.update(stamp.getBytes(StandardCharsets.UTF_8));
        }
        long prefix = ByteBuffer.wrap(sha256.digest(), 0, Long.BYTES).getLong();
        return WorkbookId.of(PREFIX + encode(prefix));
    }

    /**
     * @param workbookId 정식 ID
     * @return 접두사를 뗀 별칭 (접두사가 없으면 그대로)
     */
    public static String shortIdOf(WorkbookId workbookId) {
        String value = workbookId.getValue();
        return value.startsWith(PREFIX) ? value.substring(PREFIX.length()) : value;
    }

    static String encode(long value) {
        char[] out = new char[TOKEN_LENGTH];
        for (int i = 0; i < TOKEN_LENGTH; i++) {
            int shift = 64 - (i + 1) * 5;
            out[i] = ALPHABET[(int) ((value >>> shift) & 31)];
        }
        return new String(out);
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
