package com.ryuqq.spreadfork.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * 포크 상태의 읽기 전용 스냅샷.
 *
 * <p>호출 시점의 상태를 복사한 값이며, 이후 변경을 반영하지 않습니다.</p>
 *
 * @param forkId 포크 ID
 * @param workbookId 원본 워크북 ID
 * @param basePath 원본 파일 경로
 * @param workPath 작업본 파일 경로
 * @param version 현재 버전
 * @param createdAt 생성 시각
 * @param editCount 커밋된 편집 수
 * @param checkpointCount 체크포인트 수
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record ForkSummary(
    ForkId forkId,
    WorkbookId workbookId,
    Path basePath,
    Path workPath,
    long version,
    Instant createdAt,
    int editCount,
    int checkpointCount
) {

    /**
     * 생성 후 경과 시간.
     *
     * @param now 기준 시각
     * @return 경과 시간 (음수가 되지 않음)
     */
    public Duration age(Instant now) {
        Duration age = Duration.between(createdAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }
}
