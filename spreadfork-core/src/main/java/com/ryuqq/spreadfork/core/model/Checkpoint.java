package com.ryuqq.spreadfork.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 포크 작업본의 스냅샷 기록.
 *
 * <p>체크포인트 생성 시점의 포크 버전과 편집 로그 길이를 함께 보관하여
 * 복원 시 편집 로그를 해당 시점으로 되돌릴 수 있게 합니다.</p>
 *
 * @param checkpointId 체크포인트 ID
 * @param forkId 소속 포크 ID
 * @param snapshotPath 스냅샷 파일 경로
 * @param label 사용자 라벨 (선택, null 가능)
 * @param createdAt 생성 시각
 * @param forkVersion 생성 시점의 포크 버전
 * @param editCount 생성 시점의 편집 로그 길이
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public record Checkpoint(
    CheckpointId checkpointId,
    ForkId forkId,
    Path snapshotPath,
    String label,
    Instant createdAt,
    long forkVersion,
    int editCount
) {

    public Checkpoint {
        if (checkpointId == null) {
            throw new IllegalArgumentException("checkpointId cannot be null");
        }
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        if (snapshotPath == null) {
            throw new IllegalArgumentException("snapshotPath cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (forkVersion < 0) {
            throw new IllegalArgumentException("forkVersion cannot be negative: " + forkVersion);
        }
        if (editCount < 0) {
            throw new IllegalArgumentException("editCount cannot be negative: " + editCount);
        }
        // label은 null 허용
    }
}
