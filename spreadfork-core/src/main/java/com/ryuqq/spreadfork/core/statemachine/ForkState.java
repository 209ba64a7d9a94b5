package com.ryuqq.spreadfork.core.statemachine;

/**
 * 포크의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>CREATED → MODIFIED (첫 번째 versioned mutation 성공)</li>
 *   <li>MODIFIED → MODIFIED (이후 mutation, 버전 증가)</li>
 *   <li>CREATED/MODIFIED → SAVED (작업본 승격 후 제거)</li>
 *   <li>CREATED/MODIFIED → DISCARDED (작업본 삭제)</li>
 *   <li><strong>종료 상태에서의 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED (version = 0)
 *    │
 *    ▼ (withForkMutVersioned)
 * MODIFIED (version = n ≥ 1) ◄─┐
 *    │                         │ (withForkMutVersioned)
 *    ├─────────────────────────┘
 *    ├─► SAVED (종료)
 *    └─► DISCARDED (종료)
 *
 * 금지된 전이:
 * - SAVED → * ❌
 * - DISCARDED → * ❌
 * - MODIFIED → CREATED ❌
 * </pre>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public enum ForkState {

    /**
     * 생성 직후 (버전 0).
     */
    CREATED,

    /**
     * 한 번 이상 변경됨.
     */
    MODIFIED,

    /**
     * 저장 완료 (종료).
     */
    SAVED,

    /**
     * 폐기됨 (종료).
     */
    DISCARDED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SAVED 또는 DISCARDED인 경우 true
     */
    public boolean isTerminal() {
        return this == SAVED || this == DISCARDED;
    }
}
