package com.ryuqq.spreadfork.fork.guard;

import com.ryuqq.spreadfork.core.model.ForkId;

/**
 * 생성 도중 실패한 포크의 레지스트리 엔트리를 제거하는 콜백.
 *
 * <p>{@code ForkRegistry}가 내부 메서드 참조로 제공합니다.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ForkEntryRemover {

    /**
     * @param forkId 제거할 포크 ID
     * @return 엔트리가 존재해서 제거되었으면 true
     */
    boolean removeEntry(ForkId forkId);
}
