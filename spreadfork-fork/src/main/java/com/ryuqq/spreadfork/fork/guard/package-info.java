/**
 * try-with-resources 롤백 가드.
 *
 * <p>{@link com.ryuqq.spreadfork.fork.guard.TempFileGuard},
 * {@link com.ryuqq.spreadfork.fork.guard.ForkCreationGuard},
 * {@link com.ryuqq.spreadfork.fork.guard.CheckpointGuard}는 모두
 * {@link com.ryuqq.spreadfork.fork.guard.ScopedGuard}를 상속합니다.</p>
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.fork.guard;
