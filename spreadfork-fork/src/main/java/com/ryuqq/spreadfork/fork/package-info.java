/**
 * 포크 레지스트리와 버전 기반 변경.
 *
 * <p>{@link com.ryuqq.spreadfork.fork.ForkRegistry}가 진입점입니다. 가드는
 * {@code guard}, 재계산 락은 {@code lock}, 파일 연산은 {@code storage} 하위 패키지에
 * 있습니다.</p>
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.fork;
