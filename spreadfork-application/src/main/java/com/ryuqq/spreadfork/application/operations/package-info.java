/**
 * 엔진 연산 표면.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.spreadfork.application.operations.ForkOperations}: 모든 연산을
 *       Outcome(Ok, Retry, Fail)으로 반환하는 인터페이스</li>
 *   <li>{@link com.ryuqq.spreadfork.application.operations.DefaultForkOperations}:
 *       ForkRegistry와 WorkbookCache를 조합한 기본 구현</li>
 * </ul>
 *
 * <h2>에러 코드</h2>
 * <p>Retry: VERSION_CONFLICT, LOCK_TIMEOUT. Fail: NOT_FOUND, IO_FAILURE, INVALID_REQUEST,
 * INVALID_STATE, LOCK_TABLE_CORRUPTION.</p>
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.application.operations;
