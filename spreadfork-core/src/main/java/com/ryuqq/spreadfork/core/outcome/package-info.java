/**
 * Operation outcomes returned by the operation surface.
 *
 * <ul>
 *   <li>{@link com.ryuqq.spreadfork.core.outcome.Ok} - success with value</li>
 *   <li>{@link com.ryuqq.spreadfork.core.outcome.Retry} - version conflict or lock timeout</li>
 *   <li>{@link com.ryuqq.spreadfork.core.outcome.Fail} - permanent failure with error code</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.core.outcome;
