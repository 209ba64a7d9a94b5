/**
 * Error taxonomy of the fork engine.
 *
 * <p>All engine errors extend {@link com.ryuqq.spreadfork.core.error.EngineException}
 * and carry an {@link com.ryuqq.spreadfork.core.error.ErrorKind}, the failing operation
 * name and retry context.</p>
 *
 * <h2>Propagation Rules</h2>
 * <ul>
 *   <li>IO failures inside a guarded operation trigger the guard's rollback before surfacing</li>
 *   <li>Rollback failures are logged and never replace the original error</li>
 *   <li>Version conflicts are always recoverable by read-modify-retry</li>
 *   <li>Lock table corruption is fatal</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.core.error;
