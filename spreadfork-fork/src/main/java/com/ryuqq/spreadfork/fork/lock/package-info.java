/**
 * Reference-counted per-fork recalculation locks.
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.fork.lock;
