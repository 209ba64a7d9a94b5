/**
 * Filesystem abstraction for working copies, staging files and checkpoint snapshots.
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.fork.storage;
