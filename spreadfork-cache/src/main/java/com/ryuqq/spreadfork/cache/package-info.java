/**
 * Bounded LRU workbook cache with lock-free counters and an alias index.
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.cache;
