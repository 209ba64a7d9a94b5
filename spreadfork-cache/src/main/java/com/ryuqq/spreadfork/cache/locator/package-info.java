/**
 * Filesystem workbook discovery and id hashing.
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.cache.locator;
