/**
 * 캐시 워밍.
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.cache.warming;
