/**
 * Immutable configuration records with defaults and copy-on-change helpers.
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.core.config;
