/**
 * Service Provider Interfaces for the collaborators the engine does not implement.
 *
 * <ul>
 *   <li>{@link com.ryuqq.spreadfork.core.spi.WorkbookLoader} - parsed-document loader</li>
 *   <li>{@link com.ryuqq.spreadfork.core.spi.WorkbookLocator} - workspace discovery and id resolution</li>
 *   <li>{@link com.ryuqq.spreadfork.core.spi.SourceResolver} - fork source lookup</li>
 *   <li>{@link com.ryuqq.spreadfork.core.spi.ForkPathResolver} - fork working-copy lookup</li>
 *   <li>{@link com.ryuqq.spreadfork.core.spi.RecalcBackend} - external recalculation engine</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.core.spi;
