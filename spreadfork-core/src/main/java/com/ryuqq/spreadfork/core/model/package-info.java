/**
 * Core domain model package containing identifiers and immutable snapshots.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.spreadfork.core.model.WorkbookId} - Source workbook identifier</li>
 *   <li>{@link com.ryuqq.spreadfork.core.model.ForkId} - Fork (working copy) identifier</li>
 *   <li>{@link com.ryuqq.spreadfork.core.model.CheckpointId} - Checkpoint identifier</li>
 * </ul>
 *
 * <h2>Snapshots</h2>
 * <ul>
 *   <li>{@link com.ryuqq.spreadfork.core.model.ForkSummary} - Point-in-time view of a fork</li>
 *   <li>{@link com.ryuqq.spreadfork.core.model.Checkpoint} - Registered snapshot of a working copy</li>
 *   <li>{@link com.ryuqq.spreadfork.core.model.EditRecord} - Committed edit log entry</li>
 *   <li>{@link com.ryuqq.spreadfork.core.model.LocatedWorkbook} - Workspace resolution result</li>
 *   <li>{@link com.ryuqq.spreadfork.core.model.RecalcResult} - Recalculation report</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields, records)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.core.model;
