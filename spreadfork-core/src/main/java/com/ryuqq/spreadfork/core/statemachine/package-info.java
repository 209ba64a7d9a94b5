/**
 * Fork lifecycle state machine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.spreadfork.core.statemachine.ForkState} - Lifecycle states</li>
 *   <li>{@link com.ryuqq.spreadfork.core.statemachine.ForkStateTransition} - Transition validation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.core.statemachine;
