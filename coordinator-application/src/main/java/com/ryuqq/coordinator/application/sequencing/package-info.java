/**
 * Sequence assignment and conflict resolution.
 *
 * <p>{@link com.ryuqq.coordinator.application.sequencing.SequencingEngine} applies the
 * command's merge strategy (Explicit, AutoResequence, Force) to candidate events and
 * commits them through a compare-and-append {@link com.ryuqq.coordinator.application.sequencing.PageAppender}.</p>
 *
 * @since 1.0.0
 * @author Coordinator Team
 */
package com.ryuqq.coordinator.application.sequencing;
