package com.ryuqq.coordinator.application.sequencing;

import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.MergeStrategy;

/**
 * Sequence 확정 및 commit 결과.
 *
 * @param committed commit된 event (호출자 cover, 확정된 sequence)
 * @param strategy 사용된 병합 전략
 * @param resolution 확정 방식
 * @param attempts compare-and-append 시도 횟수
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record SequencingResult(
    EventBook committed,
    MergeStrategy strategy,
    Resolution resolution,
    int attempts
) {

    public SequencingResult {
        if (committed == null) {
            throw new IllegalArgumentException("committed cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (resolution == null) {
            throw new IllegalArgumentException("resolution cannot be null");
        }
    }
}
