package com.ryuqq.coordinator.application.sequencing;

import com.ryuqq.coordinator.core.model.EventBook;

/**
 * 주어진 이력에 대해 후보 event를 계산하는 함수.
 *
 * <p>Business logic 호출을 감싸며, 순수 함수여야 합니다. AutoResequence에서는
 * 충돌할 때마다 최신 이력으로 다시 호출됩니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CandidateProducer {

    /**
     * 후보 event 계산.
     *
     * @param history handler에 제공할 이력
     * @return 후보 event (history.nextSequence()부터 번호 지정)
     */
    EventBook produce(EventBook history);
}
