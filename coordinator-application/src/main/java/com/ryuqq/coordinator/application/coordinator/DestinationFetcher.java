package com.ryuqq.coordinator.application.coordinator;

import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;

import java.util.Optional;

/**
 * Prepare 단계에서 선언된 대상 aggregate의 현재 이력을 조회하는 포트.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DestinationFetcher {

    /**
     * 대상 이력 조회.
     *
     * @param cover 대상 cover
     * @return 현재 이력 (조회 실패 시 empty)
     */
    Optional<EventBook> fetch(Cover cover);
}
