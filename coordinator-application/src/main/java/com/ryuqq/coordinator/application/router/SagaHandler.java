package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.EventBook;

import java.util.List;

/**
 * Saga 반응 handler.
 *
 * @param <E> event 타입
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SagaHandler<E> {

    /**
     * Event에 반응하여 다른 도메인으로 보낼 command를 생성.
     *
     * @param event decode된 event
     * @param source event가 속한 event book
     * @param destinations prepare 단계에서 요청한 대상 이력
     * @return 발행할 command 목록 (반응하지 않으면 빈 목록)
     */
    List<CommandBook> react(E event, EventBook source, Destinations destinations);
}
