package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.model.EventBook;

/**
 * Process manager 반응 handler.
 *
 * @param <S> process manager state 타입
 * @param <E> event 타입
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessHandler<S, E> {

    /**
     * Event에 반응.
     *
     * @param event decode된 trigger event
     * @param state 현재 process manager state (같은 book의 앞선 event 반영됨)
     * @param trigger trigger event book
     * @param destinations prepare 단계에서 요청한 대상 이력
     * @return command와 process event
     */
    ProcessReaction handle(E event, S state, EventBook trigger, Destinations destinations);
}
