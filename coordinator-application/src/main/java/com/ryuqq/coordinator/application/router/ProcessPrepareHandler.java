package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;

import java.util.List;

/**
 * Process manager prepare 단계 handler.
 *
 * @param <S> process manager state 타입
 * @param <E> event 타입
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessPrepareHandler<S, E> {

    List<Cover> prepare(E event, S state, EventBook trigger);
}
