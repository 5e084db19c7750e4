package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;

import java.util.List;

/**
 * Saga prepare 단계 handler.
 *
 * <p>반응 handler가 필요로 하는 대상 aggregate를 선언합니다. 조회 방식은 host가 결정합니다.</p>
 *
 * @param <E> event 타입
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SagaPrepareHandler<E> {

    List<Cover> prepare(E event, EventBook source);
}
