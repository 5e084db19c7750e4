package com.ryuqq.coordinator.application.sequencing;

import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventPage;

import java.util.List;

/**
 * Compare-and-append 쓰기 경로.
 *
 * <p>기본 구현은 {@code EventBookRepository::append}이며, 호스트는 일시 장애 재시도를
 * 감싼 구현을 넣을 수 있습니다. Sequence 충돌은 재시도하지 말고 그대로 던져야 합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PageAppender {

    void append(Cover cover, List<EventPage> pages);
}
