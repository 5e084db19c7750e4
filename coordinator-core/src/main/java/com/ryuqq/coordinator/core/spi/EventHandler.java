package com.ryuqq.coordinator.core.spi;

import com.ryuqq.coordinator.core.model.EventBook;

/**
 * Callback receiving event books delivered by an {@link EventBus}.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handles one delivered event book.
     *
     * <p>Delivery is at-least-once: the same book may be delivered more than once.</p>
     *
     * @param book the delivered event book
     */
    void handle(EventBook book);
}
