package com.ryuqq.coordinator.core.spi;

import com.ryuqq.coordinator.core.error.PublishException;
import com.ryuqq.coordinator.core.model.EventBook;

/**
 * Event Bus SPI: at-least-once fan-out of committed event books.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Publishing committed event books to subscribers</li>
 *   <li>Registering handlers and delivering books once consuming has started</li>
 *   <li>Creating named, domain-filtered subscribers</li>
 * </ul>
 *
 * <p><strong>Delivery Semantics:</strong> publish may be retried after a failure whose
 * outcome is unknown, so consumers must tolerate duplicates (deduplicate by cover and
 * sequence range).</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventBus subscriber = bus.createSubscriber("order-saga", "order");
 * Subscription subscription = subscriber.subscribe(book -&gt; saga.onEvents(book));
 * subscriber.startConsuming();
 * ...
 * subscription.close();
 * </pre>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Publishes an event book.
     *
     * @param book the committed event book
     * @throws PublishException if the bus is unavailable
     * @throws IllegalArgumentException if book is null
     */
    void publish(EventBook book);

    /**
     * Registers a handler.
     *
     * <p>Delivery to the handler begins once {@link #startConsuming()} has been called.</p>
     *
     * @param handler the handler
     * @return subscription handle used to stop delivery
     */
    Subscription subscribe(EventHandler handler);

    /**
     * Starts delivering published books to registered handlers.
     *
     * <p>Calling this more than once has no further effect.</p>
     */
    void startConsuming();

    /**
     * Creates a named subscriber view of this bus.
     *
     * @param name the subscriber name (used for logging and consumer groups)
     * @param domainFilter only books of this domain are delivered (null for all domains)
     * @return a bus delivering only matching books to its own handlers
     */
    EventBus createSubscriber(String name, String domainFilter);
}
