package com.ryuqq.coordinator.adapter.inmemory.bus;

import com.ryuqq.coordinator.core.error.PublishException;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.spi.EventBus;
import com.ryuqq.coordinator.core.spi.EventHandler;
import com.ryuqq.coordinator.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link EventBus} SPI for testing and embedding.
 *
 * <p>Delivery is synchronous on the publishing thread. Books published before
 * {@link #startConsuming()} are buffered and flushed, in publish order, when consumption starts.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <pre>
 * publish(book)
 *     ↓
 * published history (test assertions)
 *     ↓
 * started? ── no ──→ pending buffer
 *     ↓ yes
 * each listener (root handlers + named subscribers with domain filter)
 * </pre>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Named subscribers via {@link #createSubscriber(String, String)} with optional domain filter</li>
 *   <li>Handler failures are logged and never reach the publisher</li>
 *   <li>Publish failure injection for recovery tests ({@link #failNextPublishes(int)})</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * InMemoryEventBus bus = new InMemoryEventBus();
 * EventBus projector = bus.createSubscriber("order-projector", "order");
 * projector.subscribe(book -> project(book));
 * projector.startConsuming();
 * bus.startConsuming();
 * }</pre>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final String name;
    private final String domainFilter;
    private final InMemoryEventBus parent;

    private final CopyOnWriteArrayList<HandlerSubscription> handlers = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<InMemoryEventBus> subscribers = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<EventBook> published = new CopyOnWriteArrayList<>();
    private final List<EventBook> pending = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger pendingFailures = new AtomicInteger();

    public InMemoryEventBus() {
        this("root", null, null);
    }

    private InMemoryEventBus(String name, String domainFilter, InMemoryEventBus parent) {
        this.name = name;
        this.domainFilter = domainFilter;
        this.parent = parent;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Publishing through a named subscriber publishes on the root bus</li>
     *   <li>An injected failure throws before the book is recorded</li>
     * </ul>
     */
    @Override
    public void publish(EventBook book) {
        if (book == null) {
            throw new IllegalArgumentException("book cannot be null");
        }
        if (parent != null) {
            parent.publish(book);
            return;
        }
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new PublishException("Injected publish failure for " + book.cover().domain());
        }
        published.add(book);
        deliver(book);
    }

    @Override
    public Subscription subscribe(EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        HandlerSubscription subscription = new HandlerSubscription(handler);
        handlers.add(subscription);
        return subscription;
    }

    @Override
    public void startConsuming() {
        List<EventBook> buffered;
        synchronized (pending) {
            if (!started.compareAndSet(false, true)) {
                return;
            }
            buffered = new ArrayList<>(pending);
            pending.clear();
        }
        log.debug("Bus {} started consuming, flushing {} buffered books", name, buffered.size());
        for (EventBook book : buffered) {
            dispatch(book);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>The returned bus receives only books whose domain equals {@code domainFilter}
     * (all books when null) and buffers them until its own {@link #startConsuming()}.</p>
     */
    @Override
    public EventBus createSubscriber(String name, String domainFilter) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        InMemoryEventBus root = parent != null ? parent : this;
        InMemoryEventBus subscriber = new InMemoryEventBus(name, domainFilter, root);
        root.subscribers.add(subscriber);
        return subscriber;
    }

    private void deliver(EventBook book) {
        if (domainFilter != null && !domainFilter.equals(book.cover().domain())) {
            return;
        }
        synchronized (pending) {
            if (!started.get()) {
                pending.add(book);
                return;
            }
        }
        dispatch(book);
    }

    private void dispatch(EventBook book) {
        for (HandlerSubscription subscription : handlers) {
            try {
                subscription.handler.handle(book);
            } catch (RuntimeException e) {
                log.error("Handler on bus {} failed for {}: {}",
                    name, book.cover().cacheKey(), e.getMessage(), e);
            }
        }
        for (InMemoryEventBus subscriber : subscribers) {
            subscriber.deliver(book);
        }
    }

    /**
     * Makes the next {@code count} publishes fail with {@link PublishException}.
     *
     * @param count number of failures to inject
     */
    public void failNextPublishes(int count) {
        pendingFailures.set(count);
    }

    /**
     * Books successfully published on this bus, in publish order. Used for test assertions.
     *
     * @return snapshot of published books
     */
    public List<EventBook> getPublished() {
        return List.copyOf(published);
    }

    public int handlerCount() {
        return handlers.size();
    }

    public int pendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }

    /**
     * Clears history, handlers and subscribers. Used for test cleanup.
     */
    public void clear() {
        handlers.clear();
        subscribers.clear();
        published.clear();
        synchronized (pending) {
            pending.clear();
        }
        pendingFailures.set(0);
    }

    private final class HandlerSubscription implements Subscription {

        private final EventHandler handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private HandlerSubscription(EventHandler handler) {
            this.handler = handler;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                handlers.remove(this);
                log.debug("Subscription closed on bus {}", name);
            }
        }
    }
}
