package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.spi.EventBus;
import com.ryuqq.coordinator.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 클라이언트 event stream 서비스.
 *
 * <p>Stream마다 버스 구독을 하나 만들고, correlation id가 일치하는 book만 sink로 전달합니다.
 * Sink가 닫히거나 {@link StreamSink#offer}가 false를 반환하면 구독을 즉시 닫습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * QueueStreamSink sink = new QueueStreamSink(256);
 * Subscription stream = service.open(correlationId, sink);
 * EventBook next = sink.poll(1, TimeUnit.SECONDS);
 * sink.close();   // 구독도 함께 닫힘
 * }</pre>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class EventStreamService {

    private static final Logger log = LoggerFactory.getLogger(EventStreamService.class);

    private final EventBus bus;
    private final AtomicInteger activeStreams = new AtomicInteger();

    public EventStreamService(EventBus bus) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        this.bus = bus;
    }

    /**
     * Stream 시작.
     *
     * @param correlationId 전달할 correlation id (null이면 모든 book)
     * @param sink 클라이언트 sink
     * @return 업스트림 구독 (sink 종료 시 자동으로 닫힘)
     * @throws IllegalArgumentException sink가 null인 경우
     */
    public Subscription open(String correlationId, StreamSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        Stream stream = new Stream(correlationId, sink);
        stream.subscription = bus.subscribe(stream::forward);
        activeStreams.incrementAndGet();
        log.debug("Event stream opened for correlation {}", correlationId);

        sink.onClose(stream::cancel);
        return stream.subscription;
    }

    public int activeStreams() {
        return activeStreams.get();
    }

    private final class Stream {

        private final String correlationId;
        private final StreamSink sink;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile Subscription subscription;

        private Stream(String correlationId, StreamSink sink) {
            this.correlationId = correlationId;
            this.sink = sink;
        }

        private void forward(EventBook book) {
            if (sink.isClosed()) {
                cancel();
                return;
            }
            if (correlationId != null && !correlationId.equals(book.cover().correlationId())) {
                return;
            }
            if (!sink.offer(book)) {
                log.debug("Event stream sink for correlation {} refused {}, cancelling",
                    correlationId, book.cover().cacheKey());
                cancel();
            }
        }

        private void cancel() {
            Subscription current = subscription;
            if (current != null && cancelled.compareAndSet(false, true)) {
                current.close();
                activeStreams.decrementAndGet();
                log.debug("Event stream closed for correlation {}", correlationId);
            }
        }
    }
}
