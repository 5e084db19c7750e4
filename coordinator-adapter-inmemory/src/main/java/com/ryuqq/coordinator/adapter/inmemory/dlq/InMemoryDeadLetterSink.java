package com.ryuqq.coordinator.adapter.inmemory.dlq;

import com.ryuqq.coordinator.core.dlq.DeadLetter;
import com.ryuqq.coordinator.core.spi.DeadLetterSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link DeadLetterSink} SPI.
 *
 * <p>Records every dead letter in arrival order so tests can assert on topic,
 * details and source component.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class InMemoryDeadLetterSink implements DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeadLetterSink.class);

    private final CopyOnWriteArrayList<DeadLetter> deadLetters = new CopyOnWriteArrayList<>();

    @Override
    public void publish(DeadLetter deadLetter) {
        if (deadLetter == null) {
            throw new IllegalArgumentException("deadLetter cannot be null");
        }
        deadLetters.add(deadLetter);
        log.info("Dead letter recorded: topic={}, reason={}", deadLetter.topic(), deadLetter.reason());
    }

    public List<DeadLetter> getDeadLetters() {
        return List.copyOf(deadLetters);
    }

    /**
     * Dead letters routed to the given topic.
     *
     * @param topic topic such as {@code coordinator.dlq.order}
     * @return matching dead letters in arrival order
     */
    public List<DeadLetter> getDeadLetters(String topic) {
        return deadLetters.stream()
            .filter(letter -> letter.topic().equals(topic))
            .toList();
    }

    public int size() {
        return deadLetters.size();
    }

    public void clear() {
        deadLetters.clear();
    }
}
