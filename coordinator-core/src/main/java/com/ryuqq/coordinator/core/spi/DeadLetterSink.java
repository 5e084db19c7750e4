package com.ryuqq.coordinator.core.spi;

import com.ryuqq.coordinator.core.dlq.DeadLetter;

/**
 * Dead Letter SPI: terminal export for failures that cannot be retried further.
 *
 * <p>Only non-transient failures and transient failures that exhausted their retry budget
 * are published here. Implementations should not throw; a sink failure is logged by the
 * caller and otherwise ignored.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public interface DeadLetterSink {

    /**
     * Publishes a dead letter.
     *
     * @param deadLetter the failure record
     */
    void publish(DeadLetter deadLetter);

    /**
     * Whether a real transport is configured behind this sink.
     *
     * @return true unless the sink only logs
     */
    default boolean isConfigured() {
        return true;
    }
}
