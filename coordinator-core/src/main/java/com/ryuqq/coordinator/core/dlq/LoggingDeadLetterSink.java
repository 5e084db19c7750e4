package com.ryuqq.coordinator.core.dlq;

import com.ryuqq.coordinator.core.spi.DeadLetterSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dead letter sink used when no transport is configured.
 *
 * <p>Records are written to the log at ERROR level and otherwise dropped.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class LoggingDeadLetterSink implements DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterSink.class);

    @Override
    public void publish(DeadLetter deadLetter) {
        log.error("Dead letter [{}] from {} {} for {}: {} (details={}, retries={})",
            deadLetter.topic(),
            deadLetter.sourceKind(),
            deadLetter.sourceComponent(),
            deadLetter.cover().cacheKey(),
            deadLetter.reason(),
            deadLetter.details(),
            deadLetter.retryCount());
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
