package com.ryuqq.coordinator.core.spi;

/**
 * Handle for an active {@link EventBus} subscription.
 *
 * <p>Closing a subscription stops delivery to its handler promptly. Closing is idempotent.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
