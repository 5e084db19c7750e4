package com.ryuqq.coordinator.core.spi;

import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.Projection;

/**
 * Projector run synchronously on newly committed events.
 *
 * <p>Its projection is returned to the command caller in the same response, giving
 * read-your-writes for the projected read model.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public interface SyncProjector {

    String name();

    /**
     * Whether this projector consumes events of a domain.
     *
     * @param domain the domain
     * @return true if {@link #project} should be called for the domain
     */
    boolean accepts(String domain);

    /**
     * Projects committed events.
     *
     * @param committed the newly committed pages
     * @return the projection
     */
    Projection project(EventBook committed);
}
