package com.ryuqq.coordinator.core.spi;

import com.ryuqq.coordinator.core.model.ContextualCommand;
import com.ryuqq.coordinator.core.model.EventBook;

import java.util.Set;

/**
 * Business Logic SPI: computes candidate events for a command.
 *
 * <p>Implementations may run in-process (a router) or call a remote aggregate service.
 * They must be pure functions of the contextual command: no writes, no hidden state,
 * so that the coordinator can safely call them again when re-sequencing.</p>
 *
 * <p><strong>Errors:</strong></p>
 * <ul>
 *   <li>{@code ValidationRejectedException}: business rule violated</li>
 *   <li>{@code UnknownHandlerException}: command type not handled</li>
 *   <li>{@code DecodeFailureException}: command payload malformed</li>
 *   <li>{@code TransientInfraException}: remote aggregate unavailable</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public interface BusinessLogicClient {

    /**
     * Handles a command in the context of the aggregate's prior events.
     *
     * @param domain the target domain
     * @param command prior events plus the command book
     * @return candidate event pages (sequences assigned from the prior events' next sequence)
     */
    EventBook handle(String domain, ContextualCommand command);

    /**
     * Lists the domains this client serves.
     *
     * @return domain names
     */
    Set<String> domains();
}
