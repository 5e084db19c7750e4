package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.router.CommandRouter;
import com.ryuqq.coordinator.core.error.UnknownHandlerException;
import com.ryuqq.coordinator.core.model.ComponentDescriptor;
import com.ryuqq.coordinator.core.model.ContextualCommand;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.spi.BusinessLogicClient;
import com.ryuqq.coordinator.core.state.StateReconstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-process {@link BusinessLogicClient} backed by {@link CommandRouter}s, one per domain.
 *
 * <p>The routers' state reconstructors are exposed so the coordinator can merge
 * stale Explicit writes and write snapshots for the same domains.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class RouterBusinessLogicClient implements BusinessLogicClient {

    private final Map<String, CommandRouter<?>> routers;

    /**
     * Creates the client.
     *
     * @param routers aggregate routers, at most one per domain
     * @throws IllegalArgumentException if routers is null or two routers share a domain
     */
    public RouterBusinessLogicClient(List<CommandRouter<?>> routers) {
        if (routers == null) {
            throw new IllegalArgumentException("routers cannot be null");
        }
        Map<String, CommandRouter<?>> byDomain = new LinkedHashMap<>();
        for (CommandRouter<?> router : routers) {
            if (byDomain.putIfAbsent(router.domain(), router) != null) {
                throw new IllegalArgumentException("Duplicate router for domain: " + router.domain());
            }
        }
        this.routers = Map.copyOf(byDomain);
    }

    @Override
    public EventBook handle(String domain, ContextualCommand command) {
        CommandRouter<?> router = routers.get(domain);
        if (router == null) {
            throw UnknownHandlerException.forDomain(domain);
        }
        return router.dispatch(command.events(), command.command());
    }

    @Override
    public Set<String> domains() {
        return routers.keySet();
    }

    /**
     * State reconstructors keyed by domain.
     *
     * @return immutable map of domain to reconstructor
     */
    public Map<String, StateReconstructor<?>> reconstructors() {
        Map<String, StateReconstructor<?>> result = new LinkedHashMap<>();
        for (Map.Entry<String, CommandRouter<?>> entry : routers.entrySet()) {
            result.put(entry.getKey(), entry.getValue().reconstructor());
        }
        return result;
    }

    public List<ComponentDescriptor> descriptors() {
        List<ComponentDescriptor> descriptors = new ArrayList<>();
        for (CommandRouter<?> router : routers.values()) {
            descriptors.add(router.descriptor());
        }
        return descriptors;
    }
}
