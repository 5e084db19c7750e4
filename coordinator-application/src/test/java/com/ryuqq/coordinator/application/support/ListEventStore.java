package com.ryuqq.coordinator.application.support;

import com.ryuqq.coordinator.core.error.SequenceConflictException;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.spi.EventStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 단일 monitor 기반 테스트용 EventStore.
 */
public final class ListEventStore implements EventStore {

    private final Map<String, List<EventPage>> streams = new LinkedHashMap<>();
    private final Map<String, RootId> roots = new LinkedHashMap<>();

    @Override
    public synchronized void add(String domain, RootId root, List<EventPage> pages, String correlationId) {
        List<EventPage> stream = streams.computeIfAbsent(key(domain, root), k -> new ArrayList<>());
        roots.putIfAbsent(key(domain, root), root);
        long expected = nextOf(stream);
        for (EventPage page : pages) {
            if (!page.forced() && page.sequence() != expected) {
                throw new SequenceConflictException(page.sequence(), expected);
            }
            expected = page.forced() ? Math.max(expected, page.sequence() + 1) : expected + 1;
        }
        stream.addAll(pages);
    }

    @Override
    public synchronized List<EventPage> get(String domain, RootId root) {
        return List.copyOf(streams.getOrDefault(key(domain, root), List.of()));
    }

    @Override
    public List<EventPage> getFrom(String domain, RootId root, long from) {
        return getFromTo(domain, root, from, Long.MAX_VALUE);
    }

    @Override
    public synchronized List<EventPage> getFromTo(String domain, RootId root, long from, long to) {
        List<EventPage> result = new ArrayList<>();
        for (EventPage page : streams.getOrDefault(key(domain, root), List.of())) {
            if (page.sequence() >= from && page.sequence() < to) {
                result.add(page);
            }
        }
        return result;
    }

    @Override
    public synchronized long getNextSequence(String domain, RootId root) {
        return nextOf(streams.getOrDefault(key(domain, root), List.of()));
    }

    @Override
    public synchronized List<RootId> listRoots(String domain) {
        List<RootId> result = new ArrayList<>();
        roots.forEach((key, root) -> {
            if (key.startsWith(domain + ":")) {
                result.add(root);
            }
        });
        return result;
    }

    @Override
    public synchronized List<String> listDomains() {
        TreeSet<String> domains = new TreeSet<>();
        for (String key : streams.keySet()) {
            domains.add(key.substring(0, key.indexOf(':')));
        }
        return List.copyOf(domains);
    }

    @Override
    public List<EventBook> getByCorrelation(String correlationId) {
        return List.of();
    }

    public void seed(Cover cover, List<EventPage> pages) {
        add(cover.domain(), cover.root(), pages, cover.correlationId());
    }

    private static long nextOf(List<EventPage> stream) {
        long next = 0;
        for (EventPage page : stream) {
            next = Math.max(next, page.sequence() + 1);
        }
        return next;
    }

    private static String key(String domain, RootId root) {
        return domain + ":" + root.asString();
    }
}
