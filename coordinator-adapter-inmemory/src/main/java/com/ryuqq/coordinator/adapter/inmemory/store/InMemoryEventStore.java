package com.ryuqq.coordinator.adapter.inmemory.store;

import com.ryuqq.coordinator.core.error.SequenceConflictException;
import com.ryuqq.coordinator.core.error.StorageException;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.spi.EventStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link EventStore} SPI for testing and embedding.
 *
 * <p>Each (domain, root) stream is an append-only list guarded by its own monitor, so
 * {@link #add} is an atomic compare-and-append per root while different roots never
 * contend with each other.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>streams:</strong> ConcurrentHashMap&lt;StreamKey, Stream&gt; - one stream per (domain, root)</li>
 *   <li><strong>Stream:</strong> pages in append order with the correlation id each was written with</li>
 * </ul>
 *
 * <p><strong>Test Support:</strong> {@link #failNextAdds(int)} makes the next N appends fail with
 * {@link StorageException} to simulate an unavailable backend.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<StreamKey, Stream> streams = new ConcurrentHashMap<>();
    private final AtomicInteger pendingFailures = new AtomicInteger();

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>All pages are validated before any is written</li>
     *   <li>Forced pages are stored at their own sequence and move the tip past them</li>
     *   <li>Empty page lists are a no-op</li>
     * </ul>
     */
    @Override
    public void add(String domain, RootId root, List<EventPage> pages, String correlationId) {
        requireStream(domain, root);
        if (pages == null) {
            throw new IllegalArgumentException("pages cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (pages.isEmpty()) {
            return;
        }
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new StorageException("Injected storage failure for " + domain);
        }

        Stream stream = streams.computeIfAbsent(new StreamKey(domain, root), key -> new Stream());
        synchronized (stream) {
            long expected = stream.nextSequence;
            for (EventPage page : pages) {
                if (page.forced()) {
                    expected = Math.max(expected, page.sequence() + 1);
                } else if (page.sequence() != expected) {
                    throw new SequenceConflictException(page.sequence(), stream.nextSequence,
                        "Sequence conflict on " + domain + "/" + root.asString()
                            + ": page " + page.sequence() + ", next " + stream.nextSequence);
                } else {
                    expected++;
                }
            }
            for (EventPage page : pages) {
                stream.pages.add(new StoredPage(page, correlationId));
            }
            stream.nextSequence = expected;
        }
    }

    @Override
    public List<EventPage> get(String domain, RootId root) {
        return getFromTo(domain, root, 0, Long.MAX_VALUE);
    }

    @Override
    public List<EventPage> getFrom(String domain, RootId root, long from) {
        return getFromTo(domain, root, from, Long.MAX_VALUE);
    }

    @Override
    public List<EventPage> getFromTo(String domain, RootId root, long from, long to) {
        requireStream(domain, root);
        Stream stream = streams.get(new StreamKey(domain, root));
        if (stream == null) {
            return List.of();
        }
        List<EventPage> result = new ArrayList<>();
        synchronized (stream) {
            for (StoredPage stored : stream.pages) {
                long sequence = stored.page.sequence();
                if (sequence >= from && sequence < to) {
                    result.add(stored.page);
                }
            }
        }
        result.sort(Comparator.comparingLong(EventPage::sequence));
        return result;
    }

    @Override
    public long getNextSequence(String domain, RootId root) {
        requireStream(domain, root);
        Stream stream = streams.get(new StreamKey(domain, root));
        if (stream == null) {
            return 0;
        }
        synchronized (stream) {
            return stream.nextSequence;
        }
    }

    @Override
    public List<RootId> listRoots(String domain) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        List<RootId> roots = new ArrayList<>();
        for (StreamKey key : streams.keySet()) {
            if (key.domain.equals(domain)) {
                roots.add(key.root);
            }
        }
        return roots;
    }

    @Override
    public List<String> listDomains() {
        List<String> domains = new ArrayList<>();
        for (StreamKey key : streams.keySet()) {
            if (!domains.contains(key.domain)) {
                domains.add(key.domain);
            }
        }
        domains.sort(Comparator.naturalOrder());
        return domains;
    }

    @Override
    public List<EventBook> getByCorrelation(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        Map<StreamKey, List<EventPage>> matches = new LinkedHashMap<>();
        for (Map.Entry<StreamKey, Stream> entry : streams.entrySet()) {
            Stream stream = entry.getValue();
            synchronized (stream) {
                for (StoredPage stored : stream.pages) {
                    if (correlationId.equals(stored.correlationId)) {
                        matches.computeIfAbsent(entry.getKey(), key -> new ArrayList<>()).add(stored.page);
                    }
                }
            }
        }
        List<EventBook> books = new ArrayList<>();
        for (Map.Entry<StreamKey, List<EventPage>> match : matches.entrySet()) {
            List<EventPage> pages = match.getValue();
            pages.sort(Comparator.comparingLong(EventPage::sequence));
            Cover cover = Cover.of(match.getKey().domain, match.getKey().root, correlationId);
            books.add(EventBook.of(cover, pages));
        }
        return books;
    }

    /**
     * Makes the next {@code count} calls to {@link #add} fail with {@link StorageException}.
     *
     * @param count number of failures to inject
     */
    public void failNextAdds(int count) {
        pendingFailures.set(count);
    }

    /**
     * Total number of stored pages. Used for test assertions.
     *
     * @return page count across all streams
     */
    public int pageCount() {
        int count = 0;
        for (Stream stream : streams.values()) {
            synchronized (stream) {
                count += stream.pages.size();
            }
        }
        return count;
    }

    /**
     * Clears all streams. Used for test cleanup.
     */
    public void clear() {
        streams.clear();
        pendingFailures.set(0);
    }

    private static void requireStream(String domain, RootId root) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain cannot be null or blank");
        }
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
    }

    private record StreamKey(String domain, RootId root) {
    }

    private record StoredPage(EventPage page, String correlationId) {
    }

    private static final class Stream {
        private final List<StoredPage> pages = new ArrayList<>();
        private long nextSequence;
    }
}
