package com.ryuqq.coordinator.testkit.contract;

import com.ryuqq.coordinator.core.error.SequenceConflictException;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.model.TypedPayload;
import com.ryuqq.coordinator.core.spi.EventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the {@link EventStore} SPI.
 *
 * <p>Every event store adapter extends this class and supplies a fresh instance
 * through {@link #createEventStore()}.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Contiguous append from 0 and half-open range reads</li>
 *   <li>Stale or gapped sequence → SequenceConflictException, nothing written</li>
 *   <li>Forced pages bypass the contiguity check</li>
 *   <li>Concurrent appends at the same sequence → exactly one wins</li>
 *   <li>Correlation lookup across domains</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public abstract class AbstractEventStoreContractTest {

    protected static final String DOMAIN = "contract";

    protected EventStore eventStore;

    /**
     * Creates the adapter under test.
     *
     * @return empty event store
     */
    protected abstract EventStore createEventStore();

    @BeforeEach
    void setUpEventStore() {
        eventStore = createEventStore();
    }

    @Test
    void testAppend_FromZero_ReadsBackInOrder() {
        // Given
        RootId root = RootId.random();

        // When
        eventStore.add(DOMAIN, root, pages(0, 3), "corr-1");

        // Then
        List<EventPage> stored = eventStore.get(DOMAIN, root);
        assertEquals(List.of(0L, 1L, 2L), sequences(stored));
        assertEquals(3, eventStore.getNextSequence(DOMAIN, root));
    }

    @Test
    void testNextSequence_UnknownRoot_IsZero() {
        assertEquals(0, eventStore.getNextSequence(DOMAIN, RootId.random()));
        assertTrue(eventStore.get(DOMAIN, RootId.random()).isEmpty());
    }

    @Test
    void testAppend_StaleSequence_ThrowsConflictAndWritesNothing() {
        // Given
        RootId root = RootId.random();
        eventStore.add(DOMAIN, root, pages(0, 2), "corr-1");

        // When
        SequenceConflictException conflict = assertThrows(SequenceConflictException.class,
                () -> eventStore.add(DOMAIN, root, pages(1, 2), "corr-2"));

        // Then
        assertEquals(2, conflict.getActual());
        assertEquals(2, eventStore.getNextSequence(DOMAIN, root));
        assertEquals(2, eventStore.get(DOMAIN, root).size());
    }

    @Test
    void testAppend_GapInBatch_ThrowsConflictAndWritesNothing() {
        // Given
        RootId root = RootId.random();
        List<EventPage> gapped = List.of(page(0), page(2));

        // When / Then
        assertThrows(SequenceConflictException.class, () -> eventStore.add(DOMAIN, root, gapped, "corr-1"));
        assertTrue(eventStore.get(DOMAIN, root).isEmpty());
    }

    @Test
    void testAppend_ForcedPages_BypassContiguity() {
        // Given
        RootId root = RootId.random();
        eventStore.add(DOMAIN, root, pages(0, 2), "corr-1");

        // When: forced page written past a gap
        eventStore.add(DOMAIN, root, List.of(page(5).asForced()), "corr-2");

        // Then
        List<EventPage> stored = eventStore.get(DOMAIN, root);
        assertEquals(List.of(0L, 1L, 5L), sequences(stored));
        assertTrue(stored.get(2).forced());
        assertEquals(6, eventStore.getNextSequence(DOMAIN, root));
    }

    @Test
    void testRangeReads_AreHalfOpen() {
        // Given
        RootId root = RootId.random();
        eventStore.add(DOMAIN, root, pages(0, 5), "corr-1");

        // Then
        assertEquals(List.of(2L, 3L, 4L), sequences(eventStore.getFrom(DOMAIN, root, 2)));
        assertEquals(List.of(1L, 2L), sequences(eventStore.getFromTo(DOMAIN, root, 1, 3)));
        assertTrue(eventStore.getFromTo(DOMAIN, root, 3, 3).isEmpty());
    }

    @Test
    void testEmptyAppend_IsNoOp() {
        RootId root = RootId.random();

        eventStore.add(DOMAIN, root, List.of(), "corr-1");

        assertEquals(0, eventStore.getNextSequence(DOMAIN, root));
    }

    @Test
    void testListRootsAndDomains_ReflectWrites() {
        // Given
        RootId first = RootId.random();
        RootId second = RootId.random();
        eventStore.add(DOMAIN, first, pages(0, 1), "corr-1");
        eventStore.add(DOMAIN, second, pages(0, 1), "corr-1");
        eventStore.add("other", first, pages(0, 1), "corr-1");

        // Then
        List<RootId> roots = eventStore.listRoots(DOMAIN);
        assertEquals(2, roots.size());
        assertTrue(roots.contains(first));
        assertTrue(roots.contains(second));
        assertTrue(eventStore.listDomains().containsAll(List.of(DOMAIN, "other")));
    }

    @Test
    void testGetByCorrelation_ReturnsOneBookPerRoot() {
        // Given
        RootId first = RootId.random();
        RootId second = RootId.random();
        eventStore.add(DOMAIN, first, pages(0, 2), "flow-1");
        eventStore.add("other", second, pages(0, 1), "flow-1");
        eventStore.add(DOMAIN, first, pages(2, 1), "flow-2");

        // When
        List<EventBook> books = eventStore.getByCorrelation("flow-1");

        // Then
        assertEquals(2, books.size());
        int total = 0;
        for (EventBook book : books) {
            assertEquals("flow-1", book.cover().correlationId());
            total += book.pages().size();
        }
        assertEquals(3, total);
    }

    @Test
    void testConcurrentAppends_SameSequence_ExactlyOneWins() throws InterruptedException {
        // Given
        RootId root = RootId.random();
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(writers);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();

        // When
        for (int i = 0; i < writers; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    eventStore.add(DOMAIN, root, pages(0, 1), "corr");
                    successes.incrementAndGet();
                } catch (SequenceConflictException e) {
                    conflicts.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS), "writers should finish");
        executor.shutdownNow();

        // Then
        assertEquals(1, successes.get());
        assertEquals(writers - 1, conflicts.get());
        assertEquals(1, eventStore.get(DOMAIN, root).size());
    }

    protected static EventPage page(long sequence) {
        byte[] body = ("{\"n\":" + sequence + "}").getBytes(StandardCharsets.UTF_8);
        return EventPage.of(sequence, TypedPayload.ofType("contract.Happened", body));
    }

    protected static List<EventPage> pages(long from, int count) {
        List<EventPage> result = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            result.add(page(from + i));
        }
        return result;
    }

    protected static List<Long> sequences(List<EventPage> pages) {
        List<Long> result = new ArrayList<>();
        for (EventPage page : pages) {
            result.add(page.sequence());
        }
        return result;
    }
}
