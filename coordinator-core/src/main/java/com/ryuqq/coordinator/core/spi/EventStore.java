package com.ryuqq.coordinator.core.spi;

import com.ryuqq.coordinator.core.error.SequenceConflictException;
import com.ryuqq.coordinator.core.error.StorageException;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.RootId;

import java.util.List;

/**
 * Event Store SPI: the durable, append-only source of truth.
 *
 * <p>Events are stored per (domain, root) as an ordered list of pages. The store is the
 * only place where concurrent writers against the same root are serialized: {@link #add}
 * is an atomic compare-and-append.</p>
 *
 * <p><strong>Sequencing Contract for {@link #add}:</strong></p>
 * <ul>
 *   <li>Non-forced pages must start exactly at {@link #getNextSequence} and be contiguous</li>
 *   <li>Any mismatch fails with {@link SequenceConflictException} and writes nothing</li>
 *   <li>Forced pages ({@link EventPage#forced()}) are written at the sequence they carry
 *       without the check; contiguity is not guaranteed once a root holds forced pages</li>
 * </ul>
 *
 * <p><strong>Error Contract:</strong> sequence conflicts must be reported distinguishably
 * from any other failure. Other failures are reported as {@link StorageException}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Atomic: a batch of pages is either fully appended or not at all</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public interface EventStore {

    /**
     * Appends pages to a root.
     *
     * @param domain the domain
     * @param root the aggregate root
     * @param pages the pages to append (in order)
     * @param correlationId the correlation id recorded with the pages (may be empty)
     * @throws SequenceConflictException if the first non-forced page is not at the current tip
     * @throws StorageException if the store is unavailable
     * @throws IllegalArgumentException if any argument is null
     */
    void add(String domain, RootId root, List<EventPage> pages, String correlationId);

    /**
     * Returns every page of a root in sequence order.
     *
     * @param domain the domain
     * @param root the aggregate root
     * @return all pages (empty for an unknown root)
     */
    List<EventPage> get(String domain, RootId root);

    /**
     * Returns pages with {@code sequence >= from}.
     *
     * @param domain the domain
     * @param root the aggregate root
     * @param from inclusive lower bound
     * @return matching pages in sequence order
     */
    List<EventPage> getFrom(String domain, RootId root, long from);

    /**
     * Returns pages with {@code from <= sequence < to}.
     *
     * @param domain the domain
     * @param root the aggregate root
     * @param from inclusive lower bound
     * @param to exclusive upper bound
     * @return matching pages in sequence order
     */
    List<EventPage> getFromTo(String domain, RootId root, long from, long to);

    /**
     * Returns the next sequence a non-forced append must use.
     *
     * @param domain the domain
     * @param root the aggregate root
     * @return highest stored sequence + 1, or 0 for an unknown root
     */
    long getNextSequence(String domain, RootId root);

    /**
     * Lists the roots that have at least one page in a domain.
     *
     * @param domain the domain
     * @return root ids
     */
    List<RootId> listRoots(String domain);

    /**
     * Lists the domains that have at least one page.
     *
     * @return domain names
     */
    List<String> listDomains();

    /**
     * Returns, per root, the pages that were appended with the given correlation id.
     *
     * @param correlationId the correlation id (must not be blank)
     * @return one event book per matching root
     */
    List<EventBook> getByCorrelation(String correlationId);
}
