package com.ryuqq.coordinator.application.repository;

import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.Snapshot;
import com.ryuqq.coordinator.core.spi.EventStore;
import com.ryuqq.coordinator.core.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Aggregate 이력 조회기.
 *
 * <p>Snapshot이 있으면 snapshot과 그 이후 event만, 없으면 전체 이력을 읽어
 * {@link EventBook}으로 조립합니다. 매 요청마다 저장소에서 다시 읽으며 프로세스 내에
 * aggregate state를 캐시하지 않습니다.</p>
 *
 * <p><strong>Snapshot 무결성:</strong> snapshot sequence가 저장된 마지막 event sequence를
 * 넘으면 (저장소 불일치) snapshot을 무시하고 전체 이력을 읽습니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class EventBookRepository {

    private static final Logger log = LoggerFactory.getLogger(EventBookRepository.class);

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;

    /**
     * 생성자.
     *
     * @param eventStore event 저장소
     * @param snapshotStore snapshot 저장소
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventBookRepository(EventStore eventStore, SnapshotStore snapshotStore) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (snapshotStore == null) {
            throw new IllegalArgumentException("snapshotStore cannot be null");
        }
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
    }

    /**
     * 현재 이력 조회 (snapshot + tail).
     *
     * @param cover 대상 aggregate
     * @return 현재 이력
     */
    public EventBook load(Cover cover) {
        Optional<Snapshot> snapshot = snapshotStore.get(cover.domain(), cover.root());
        if (snapshot.isPresent()) {
            long next = eventStore.getNextSequence(cover.domain(), cover.root());
            if (snapshot.get().sequence() < next) {
                List<EventPage> tail = eventStore.getFrom(cover.domain(), cover.root(), snapshot.get().sequence() + 1);
                return EventBook.of(cover, snapshot.get(), tail);
            }
            log.warn("Ignoring snapshot at sequence {} for {}: store next sequence is {}",
                snapshot.get().sequence(), cover.cacheKey(), next);
        }
        return EventBook.of(cover, eventStore.get(cover.domain(), cover.root()));
    }

    /**
     * 특정 sequence 이전까지의 이력 조회.
     *
     * <p>{@code sequence < before}인 event만 포함하며, 그 범위 안의 snapshot만 사용합니다.
     * Explicit 전략에서 호출자가 보았던 과거 시점을 복원할 때 사용합니다.</p>
     *
     * @param cover 대상 aggregate
     * @param before 배타적 상한
     * @return 과거 시점의 이력 (nextSequence는 before 이하)
     */
    public EventBook loadBefore(Cover cover, long before) {
        if (before <= 0) {
            return EventBook.empty(cover);
        }
        Optional<Snapshot> snapshot = snapshotStore.get(cover.domain(), cover.root())
            .filter(candidate -> candidate.sequence() < before);
        if (snapshot.isPresent()) {
            List<EventPage> tail = eventStore.getFromTo(
                cover.domain(), cover.root(), snapshot.get().sequence() + 1, before);
            return EventBook.of(cover, snapshot.get(), tail);
        }
        return EventBook.of(cover, eventStore.getFromTo(cover.domain(), cover.root(), 0, before));
    }

    /**
     * 특정 sequence 시점(포함)의 이력 조회.
     *
     * @param cover 대상 aggregate
     * @param asOfSequence 포함할 마지막 sequence
     * @return 해당 시점의 이력
     */
    public EventBook loadAsOf(Cover cover, long asOfSequence) {
        return loadBefore(cover, asOfSequence + 1);
    }

    /**
     * 범위 조회 (snapshot 미사용).
     *
     * @param cover 대상 aggregate
     * @param from 포함 하한
     * @param to 배타 상한
     * @return 범위 내 event만 담은 book
     */
    public EventBook loadRange(Cover cover, long from, long to) {
        return EventBook.of(cover, eventStore.getFromTo(cover.domain(), cover.root(), from, to));
    }

    /**
     * Snapshot 저장.
     *
     * @param cover 대상 aggregate
     * @param snapshot snapshot
     */
    public void saveSnapshot(Cover cover, Snapshot snapshot) {
        snapshotStore.put(cover.domain(), cover.root(), snapshot);
    }

    /**
     * 다음 sequence 조회.
     *
     * @param cover 대상 aggregate
     * @return 저장소 기준 다음 sequence
     */
    public long nextSequence(Cover cover) {
        return eventStore.getNextSequence(cover.domain(), cover.root());
    }

    /**
     * Event 추가 (compare-and-append).
     *
     * @param cover 대상 aggregate (correlation id 포함)
     * @param pages 추가할 page
     * @throws com.ryuqq.coordinator.core.error.SequenceConflictException sequence 불일치
     */
    public void append(Cover cover, List<EventPage> pages) {
        eventStore.add(cover.domain(), cover.root(), pages, cover.correlationId());
    }
}
