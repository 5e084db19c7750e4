package com.ryuqq.coordinator.core.model;

import java.util.List;

/**
 * 하나의 aggregate에 대한 전체 또는 부분 event 이력.
 *
 * <p>Router에게는 읽기 전용이며, coordinator/저장소 계층만 page를 추가합니다.</p>
 *
 * <p><strong>nextSequence 계산 규칙:</strong></p>
 * <ol>
 *   <li>마지막 page가 있으면: 마지막 page sequence + 1</li>
 *   <li>page가 없고 snapshot이 있으면: snapshot sequence + 1</li>
 *   <li>둘 다 없으면: 0 (처음 보는 root)</li>
 * </ol>
 *
 * @param cover 소유 aggregate
 * @param snapshot snapshot (선택, null 가능)
 * @param pages 순서 있는 event page 목록
 * @param nextSequence 다음에 사용할 수 있는 sequence
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record EventBook(
    Cover cover,
    Snapshot snapshot,
    List<EventPage> pages,
    long nextSequence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cover가 null이거나 nextSequence가 음수인 경우
     */
    public EventBook {
        if (cover == null) {
            throw new IllegalArgumentException("cover cannot be null");
        }
        pages = pages == null ? List.of() : List.copyOf(pages);
        if (nextSequence < 0) {
            throw new IllegalArgumentException("nextSequence must be non-negative (current: " + nextSequence + ")");
        }
    }

    /**
     * nextSequence를 계산하여 EventBook 생성.
     *
     * @param cover 소유 aggregate
     * @param snapshot snapshot (null 가능)
     * @param pages event page 목록
     * @return EventBook 인스턴스
     */
    public static EventBook of(Cover cover, Snapshot snapshot, List<EventPage> pages) {
        return new EventBook(cover, snapshot, pages, computeNextSequence(snapshot, pages));
    }

    /**
     * Snapshot 없이 EventBook 생성.
     *
     * @param cover 소유 aggregate
     * @param pages event page 목록
     * @return EventBook 인스턴스
     */
    public static EventBook of(Cover cover, List<EventPage> pages) {
        return of(cover, null, pages);
    }

    /**
     * 비어 있는 EventBook 생성 (nextSequence=0).
     *
     * @param cover 소유 aggregate
     * @return 빈 EventBook
     */
    public static EventBook empty(Cover cover) {
        return new EventBook(cover, null, List.of(), 0);
    }

    private static long computeNextSequence(Snapshot snapshot, List<EventPage> pages) {
        if (pages != null && !pages.isEmpty()) {
            long max = -1;
            for (EventPage page : pages) {
                max = Math.max(max, page.sequence());
            }
            return max + 1;
        }
        if (snapshot != null) {
            return snapshot.sequence() + 1;
        }
        return 0;
    }

    public boolean isEmpty() {
        return pages.isEmpty();
    }

    public boolean hasSnapshot() {
        return snapshot != null;
    }

    /**
     * Pages만 변경한 새 인스턴스 생성 (nextSequence 재계산).
     *
     * @param pages 새 page 목록
     * @return 새 EventBook 인스턴스
     */
    public EventBook withPages(List<EventPage> pages) {
        return of(cover, snapshot, pages);
    }

    /**
     * Cover만 변경한 새 인스턴스 생성.
     *
     * @param cover 새 cover
     * @return 새 EventBook 인스턴스
     */
    public EventBook withCover(Cover cover) {
        return new EventBook(cover, snapshot, pages, nextSequence);
    }
}
