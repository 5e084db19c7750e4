package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prepare 단계에서 요청한 대상 aggregate의 현재 이력.
 *
 * <p>(domain, root) 기준으로 조회하며, 조회되지 않은 대상은 빈 이력으로 취급할 수 있습니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class Destinations {

    private static final Destinations NONE = new Destinations(List.of());

    private final Map<String, EventBook> books;

    private Destinations(List<EventBook> books) {
        this.books = new LinkedHashMap<>();
        for (EventBook book : books) {
            this.books.put(book.cover().cacheKey(), book);
        }
    }

    public static Destinations of(List<EventBook> books) {
        if (books == null || books.isEmpty()) {
            return NONE;
        }
        return new Destinations(books);
    }

    public static Destinations none() {
        return NONE;
    }

    /**
     * 대상 이력 조회.
     *
     * @param cover 대상 cover
     * @return 이력 (조회되지 않았으면 empty)
     */
    public Optional<EventBook> find(Cover cover) {
        return Optional.ofNullable(books.get(cover.cacheKey()));
    }

    /**
     * 대상 이력 조회, 없으면 빈 이력.
     *
     * @param cover 대상 cover
     * @return 이력
     */
    public EventBook getOrEmpty(Cover cover) {
        return find(cover).orElseGet(() -> EventBook.empty(cover));
    }

    /**
     * 대상의 다음 sequence.
     *
     * <p>Explicit 전략 command를 만들 때 기대 sequence로 사용합니다.</p>
     *
     * @param cover 대상 cover
     * @return 다음 sequence (조회되지 않았으면 0)
     */
    public long nextSequence(Cover cover) {
        return getOrEmpty(cover).nextSequence();
    }

    public List<EventBook> all() {
        return List.copyOf(books.values());
    }

    public int size() {
        return books.size();
    }
}
