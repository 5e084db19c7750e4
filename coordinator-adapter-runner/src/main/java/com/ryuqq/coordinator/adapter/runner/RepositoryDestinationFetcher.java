package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.coordinator.DestinationFetcher;
import com.ryuqq.coordinator.application.repository.EventBookRepository;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;

import java.util.Optional;

/**
 * 로컬 저장소에서 대상 aggregate 이력을 조회하는 DestinationFetcher.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class RepositoryDestinationFetcher implements DestinationFetcher {

    private final EventBookRepository repository;

    public RepositoryDestinationFetcher(EventBookRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        this.repository = repository;
    }

    @Override
    public Optional<EventBook> fetch(Cover cover) {
        return Optional.of(repository.load(cover));
    }
}
