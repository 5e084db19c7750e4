package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.coordinator.DestinationFetcher;
import com.ryuqq.coordinator.core.error.CoordinatorException;
import com.ryuqq.coordinator.core.error.TransientInfraException;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Prepare 단계가 요청한 대상 이력을 병렬로 조회합니다.
 *
 * <p>조회 결과가 없는 cover는 빈 이력으로 채웁니다. 결과 순서는 요청 순서와 같습니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
final class ParallelDestinationLoader {

    private final DestinationFetcher fetcher;
    private final ExecutorService executor;
    private final long timeoutMs;

    ParallelDestinationLoader(DestinationFetcher fetcher, ExecutorService executor, long timeoutMs) {
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.fetcher = fetcher;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    /**
     * 대상 이력 조회.
     *
     * @param covers 조회할 cover 목록
     * @return cover 순서대로의 이력
     * @throws TransientInfraException 제한 시간 초과 또는 조회 실패
     */
    List<EventBook> load(List<Cover> covers) {
        if (covers.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<EventBook>> futures = new ArrayList<>(covers.size());
        for (Cover cover : covers) {
            futures.add(CompletableFuture.supplyAsync(
                () -> fetcher.fetch(cover).orElseGet(() -> EventBook.empty(cover)), executor));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        List<EventBook> books = new ArrayList<>(covers.size());
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<EventBook> future = futures.get(i);
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                books.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                cancelAll(futures);
                throw new TransientInfraException("Timed out fetching destination " + covers.get(i).cacheKey(), e);
            } catch (ExecutionException e) {
                cancelAll(futures);
                Throwable cause = e.getCause();
                if (cause instanceof CoordinatorException coordinatorException) {
                    throw coordinatorException;
                }
                throw new TransientInfraException("Failed fetching destination " + covers.get(i).cacheKey(), cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new TransientInfraException("Interrupted fetching destinations", e);
            }
        }
        return books;
    }

    private static void cancelAll(List<CompletableFuture<EventBook>> futures) {
        for (CompletableFuture<EventBook> future : futures) {
            future.cancel(true);
        }
    }
}
