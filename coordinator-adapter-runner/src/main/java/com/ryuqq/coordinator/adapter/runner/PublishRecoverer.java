package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.core.dlq.DeadLetter;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.spi.DeadLetterSink;
import com.ryuqq.coordinator.core.spi.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * PublishRecoverer 컴포넌트.
 *
 * <p>저장은 성공했지만 발행에 실패한 event book을 주기적으로 다시 발행합니다.
 * 저장소가 진실의 원천이므로 commit은 되돌리지 않습니다.</p>
 *
 * <p><strong>복구 시나리오:</strong></p>
 * <pre>
 * 1. DefaultCommandCoordinator가 append 성공
 * 2. publish가 재시도 예산까지 실패 → enqueue(book)
 * 3. 스케줄러가 주기적으로 scan() 호출
 * 4. 재발행 성공 → 제거
 *    재발행 실패 → 시도 횟수 증가, maxAttempts 도달 시 DLQ
 * </pre>
 *
 * <p><strong>멱등성:</strong> 버스는 at-least-once이므로 구독자는 같은 book을 여러 번 받을 수 있습니다.
 * EventDispatchRunner가 cover와 sequence 범위로 중복을 거릅니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class PublishRecoverer {

    private static final Logger log = LoggerFactory.getLogger(PublishRecoverer.class);

    static final String COMPONENT_NAME = "publish-recoverer";

    private final EventBus bus;
    private final DeadLetterSink deadLetterSink;
    private final PublishRecoveryConfig config;
    private final ConcurrentLinkedQueue<PendingPublication> pending = new ConcurrentLinkedQueue<>();

    /**
     * 생성자.
     *
     * @param bus 이벤트 버스
     * @param deadLetterSink 포기한 book을 받을 DLQ
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PublishRecoverer(EventBus bus, DeadLetterSink deadLetterSink, PublishRecoveryConfig config) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (deadLetterSink == null) {
            throw new IllegalArgumentException("deadLetterSink cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.bus = bus;
        this.deadLetterSink = deadLetterSink;
        this.config = config;
    }

    /**
     * 발행 실패한 book 등록.
     *
     * @param book commit된 event book
     * @param cause 마지막 발행 실패 원인
     */
    public void enqueue(EventBook book, Throwable cause) {
        if (book == null) {
            throw new IllegalArgumentException("book cannot be null");
        }
        pending.add(new PendingPublication(book, 0, cause == null ? "unknown" : String.valueOf(cause.getMessage())));
        log.warn("Queued {} ({} pages) for publish recovery: {}",
            book.cover().cacheKey(), book.pages().size(), cause == null ? "unknown" : cause.getMessage());
    }

    /**
     * 대기 중인 book 재발행.
     *
     * <p>직접 호출하거나 {@link #schedule(ScheduledExecutorService)}로 주기 실행합니다.</p>
     *
     * @return 이번 scan에서 재발행에 성공한 book 수
     */
    public int scan() {
        List<PendingPublication> batch = new ArrayList<>();
        PendingPublication next;
        while (batch.size() < config.batchSize() && (next = pending.poll()) != null) {
            batch.add(next);
        }

        int recovered = 0;
        for (PendingPublication publication : batch) {
            if (tryPublish(publication)) {
                recovered++;
            }
        }
        if (!batch.isEmpty()) {
            log.info("Publish recovery scan completed: {} recovered out of {} pending", recovered, batch.size());
        }
        return recovered;
    }

    /**
     * {@link PublishRecoveryConfig#scanIntervalMs()} 주기로 {@link #scan()} 예약.
     *
     * @param scheduler scan을 실행할 scheduler
     * @return 예약된 작업 (cancel로 중단)
     */
    public ScheduledFuture<?> schedule(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        long interval = config.scanIntervalMs();
        return scheduler.scheduleWithFixedDelay(this::scanQuietly, interval, interval, TimeUnit.MILLISECONDS);
    }

    public int pendingCount() {
        return pending.size();
    }

    private boolean tryPublish(PendingPublication publication) {
        EventBook book = publication.book();
        try {
            bus.publish(book);
            log.info("Recovered publication of {} after {} failed attempts",
                book.cover().cacheKey(), publication.attempts() + 1);
            return true;
        } catch (RuntimeException e) {
            int attempts = publication.attempts() + 1;
            if (attempts >= config.maxAttempts()) {
                log.error("Giving up publication of {} after {} recovery attempts",
                    book.cover().cacheKey(), attempts, e);
                deadLetterSink.publish(DeadLetter.fromEventProcessingFailure(
                    book, "Publish failed: " + e.getMessage(), attempts, true,
                    COMPONENT_NAME, ComponentKind.AGGREGATE));
            } else {
                pending.add(new PendingPublication(book, attempts, e.getMessage()));
            }
            return false;
        }
    }

    private void scanQuietly() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("Publish recovery scan failed", e);
        }
    }

    private record PendingPublication(EventBook book, int attempts, String lastError) {
    }
}
