package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.spi.EventBus;
import com.ryuqq.coordinator.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event Dispatch Runner 구현체.
 *
 * <p>버스를 구독하여 수신한 event book을 saga와 process manager에게 worker pool에서 전달합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * start() → bus.subscribe(onEvent) + bus.startConsuming()
 *   ↓
 * onEvent(book)
 *   1. 빈 book → 무시
 *   2. (domain, root, 첫 sequence, 마지막 sequence)로 중복 판별 → 이미 본 book이면 무시
 *   3. 각 saga / process manager마다 worker에 제출
 *      (실패는 로그만 남기고 다른 컴포넌트 처리를 막지 않음)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>중복 판별은 최근 dedupCapacity개의 book만 기억하는 LRU</li>
 *   <li>같은 book에 대한 컴포넌트 처리는 서로 독립적으로 동시 실행</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class EventDispatchRunner {

    private static final Logger log = LoggerFactory.getLogger(EventDispatchRunner.class);

    private final EventBus bus;
    private final List<SagaOrchestrator> sagas;
    private final List<ProcessManagerOrchestrator> processManagers;
    private final DispatchConfig config;
    private final ExecutorService workerExecutor;
    private final Map<String, Boolean> recentlySeen;
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private volatile Subscription subscription;

    public EventDispatchRunner(
        EventBus bus,
        List<SagaOrchestrator> sagas,
        List<ProcessManagerOrchestrator> processManagers,
        DispatchConfig config
    ) {
        this(bus, sagas, processManagers, config, Executors.newFixedThreadPool(config.concurrency()));
    }

    /**
     * 생성자 (worker pool 주입).
     *
     * @param bus 이벤트 버스
     * @param sagas saga 실행기 목록
     * @param processManagers process manager 실행기 목록
     * @param config 설정
     * @param workerExecutor worker pool
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventDispatchRunner(
        EventBus bus,
        List<SagaOrchestrator> sagas,
        List<ProcessManagerOrchestrator> processManagers,
        DispatchConfig config,
        ExecutorService workerExecutor
    ) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (sagas == null) {
            throw new IllegalArgumentException("sagas cannot be null");
        }
        if (processManagers == null) {
            throw new IllegalArgumentException("processManagers cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (workerExecutor == null) {
            throw new IllegalArgumentException("workerExecutor cannot be null");
        }
        this.bus = bus;
        this.sagas = List.copyOf(sagas);
        this.processManagers = List.copyOf(processManagers);
        this.config = config;
        this.workerExecutor = workerExecutor;
        int capacity = config.dedupCapacity();
        this.recentlySeen = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * 버스 구독 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (subscription != null) {
            throw new IllegalStateException("EventDispatchRunner already started");
        }
        subscription = bus.subscribe(this::onEvent);
        bus.startConsuming();
        log.info("EventDispatchRunner started: {} sagas, {} process managers",
            sagas.size(), processManagers.size());
    }

    /**
     * 수신한 event book 처리.
     *
     * @param book commit된 event book
     */
    void onEvent(EventBook book) {
        if (book.isEmpty()) {
            return;
        }
        if (!markSeen(dedupKey(book))) {
            duplicates.incrementAndGet();
            log.debug("Skipping duplicate delivery of {}", book.cover().cacheKey());
            return;
        }
        dispatched.incrementAndGet();
        for (SagaOrchestrator saga : sagas) {
            submit(saga.router().name(), book, () -> saga.handle(book));
        }
        for (ProcessManagerOrchestrator processManager : processManagers) {
            submit(processManager.router().name(), book, () -> processManager.handle(book));
        }
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>구독을 닫고 ExecutorService를 graceful shutdown하여 진행 중인 작업이 완료되도록 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        Subscription current = subscription;
        if (current != null) {
            current.close();
        }
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    public long dispatchedCount() {
        return dispatched.get();
    }

    public long duplicateCount() {
        return duplicates.get();
    }

    private void submit(String component, EventBook book, Runnable task) {
        try {
            workerExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Component {} failed handling {}", component, book.cover().cacheKey(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected {} for {}: runner is shutting down", component, book.cover().cacheKey());
        }
    }

    private boolean markSeen(String key) {
        synchronized (recentlySeen) {
            return recentlySeen.put(key, Boolean.TRUE) == null;
        }
    }

    private static String dedupKey(EventBook book) {
        long first = book.pages().get(0).sequence();
        long last = book.pages().get(book.pages().size() - 1).sequence();
        return book.cover().cacheKey() + "@" + first + "-" + last;
    }
}
