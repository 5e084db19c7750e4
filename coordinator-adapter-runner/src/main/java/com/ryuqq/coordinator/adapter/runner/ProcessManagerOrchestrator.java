package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.coordinator.CommandExecutor;
import com.ryuqq.coordinator.application.coordinator.DestinationFetcher;
import com.ryuqq.coordinator.application.repository.EventBookRepository;
import com.ryuqq.coordinator.application.retry.BackoffCalculator;
import com.ryuqq.coordinator.application.retry.Sleeper;
import com.ryuqq.coordinator.application.router.ProcessManagerRouter;
import com.ryuqq.coordinator.core.dlq.DeadLetter;
import com.ryuqq.coordinator.core.error.ErrorKind;
import com.ryuqq.coordinator.core.error.SequenceConflictException;
import com.ryuqq.coordinator.core.error.TransientInfraException;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.ProcessManagerResponse;
import com.ryuqq.coordinator.core.outcome.CommandOutcome;
import com.ryuqq.coordinator.core.outcome.Rejected;
import com.ryuqq.coordinator.core.outcome.Retryable;
import com.ryuqq.coordinator.core.spi.DeadLetterSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Process manager 실행기.
 *
 * <p>Process manager 인스턴스는 trigger의 correlation id로 식별되며, 자신의 state를
 * {@code processDomain} 아래 event로 저장합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * handle(trigger)
 *   1. correlation id 없음 → 건너뜀
 *   2. attempt 1..maxAttempts:
 *        processState = repository.load(processCover)
 *        router.prepare → 대상 이력 병렬 조회 → router.dispatch
 *        process event가 있으면 compare-and-append
 *        충돌 → backoff 후 최신 state로 다시 실행
 *   3. command별 execute (Retryable은 backoff 후 재시도, Rejected는 보상 후 실패 시 DLQ)
 * </pre>
 *
 * <p>조회/저장 단계의 일시 장애는 maxAttempts까지 backoff 재시도하고, 소진되면 trigger를 DLQ로 보냅니다.</p>
 *
 * <p>Process event를 먼저 저장한 뒤 command를 실행하므로, 같은 trigger가 다시 전달되어도
 * router는 갱신된 state를 보고 중복 command를 만들지 않을 수 있습니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class ProcessManagerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProcessManagerOrchestrator.class);

    private final ProcessManagerRouter<?> router;
    private final EventBookRepository repository;
    private final ParallelDestinationLoader loader;
    private final CommandExecutor executor;
    private final DeadLetterSink deadLetterSink;
    private final SagaConfig config;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;
    private final TransientRetrier retrier;
    private final CommandCompensator compensator;

    public ProcessManagerOrchestrator(
        ProcessManagerRouter<?> router,
        EventBookRepository repository,
        DestinationFetcher fetcher,
        CommandExecutor executor,
        DeadLetterSink deadLetterSink,
        SagaConfig config,
        ExecutorService fetchExecutor
    ) {
        this(router, repository, fetcher, executor, deadLetterSink, config, fetchExecutor, Sleeper.THREAD);
    }

    /**
     * 생성자.
     *
     * @param router process manager router
     * @param repository process manager 이력 저장소
     * @param fetcher 대상 이력 조회기
     * @param executor command 실행기
     * @param deadLetterSink DLQ
     * @param config 설정
     * @param fetchExecutor 대상 이력 병렬 조회용 스레드 풀
     * @param sleeper 재시도 대기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ProcessManagerOrchestrator(
        ProcessManagerRouter<?> router,
        EventBookRepository repository,
        DestinationFetcher fetcher,
        CommandExecutor executor,
        DeadLetterSink deadLetterSink,
        SagaConfig config,
        ExecutorService fetchExecutor,
        Sleeper sleeper
    ) {
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (deadLetterSink == null) {
            throw new IllegalArgumentException("deadLetterSink cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.router = router;
        this.repository = repository;
        this.loader = new ParallelDestinationLoader(fetcher, fetchExecutor, config.fetchTimeoutMs());
        this.executor = executor;
        this.deadLetterSink = deadLetterSink;
        this.config = config;
        this.backoff = new BackoffCalculator(config.baseDelayMs(), config.maxDelayMs(), 0.5);
        this.sleeper = sleeper;
        this.retrier = new TransientRetrier(config.retryConfig(), sleeper);
        this.compensator = new CommandCompensator(executor);
    }

    /**
     * 구독 도메인의 event book 처리.
     *
     * @param trigger commit된 event book
     * @return command별 최종 결과
     */
    public List<CommandOutcome> handle(EventBook trigger) {
        Cover triggerCover = trigger.cover();
        if (!router.subscribesTo(triggerCover.domain()) || trigger.isEmpty()) {
            return List.of();
        }
        if (!triggerCover.hasCorrelationId()) {
            log.debug("Process manager {} skipping {}: no correlation id", router.name(), triggerCover.cacheKey());
            return List.of();
        }

        ProcessManagerResponse response = advance(trigger, router.processCover(triggerCover.correlationId()));
        if (response == null) {
            return List.of();
        }
        List<CommandOutcome> outcomes = new ArrayList<>();
        for (CommandBook command : response.commands()) {
            outcomes.add(execute(command));
        }
        return outcomes;
    }

    public ProcessManagerRouter<?> router() {
        return router;
    }

    private ProcessManagerResponse advance(EventBook trigger, Cover processCover) {
        try {
            return recordState(trigger, processCover);
        } catch (TransientInfraException e) {
            log.error("Process manager {} could not advance {} after {} attempts: {}",
                router.name(), processCover.cacheKey(), retrier.maxAttempts(), e.getMessage());
            deadLetterSink.publish(DeadLetter.fromEventProcessingFailure(
                trigger, DeadLetter.describe(e), retrier.maxAttempts(), true,
                router.name(), ComponentKind.PROCESS_MANAGER));
            return null;
        } catch (RuntimeException e) {
            log.error("Process manager {} failed advancing {}: {}", router.name(), processCover.cacheKey(), e.getMessage());
            deadLetterSink.publish(DeadLetter.fromEventProcessingFailure(
                trigger, DeadLetter.describe(e), 0, false, router.name(), ComponentKind.PROCESS_MANAGER));
            return null;
        }
    }

    private ProcessManagerResponse recordState(EventBook trigger, Cover processCover) {
        String operation = "Process manager " + router.name() + " advancing " + processCover.cacheKey();
        for (int attempt = 1; ; attempt++) {
            ProcessManagerResponse response = retrier.call(operation, () -> {
                EventBook processState = repository.load(processCover);
                List<EventBook> destinations = loader.load(router.prepare(trigger, processState));
                return router.dispatch(trigger, processState, destinations);
            });
            if (!response.hasProcessEvents()) {
                return response;
            }
            try {
                retrier.run(operation, () -> repository.append(processCover, response.processEvents().pages()));
                return response;
            } catch (SequenceConflictException e) {
                if (attempt >= config.maxAttempts()) {
                    log.error("Process manager {} could not record state for {} after {} attempts",
                        router.name(), processCover.cacheKey(), attempt);
                    deadLetterSink.publish(DeadLetter.fromEventProcessingFailure(
                        trigger, e.getMessage(), attempt, true, router.name(), ComponentKind.PROCESS_MANAGER));
                    return null;
                }
                log.debug("Process manager {} state conflict on {} (attempt {}), retrying",
                    router.name(), processCover.cacheKey(), attempt);
                pause(attempt);
            }
        }
    }

    private CommandOutcome execute(CommandBook command) {
        for (int attempt = 1; ; attempt++) {
            CommandOutcome outcome = executor.execute(command);
            if (outcome instanceof Rejected rejected) {
                log.warn("Process manager {} command to {} rejected: {}",
                    router.name(), command.cover().cacheKey(), rejected.reason());
                Optional<String> compensationFailure = compensator.compensate(command, rejected.reason());
                if (compensationFailure.isPresent()) {
                    DeadLetter deadLetter = rejected.kind() == ErrorKind.VALIDATION_REJECTED
                        ? DeadLetter.fromValidationFailure(command, rejected.reason(), router.name(), ComponentKind.PROCESS_MANAGER)
                        : DeadLetter.fromProcessingFailure(command, rejected.reason(), 0, false, router.name(), ComponentKind.PROCESS_MANAGER);
                    deadLetterSink.publish(deadLetter.withMetadata(
                        SagaOrchestrator.COMPENSATION_METADATA_KEY, compensationFailure.get()));
                }
                return outcome;
            }
            if (!(outcome instanceof Retryable retryable)) {
                return outcome;
            }
            if (attempt >= config.maxAttempts()) {
                deadLetterSink.publish(DeadLetter.fromProcessingFailure(
                    command, retryable.reason(), attempt, true, router.name(), ComponentKind.PROCESS_MANAGER));
                return outcome;
            }
            pause(attempt);
        }
    }

    private void pause(int attempt) {
        try {
            sleeper.sleep(backoff.calculate(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfraException("Process manager " + router.name() + " interrupted while retrying", e);
        }
    }
}
