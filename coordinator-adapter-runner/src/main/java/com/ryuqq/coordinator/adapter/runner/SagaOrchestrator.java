package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.coordinator.CommandExecutor;
import com.ryuqq.coordinator.application.coordinator.DestinationFetcher;
import com.ryuqq.coordinator.application.retry.BackoffCalculator;
import com.ryuqq.coordinator.application.retry.Sleeper;
import com.ryuqq.coordinator.application.router.EventRouter;
import com.ryuqq.coordinator.core.dlq.DeadLetter;
import com.ryuqq.coordinator.core.error.ErrorKind;
import com.ryuqq.coordinator.core.error.TransientInfraException;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.outcome.Accepted;
import com.ryuqq.coordinator.core.outcome.CommandOutcome;
import com.ryuqq.coordinator.core.outcome.Rejected;
import com.ryuqq.coordinator.core.outcome.Retryable;
import com.ryuqq.coordinator.core.spi.DeadLetterSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Saga 실행기.
 *
 * <p>EventRouter의 두 단계(prepare → dispatch)를 실행하고 생성된 command를 CommandExecutor로 보냅니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * handle(source)
 *   1. router.prepare(source) → 대상 cover
 *   2. 대상 이력 병렬 조회 (ExecutorService, fetchTimeoutMs)
 *   3. router.dispatch(source, destinations) → command 목록
 *   4. command별 execute:
 *      - Accepted → 완료
 *      - Rejected → 원인 aggregate에 RevokeEventCommand로 보상, 보상 실패 시 DLQ
 *      - Retryable → backoff 후 1~3단계를 다시 실행하여 같은 위치의 command 재시도
 *   5. maxAttempts 소진 → DLQ (ProcessingFailure, transient)
 * </pre>
 *
 * <p>1~3단계는 일시 장애(TransientInfra) 시 maxAttempts까지 backoff 재시도합니다.
 * 재시도를 소진하거나 출력 도메인 밖의 command를 만든 경우 source event book 자체를 DLQ로 보냅니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class SagaOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SagaOrchestrator.class);

    /** Metadata key holding why compensation of a rejected command failed. */
    public static final String COMPENSATION_METADATA_KEY = "compensationFailure";

    private final EventRouter router;
    private final ParallelDestinationLoader loader;
    private final CommandExecutor executor;
    private final DeadLetterSink deadLetterSink;
    private final SagaConfig config;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;
    private final TransientRetrier planRetrier;
    private final CommandCompensator compensator;

    public SagaOrchestrator(
        EventRouter router,
        DestinationFetcher fetcher,
        CommandExecutor executor,
        DeadLetterSink deadLetterSink,
        SagaConfig config,
        ExecutorService fetchExecutor
    ) {
        this(router, fetcher, executor, deadLetterSink, config, fetchExecutor, Sleeper.THREAD);
    }

    /**
     * 생성자.
     *
     * @param router saga router
     * @param fetcher 대상 이력 조회기
     * @param executor command 실행기
     * @param deadLetterSink DLQ
     * @param config 설정
     * @param fetchExecutor 대상 이력 병렬 조회용 스레드 풀
     * @param sleeper 재시도 대기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SagaOrchestrator(
        EventRouter router,
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
        this.loader = new ParallelDestinationLoader(fetcher, fetchExecutor, config.fetchTimeoutMs());
        this.executor = executor;
        this.deadLetterSink = deadLetterSink;
        this.config = config;
        this.backoff = new BackoffCalculator(config.baseDelayMs(), config.maxDelayMs(), 0.5);
        this.sleeper = sleeper;
        this.planRetrier = new TransientRetrier(config.retryConfig(), sleeper);
        this.compensator = new CommandCompensator(executor);
    }

    /**
     * 입력 도메인의 event book 처리.
     *
     * @param source commit된 event book
     * @return command별 최종 결과 (입력 도메인이 아니거나 반응이 없으면 빈 목록)
     */
    public List<CommandOutcome> handle(EventBook source) {
        if (!router.inputDomain().equals(source.cover().domain()) || source.isEmpty()) {
            return List.of();
        }

        List<CommandBook> commands = planOrDeadLetter(source);
        if (commands == null || commands.isEmpty()) {
            return List.of();
        }

        CommandOutcome[] outcomes = new CommandOutcome[commands.size()];
        for (int attempt = 1; ; attempt++) {
            boolean retry = false;
            for (int i = 0; i < commands.size(); i++) {
                if (outcomes[i] != null && !outcomes[i].isRetryable()) {
                    continue;
                }
                outcomes[i] = executor.execute(commands.get(i));
                if (outcomes[i] instanceof Rejected rejected) {
                    compensateOrDeadLetter(commands.get(i), rejected);
                } else if (outcomes[i].isRetryable()) {
                    retry = true;
                }
            }
            if (!retry) {
                break;
            }
            if (attempt >= config.maxAttempts()) {
                deadLetterExhausted(commands, outcomes, attempt);
                break;
            }
            pause(attempt);
            List<CommandBook> replanned = planOrDeadLetter(source);
            if (replanned == null) {
                break;
            }
            if (replanned.size() != commands.size()) {
                log.warn("Saga {} re-planned {} commands instead of {} for {}",
                    router.name(), replanned.size(), commands.size(), source.cover().cacheKey());
                deadLetterExhausted(commands, outcomes, attempt);
                break;
            }
            commands = replanned;
        }

        long accepted = Arrays.stream(outcomes).filter(outcome -> outcome instanceof Accepted).count();
        log.debug("Saga {} handled {}: {}/{} commands accepted",
            router.name(), source.cover().cacheKey(), accepted, outcomes.length);
        return List.of(outcomes);
    }

    public EventRouter router() {
        return router;
    }

    /**
     * prepare → 대상 이력 조회 → dispatch.
     *
     * @return command 목록, 실패해서 source를 DLQ로 보낸 경우 null
     */
    private List<CommandBook> planOrDeadLetter(EventBook source) {
        try {
            return planRetrier.call("Saga " + router.name() + " planning " + source.cover().cacheKey(),
                () -> plan(source));
        } catch (TransientInfraException e) {
            log.error("Saga {} could not plan {} after {} attempts: {}",
                router.name(), source.cover().cacheKey(), planRetrier.maxAttempts(), e.getMessage());
            deadLetterSink.publish(DeadLetter.fromEventProcessingFailure(
                source, DeadLetter.describe(e), planRetrier.maxAttempts(), true, router.name(), ComponentKind.SAGA));
            return null;
        } catch (RuntimeException e) {
            log.error("Saga {} failed planning {}: {}", router.name(), source.cover().cacheKey(), e.getMessage());
            deadLetterSink.publish(DeadLetter.fromEventProcessingFailure(
                source, DeadLetter.describe(e), 0, false, router.name(), ComponentKind.SAGA));
            return null;
        }
    }

    private List<CommandBook> plan(EventBook source) {
        List<Cover> covers = router.prepare(source);
        List<EventBook> destinations = loader.load(covers);
        return router.dispatch(source, destinations);
    }

    private void compensateOrDeadLetter(CommandBook command, Rejected rejected) {
        log.warn("Saga {} command to {} rejected: {}", router.name(), command.cover().cacheKey(), rejected.reason());
        Optional<String> compensationFailure = compensator.compensate(command, rejected.reason());
        if (compensationFailure.isEmpty()) {
            return;
        }
        DeadLetter deadLetter = rejected.kind() == ErrorKind.VALIDATION_REJECTED
            ? DeadLetter.fromValidationFailure(command, rejected.reason(), router.name(), ComponentKind.SAGA)
            : DeadLetter.fromProcessingFailure(command, rejected.reason(), 0, false, router.name(), ComponentKind.SAGA);
        deadLetterSink.publish(deadLetter.withMetadata(COMPENSATION_METADATA_KEY, compensationFailure.get()));
    }

    private void deadLetterExhausted(List<CommandBook> commands, CommandOutcome[] outcomes, int attempts) {
        List<CommandBook> exhausted = new ArrayList<>();
        for (int i = 0; i < outcomes.length; i++) {
            if (outcomes[i] instanceof Retryable retryable) {
                exhausted.add(commands.get(i));
                deadLetterSink.publish(DeadLetter.fromProcessingFailure(
                    commands.get(i), retryable.reason(), attempts, true, router.name(), ComponentKind.SAGA));
            }
        }
        log.error("Saga {} gave up on {} commands after {} attempts", router.name(), exhausted.size(), attempts);
    }

    private void pause(int attempt) {
        try {
            sleeper.sleep(backoff.calculate(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfraException("Saga " + router.name() + " interrupted while retrying", e);
        }
    }
}
