package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.coordinator.CommandCoordinator;
import com.ryuqq.coordinator.application.repository.EventBookRepository;
import com.ryuqq.coordinator.application.retry.Sleeper;
import com.ryuqq.coordinator.application.sequencing.CandidateProducer;
import com.ryuqq.coordinator.application.sequencing.SequencingConfig;
import com.ryuqq.coordinator.application.sequencing.SequencingEngine;
import com.ryuqq.coordinator.application.sequencing.SequencingResult;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.dlq.DeadLetter;
import com.ryuqq.coordinator.core.dlq.LoggingDeadLetterSink;
import com.ryuqq.coordinator.core.error.SequenceConflictException;
import com.ryuqq.coordinator.core.error.TransientInfraException;
import com.ryuqq.coordinator.core.error.UnknownHandlerException;
import com.ryuqq.coordinator.core.error.ValidationRejectedException;
import com.ryuqq.coordinator.core.merge.MergeAnalyzer;
import com.ryuqq.coordinator.core.model.BusinessResponse;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.ContextualCommand;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.MergeStrategy;
import com.ryuqq.coordinator.core.model.Projection;
import com.ryuqq.coordinator.core.model.Snapshot;
import com.ryuqq.coordinator.core.spi.BusinessLogicClient;
import com.ryuqq.coordinator.core.spi.DeadLetterSink;
import com.ryuqq.coordinator.core.spi.EventBus;
import com.ryuqq.coordinator.core.spi.SyncProjector;
import com.ryuqq.coordinator.core.state.StateReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 기본 CommandCoordinator 구현체.
 *
 * <p>요청마다 상태를 새로 만들며 aggregate state를 요청 사이에 캐시하지 않습니다. 같은 root에 대한
 * 동시 요청의 정확성은 저장소의 원자적 compare-and-append에만 의존합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * handle(priorEvents, command)
 *   1. cover/page 검증 (edition 지정 시 거부), correlation id 없으면 UUID 생성
 *   2. 이력 결정: priorEvents 또는 repository.load(cover)
 *   3. SequencingEngine.sequence(전략별):
 *        business logic(ContextualCommand) → 후보 event → 검증 → compare-and-append (TransientRetrier)
 *   4. publish (TransientRetrier) → 실패 시 PublishRecoverer로 인계, 호출자는 성공
 *   5. snapshot 저장 (설정 시, 실패해도 무시)
 *   6. 동기 projector 실행 (실패한 projector는 로그 후 제외)
 *   7. BusinessResponse(commit된 event, projections)
 * </pre>
 *
 * <p><strong>DLQ 정책:</strong></p>
 * <ul>
 *   <li>AutoResequence 재시도 소진 → SequenceMismatch dead letter + 예외</li>
 *   <li>저장소 일시 장애 재시도 소진 → ProcessingFailure(transient) dead letter + 예외</li>
 *   <li>Explicit 충돌, 비즈니스 거부 → 호출자에게만 전달</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class DefaultCommandCoordinator implements CommandCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DefaultCommandCoordinator.class);

    private final EventBookRepository repository;
    private final EventBus bus;
    private final BusinessLogicClient client;
    private final PayloadCodec codec;
    private final Map<String, StateReconstructor<?>> reconstructors;
    private final List<SyncProjector> projectors;
    private final DeadLetterSink deadLetterSink;
    private final PublishRecoverer publishRecoverer;
    private final CoordinatorConfig config;
    private final SequencingConfig sequencingConfig;
    private final TransientRetrier retrier;
    private final SequencingEngine engine;

    private DefaultCommandCoordinator(Builder builder) {
        this.repository = builder.repository;
        this.bus = builder.bus;
        this.client = builder.client;
        this.codec = builder.codec;
        this.reconstructors = Map.copyOf(builder.reconstructors);
        this.projectors = List.copyOf(builder.projectors);
        this.deadLetterSink = builder.deadLetterSink;
        this.publishRecoverer = builder.publishRecoverer;
        this.config = builder.config;
        this.sequencingConfig = builder.sequencingConfig;
        this.retrier = new TransientRetrier(builder.retryConfig, builder.sleeper);
        this.engine = new SequencingEngine(
            repository,
            (cover, pages) -> retrier.run("append " + cover.cacheKey(), () -> repository.append(cover, pages)),
            new MergeAnalyzer(codec),
            reconstructors,
            sequencingConfig,
            builder.sleeper
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public BusinessResponse handle(EventBook priorEvents, CommandBook command) {
        validate(command);
        CommandBook effective = withCorrelation(command);
        Cover cover = effective.cover();
        requireDomain(cover.domain());

        EventBook history = resolveHistory(priorEvents, cover);
        CandidateProducer producer = view -> produce(cover.domain(), view, effective);

        SequencingResult result = sequence(effective, history, producer);
        EventBook committed = result.committed();
        if (committed.isEmpty()) {
            log.debug("Command on {} produced no events", cover.cacheKey());
            return BusinessResponse.of(committed);
        }
        log.debug("Committed {} pages on {} ({}, {}, attempts={})", committed.pages().size(),
            cover.cacheKey(), result.strategy(), result.resolution(), result.attempts());

        publish(committed);
        writeSnapshot(cover, committed);
        return new BusinessResponse(committed, project(committed));
    }

    @Override
    public BusinessResponse dryRun(CommandBook command, long asOfSequence) {
        validate(command);
        Cover cover = command.cover();
        requireDomain(cover.domain());

        EventBook history = asOfSequence < 0
            ? repository.load(cover)
            : repository.loadAsOf(cover, asOfSequence);
        EventBook speculative = produce(cover.domain(), history, command);
        log.debug("Dry run on {} as of {} produced {} events",
            cover.cacheKey(), asOfSequence, speculative.pages().size());
        return BusinessResponse.of(speculative);
    }

    // ========================================
    // request preparation
    // ========================================

    private static void validate(CommandBook command) {
        if (command == null) {
            throw ValidationRejectedException.invalidArgument("command cannot be null");
        }
        Cover cover = command.cover();
        if (cover.domain() == null || cover.domain().isBlank()) {
            throw ValidationRejectedException.invalidArgument("cover domain cannot be null or blank");
        }
        if (cover.root() == null) {
            throw ValidationRejectedException.invalidArgument("cover root cannot be null");
        }
        if (cover.edition() != null) {
            throw ValidationRejectedException.invalidArgument(
                "Editions are not supported: " + cover.cacheKey() + " requested edition '" + cover.edition() + "'");
        }
        for (CommandPage page : command.pages()) {
            if (page.command() == null) {
                throw ValidationRejectedException.invalidArgument("command page payload cannot be null");
            }
        }
    }

    private static CommandBook withCorrelation(CommandBook command) {
        if (command.cover().hasCorrelationId()) {
            return command;
        }
        String correlationId = UUID.randomUUID().toString();
        return command.withCover(command.cover().withCorrelationId(correlationId));
    }

    private void requireDomain(String domain) {
        if (!client.domains().contains(domain)) {
            throw UnknownHandlerException.forDomain(domain);
        }
    }

    private EventBook resolveHistory(EventBook priorEvents, Cover cover) {
        if (priorEvents == null) {
            return retrier.call("load " + cover.cacheKey(), () -> repository.load(cover));
        }
        Cover prior = priorEvents.cover();
        if (!prior.domain().equals(cover.domain()) || !prior.root().equals(cover.root())) {
            throw ValidationRejectedException.invalidArgument(
                "priorEvents cover " + prior.cacheKey() + " does not match command cover " + cover.cacheKey());
        }
        return priorEvents.withCover(cover);
    }

    private EventBook produce(String domain, EventBook history, CommandBook command) {
        EventBook candidate = client.handle(domain, new ContextualCommand(history, command));
        for (EventPage page : candidate.pages()) {
            codec.validate(page.event());
        }
        return candidate;
    }

    // ========================================
    // sequencing + DLQ
    // ========================================

    private SequencingResult sequence(CommandBook command, EventBook history, CandidateProducer producer) {
        MergeStrategy strategy = command.primaryPage().mergeStrategy();
        try {
            return engine.sequence(command, history, producer);
        } catch (SequenceConflictException e) {
            if (strategy == MergeStrategy.AUTO_RESEQUENCE) {
                deadLetterSink.publish(DeadLetter.fromSequenceMismatch(
                    command, e.getExpected(), e.getActual(), strategy,
                    sequencingConfig.maxAttempts(), command.cover().domain(), ComponentKind.AGGREGATE));
            }
            throw e;
        } catch (TransientInfraException e) {
            deadLetterSink.publish(DeadLetter.fromProcessingFailure(
                command, e.getMessage(), retrier.maxAttempts(), true,
                command.cover().domain(), ComponentKind.AGGREGATE));
            throw e;
        }
    }

    // ========================================
    // post-commit
    // ========================================

    private void publish(EventBook committed) {
        try {
            retrier.run("publish " + committed.cover().cacheKey(), () -> bus.publish(committed));
        } catch (TransientInfraException e) {
            log.warn("Publish of committed events on {} failed, handing off to recovery: {}",
                committed.cover().cacheKey(), e.getMessage());
            publishRecoverer.enqueue(committed, e);
        }
    }

    private void writeSnapshot(Cover cover, EventBook committed) {
        if (!config.snapshotWriteEnabled()) {
            return;
        }
        StateReconstructor<?> reconstructor = reconstructors.get(cover.domain());
        if (reconstructor == null) {
            return;
        }
        long first = committed.pages().get(0).sequence();
        long next = committed.nextSequence();
        if (first / config.snapshotEvery() == next / config.snapshotEvery()) {
            return;
        }
        try {
            EventBook current = repository.load(cover);
            repository.saveSnapshot(cover, snapshotOf(reconstructor, current));
            log.debug("Snapshot written for {} at sequence {}", cover.cacheKey(), current.nextSequence() - 1);
        } catch (RuntimeException e) {
            log.warn("Snapshot write for {} failed, continuing without it: {}", cover.cacheKey(), e.getMessage());
        }
    }

    private static <S> Snapshot snapshotOf(StateReconstructor<S> reconstructor, EventBook book) {
        S state = reconstructor.rebuild(book);
        return reconstructor.snapshotOf(state, book.nextSequence() - 1);
    }

    private List<Projection> project(EventBook committed) {
        if (!config.syncProjectionEnabled() || projectors.isEmpty()) {
            return List.of();
        }
        List<Projection> projections = new ArrayList<>();
        for (SyncProjector projector : projectors) {
            if (!projector.accepts(committed.cover().domain())) {
                continue;
            }
            try {
                projections.add(projector.project(committed));
            } catch (RuntimeException e) {
                log.warn("Sync projector {} failed on {}, omitting its projection: {}",
                    projector.name(), committed.cover().cacheKey(), e.getMessage());
            }
        }
        return projections;
    }

    /**
     * DefaultCommandCoordinator Builder.
     *
     * <p>repository, bus, client, codec은 필수입니다. 나머지는 기본값을 사용합니다.</p>
     */
    public static final class Builder {

        private EventBookRepository repository;
        private EventBus bus;
        private BusinessLogicClient client;
        private PayloadCodec codec;
        private final Map<String, StateReconstructor<?>> reconstructors = new LinkedHashMap<>();
        private final List<SyncProjector> projectors = new ArrayList<>();
        private DeadLetterSink deadLetterSink;
        private PublishRecoverer publishRecoverer;
        private CoordinatorConfig config = new CoordinatorConfig();
        private SequencingConfig sequencingConfig = new SequencingConfig();
        private RetryConfig retryConfig = new RetryConfig();
        private Sleeper sleeper = Sleeper.THREAD;

        private Builder() {
        }

        public Builder repository(EventBookRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder bus(EventBus bus) {
            this.bus = bus;
            return this;
        }

        /**
         * Business logic 설정. {@link RouterBusinessLogicClient}면 그 reconstructor도 함께 등록합니다.
         *
         * @param client business logic client
         * @return this
         */
        public Builder client(BusinessLogicClient client) {
            this.client = client;
            if (client instanceof RouterBusinessLogicClient routerClient) {
                routerClient.reconstructors().forEach(reconstructors::putIfAbsent);
            }
            return this;
        }

        public Builder codec(PayloadCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder reconstructor(String domain, StateReconstructor<?> reconstructor) {
            this.reconstructors.put(domain, reconstructor);
            return this;
        }

        public Builder projector(SyncProjector projector) {
            this.projectors.add(projector);
            return this;
        }

        public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
            this.deadLetterSink = deadLetterSink;
            return this;
        }

        public Builder publishRecoverer(PublishRecoverer publishRecoverer) {
            this.publishRecoverer = publishRecoverer;
            return this;
        }

        public Builder config(CoordinatorConfig config) {
            this.config = config;
            return this;
        }

        public Builder sequencingConfig(SequencingConfig sequencingConfig) {
            this.sequencingConfig = sequencingConfig;
            return this;
        }

        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = retryConfig;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Coordinator 생성.
         *
         * <p>DLQ가 없으면 {@link LoggingDeadLetterSink},
         * PublishRecoverer가 없으면 기본 설정의 recoverer를 사용합니다.</p>
         *
         * @return DefaultCommandCoordinator
         * @throws IllegalArgumentException 필수 의존성이 없는 경우
         */
        public DefaultCommandCoordinator build() {
            if (repository == null) {
                throw new IllegalArgumentException("repository cannot be null");
            }
            if (bus == null) {
                throw new IllegalArgumentException("bus cannot be null");
            }
            if (client == null) {
                throw new IllegalArgumentException("client cannot be null");
            }
            if (codec == null) {
                throw new IllegalArgumentException("codec cannot be null");
            }
            if (config == null || sequencingConfig == null || retryConfig == null || sleeper == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            if (deadLetterSink == null) {
                deadLetterSink = new LoggingDeadLetterSink();
            }
            if (publishRecoverer == null) {
                publishRecoverer = new PublishRecoverer(bus, deadLetterSink, new PublishRecoveryConfig());
            }
            return new DefaultCommandCoordinator(this);
        }
    }
}
