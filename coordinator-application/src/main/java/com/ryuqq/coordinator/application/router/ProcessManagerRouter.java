package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.error.DecodeFailureException;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandOrigin;
import com.ryuqq.coordinator.core.model.ComponentDescriptor;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.DomainTypes;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.ProcessManagerResponse;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.state.HandlerTable;
import com.ryuqq.coordinator.core.state.StateReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process manager event router.
 *
 * <p>EventRouter와 같은 prepare → dispatch 구조이지만, 자신의 도메인에 저장된 이력으로
 * 재구성한 state를 두 단계 모두에 전달합니다. Process manager의 root는 correlation id에서
 * 결정되므로, 같은 correlation id를 가진 모든 event가 하나의 process 인스턴스로 모입니다.</p>
 *
 * <p><strong>Dispatch 결과:</strong></p>
 * <ul>
 *   <li>commands: 다른 도메인으로 발행할 command (process manager 출처 기록)</li>
 *   <li>processEvents: 자신의 도메인에 저장할 event, process state의 nextSequence부터 번호 지정</li>
 * </ul>
 *
 * <p>한 trigger book에 여러 event가 있으면 앞선 event가 만든 process event를 state에 반영한 뒤
 * 다음 handler를 호출합니다.</p>
 *
 * @param <S> process manager state 타입
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class ProcessManagerRouter<S> {

    private static final Logger log = LoggerFactory.getLogger(ProcessManagerRouter.class);

    private final String name;
    private final String processDomain;
    private final List<String> inputDomains;
    private final StateReconstructor<S> reconstructor;
    private final PayloadCodec codec;
    private final HandlerTable<Preparer<S, ?>> preparers;
    private final HandlerTable<Reaction<S, ?>> reactions;

    private ProcessManagerRouter(Builder<S> builder) {
        this.name = builder.name;
        this.processDomain = builder.processDomain;
        this.inputDomains = List.copyOf(builder.inputDomains);
        this.reconstructor = builder.reconstructor;
        this.codec = builder.codec;
        this.preparers = builder.preparers;
        this.reactions = builder.reactions;
    }

    public static <S> Builder<S> builder(
        String name,
        String processDomain,
        StateReconstructor<S> reconstructor,
        PayloadCodec codec
    ) {
        return new Builder<>(name, processDomain, reconstructor, codec);
    }

    /**
     * Correlation id에 해당하는 process 인스턴스 cover.
     *
     * @param correlationId correlation id (비어 있으면 안 됨)
     * @return process manager cover
     */
    public Cover processCover(String correlationId) {
        return Cover.of(processDomain, RootId.fromName(correlationId), correlationId);
    }

    /**
     * 이 process manager가 구독하는 도메인인지 확인.
     *
     * @param domain 도메인
     * @return 구독 여부
     */
    public boolean subscribesTo(String domain) {
        return inputDomains.contains(domain);
    }

    /**
     * Prepare 단계.
     *
     * @param trigger trigger event book
     * @param processState process manager 자신의 이력
     * @return 조회할 대상 cover 목록
     */
    public List<Cover> prepare(EventBook trigger, EventBook processState) {
        S state = reconstructor.rebuild(processState);
        Map<String, Cover> covers = new LinkedHashMap<>();
        for (EventPage page : trigger.pages()) {
            Optional<HandlerTable.Entry<Preparer<S, ?>>> entry = preparers.find(page.event().getTypeUrl());
            if (entry.isEmpty()) {
                continue;
            }
            try {
                for (Cover cover : entry.get().handler().invoke(page, state, trigger, codec)) {
                    covers.putIfAbsent(cover.cacheKey(), cover);
                }
            } catch (DecodeFailureException e) {
                log.warn("Process manager {} skipping undecodable event {} at sequence {}",
                    name, page.event().getTypeUrl(), page.sequence());
            }
        }
        return List.copyOf(covers.values());
    }

    /**
     * Dispatch 단계.
     *
     * @param trigger trigger event book
     * @param processState process manager 자신의 이력
     * @param destinations prepare 단계 대상 이력
     * @return command와 process event
     */
    public ProcessManagerResponse dispatch(EventBook trigger, EventBook processState, List<EventBook> destinations) {
        Destinations resolved = Destinations.of(destinations);
        S state = reconstructor.rebuild(processState);
        long nextSequence = processState.nextSequence();
        List<CommandBook> commands = new ArrayList<>();
        List<EventPage> processPages = new ArrayList<>();

        for (EventPage page : trigger.pages()) {
            Optional<HandlerTable.Entry<Reaction<S, ?>>> entry = reactions.find(page.event().getTypeUrl());
            if (entry.isEmpty()) {
                log.debug("Process manager {} has no reaction for {}, skipping", name, page.event().getTypeUrl());
                continue;
            }
            ProcessReaction reaction;
            try {
                reaction = entry.get().handler().invoke(page, state, trigger, resolved, codec);
            } catch (DecodeFailureException e) {
                log.warn("Process manager {} skipping undecodable event {} at sequence {}",
                    name, page.event().getTypeUrl(), page.sequence());
                continue;
            }

            for (CommandBook command : reaction.commands()) {
                commands.add(stamp(command, trigger.cover(), page.sequence()));
            }
            List<EventPage> produced = new ArrayList<>(reaction.events().size());
            for (Object event : reaction.events()) {
                produced.add(EventPage.of(nextSequence++, codec.pack(event)));
            }
            state = reconstructor.apply(state, produced);
            processPages.addAll(produced);
        }

        EventBook processEvents = processPages.isEmpty()
            ? null
            : new EventBook(processState.cover(), null, processPages, nextSequence);
        return new ProcessManagerResponse(commands, processEvents);
    }

    public ComponentDescriptor descriptor() {
        List<DomainTypes> inputs = new ArrayList<>();
        for (String domain : inputDomains) {
            inputs.add(new DomainTypes(domain, reactions.suffixes()));
        }
        return new ComponentDescriptor(
            name,
            ComponentKind.PROCESS_MANAGER,
            inputs,
            List.of(new DomainTypes(processDomain, reconstructor.eventTypes()))
        );
    }

    public String name() {
        return name;
    }

    public String processDomain() {
        return processDomain;
    }

    public List<String> inputDomains() {
        return inputDomains;
    }

    public StateReconstructor<S> reconstructor() {
        return reconstructor;
    }

    private CommandBook stamp(CommandBook command, Cover trigger, long triggerSequence) {
        Cover cover = command.cover();
        if (!cover.hasCorrelationId() && trigger.hasCorrelationId()) {
            cover = cover.withCorrelationId(trigger.correlationId());
        }
        return new CommandBook(cover, command.pages(), new CommandOrigin(name, ComponentKind.PROCESS_MANAGER, trigger, triggerSequence));
    }

    private record Preparer<S, E>(Class<E> eventType, ProcessPrepareHandler<S, E> handler) {

        List<Cover> invoke(EventPage page, S state, EventBook trigger, PayloadCodec codec) {
            List<Cover> covers = handler.prepare(codec.unpack(page.event(), eventType), state, trigger);
            return covers == null ? List.of() : covers;
        }
    }

    private record Reaction<S, E>(Class<E> eventType, ProcessHandler<S, E> handler) {

        ProcessReaction invoke(EventPage page, S state, EventBook trigger, Destinations destinations, PayloadCodec codec) {
            ProcessReaction reaction = handler.handle(codec.unpack(page.event(), eventType), state, trigger, destinations);
            return reaction == null ? ProcessReaction.none() : reaction;
        }
    }

    /**
     * ProcessManagerRouter Builder.
     *
     * @param <S> process manager state 타입
     */
    public static final class Builder<S> {

        private final String name;
        private final String processDomain;
        private final List<String> inputDomains = new ArrayList<>();
        private final StateReconstructor<S> reconstructor;
        private final PayloadCodec codec;
        private final HandlerTable<Preparer<S, ?>> preparers;
        private final HandlerTable<Reaction<S, ?>> reactions;

        private Builder(String name, String processDomain, StateReconstructor<S> reconstructor, PayloadCodec codec) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (processDomain == null || processDomain.isBlank()) {
                throw new IllegalArgumentException("processDomain cannot be null or blank");
            }
            if (reconstructor == null) {
                throw new IllegalArgumentException("reconstructor cannot be null");
            }
            if (codec == null) {
                throw new IllegalArgumentException("codec cannot be null");
            }
            this.name = name;
            this.processDomain = processDomain;
            this.reconstructor = reconstructor;
            this.codec = codec;
            this.preparers = new HandlerTable<>("process manager " + name + " prepare");
            this.reactions = new HandlerTable<>("process manager " + name);
        }

        /**
         * 구독할 입력 도메인 추가.
         *
         * @param domain 도메인
         * @return this
         */
        public Builder<S> subscribe(String domain) {
            if (domain == null || domain.isBlank()) {
                throw new IllegalArgumentException("domain cannot be null or blank");
            }
            if (!inputDomains.contains(domain)) {
                inputDomains.add(domain);
            }
            return this;
        }

        public <E> Builder<S> prepare(String suffix, Class<E> eventType, ProcessPrepareHandler<S, E> handler) {
            if (eventType == null) {
                throw new IllegalArgumentException("eventType cannot be null");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null");
            }
            preparers.register(suffix, new Preparer<S, E>(eventType, handler));
            return this;
        }

        public <E> Builder<S> on(String suffix, Class<E> eventType, ProcessHandler<S, E> handler) {
            if (eventType == null) {
                throw new IllegalArgumentException("eventType cannot be null");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null");
            }
            reactions.register(suffix, new Reaction<S, E>(eventType, handler));
            return this;
        }

        public ProcessManagerRouter<S> build() {
            if (inputDomains.isEmpty()) {
                throw new IllegalStateException("Process manager " + name + " subscribes to no domain");
            }
            return new ProcessManagerRouter<>(this);
        }
    }
}
