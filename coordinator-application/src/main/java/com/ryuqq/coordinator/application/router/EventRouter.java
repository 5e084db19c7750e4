package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.error.DecodeFailureException;
import com.ryuqq.coordinator.core.error.ValidationRejectedException;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandOrigin;
import com.ryuqq.coordinator.core.model.ComponentDescriptor;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.DomainTypes;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.state.HandlerTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Saga event router.
 *
 * <p>한 입력 도메인의 event에 반응하여 한 출력 도메인으로 command를 발행합니다.
 * 처리는 두 단계로 나뉩니다:</p>
 * <ol>
 *   <li><strong>prepare:</strong> 반응에 필요한 대상 aggregate cover 선언</li>
 *   <li><strong>dispatch:</strong> host가 조회한 대상 이력과 함께 반응 handler 호출</li>
 * </ol>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>Handler가 없는 event 타입은 오류 없이 건너뜀 (새 event 타입에 대한 전방 호환)</li>
 *   <li>Decode 실패 event도 건너뜀 (warn 로그)</li>
 *   <li>출력 도메인 이외로 향하는 command는 실행 전에 거부</li>
 *   <li>발행된 command에는 saga 출처와 원본 correlation id가 기록됨</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EventRouter saga = EventRouter.builder("order-inventory", "order", "inventory", codec)
 *     .prepare("OrderCreated", OrderCreated.class, (event, source) -&gt; List.of(stockCover(event)))
 *     .on("OrderCreated", OrderCreated.class, OrderInventorySaga::reserve)
 *     .build();
 * </pre>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final String name;
    private final String inputDomain;
    private final String outputDomain;
    private final PayloadCodec codec;
    private final HandlerTable<Preparer<?>> preparers;
    private final HandlerTable<Reaction<?>> reactions;

    private EventRouter(Builder builder) {
        this.name = builder.name;
        this.inputDomain = builder.inputDomain;
        this.outputDomain = builder.outputDomain;
        this.codec = builder.codec;
        this.preparers = builder.preparers;
        this.reactions = builder.reactions;
    }

    public static Builder builder(String name, String inputDomain, String outputDomain, PayloadCodec codec) {
        return new Builder(name, inputDomain, outputDomain, codec);
    }

    /**
     * Prepare 단계: 필요한 대상 aggregate 선언.
     *
     * @param source 입력 event book
     * @return 조회할 대상 cover 목록 (중복 제거, 선언 순서 유지)
     */
    public List<Cover> prepare(EventBook source) {
        Map<String, Cover> covers = new LinkedHashMap<>();
        for (EventPage page : source.pages()) {
            Optional<HandlerTable.Entry<Preparer<?>>> entry = preparers.find(page.event().getTypeUrl());
            if (entry.isEmpty()) {
                continue;
            }
            try {
                for (Cover cover : entry.get().handler().invoke(page, source, codec)) {
                    covers.putIfAbsent(cover.cacheKey(), cover);
                }
            } catch (DecodeFailureException e) {
                log.warn("Saga {} skipping undecodable event {} at sequence {}",
                    name, page.event().getTypeUrl(), page.sequence());
            }
        }
        return List.copyOf(covers.values());
    }

    /**
     * Dispatch 단계: event별 반응 handler 호출.
     *
     * @param source 입력 event book
     * @param destinations prepare 단계 대상 이력
     * @return 발행할 command 목록
     * @throws ValidationRejectedException handler가 출력 도메인 밖으로 command를 만든 경우
     */
    public List<CommandBook> dispatch(EventBook source, List<EventBook> destinations) {
        Destinations resolved = Destinations.of(destinations);
        List<CommandBook> commands = new ArrayList<>();
        for (EventPage page : source.pages()) {
            Optional<HandlerTable.Entry<Reaction<?>>> entry = reactions.find(page.event().getTypeUrl());
            if (entry.isEmpty()) {
                log.debug("Saga {} has no reaction for {}, skipping", name, page.event().getTypeUrl());
                continue;
            }
            List<CommandBook> produced;
            try {
                produced = entry.get().handler().invoke(page, source, resolved, codec);
            } catch (DecodeFailureException e) {
                log.warn("Saga {} skipping undecodable event {} at sequence {}",
                    name, page.event().getTypeUrl(), page.sequence());
                continue;
            }
            for (CommandBook command : produced) {
                commands.add(stamp(validateOutput(command), source.cover(), page.sequence()));
            }
        }
        return commands;
    }

    /**
     * 이 saga를 설명하는 컴포넌트 정보.
     *
     * @return saga ComponentDescriptor
     */
    public ComponentDescriptor descriptor() {
        return new ComponentDescriptor(
            name,
            ComponentKind.SAGA,
            List.of(new DomainTypes(inputDomain, reactions.suffixes())),
            List.of(new DomainTypes(outputDomain, List.of()))
        );
    }

    public String name() {
        return name;
    }

    public String inputDomain() {
        return inputDomain;
    }

    public String outputDomain() {
        return outputDomain;
    }

    private CommandBook validateOutput(CommandBook command) {
        if (!outputDomain.equals(command.cover().domain())) {
            throw ValidationRejectedException.invalidArgument(
                "Saga " + name + " emitted command for domain " + command.cover().domain()
                    + " but declares output domain " + outputDomain);
        }
        return command;
    }

    private CommandBook stamp(CommandBook command, Cover trigger, long triggerSequence) {
        Cover cover = command.cover();
        if (!cover.hasCorrelationId() && trigger.hasCorrelationId()) {
            cover = cover.withCorrelationId(trigger.correlationId());
        }
        return new CommandBook(cover, command.pages(), new CommandOrigin(name, ComponentKind.SAGA, trigger, triggerSequence));
    }

    private record Preparer<E>(Class<E> eventType, SagaPrepareHandler<E> handler) {

        List<Cover> invoke(EventPage page, EventBook source, PayloadCodec codec) {
            List<Cover> covers = handler.prepare(codec.unpack(page.event(), eventType), source);
            return covers == null ? List.of() : covers;
        }
    }

    private record Reaction<E>(Class<E> eventType, SagaHandler<E> handler) {

        List<CommandBook> invoke(EventPage page, EventBook source, Destinations destinations, PayloadCodec codec) {
            List<CommandBook> commands = handler.react(codec.unpack(page.event(), eventType), source, destinations);
            return commands == null ? List.of() : commands;
        }
    }

    /**
     * EventRouter Builder.
     */
    public static final class Builder {

        private final String name;
        private final String inputDomain;
        private final String outputDomain;
        private final PayloadCodec codec;
        private final HandlerTable<Preparer<?>> preparers;
        private final HandlerTable<Reaction<?>> reactions;

        private Builder(String name, String inputDomain, String outputDomain, PayloadCodec codec) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (inputDomain == null || inputDomain.isBlank()) {
                throw new IllegalArgumentException("inputDomain cannot be null or blank");
            }
            if (outputDomain == null || outputDomain.isBlank()) {
                throw new IllegalArgumentException("outputDomain cannot be null or blank");
            }
            if (codec == null) {
                throw new IllegalArgumentException("codec cannot be null");
            }
            this.name = name;
            this.inputDomain = inputDomain;
            this.outputDomain = outputDomain;
            this.codec = codec;
            this.preparers = new HandlerTable<>("saga " + name + " prepare");
            this.reactions = new HandlerTable<>("saga " + name);
        }

        public <E> Builder prepare(String suffix, Class<E> eventType, SagaPrepareHandler<E> handler) {
            if (eventType == null) {
                throw new IllegalArgumentException("eventType cannot be null");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null");
            }
            preparers.register(suffix, new Preparer<E>(eventType, handler));
            return this;
        }

        public <E> Builder on(String suffix, Class<E> eventType, SagaHandler<E> handler) {
            if (eventType == null) {
                throw new IllegalArgumentException("eventType cannot be null");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null");
            }
            reactions.register(suffix, new Reaction<E>(eventType, handler));
            return this;
        }

        public EventRouter build() {
            return new EventRouter(this);
        }
    }
}
