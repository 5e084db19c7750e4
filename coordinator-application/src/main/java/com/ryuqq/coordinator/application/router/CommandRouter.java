package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.error.UnknownHandlerException;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.ComponentDescriptor;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.DomainTypes;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.state.HandlerTable;
import com.ryuqq.coordinator.core.state.StateReconstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 도메인의 aggregate command router.
 *
 * <p>Command의 wire 타입 이름을 등록된 suffix와 순서대로 비교하여 첫 번째로 매칭되는
 * handler를 호출합니다. Handler 호출 전 StateReconstructor로 이전 이력에서 state를 재구성합니다.</p>
 *
 * <p><strong>Dispatch 흐름:</strong></p>
 * <pre>
 * 1. primary command page의 type URL로 handler 조회 (없으면 UnknownHandlerException)
 * 2. priorEvents → state 재구성
 * 3. command payload decode (실패 시 DecodeFailureException)
 * 4. handler(page, command, state, nextSequence) → event 객체 목록
 * 5. event를 pack하여 nextSequence부터 번호를 매긴 EventBook 반환
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CommandRouter&lt;CustomerState&gt; router = CommandRouter
 *     .builder("customer", reconstructor, codec)
 *     .on("CreateCustomer", CreateCustomer.class, CustomerHandlers::create)
 *     .on("AddLoyaltyPoints", AddLoyaltyPoints.class, CustomerHandlers::addPoints)
 *     .build();
 * </pre>
 *
 * @param <S> aggregate state 타입
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class CommandRouter<S> {

    private final String domain;
    private final StateReconstructor<S> reconstructor;
    private final PayloadCodec codec;
    private final HandlerTable<Route<S, ?>> routes;

    private CommandRouter(Builder<S> builder) {
        this.domain = builder.domain;
        this.reconstructor = builder.reconstructor;
        this.codec = builder.codec;
        this.routes = builder.routes;
    }

    /**
     * Builder 생성.
     *
     * @param domain 도메인 이름
     * @param reconstructor state 재구성기
     * @param codec payload codec
     * @param <S> state 타입
     * @return Builder
     */
    public static <S> Builder<S> builder(String domain, StateReconstructor<S> reconstructor, PayloadCodec codec) {
        return new Builder<>(domain, reconstructor, codec);
    }

    /**
     * Command dispatch.
     *
     * @param priorEvents aggregate의 이전 이력
     * @param commandBook 처리할 command book (primary page만 처리)
     * @return 후보 event book (sequence는 priorEvents.nextSequence()부터)
     * @throws UnknownHandlerException 매칭되는 handler가 없는 경우
     * @throws com.ryuqq.coordinator.core.error.DecodeFailureException command decode 실패 시
     * @throws com.ryuqq.coordinator.core.error.ValidationRejectedException handler가 거부한 경우
     */
    public EventBook dispatch(EventBook priorEvents, CommandBook commandBook) {
        CommandPage page = commandBook.primaryPage();
        String typeUrl = page.command().getTypeUrl();
        Route<S, ?> route = routes.find(typeUrl)
            .orElseThrow(() -> UnknownHandlerException.forCommand(domain, typeUrl))
            .handler();

        S state = reconstructor.rebuild(priorEvents);
        long nextSequence = priorEvents.nextSequence();
        List<?> events = route.invoke(page, state, nextSequence, codec);

        List<EventPage> pages = new ArrayList<>(events.size());
        long sequence = nextSequence;
        for (Object event : events) {
            pages.add(EventPage.of(sequence++, codec.pack(event)));
        }
        return new EventBook(commandBook.cover(), null, pages, sequence);
    }

    /**
     * 이 router를 설명하는 컴포넌트 정보.
     *
     * @return aggregate ComponentDescriptor
     */
    public ComponentDescriptor descriptor() {
        return new ComponentDescriptor(
            domain,
            ComponentKind.AGGREGATE,
            List.of(new DomainTypes(domain, routes.suffixes())),
            List.of(new DomainTypes(domain, reconstructor.eventTypes()))
        );
    }

    public String domain() {
        return domain;
    }

    public StateReconstructor<S> reconstructor() {
        return reconstructor;
    }

    /**
     * 등록된 command 타입 suffix 목록.
     *
     * @return suffix 목록 (등록 순서)
     */
    public List<String> commandTypes() {
        return routes.suffixes();
    }

    private record Route<S, C>(Class<C> commandType, CommandHandler<S, C> handler) {

        List<?> invoke(CommandPage page, S state, long nextSequence, PayloadCodec codec) {
            C command = codec.unpack(page.command(), commandType);
            List<?> events = handler.handle(page, command, state, nextSequence);
            return events == null ? List.of() : events;
        }
    }

    /**
     * CommandRouter Builder.
     *
     * @param <S> state 타입
     */
    public static final class Builder<S> {

        private final String domain;
        private final StateReconstructor<S> reconstructor;
        private final PayloadCodec codec;
        private final HandlerTable<Route<S, ?>> routes;

        private Builder(String domain, StateReconstructor<S> reconstructor, PayloadCodec codec) {
            if (domain == null || domain.isBlank()) {
                throw new IllegalArgumentException("domain cannot be null or blank");
            }
            if (reconstructor == null) {
                throw new IllegalArgumentException("reconstructor cannot be null");
            }
            if (codec == null) {
                throw new IllegalArgumentException("codec cannot be null");
            }
            this.domain = domain;
            this.reconstructor = reconstructor;
            this.codec = codec;
            this.routes = new HandlerTable<>(domain + " command router");
        }

        /**
         * Command handler 등록.
         *
         * @param suffix command 타입 이름 suffix
         * @param commandType command 클래스
         * @param handler handler
         * @param <C> command 타입
         * @return this
         */
        public <C> Builder<S> on(String suffix, Class<C> commandType, CommandHandler<S, C> handler) {
            if (commandType == null) {
                throw new IllegalArgumentException("commandType cannot be null");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null");
            }
            routes.register(suffix, new Route<S, C>(commandType, handler));
            return this;
        }

        public CommandRouter<S> build() {
            if (routes.isEmpty()) {
                throw new IllegalStateException("CommandRouter for " + domain + " has no handlers");
            }
            return new CommandRouter<>(this);
        }
    }
}
