package com.ryuqq.coordinator.core.state;

import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.error.DecodeFailureException;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Snapshot과 event tail로 state를 재구성하는 컴포넌트.
 *
 * <p><strong>재구성 규칙:</strong></p>
 * <ol>
 *   <li>Snapshot이 있으면 snapshot state에서 시작하고, snapshot sequence 이후의 event만 적용</li>
 *   <li>Snapshot이 없으면 초기 state에서 시작하여 전체 이력을 적용</li>
 *   <li>각 event는 type 이름 suffix로 applier를 찾아 적용 (먼저 등록된 applier 우선)</li>
 * </ol>
 *
 * <p><strong>Forward Compatibility:</strong></p>
 * <ul>
 *   <li>등록되지 않은 event 타입은 건너뜀 (debug 로그)</li>
 *   <li>Decode 실패 event는 건너뜀 (warn 로그)</li>
 *   <li>Snapshot decode 실패는 {@link DecodeFailureException} (tail만으로는 재구성 불가)</li>
 * </ul>
 *
 * <p><strong>순수성:</strong> applier는 입력 state를 변경하지 않고 새 state를 반환해야 합니다.
 * 동일한 EventBook에 대해 rebuild는 항상 동일한 state를 만듭니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StateReconstructor&lt;CustomerState&gt; reconstructor = StateReconstructor
 *     .builder(CustomerState.class, CustomerState::empty, codec)
 *     .on("CustomerCreated", CustomerCreated.class, CustomerState::apply)
 *     .on("LoyaltyPointsAdded", LoyaltyPointsAdded.class, CustomerState::apply)
 *     .build();
 *
 * CustomerState state = reconstructor.rebuild(eventBook);
 * </pre>
 *
 * @param <S> state 타입
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class StateReconstructor<S> {

    private static final Logger log = LoggerFactory.getLogger(StateReconstructor.class);

    private final Class<S> stateType;
    private final Supplier<S> initialState;
    private final PayloadCodec codec;
    private final HandlerTable<Applier<S, ?>> appliers;

    private StateReconstructor(Builder<S> builder) {
        this.stateType = builder.stateType;
        this.initialState = builder.initialState;
        this.codec = builder.codec;
        this.appliers = builder.appliers;
    }

    /**
     * Builder 생성.
     *
     * @param stateType state 클래스 (snapshot decode에 사용)
     * @param initialState 빈 state 공급자
     * @param codec payload codec
     * @param <S> state 타입
     * @return Builder
     */
    public static <S> Builder<S> builder(Class<S> stateType, Supplier<S> initialState, PayloadCodec codec) {
        return new Builder<>(stateType, initialState, codec);
    }

    /**
     * EventBook으로부터 state 재구성.
     *
     * @param book event 이력 (snapshot 포함 가능)
     * @return 재구성된 state
     * @throws DecodeFailureException snapshot decode 실패 시
     */
    public S rebuild(EventBook book) {
        S state = initialState.get();
        long after = -1;
        Snapshot snapshot = book.snapshot();
        if (snapshot != null) {
            state = codec.unpack(snapshot.state(), stateType);
            after = snapshot.sequence();
        }
        for (EventPage page : book.pages()) {
            if (page.sequence() > after) {
                state = applyPage(state, page);
            }
        }
        return state;
    }

    /**
     * 주어진 state에 page들을 순서대로 적용.
     *
     * <p>병합 분석에서 아직 commit되지 않은 후보 event를 적용할 때 사용합니다.</p>
     *
     * @param state 시작 state
     * @param pages 적용할 page
     * @return 적용 후 state
     */
    public S apply(S state, List<EventPage> pages) {
        S current = state;
        for (EventPage page : pages) {
            current = applyPage(current, page);
        }
        return current;
    }

    /**
     * State를 snapshot으로 직렬화.
     *
     * @param state state
     * @param sequence 이 state에 반영된 마지막 event sequence
     * @return Snapshot
     */
    public Snapshot snapshotOf(S state, long sequence) {
        return new Snapshot(sequence, codec.pack(state));
    }

    public S initialState() {
        return initialState.get();
    }

    public Class<S> stateType() {
        return stateType;
    }

    /**
     * 등록된 event 타입 suffix 목록.
     *
     * @return suffix 목록 (등록 순서)
     */
    public List<String> eventTypes() {
        return appliers.suffixes();
    }

    private S applyPage(S state, EventPage page) {
        String typeUrl = page.event().getTypeUrl();
        Optional<HandlerTable.Entry<Applier<S, ?>>> entry = appliers.find(typeUrl);
        if (entry.isEmpty()) {
            log.debug("No applier for {} at sequence {}, skipping", typeUrl, page.sequence());
            return state;
        }
        try {
            return entry.get().handler().apply(state, page, codec);
        } catch (DecodeFailureException e) {
            log.warn("Skipping undecodable event {} at sequence {}: {}", typeUrl, page.sequence(), e.getMessage());
            return state;
        }
    }

    /**
     * 하나의 event 타입 applier.
     */
    private record Applier<S, E>(Class<E> eventType, BiFunction<S, E, S> function) {

        S apply(S state, EventPage page, PayloadCodec codec) {
            E event = codec.unpack(page.event(), eventType);
            return function.apply(state, event);
        }
    }

    /**
     * StateReconstructor Builder.
     *
     * @param <S> state 타입
     */
    public static final class Builder<S> {

        private final Class<S> stateType;
        private final Supplier<S> initialState;
        private final PayloadCodec codec;
        private final HandlerTable<Applier<S, ?>> appliers;

        private Builder(Class<S> stateType, Supplier<S> initialState, PayloadCodec codec) {
            if (stateType == null) {
                throw new IllegalArgumentException("stateType cannot be null");
            }
            if (initialState == null) {
                throw new IllegalArgumentException("initialState cannot be null");
            }
            if (codec == null) {
                throw new IllegalArgumentException("codec cannot be null");
            }
            this.stateType = stateType;
            this.initialState = initialState;
            this.codec = codec;
            this.appliers = new HandlerTable<>(stateType.getSimpleName() + " reconstructor");
        }

        /**
         * Event 타입별 applier 등록.
         *
         * @param suffix event 타입 이름 suffix
         * @param eventType event 클래스
         * @param applier (state, event) → 새 state
         * @param <E> event 타입
         * @return this
         */
        public <E> Builder<S> on(String suffix, Class<E> eventType, BiFunction<S, E, S> applier) {
            if (eventType == null) {
                throw new IllegalArgumentException("eventType cannot be null");
            }
            if (applier == null) {
                throw new IllegalArgumentException("applier cannot be null");
            }
            appliers.register(suffix, new Applier<S, E>(eventType, applier));
            return this;
        }

        public StateReconstructor<S> build() {
            return new StateReconstructor<>(this);
        }
    }
}
