package com.ryuqq.coordinator.testkit.fixture;

import com.ryuqq.coordinator.application.router.ProcessManagerRouter;
import com.ryuqq.coordinator.application.router.ProcessReaction;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.codec.TypeRegistry;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.state.StateReconstructor;
import com.ryuqq.coordinator.testkit.fixture.CustomerDomain.AddLoyaltyPoints;
import com.ryuqq.coordinator.testkit.fixture.InventoryDomain.StockReserved;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain.OrderCreated;

import java.util.List;

/**
 * 주문과 재고 예약을 결합하는 fulfillment process manager.
 *
 * <p>OrderCreated와 StockReserved는 어느 쪽이 먼저 도착해도 됩니다. 둘 다 관찰되면
 * 고객에게 수량 × {@link #POINTS_PER_UNIT} 적립금을 지급하고 FulfillmentCompleted를 기록합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class FulfillmentProcess {

    public static final String NAME = "fulfillment";
    public static final String DOMAIN = "fulfillment";
    public static final int POINTS_PER_UNIT = 10;

    private FulfillmentProcess() {
    }

    public record FulfillmentStarted(String orderId, String customerId, int quantity) {
    }

    public record ReservationObserved(String orderId, int quantity) {
    }

    public record FulfillmentCompleted(String orderId, int pointsAwarded) {
    }

    public record FulfillmentState(String orderId, String customerId, int reservedQuantity, boolean completed) {

        public static FulfillmentState initial() {
            return new FulfillmentState(null, null, 0, false);
        }
    }

    static void register(TypeRegistry.Builder builder) {
        builder.register("fixture.fulfillment.FulfillmentStarted", FulfillmentStarted.class)
            .register("fixture.fulfillment.ReservationObserved", ReservationObserved.class)
            .register("fixture.fulfillment.FulfillmentCompleted", FulfillmentCompleted.class)
            .register("fixture.fulfillment.FulfillmentState", FulfillmentState.class);
    }

    public static Cover customerCover(String customerId) {
        return Cover.of(CustomerDomain.DOMAIN, RootId.fromName(customerId));
    }

    public static StateReconstructor<FulfillmentState> reconstructor(PayloadCodec codec) {
        return StateReconstructor.builder(FulfillmentState.class, FulfillmentState::initial, codec)
            .on("FulfillmentStarted", FulfillmentStarted.class, (state, event) ->
                new FulfillmentState(event.orderId(), event.customerId(), state.reservedQuantity(), state.completed()))
            .on("ReservationObserved", ReservationObserved.class, (state, event) ->
                new FulfillmentState(event.orderId(), state.customerId(), event.quantity(), state.completed()))
            .on("FulfillmentCompleted", FulfillmentCompleted.class, (state, event) ->
                new FulfillmentState(state.orderId(), state.customerId(), state.reservedQuantity(), true))
            .build();
    }

    public static ProcessManagerRouter<FulfillmentState> router(PayloadCodec codec) {
        return ProcessManagerRouter.builder(NAME, DOMAIN, reconstructor(codec), codec)
            .subscribe(OrderDomain.DOMAIN)
            .subscribe(InventoryDomain.DOMAIN)
            .on("OrderCreated", OrderCreated.class, (event, state, trigger, destinations) -> {
                if (state.completed()) {
                    return ProcessReaction.none();
                }
                FulfillmentStarted started = new FulfillmentStarted(event.orderId(), event.customerId(), event.quantity());
                if (state.reservedQuantity() > 0) {
                    int points = state.reservedQuantity() * POINTS_PER_UNIT;
                    return ProcessReaction.of(
                        List.of(awardPoints(codec, event.customerId(), points, event.orderId())),
                        List.of(started, new FulfillmentCompleted(event.orderId(), points)));
                }
                return ProcessReaction.of(List.of(), List.of(started));
            })
            .on("StockReserved", StockReserved.class, (event, state, trigger, destinations) -> {
                if (state.completed()) {
                    return ProcessReaction.none();
                }
                ReservationObserved observed = new ReservationObserved(event.orderId(), event.quantity());
                if (state.customerId() != null) {
                    int points = event.quantity() * POINTS_PER_UNIT;
                    return ProcessReaction.of(
                        List.of(awardPoints(codec, state.customerId(), points, event.orderId())),
                        List.of(observed, new FulfillmentCompleted(event.orderId(), points)));
                }
                return ProcessReaction.of(List.of(), List.of(observed));
            })
            .build();
    }

    private static CommandBook awardPoints(PayloadCodec codec, String customerId, int points, String orderId) {
        CommandPage page = CommandPage.autoResequence(
            codec.pack(new AddLoyaltyPoints(points, "order " + orderId)), null);
        return CommandBook.of(customerCover(customerId), page);
    }
}
