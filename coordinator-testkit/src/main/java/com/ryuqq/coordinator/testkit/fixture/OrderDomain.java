package com.ryuqq.coordinator.testkit.fixture;

import com.ryuqq.coordinator.application.router.CommandRouter;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.codec.TypeRegistry;
import com.ryuqq.coordinator.core.error.ValidationRejectedException;
import com.ryuqq.coordinator.core.model.RevokeEventCommand;
import com.ryuqq.coordinator.core.state.StateReconstructor;

import java.util.List;

/**
 * 주문 fixture 도메인. OrderCreated는 order-inventory saga와 fulfillment process의 시작점입니다.
 *
 * <p>후속 command가 거부되어 RevokeEventCommand를 받으면 주문을 취소합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class OrderDomain {

    public static final String DOMAIN = "order";

    private OrderDomain() {
    }

    public record CreateOrder(String orderId, String customerId, String sku, int quantity) {
    }

    public record OrderCreated(String orderId, String customerId, String sku, int quantity) {
    }

    public record OrderCancelled(String reason, String rejectedBy) {
    }

    public record OrderState(boolean created, String customerId, String sku, int quantity, String cancellationReason) {

        public static OrderState initial() {
            return new OrderState(false, null, null, 0, null);
        }

        public boolean cancelled() {
            return cancellationReason != null;
        }
    }

    static void register(TypeRegistry.Builder builder) {
        builder.register("fixture.order.CreateOrder", CreateOrder.class)
            .register("fixture.order.OrderCreated", OrderCreated.class)
            .register("fixture.order.OrderCancelled", OrderCancelled.class)
            .register("fixture.order.OrderState", OrderState.class);
    }

    public static StateReconstructor<OrderState> reconstructor(PayloadCodec codec) {
        return StateReconstructor.builder(OrderState.class, OrderState::initial, codec)
            .on("OrderCreated", OrderCreated.class,
                (state, event) -> new OrderState(true, event.customerId(), event.sku(), event.quantity(), null))
            .on("OrderCancelled", OrderCancelled.class,
                (state, event) -> new OrderState(state.created(), state.customerId(), state.sku(), state.quantity(),
                    event.reason()))
            .build();
    }

    public static CommandRouter<OrderState> router(PayloadCodec codec) {
        return CommandRouter.builder(DOMAIN, reconstructor(codec), codec)
            .on("CreateOrder", CreateOrder.class, (page, command, state, next) -> {
                if (state.created()) {
                    throw ValidationRejectedException.failedPrecondition("Order already created");
                }
                if (command.quantity() <= 0) {
                    throw ValidationRejectedException.invalidArgument(
                        "quantity must be positive (current: " + command.quantity() + ")");
                }
                return List.of(new OrderCreated(command.orderId(), command.customerId(), command.sku(), command.quantity()));
            })
            .on("RevokeEventCommand", RevokeEventCommand.class, (page, command, state, next) -> {
                if (!state.created()) {
                    throw ValidationRejectedException.failedPrecondition("Order does not exist");
                }
                if (state.cancelled()) {
                    return List.of();
                }
                return List.of(new OrderCancelled(command.rejectionReason(), command.componentName()));
            })
            .build();
    }
}
