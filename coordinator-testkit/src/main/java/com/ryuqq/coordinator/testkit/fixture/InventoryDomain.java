package com.ryuqq.coordinator.testkit.fixture;

import com.ryuqq.coordinator.application.router.CommandRouter;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.codec.TypeRegistry;
import com.ryuqq.coordinator.core.error.ValidationRejectedException;
import com.ryuqq.coordinator.core.state.StateReconstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 재고 fixture 도메인.
 *
 * <p>예약 후 가용 재고가 임계값 아래로 내려가면 StockReserved 다음에 LowStockAlert를
 * 함께 발행합니다 (한 command가 여러 event를 만드는 경우).</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class InventoryDomain {

    public static final String DOMAIN = "inventory";

    private InventoryDomain() {
    }

    public record InitializeStock(int onHand, int lowStockThreshold) {
    }

    public record ReserveStock(int quantity, String orderId) {
    }

    public record ReleaseReservation(String orderId) {
    }

    public record StockInitialized(int onHand, int lowStockThreshold) {
    }

    public record StockReserved(int quantity, String orderId, int newAvailable) {
    }

    public record LowStockAlert(int available, int threshold) {
    }

    public record ReservationReleased(String orderId, int quantity) {
    }

    public record InventoryState(
        boolean initialized,
        int onHand,
        int reserved,
        int lowStockThreshold,
        Map<String, Integer> reservations
    ) {

        public InventoryState {
            reservations = reservations == null ? Map.of() : Map.copyOf(reservations);
        }

        public static InventoryState initial() {
            return new InventoryState(false, 0, 0, 0, Map.of());
        }

        public int available() {
            return onHand - reserved;
        }
    }

    static void register(TypeRegistry.Builder builder) {
        builder.register("fixture.inventory.InitializeStock", InitializeStock.class)
            .register("fixture.inventory.ReserveStock", ReserveStock.class)
            .register("fixture.inventory.ReleaseReservation", ReleaseReservation.class)
            .register("fixture.inventory.StockInitialized", StockInitialized.class)
            .register("fixture.inventory.StockReserved", StockReserved.class)
            .register("fixture.inventory.LowStockAlert", LowStockAlert.class)
            .register("fixture.inventory.ReservationReleased", ReservationReleased.class)
            .register("fixture.inventory.InventoryState", InventoryState.class);
    }

    public static StateReconstructor<InventoryState> reconstructor(PayloadCodec codec) {
        return StateReconstructor.builder(InventoryState.class, InventoryState::initial, codec)
            .on("StockInitialized", StockInitialized.class,
                (state, event) -> new InventoryState(true, event.onHand(), 0, event.lowStockThreshold(), Map.of()))
            .on("StockReserved", StockReserved.class, (state, event) -> {
                Map<String, Integer> reservations = new HashMap<>(state.reservations());
                reservations.merge(event.orderId(), event.quantity(), Integer::sum);
                return new InventoryState(state.initialized(), state.onHand(),
                    state.reserved() + event.quantity(), state.lowStockThreshold(), reservations);
            })
            .on("ReservationReleased", ReservationReleased.class, (state, event) -> {
                Map<String, Integer> reservations = new HashMap<>(state.reservations());
                reservations.remove(event.orderId());
                return new InventoryState(state.initialized(), state.onHand(),
                    state.reserved() - event.quantity(), state.lowStockThreshold(), reservations);
            })
            .build();
    }

    public static CommandRouter<InventoryState> router(PayloadCodec codec) {
        return CommandRouter.builder(DOMAIN, reconstructor(codec), codec)
            .on("InitializeStock", InitializeStock.class, (page, command, state, next) -> {
                if (state.initialized()) {
                    throw ValidationRejectedException.failedPrecondition("Stock already initialized");
                }
                if (command.onHand() < 0) {
                    throw ValidationRejectedException.invalidArgument(
                        "onHand must be non-negative (current: " + command.onHand() + ")");
                }
                return List.of(new StockInitialized(command.onHand(), command.lowStockThreshold()));
            })
            .on("ReserveStock", ReserveStock.class, (page, command, state, next) -> {
                if (!state.initialized()) {
                    throw ValidationRejectedException.failedPrecondition("Stock not initialized");
                }
                if (command.quantity() <= 0) {
                    throw ValidationRejectedException.invalidArgument(
                        "quantity must be positive (current: " + command.quantity() + ")");
                }
                if (command.quantity() > state.available()) {
                    throw ValidationRejectedException.failedPrecondition("Insufficient available stock");
                }
                int newAvailable = state.available() - command.quantity();
                List<Object> events = new ArrayList<>();
                events.add(new StockReserved(command.quantity(), command.orderId(), newAvailable));
                if (state.lowStockThreshold() > 0 && newAvailable < state.lowStockThreshold()) {
                    events.add(new LowStockAlert(newAvailable, state.lowStockThreshold()));
                }
                return events;
            })
            .on("ReleaseReservation", ReleaseReservation.class, (page, command, state, next) -> {
                Integer quantity = state.reservations().get(command.orderId());
                if (quantity == null) {
                    throw ValidationRejectedException.failedPrecondition(
                        "No reservation for order " + command.orderId());
                }
                return List.of(new ReservationReleased(command.orderId(), quantity));
            })
            .build();
    }
}
