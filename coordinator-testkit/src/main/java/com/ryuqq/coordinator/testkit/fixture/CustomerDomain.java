package com.ryuqq.coordinator.testkit.fixture;

import com.ryuqq.coordinator.application.router.CommandRouter;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.codec.TypeRegistry;
import com.ryuqq.coordinator.core.error.ValidationRejectedException;
import com.ryuqq.coordinator.core.state.StateReconstructor;

import java.util.List;

/**
 * 고객 fixture 도메인.
 *
 * <p>고객 생성, 이메일 변경, 적립금 적립/사용을 다룹니다. 이메일 필드와 적립금 필드는
 * 서로 겹치지 않으므로 Explicit merge 테스트의 교환 가능한 command 쌍으로 쓰입니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>CreateCustomer: 이미 존재하면 거부, 이름 필수</li>
 *   <li>AddLoyaltyPoints: 존재하는 고객만, points &gt; 0</li>
 *   <li>RedeemLoyaltyPoints: 잔액 부족 시 "Insufficient points"</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class CustomerDomain {

    public static final String DOMAIN = "customer";

    private CustomerDomain() {
    }

    public record CreateCustomer(String name, String email) {
    }

    public record UpdateEmail(String email) {
    }

    public record AddLoyaltyPoints(int points, String reason) {
    }

    public record RedeemLoyaltyPoints(int points) {
    }

    public record CustomerCreated(String name, String email) {
    }

    public record EmailUpdated(String email) {
    }

    public record LoyaltyPointsAdded(int points, int newBalance) {
    }

    public record LoyaltyPointsRedeemed(int points, int newBalance) {
    }

    public record CustomerState(boolean exists, String name, String email, int loyaltyPoints) {

        public static CustomerState initial() {
            return new CustomerState(false, null, null, 0);
        }
    }

    static void register(TypeRegistry.Builder builder) {
        builder.register("fixture.customer.CreateCustomer", CreateCustomer.class)
            .register("fixture.customer.UpdateEmail", UpdateEmail.class)
            .register("fixture.customer.AddLoyaltyPoints", AddLoyaltyPoints.class)
            .register("fixture.customer.RedeemLoyaltyPoints", RedeemLoyaltyPoints.class)
            .register("fixture.customer.CustomerCreated", CustomerCreated.class)
            .register("fixture.customer.EmailUpdated", EmailUpdated.class)
            .register("fixture.customer.LoyaltyPointsAdded", LoyaltyPointsAdded.class)
            .register("fixture.customer.LoyaltyPointsRedeemed", LoyaltyPointsRedeemed.class)
            .register("fixture.customer.CustomerState", CustomerState.class);
    }

    public static StateReconstructor<CustomerState> reconstructor(PayloadCodec codec) {
        return StateReconstructor.builder(CustomerState.class, CustomerState::initial, codec)
            .on("CustomerCreated", CustomerCreated.class,
                (state, event) -> new CustomerState(true, event.name(), event.email(), state.loyaltyPoints()))
            .on("EmailUpdated", EmailUpdated.class,
                (state, event) -> new CustomerState(state.exists(), state.name(), event.email(), state.loyaltyPoints()))
            .on("LoyaltyPointsAdded", LoyaltyPointsAdded.class,
                (state, event) -> new CustomerState(state.exists(), state.name(), state.email(), event.newBalance()))
            .on("LoyaltyPointsRedeemed", LoyaltyPointsRedeemed.class,
                (state, event) -> new CustomerState(state.exists(), state.name(), state.email(), event.newBalance()))
            .build();
    }

    public static CommandRouter<CustomerState> router(PayloadCodec codec) {
        return CommandRouter.builder(DOMAIN, reconstructor(codec), codec)
            .on("CreateCustomer", CreateCustomer.class, (page, command, state, next) -> {
                if (state.exists()) {
                    throw ValidationRejectedException.failedPrecondition("Customer already exists");
                }
                if (command.name() == null || command.name().isBlank()) {
                    throw ValidationRejectedException.invalidArgument("Customer name is required");
                }
                return List.of(new CustomerCreated(command.name(), command.email()));
            })
            .on("UpdateEmail", UpdateEmail.class, (page, command, state, next) -> {
                requireExists(state);
                return List.of(new EmailUpdated(command.email()));
            })
            .on("AddLoyaltyPoints", AddLoyaltyPoints.class, (page, command, state, next) -> {
                requireExists(state);
                if (command.points() <= 0) {
                    throw ValidationRejectedException.invalidArgument(
                        "points must be positive (current: " + command.points() + ")");
                }
                return List.of(new LoyaltyPointsAdded(command.points(), state.loyaltyPoints() + command.points()));
            })
            .on("RedeemLoyaltyPoints", RedeemLoyaltyPoints.class, (page, command, state, next) -> {
                requireExists(state);
                if (command.points() > state.loyaltyPoints()) {
                    throw ValidationRejectedException.failedPrecondition("Insufficient points");
                }
                return List.of(new LoyaltyPointsRedeemed(command.points(), state.loyaltyPoints() - command.points()));
            })
            .build();
    }

    private static void requireExists(CustomerState state) {
        if (!state.exists()) {
            throw ValidationRejectedException.failedPrecondition("Customer does not exist");
        }
    }
}
