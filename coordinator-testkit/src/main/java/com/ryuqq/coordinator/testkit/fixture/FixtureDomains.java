package com.ryuqq.coordinator.testkit.fixture;

import com.ryuqq.coordinator.application.router.CommandRouter;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.codec.TypeRegistry;

import java.util.List;

/**
 * Fixture 도메인 전체를 위한 type registry, codec, router 묶음.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * PayloadCodec codec = FixtureDomains.codec();
 * List<CommandRouter<?>> routers = FixtureDomains.commandRouters(codec);
 * }</pre>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class FixtureDomains {

    private FixtureDomains() {
    }

    public static TypeRegistry registry() {
        TypeRegistry.Builder builder = TypeRegistry.builder();
        CustomerDomain.register(builder);
        InventoryDomain.register(builder);
        OrderDomain.register(builder);
        FulfillmentProcess.register(builder);
        CustomerActivityProjector.register(builder);
        return builder.build();
    }

    public static PayloadCodec codec() {
        return new PayloadCodec(registry());
    }

    public static List<CommandRouter<?>> commandRouters(PayloadCodec codec) {
        return List.of(
            CustomerDomain.router(codec),
            InventoryDomain.router(codec),
            OrderDomain.router(codec)
        );
    }
}
