package com.ryuqq.coordinator.testkit.fixture;

import com.ryuqq.coordinator.application.router.EventRouter;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.testkit.fixture.InventoryDomain.ReserveStock;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain.OrderCreated;

import java.util.List;

/**
 * OrderCreated → ReserveStock saga.
 *
 * <p>재고 aggregate의 현재 sequence를 prepare 단계에서 조회하고, 그 값을 Explicit
 * sequence로 사용합니다. 경쟁 commit이 발생하면 orchestrator가 다시 prepare합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class OrderInventorySaga {

    public static final String NAME = "order-inventory";

    private OrderInventorySaga() {
    }

    public static Cover stockCover(String sku) {
        return Cover.of(InventoryDomain.DOMAIN, RootId.fromName(sku));
    }

    public static EventRouter router(PayloadCodec codec) {
        return EventRouter.builder(NAME, OrderDomain.DOMAIN, InventoryDomain.DOMAIN, codec)
            .prepare("OrderCreated", OrderCreated.class, (event, source) -> List.of(stockCover(event.sku())))
            .on("OrderCreated", OrderCreated.class, (event, source, destinations) -> {
                Cover stock = stockCover(event.sku());
                CommandPage page = CommandPage.explicit(
                    codec.pack(new ReserveStock(event.quantity(), event.orderId())),
                    destinations.nextSequence(stock));
                return List.of(CommandBook.of(stock, page));
            })
            .build();
    }
}
