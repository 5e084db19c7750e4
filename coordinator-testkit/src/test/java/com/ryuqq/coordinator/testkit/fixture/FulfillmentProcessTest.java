package com.ryuqq.coordinator.testkit.fixture;

import com.ryuqq.coordinator.application.router.ProcessManagerRouter;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.ProcessManagerResponse;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.testkit.fixture.CustomerDomain.AddLoyaltyPoints;
import com.ryuqq.coordinator.testkit.fixture.FulfillmentProcess.FulfillmentState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * FulfillmentProcess fixture 테스트.
 *
 * <p>주문 생성과 재고 예약 두 trigger가 어떤 순서로 도착해도 포인트를 한 번 지급하는지 검증합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
class FulfillmentProcessTest {

    private static final String CORRELATION = "corr-order-1";

    private final PayloadCodec codec = FixtureDomains.codec();
    private final ProcessManagerRouter<FulfillmentState> router = FulfillmentProcess.router(codec);

    private EventBook orderCreated() {
        Cover cover = Cover.of(OrderDomain.DOMAIN, RootId.fromName("order-1"), CORRELATION);
        return EventBook.of(cover, List.of(EventPage.of(0,
            codec.pack(new OrderDomain.OrderCreated("order-1", "cust-1", "SKU-1", 3)))));
    }

    private EventBook stockReserved() {
        Cover cover = OrderInventorySaga.stockCover("SKU-1").withCorrelationId(CORRELATION);
        return EventBook.of(cover, List.of(EventPage.of(1,
            codec.pack(new InventoryDomain.StockReserved(3, "order-1", 7)))));
    }

    private ProcessManagerResponse step(List<EventPage> processPages, EventBook trigger) {
        EventBook processState = EventBook.of(router.processCover(CORRELATION), processPages);
        ProcessManagerResponse response = router.dispatch(trigger, processState, List.of());
        if (response.hasProcessEvents()) {
            processPages.addAll(response.processEvents().pages());
        }
        return response;
    }

    @Test
    void 주문_후_예약_순서면_두번째_trigger에서_포인트_지급() {
        // given
        List<EventPage> processPages = new ArrayList<>();

        // when
        ProcessManagerResponse first = step(processPages, orderCreated());
        ProcessManagerResponse second = step(processPages, stockReserved());

        // then
        assertThat(first.commands()).isEmpty();
        assertThat(second.commands()).hasSize(1);
        CommandBook award = second.commands().get(0);
        assertThat(award.cover().domain()).isEqualTo(CustomerDomain.DOMAIN);
        assertThat(award.cover().correlationId()).isEqualTo(CORRELATION);
        assertThat(codec.unpack(award.primaryPage().command(), AddLoyaltyPoints.class).points()).isEqualTo(30);
        assertThat(processPages).extracting(EventPage::sequence).containsExactly(0L, 1L, 2L);
    }

    @Test
    void 예약_후_주문_순서여도_포인트_지급() {
        // given
        List<EventPage> processPages = new ArrayList<>();

        // when
        ProcessManagerResponse first = step(processPages, stockReserved());
        ProcessManagerResponse second = step(processPages, orderCreated());

        // then
        assertThat(first.commands()).isEmpty();
        assertThat(second.commands()).hasSize(1);
        assertThat(second.commands().get(0).cover()).isEqualTo(
            FulfillmentProcess.customerCover("cust-1").withCorrelationId(CORRELATION));
    }

    @Test
    void 완료된_process는_중복_trigger를_무시() {
        // given
        List<EventPage> processPages = new ArrayList<>();
        step(processPages, orderCreated());
        step(processPages, stockReserved());

        // when
        ProcessManagerResponse replay = step(processPages, stockReserved());

        // then
        assertThat(replay.commands()).isEmpty();
        assertThat(replay.hasProcessEvents()).isFalse();
    }
}
