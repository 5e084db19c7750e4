package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.adapter.inmemory.store.InMemoryEventStore;
import com.ryuqq.coordinator.application.coordinator.CommandExecutor;
import com.ryuqq.coordinator.application.repository.EventBookRepository;
import com.ryuqq.coordinator.application.router.ProcessManagerRouter;
import com.ryuqq.coordinator.core.dlq.DeadLetter;
import com.ryuqq.coordinator.core.dlq.DeadLetterPayload;
import com.ryuqq.coordinator.core.dlq.RejectionDetails;
import com.ryuqq.coordinator.core.error.StorageException;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.outcome.Accepted;
import com.ryuqq.coordinator.core.outcome.CommandOutcome;
import com.ryuqq.coordinator.core.outcome.Rejected;
import com.ryuqq.coordinator.core.outcome.Retryable;
import com.ryuqq.coordinator.testkit.fixture.CustomerDomain;
import com.ryuqq.coordinator.testkit.fixture.CustomerDomain.CreateCustomer;
import com.ryuqq.coordinator.testkit.fixture.CustomerDomain.CustomerState;
import com.ryuqq.coordinator.testkit.fixture.FulfillmentProcess;
import com.ryuqq.coordinator.testkit.fixture.FulfillmentProcess.FulfillmentState;
import com.ryuqq.coordinator.testkit.fixture.InventoryDomain.InitializeStock;
import com.ryuqq.coordinator.testkit.fixture.InventoryDomain.ReserveStock;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain.CreateOrder;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain.OrderCreated;
import com.ryuqq.coordinator.testkit.fixture.OrderInventorySaga;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ProcessManagerOrchestrator 테스트.
 *
 * <p>fulfillment process manager를 in-memory 런타임 위에서 실행합니다.
 * 주문 생성과 재고 예약이 같은 correlation으로 모두 관측되면 고객에게 포인트를 적립합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
class ProcessManagerOrchestratorTest {

    private static final String CORRELATION = "corr-fulfillment-1";

    private InMemoryRuntime runtime;
    private DefaultCommandCoordinator coordinator;
    private ExecutorService fetchExecutor;
    private ProcessManagerRouter<FulfillmentState> router;

    @BeforeEach
    void setUp() {
        runtime = new InMemoryRuntime();
        coordinator = runtime.coordinator();
        fetchExecutor = Executors.newFixedThreadPool(2);
        router = FulfillmentProcess.router(runtime.codec);
    }

    @AfterEach
    void tearDown() {
        fetchExecutor.shutdownNow();
    }

    // ============================================================
    // 1. 정상 흐름
    // ============================================================

    @Test
    void handle_주문과_예약이_모두_관측되면_포인트를_적립하고_process_state를_기록함() {
        // given
        coordinator.handle(runtime.explicit(FulfillmentProcess.customerCover("cust-1"),
            new CreateCustomer("Dana", "dana@example.com"), 0));
        ProcessManagerOrchestrator processManager = processManager(new CoordinatorCommandExecutor(coordinator));
        EventBook orderCreated = createOrder("order-1", "cust-1", CORRELATION);
        EventBook stockReserved = reserveStock("SKU-1", 3, "order-1", CORRELATION);

        // when
        List<CommandOutcome> first = processManager.handle(orderCreated);
        List<CommandOutcome> second = processManager.handle(stockReserved);

        // then
        assertThat(first).isEmpty();
        assertThat(second).singleElement().isInstanceOf(Accepted.class);

        EventBook customer = runtime.repository.load(FulfillmentProcess.customerCover("cust-1"));
        CustomerState state = CustomerDomain.reconstructor(runtime.codec).rebuild(customer);
        assertThat(state.loyaltyPoints()).isEqualTo(3 * FulfillmentProcess.POINTS_PER_UNIT);

        EventBook process = runtime.repository.load(router.processCover(CORRELATION));
        assertThat(process.pages()).extracting(EventPage::sequence).containsExactly(0L, 1L, 2L);
        FulfillmentState processState = FulfillmentProcess.reconstructor(runtime.codec).rebuild(process);
        assertThat(processState.completed()).isTrue();
    }

    @Test
    void handle_correlation_id가_없으면_건너뜀() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        Cover uncorrelated = Cover.of(OrderDomain.DOMAIN, RootId.fromName("order-2"));
        EventBook trigger = EventBook.of(uncorrelated, List.of(
            EventPage.of(0, runtime.codec.pack(new OrderCreated("order-2", "cust-2", "SKU-2", 1)))));

        // when
        List<CommandOutcome> outcomes = processManager(executor).handle(trigger);

        // then
        assertThat(outcomes).isEmpty();
        assertThat(runtime.eventStore.listDomains()).doesNotContain(FulfillmentProcess.DOMAIN);
    }

    @Test
    void handle_구독하지_않은_도메인이면_건너뜀() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        EventBook customerEvents = coordinator.handle(runtime.explicit(
            Cover.of(CustomerDomain.DOMAIN, RootId.fromName("cust-3"), CORRELATION),
            new CreateCustomer("Eve", "eve@example.com"), 0)).events();

        // when
        List<CommandOutcome> outcomes = processManager(executor).handle(customerEvents);

        // then
        assertThat(outcomes).isEmpty();
    }

    // ============================================================
    // 2. 거부 / 재시도
    // ============================================================

    @Test
    void handle_적립_command가_거부되면_ValidationFailure로_DLQ에_기록함() {
        // given
        ProcessManagerOrchestrator processManager = processManager(new CoordinatorCommandExecutor(coordinator));
        processManager.handle(createOrder("order-4", "ghost", CORRELATION));

        // when
        List<CommandOutcome> outcomes = processManager.handle(reserveStock("SKU-4", 2, "order-4", CORRELATION));

        // then
        assertThat(outcomes).singleElement().isInstanceOf(Rejected.class);
        DeadLetter deadLetter = runtime.deadLetters.getDeadLetters().get(0);
        assertThat(deadLetter.sourceComponent()).isEqualTo(FulfillmentProcess.NAME);
        assertThat(deadLetter.sourceKind()).isEqualTo(ComponentKind.PROCESS_MANAGER);
        assertThat(deadLetter.details()).isInstanceOf(RejectionDetails.ValidationFailure.class);
        assertThat(deadLetter.reason()).contains("Customer does not exist");
        assertThat(deadLetter.metadata()).containsKey(SagaOrchestrator.COMPENSATION_METADATA_KEY);
    }

    @Test
    void handle_적립_command가_계속_Retryable이면_한도_후_DLQ에_기록함() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        when(executor.execute(any())).thenReturn(new Retryable("sequence conflict", null));
        ProcessManagerOrchestrator processManager = processManager(executor);
        processManager.handle(createOrder("order-5", "cust-5", CORRELATION));

        // when
        List<CommandOutcome> outcomes = processManager.handle(reserveStock("SKU-5", 1, "order-5", CORRELATION));

        // then
        assertThat(outcomes).singleElement().isInstanceOf(Retryable.class);
        verify(executor, times(3)).execute(any());
        assertThat(runtime.deadLetters.getDeadLetters().get(0).details())
            .isInstanceOf(RejectionDetails.ProcessingFailure.class);
    }

    // ============================================================
    // 3. 저장소 장애
    // ============================================================

    @Test
    void handle_process_state_조회가_계속_실패하면_trigger를_DLQ에_기록함() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        EventBookRepository failing = mock(EventBookRepository.class);
        when(failing.load(any())).thenThrow(new StorageException("store down"));
        EventBook orderCreated = createOrder("order-6", "cust-6", CORRELATION);

        // when
        List<CommandOutcome> outcomes = processManager(failing, executor).handle(orderCreated);

        // then
        assertThat(outcomes).isEmpty();
        verify(failing, times(3)).load(any());
        verify(executor, never()).execute(any());
        DeadLetter deadLetter = runtime.deadLetters.getDeadLetters(DeadLetter.TOPIC_PREFIX + OrderDomain.DOMAIN).get(0);
        assertThat(deadLetter.payload()).isInstanceOf(DeadLetterPayload.RejectedEvents.class);
        assertThat(deadLetter.sourceKind()).isEqualTo(ComponentKind.PROCESS_MANAGER);
        assertThat(deadLetter.reason()).isEqualTo("store down");
        assertThat(deadLetter.details()).isInstanceOfSatisfying(RejectionDetails.ProcessingFailure.class, failure -> {
            assertThat(failure.transientFailure()).isTrue();
            assertThat(failure.retryCount()).isEqualTo(3);
        });
    }

    @Test
    void handle_process_state_저장이_일시적으로_실패하면_재시도해서_기록함() {
        // given
        InMemoryEventStore store = new InMemoryEventStore();
        runtime = new InMemoryRuntime(store, new PublishRecoveryConfig());
        coordinator = runtime.coordinator();
        EventBook orderCreated = createOrder("order-7", "cust-7", CORRELATION);
        store.failNextAdds(2);

        // when
        processManager(mock(CommandExecutor.class)).handle(orderCreated);

        // then
        EventBook process = runtime.repository.load(router.processCover(CORRELATION));
        assertThat(process.pages()).extracting(EventPage::sequence).containsExactly(0L);
        assertThat(runtime.deadLetters.size()).isZero();
    }

    @Test
    void handle_process_state_저장이_계속_실패하면_trigger를_DLQ에_기록함() {
        // given
        InMemoryEventStore store = new InMemoryEventStore();
        runtime = new InMemoryRuntime(store, new PublishRecoveryConfig());
        coordinator = runtime.coordinator();
        EventBook orderCreated = createOrder("order-8", "cust-8", CORRELATION);
        store.failNextAdds(3);

        // when
        List<CommandOutcome> outcomes = processManager(mock(CommandExecutor.class)).handle(orderCreated);

        // then
        assertThat(outcomes).isEmpty();
        assertThat(runtime.eventStore.listDomains()).doesNotContain(FulfillmentProcess.DOMAIN);
        assertThat(runtime.deadLetters.getDeadLetters(DeadLetter.TOPIC_PREFIX + OrderDomain.DOMAIN)).hasSize(1);
    }

    // ============================================================
    // helpers
    // ============================================================

    private ProcessManagerOrchestrator processManager(CommandExecutor executor) {
        return processManager(runtime.repository, executor);
    }

    private ProcessManagerOrchestrator processManager(EventBookRepository repository, CommandExecutor executor) {
        return new ProcessManagerOrchestrator(router, repository,
            new RepositoryDestinationFetcher(runtime.repository), executor, runtime.deadLetters,
            new SagaConfig().withMaxAttempts(3), fetchExecutor, InMemoryRuntime.NO_SLEEP);
    }

    private EventBook createOrder(String orderId, String customerId, String correlationId) {
        Cover order = Cover.of(OrderDomain.DOMAIN, RootId.fromName(orderId), correlationId);
        return coordinator.handle(runtime.explicit(order, new CreateOrder(orderId, customerId, "SKU", 1), 0)).events();
    }

    private EventBook reserveStock(String sku, int quantity, String orderId, String correlationId) {
        Cover stock = OrderInventorySaga.stockCover(sku).withCorrelationId(correlationId);
        coordinator.handle(runtime.explicit(stock, new InitializeStock(100, 0), 0));
        return coordinator.handle(runtime.explicit(stock, new ReserveStock(quantity, orderId), 1)).events();
    }
}
