package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.coordinator.CommandExecutor;
import com.ryuqq.coordinator.application.coordinator.DestinationFetcher;
import com.ryuqq.coordinator.application.router.EventRouter;
import com.ryuqq.coordinator.core.dlq.DeadLetter;
import com.ryuqq.coordinator.core.dlq.DeadLetterPayload;
import com.ryuqq.coordinator.core.dlq.RejectionDetails;
import com.ryuqq.coordinator.core.error.ErrorKind;
import com.ryuqq.coordinator.core.error.StorageException;
import com.ryuqq.coordinator.core.model.BusinessResponse;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.MergeStrategy;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.outcome.Accepted;
import com.ryuqq.coordinator.core.outcome.CommandOutcome;
import com.ryuqq.coordinator.core.outcome.Rejected;
import com.ryuqq.coordinator.core.outcome.Retryable;
import com.ryuqq.coordinator.testkit.fixture.CustomerDomain;
import com.ryuqq.coordinator.testkit.fixture.CustomerDomain.AddLoyaltyPoints;
import com.ryuqq.coordinator.testkit.fixture.InventoryDomain;
import com.ryuqq.coordinator.testkit.fixture.InventoryDomain.InitializeStock;
import com.ryuqq.coordinator.testkit.fixture.InventoryDomain.InventoryState;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain.CreateOrder;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain.OrderCreated;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain.OrderState;
import com.ryuqq.coordinator.testkit.fixture.OrderInventorySaga;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SagaOrchestrator 테스트.
 *
 * <p>order → inventory saga를 in-memory 런타임 위에서 실행합니다:</p>
 * <ul>
 *   <li>OrderCreated → ReserveStock 실행 및 correlation 전파</li>
 *   <li>대상 aggregate 거부 → 주문 aggregate에 RevokeEventCommand로 보상, 보상 실패 시 DLQ(ValidationFailure)</li>
 *   <li>Retryable → 재계획 후 재실행, 소진 시 DLQ</li>
 *   <li>출력 도메인 위반, 대상 조회 장애 소진 → DLQ(RejectedEvents)</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
class SagaOrchestratorTest {

    private static final SagaConfig CONFIG = new SagaConfig().withMaxAttempts(3);

    private InMemoryRuntime runtime;
    private DefaultCommandCoordinator coordinator;
    private ExecutorService fetchExecutor;

    @BeforeEach
    void setUp() {
        runtime = new InMemoryRuntime();
        coordinator = runtime.coordinator();
        fetchExecutor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        fetchExecutor.shutdownNow();
    }

    // ============================================================
    // 1. 정상 흐름
    // ============================================================

    @Test
    void handle_OrderCreated면_재고를_예약하고_correlation을_전파함() {
        // given
        initializeStock("SKU-1", 100);
        EventBook orderCreated = createOrder("order-1", "SKU-1", 3, "corr-1");
        SagaOrchestrator saga = saga(OrderInventorySaga.router(runtime.codec), realExecutor());

        // when
        List<CommandOutcome> outcomes = saga.handle(orderCreated);

        // then
        assertThat(outcomes).hasSize(1);
        assertThat(outcomes.get(0)).isInstanceOf(Accepted.class);
        EventBook stock = runtime.repository.load(OrderInventorySaga.stockCover("SKU-1"));
        assertThat(stock.pages()).extracting(EventPage::sequence).containsExactly(0L, 1L);
        InventoryState state = InventoryDomain.reconstructor(runtime.codec).rebuild(stock);
        assertThat(state.available()).isEqualTo(97);
        assertThat(runtime.eventStore.getByCorrelation("corr-1"))
            .extracting(book -> book.cover().domain())
            .containsExactlyInAnyOrder(OrderDomain.DOMAIN, InventoryDomain.DOMAIN);
        assertThat(runtime.deadLetters.size()).isZero();
    }

    @Test
    void handle_입력_도메인이_아니면_아무것도_하지_않음() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        SagaOrchestrator saga = saga(OrderInventorySaga.router(runtime.codec), executor);
        Cover customer = Cover.of(CustomerDomain.DOMAIN, RootId.fromName("alice"), "corr-9");
        EventBook foreign = EventBook.of(customer,
            List.of(EventPage.of(0, runtime.codec.pack(new AddLoyaltyPoints(1, "x")))));

        // when
        List<CommandOutcome> outcomes = saga.handle(foreign);

        // then
        assertThat(outcomes).isEmpty();
        verify(executor, never()).execute(any());
    }

    // ============================================================
    // 2. 거부 → 보상 / DLQ
    // ============================================================

    @Test
    void handle_재고_부족으로_거부되면_주문_aggregate에_보상_event를_남김() {
        // given
        initializeStock("SKU-2", 2);
        EventBook orderCreated = createOrder("order-2", "SKU-2", 10, "corr-2");
        SagaOrchestrator saga = saga(OrderInventorySaga.router(runtime.codec), realExecutor());

        // when
        List<CommandOutcome> outcomes = saga.handle(orderCreated);

        // then
        assertThat(outcomes).singleElement().isInstanceOf(Rejected.class);
        EventBook order = runtime.repository.load(orderCreated.cover());
        assertThat(order.pages()).extracting(EventPage::sequence).containsExactly(0L, 1L);
        assertThat(order.pages().get(1).event().matches("OrderCancelled")).isTrue();
        OrderState state = OrderDomain.reconstructor(runtime.codec).rebuild(order);
        assertThat(state.cancelled()).isTrue();
        assertThat(state.cancellationReason()).contains("Insufficient available stock");
        assertThat(runtime.deadLetters.size()).isZero();
    }

    @Test
    void handle_보상도_거부되면_ValidationFailure로_DLQ에_기록함() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        when(executor.execute(any()))
            .thenReturn(new Rejected(ErrorKind.VALIDATION_REJECTED, "Insufficient available stock"))
            .thenReturn(new Rejected(ErrorKind.UNKNOWN_HANDLER, "No handler for RevokeEventCommand"));
        EventBook orderCreated = createOrder("order-6", "SKU-6", 10, "corr-6");

        // when
        List<CommandOutcome> outcomes = saga(OrderInventorySaga.router(runtime.codec), executor).handle(orderCreated);

        // then
        assertThat(outcomes).singleElement().isInstanceOf(Rejected.class);
        ArgumentCaptor<CommandBook> sent = ArgumentCaptor.forClass(CommandBook.class);
        verify(executor, times(2)).execute(sent.capture());
        CommandBook revoke = sent.getAllValues().get(1);
        assertThat(revoke.cover()).isEqualTo(orderCreated.cover());
        assertThat(revoke.primaryPage().command().matches("RevokeEventCommand")).isTrue();
        assertThat(revoke.primaryPage().mergeStrategy()).isEqualTo(MergeStrategy.AUTO_RESEQUENCE);

        assertThat(runtime.deadLetters.getDeadLetters(DeadLetter.TOPIC_PREFIX + InventoryDomain.DOMAIN)).hasSize(1);
        DeadLetter deadLetter = runtime.deadLetters.getDeadLetters().get(0);
        assertThat(deadLetter.sourceComponent()).isEqualTo(OrderInventorySaga.NAME);
        assertThat(deadLetter.sourceKind()).isEqualTo(ComponentKind.SAGA);
        assertThat(deadLetter.details()).isInstanceOf(RejectionDetails.ValidationFailure.class);
        assertThat(deadLetter.reason()).contains("Insufficient available stock");
        assertThat(deadLetter.metadata())
            .containsEntry(SagaOrchestrator.COMPENSATION_METADATA_KEY, "No handler for RevokeEventCommand");
    }

    @Test
    void handle_saga가_출력_도메인_밖으로_command를_만들면_source_event를_DLQ에_기록함() {
        // given
        EventRouter misrouted = EventRouter.builder("misrouted", OrderDomain.DOMAIN, InventoryDomain.DOMAIN, runtime.codec)
            .on("OrderCreated", OrderCreated.class, (event, source, destinations) -> List.of(CommandBook.of(
                Cover.of(CustomerDomain.DOMAIN, RootId.fromName(event.customerId())),
                CommandPage.autoResequence(runtime.codec.pack(new AddLoyaltyPoints(1, "wrong")), null))))
            .build();
        CommandExecutor executor = mock(CommandExecutor.class);
        EventBook orderCreated = createOrder("order-3", "SKU-3", 1, "corr-3");

        // when
        List<CommandOutcome> outcomes = saga(misrouted, executor).handle(orderCreated);

        // then
        assertThat(outcomes).isEmpty();
        verify(executor, never()).execute(any());
        DeadLetter deadLetter = runtime.deadLetters.getDeadLetters().get(0);
        assertThat(deadLetter.payload()).isInstanceOf(DeadLetterPayload.RejectedEvents.class);
        assertThat(deadLetter.reason()).contains("but declares output domain " + InventoryDomain.DOMAIN);
    }

    // ============================================================
    // 3. Retryable → 재계획
    // ============================================================

    @Test
    void handle_Retryable이면_재계획해서_다시_실행함() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        BusinessResponse accepted = BusinessResponse.of(EventBook.empty(OrderInventorySaga.stockCover("SKU-4")));
        when(executor.execute(any()))
            .thenReturn(new Retryable("sequence conflict", null))
            .thenReturn(new Accepted(accepted));
        EventBook orderCreated = createOrder("order-4", "SKU-4", 1, "corr-4");

        // when
        List<CommandOutcome> outcomes = saga(OrderInventorySaga.router(runtime.codec), executor).handle(orderCreated);

        // then
        assertThat(outcomes).singleElement().isInstanceOf(Accepted.class);
        verify(executor, times(2)).execute(any());
        assertThat(runtime.deadLetters.size()).isZero();
    }

    @Test
    void handle_Retryable이_한도까지_이어지면_ProcessingFailure로_DLQ에_기록함() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        when(executor.execute(any())).thenReturn(new Retryable("sequence conflict", null));
        EventBook orderCreated = createOrder("order-5", "SKU-5", 1, "corr-5");

        // when
        List<CommandOutcome> outcomes = saga(OrderInventorySaga.router(runtime.codec), executor).handle(orderCreated);

        // then
        assertThat(outcomes).singleElement().isInstanceOf(Retryable.class);
        verify(executor, times(3)).execute(any());
        DeadLetter deadLetter = runtime.deadLetters.getDeadLetters().get(0);
        assertThat(deadLetter.details()).isInstanceOfSatisfying(RejectionDetails.ProcessingFailure.class, failure -> {
            assertThat(failure.transientFailure()).isTrue();
            assertThat(failure.retryCount()).isEqualTo(3);
        });
    }

    // ============================================================
    // 4. 대상 조회 장애
    // ============================================================

    @Test
    void handle_대상_조회가_계속_실패하면_재시도_후_source를_DLQ에_기록함() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        AtomicInteger fetches = new AtomicInteger();
        DestinationFetcher failing = cover -> {
            fetches.incrementAndGet();
            throw new StorageException("store down");
        };
        EventBook orderCreated = createOrder("order-7", "SKU-7", 1, "corr-7");

        // when
        List<CommandOutcome> outcomes = saga(OrderInventorySaga.router(runtime.codec), executor, failing)
            .handle(orderCreated);

        // then
        assertThat(outcomes).isEmpty();
        assertThat(fetches.get()).isEqualTo(3);
        verify(executor, never()).execute(any());
        assertThat(runtime.deadLetters.getDeadLetters(DeadLetter.TOPIC_PREFIX + OrderDomain.DOMAIN)).hasSize(1);
        DeadLetter deadLetter = runtime.deadLetters.getDeadLetters().get(0);
        assertThat(deadLetter.payload()).isInstanceOf(DeadLetterPayload.RejectedEvents.class);
        assertThat(deadLetter.reason()).isEqualTo("store down");
        assertThat(deadLetter.details()).isInstanceOfSatisfying(RejectionDetails.ProcessingFailure.class, failure -> {
            assertThat(failure.transientFailure()).isTrue();
            assertThat(failure.retryCount()).isEqualTo(3);
        });
    }

    @Test
    void handle_대상_조회가_일시적으로_실패하면_재시도해서_처리함() {
        // given
        initializeStock("SKU-8", 10);
        AtomicInteger fetches = new AtomicInteger();
        RepositoryDestinationFetcher repositoryFetcher = new RepositoryDestinationFetcher(runtime.repository);
        DestinationFetcher flaky = cover -> {
            if (fetches.incrementAndGet() == 1) {
                throw new StorageException("connection reset");
            }
            return repositoryFetcher.fetch(cover);
        };
        EventBook orderCreated = createOrder("order-8", "SKU-8", 4, "corr-8");

        // when
        List<CommandOutcome> outcomes = saga(OrderInventorySaga.router(runtime.codec), realExecutor(), flaky)
            .handle(orderCreated);

        // then
        assertThat(outcomes).singleElement().isInstanceOf(Accepted.class);
        assertThat(fetches.get()).isEqualTo(2);
        assertThat(runtime.deadLetters.size()).isZero();
    }

    @Test
    void handle_재계획_중_조회가_실패하면_source를_DLQ에_기록함() {
        // given
        CommandExecutor executor = mock(CommandExecutor.class);
        when(executor.execute(any())).thenReturn(new Retryable("sequence conflict", null));
        AtomicInteger fetches = new AtomicInteger();
        RepositoryDestinationFetcher repositoryFetcher = new RepositoryDestinationFetcher(runtime.repository);
        DestinationFetcher failsAfterFirstPlan = cover -> {
            if (fetches.incrementAndGet() > 1) {
                throw new StorageException("store down");
            }
            return repositoryFetcher.fetch(cover);
        };
        EventBook orderCreated = createOrder("order-9", "SKU-9", 1, "corr-9");

        // when
        List<CommandOutcome> outcomes = saga(OrderInventorySaga.router(runtime.codec), executor, failsAfterFirstPlan)
            .handle(orderCreated);

        // then
        assertThat(outcomes).singleElement().isInstanceOf(Retryable.class);
        verify(executor, times(1)).execute(any());
        DeadLetter deadLetter = runtime.deadLetters.getDeadLetters().get(0);
        assertThat(deadLetter.payload()).isInstanceOf(DeadLetterPayload.RejectedEvents.class);
        assertThat(deadLetter.reason()).isEqualTo("store down");
    }

    @Test
    void EventDispatchRunner를_거쳐도_조회_장애는_DLQ에_기록됨() throws InterruptedException {
        // given
        DestinationFetcher failing = cover -> {
            throw new StorageException("store down");
        };
        SagaOrchestrator saga = saga(OrderInventorySaga.router(runtime.codec), mock(CommandExecutor.class), failing);
        EventDispatchRunner runner = new EventDispatchRunner(runtime.bus, List.of(saga), List.of(),
            new DispatchConfig(), Executors.newSingleThreadExecutor());
        EventBook orderCreated = createOrder("order-10", "SKU-10", 1, "corr-10");

        // when
        runner.onEvent(orderCreated);
        runner.shutdown();

        // then
        assertThat(runtime.deadLetters.getDeadLetters(DeadLetter.TOPIC_PREFIX + OrderDomain.DOMAIN)).hasSize(1);
    }

    // ============================================================
    // helpers
    // ============================================================

    private SagaOrchestrator saga(EventRouter router, CommandExecutor executor) {
        return saga(router, executor, new RepositoryDestinationFetcher(runtime.repository));
    }

    private SagaOrchestrator saga(EventRouter router, CommandExecutor executor, DestinationFetcher fetcher) {
        return new SagaOrchestrator(router, fetcher, executor,
            runtime.deadLetters, CONFIG, fetchExecutor, InMemoryRuntime.NO_SLEEP);
    }

    private CommandExecutor realExecutor() {
        return new CoordinatorCommandExecutor(coordinator);
    }

    private void initializeStock(String sku, int onHand) {
        coordinator.handle(runtime.explicit(OrderInventorySaga.stockCover(sku), new InitializeStock(onHand, 0), 0));
    }

    private EventBook createOrder(String orderId, String sku, int quantity, String correlationId) {
        Cover order = Cover.of(OrderDomain.DOMAIN, RootId.fromName(orderId), correlationId);
        return coordinator.handle(runtime.explicit(order, new CreateOrder(orderId, "alice", sku, quantity), 0)).events();
    }
}
