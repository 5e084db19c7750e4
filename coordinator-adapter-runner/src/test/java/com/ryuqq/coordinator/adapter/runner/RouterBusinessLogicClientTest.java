package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.error.UnknownHandlerException;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.ComponentDescriptor;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.ContextualCommand;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.testkit.fixture.CustomerDomain;
import com.ryuqq.coordinator.testkit.fixture.CustomerDomain.CreateCustomer;
import com.ryuqq.coordinator.testkit.fixture.FixtureDomains;
import com.ryuqq.coordinator.testkit.fixture.InventoryDomain;
import com.ryuqq.coordinator.testkit.fixture.OrderDomain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RouterBusinessLogicClient 유닛 테스트.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
class RouterBusinessLogicClientTest {

    private final PayloadCodec codec = FixtureDomains.codec();
    private final RouterBusinessLogicClient client = new RouterBusinessLogicClient(FixtureDomains.commandRouters(codec));

    @Test
    void domains_등록된_router의_domain을_모두_노출함() {
        assertThat(client.domains())
            .containsExactlyInAnyOrder(CustomerDomain.DOMAIN, InventoryDomain.DOMAIN, OrderDomain.DOMAIN);
        assertThat(client.reconstructors()).containsOnlyKeys(client.domains());
    }

    @Test
    void descriptors_aggregate_descriptor를_router별로_반환함() {
        // when
        List<ComponentDescriptor> descriptors = client.descriptors();

        // then
        assertThat(descriptors).hasSize(3);
        assertThat(descriptors).allSatisfy(descriptor ->
            assertThat(descriptor.kind()).isEqualTo(ComponentKind.AGGREGATE));
    }

    @Test
    void handle_domain의_router로_위임해서_후보_event를_반환함() {
        // given
        Cover cover = Cover.of(CustomerDomain.DOMAIN, RootId.fromName("carol"));
        CommandBook command = CommandBook.of(cover,
            CommandPage.explicit(codec.pack(new CreateCustomer("Carol", "carol@example.com")), 0));

        // when
        EventBook candidate = client.handle(CustomerDomain.DOMAIN, new ContextualCommand(EventBook.empty(cover), command));

        // then
        assertThat(candidate.pages()).hasSize(1);
        assertThat(candidate.pages().get(0).event().matches("CustomerCreated")).isTrue();
    }

    @Test
    void handle_등록되지_않은_domain이면_UnknownHandler() {
        // given
        Cover cover = Cover.of("billing", RootId.fromName("invoice-1"));
        CommandBook command = CommandBook.of(cover,
            CommandPage.explicit(codec.pack(new CreateCustomer("Carol", "carol@example.com")), 0));

        // when & then
        assertThatThrownBy(() -> client.handle("billing", new ContextualCommand(EventBook.empty(cover), command)))
            .isInstanceOf(UnknownHandlerException.class);
    }

    @Test
    void constructor_같은_domain의_router가_둘이면_예외() {
        assertThatThrownBy(() -> new RouterBusinessLogicClient(
            List.of(CustomerDomain.router(codec), CustomerDomain.router(codec))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate router for domain: customer");
    }
}
