package com.ryuqq.coordinator.adapter.inmemory.dlq;

import com.ryuqq.coordinator.core.dlq.DeadLetter;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.model.TypedPayload;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryDeadLetterSink 테스트.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
class InMemoryDeadLetterSinkTest {

    private final InMemoryDeadLetterSink sink = new InMemoryDeadLetterSink();

    @Test
    void publish_topic별로_조회_가능() {
        // given
        DeadLetter order = DeadLetter.fromValidationFailure(command("order"), "rejected", "order-inventory", ComponentKind.SAGA);
        DeadLetter inventory = DeadLetter.fromValidationFailure(command("inventory"), "rejected", "order-inventory", ComponentKind.SAGA);

        // when
        sink.publish(order);
        sink.publish(inventory);

        // then
        assertThat(sink.size()).isEqualTo(2);
        assertThat(sink.getDeadLetters("coordinator.dlq.inventory")).containsExactly(inventory);
        assertThat(sink.isConfigured()).isTrue();
    }

    @Test
    void clear_후_비어있음() {
        sink.publish(DeadLetter.fromValidationFailure(command("order"), "rejected", "order", ComponentKind.AGGREGATE));

        sink.clear();

        assertThat(sink.getDeadLetters()).isEmpty();
    }

    private static CommandBook command(String domain) {
        TypedPayload payload = TypedPayload.ofType("test.Do", "{}".getBytes(StandardCharsets.UTF_8));
        return CommandBook.of(Cover.of(domain, RootId.random()), CommandPage.explicit(payload, 0));
    }
}
