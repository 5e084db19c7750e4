package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.application.support.VenueFixture;
import com.ryuqq.coordinator.application.support.VenueFixture.SeatReserved;
import com.ryuqq.coordinator.application.support.VenueFixture.SendConfirmation;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.error.ValidationRejectedException;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.RootId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventRouter (saga) 단위 테스트.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
class EventRouterTest {

    private static final String MAIL = "mail";

    private final PayloadCodec codec = VenueFixture.codec();

    private static Cover mailbox(String holder) {
        return Cover.of(MAIL, RootId.fromName(holder));
    }

    private final EventRouter saga = EventRouter.builder("seat-confirmation", VenueFixture.DOMAIN, MAIL, codec)
        .prepare("SeatReserved", SeatReserved.class, (event, source) -> List.of(mailbox(event.holder())))
        .on("SeatReserved", SeatReserved.class, (event, source, destinations) -> {
            Cover target = mailbox(event.holder());
            return List.of(CommandBook.of(target, CommandPage.explicit(
                codec.pack(new SendConfirmation(event.holder(), event.seat())), destinations.nextSequence(target))));
        })
        .build();

    private EventBook source(String correlationId, Object... events) {
        Cover cover = Cover.of(VenueFixture.DOMAIN, RootId.fromName("hall-1"), correlationId);
        EventPage[] pages = new EventPage[events.length];
        for (int i = 0; i < events.length; i++) {
            pages[i] = EventPage.of(i + 1, codec.pack(events[i]));
        }
        return EventBook.of(cover, List.of(pages));
    }

    @Test
    void prepare_같은_destination은_한번만_반환() {
        // given
        EventBook source = source("corr-1", new SeatReserved("A1", "kim"), new SeatReserved("A2", "kim"));

        // when
        List<Cover> covers = saga.prepare(source);

        // then
        assertThat(covers).containsExactly(mailbox("kim"));
    }

    @Test
    void dispatch_destination_이력의_nextSequence로_command_생성() {
        // given
        EventBook source = source("corr-1", new SeatReserved("A1", "kim"));
        EventBook mailHistory = EventBook.of(mailbox("kim"), List.of(
            EventPage.of(0, codec.pack(new VenueFixture.SeatCounted("x"))),
            EventPage.of(1, codec.pack(new VenueFixture.SeatCounted("y")))));

        // when
        List<CommandBook> commands = saga.dispatch(source, List.of(mailHistory));

        // then
        assertThat(commands).hasSize(1);
        assertThat(commands.get(0).primaryPage().sequence()).isEqualTo(2L);
    }

    @Test
    void dispatch_trigger의_correlation과_origin을_command에_기록() {
        // given
        EventBook source = source("corr-7", new SeatReserved("A1", "lee"));

        // when
        CommandBook command = saga.dispatch(source, List.of()).get(0);

        // then
        assertThat(command.cover().correlationId()).isEqualTo("corr-7");
        assertThat(command.origin().componentName()).isEqualTo("seat-confirmation");
        assertThat(command.origin().componentKind()).isEqualTo(ComponentKind.SAGA);
        assertThat(command.origin().triggeringCover()).isEqualTo(source.cover());
        assertThat(command.origin().triggeringSequence()).isEqualTo(1L);
        assertThat(command.primaryPage().sequence()).isZero();
    }

    @Test
    void dispatch_reaction이_없는_event는_건너뜀() {
        // given
        EventBook source = source("corr-1", new VenueFixture.VenueRenamed("New Hall"));

        // when & then
        assertThat(saga.dispatch(source, List.of())).isEmpty();
        assertThat(saga.prepare(source)).isEmpty();
    }

    @Test
    void dispatch_선언하지_않은_domain으로_command를_내면_ValidationRejected() {
        // given
        EventRouter misrouted = EventRouter.builder("misrouted", VenueFixture.DOMAIN, MAIL, codec)
            .on("SeatReserved", SeatReserved.class, (event, source, destinations) -> List.of(
                CommandBook.of(VenueFixture.cover("hall-2"), CommandPage.autoResequence(
                    codec.pack(new VenueFixture.RenameVenue("x")), null))))
            .build();

        // when & then
        assertThatThrownBy(() -> misrouted.dispatch(source("corr-1", new SeatReserved("A1", "kim")), List.of()))
            .isInstanceOf(ValidationRejectedException.class)
            .hasMessageContaining("output domain mail");
    }

    @Test
    void descriptor_saga_입출력_domain_노출() {
        assertThat(saga.descriptor().kind()).isEqualTo(ComponentKind.SAGA);
        assertThat(saga.descriptor().inputs().get(0).domain()).isEqualTo(VenueFixture.DOMAIN);
        assertThat(saga.descriptor().outputs().get(0).domain()).isEqualTo(MAIL);
        assertThat(saga.inputDomain()).isEqualTo(VenueFixture.DOMAIN);
    }
}
