package com.ryuqq.coordinator.application.support;

import com.ryuqq.coordinator.application.router.CommandRouter;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.codec.TypeRegistry;
import com.ryuqq.coordinator.core.error.ValidationRejectedException;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.state.StateReconstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 좌석 예약 venue aggregate 테스트 fixture.
 *
 * <p>좌석 map은 key 단위 merge 검증에 사용합니다.</p>
 */
public final class VenueFixture {

    public static final String DOMAIN = "venue";

    public record OpenVenue(String name, List<String> seats) {
    }

    public record ReserveSeat(String seat, String holder) {
    }

    public record RenameVenue(String name) {
    }

    public record VenueOpened(String name, List<String> seats) {
    }

    public record SeatReserved(String seat, String holder) {
    }

    public record VenueRenamed(String name) {
    }

    public record SendConfirmation(String holder, String seat) {
    }

    public record SeatCounted(String seat) {
    }

    public record CloseSales(String reason) {
    }

    public record Venue(boolean open, String name, Map<String, String> seats) {

        public Venue {
            seats = seats == null ? Map.of() : Map.copyOf(seats);
        }

        public static Venue initial() {
            return new Venue(false, "", Map.of());
        }
    }

    private VenueFixture() {
    }

    public static PayloadCodec codec() {
        return new PayloadCodec(TypeRegistry.builder()
            .register("test.venue.OpenVenue", OpenVenue.class)
            .register("test.venue.ReserveSeat", ReserveSeat.class)
            .register("test.venue.RenameVenue", RenameVenue.class)
            .register("test.venue.VenueOpened", VenueOpened.class)
            .register("test.venue.SeatReserved", SeatReserved.class)
            .register("test.venue.VenueRenamed", VenueRenamed.class)
            .register("test.venue.Venue", Venue.class)
            .register("test.mail.SendConfirmation", SendConfirmation.class)
            .register("test.seating.SeatCounted", SeatCounted.class)
            .register("test.venue.CloseSales", CloseSales.class)
            .build());
    }

    public static Cover cover(String name) {
        return Cover.of(DOMAIN, RootId.fromName(name));
    }

    public static StateReconstructor<Venue> reconstructor(PayloadCodec codec) {
        return StateReconstructor.builder(Venue.class, Venue::initial, codec)
            .on("VenueOpened", VenueOpened.class, (state, event) -> {
                Map<String, String> seats = new LinkedHashMap<>();
                for (String seat : event.seats()) {
                    seats.put(seat, "");
                }
                return new Venue(true, event.name(), seats);
            })
            .on("SeatReserved", SeatReserved.class, (state, event) -> {
                Map<String, String> seats = new LinkedHashMap<>(state.seats());
                seats.put(event.seat(), event.holder());
                return new Venue(state.open(), state.name(), seats);
            })
            .on("VenueRenamed", VenueRenamed.class,
                (state, event) -> new Venue(state.open(), event.name(), state.seats()))
            .build();
    }

    public static CommandRouter<Venue> router(PayloadCodec codec) {
        return CommandRouter.builder(DOMAIN, reconstructor(codec), codec)
            .on("OpenVenue", OpenVenue.class, (page, command, state, next) -> {
                if (state.open()) {
                    throw ValidationRejectedException.failedPrecondition("Venue already open");
                }
                return List.of(new VenueOpened(command.name(), command.seats()));
            })
            .on("ReserveSeat", ReserveSeat.class, (page, command, state, next) -> {
                if (!state.open()) {
                    throw ValidationRejectedException.failedPrecondition("Venue is not open");
                }
                String holder = state.seats().get(command.seat());
                if (holder == null) {
                    throw ValidationRejectedException.invalidArgument("Unknown seat " + command.seat());
                }
                if (!holder.isEmpty()) {
                    throw ValidationRejectedException.failedPrecondition("Seat already reserved");
                }
                return List.of(new SeatReserved(command.seat(), command.holder()));
            })
            .on("RenameVenue", RenameVenue.class, (page, command, state, next) ->
                command.name().equals(state.name()) ? List.of() : List.of(new VenueRenamed(command.name())))
            .build();
    }
}
