package com.ryuqq.coordinator.testkit.fixture;

import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.codec.TypeRegistry;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.Projection;
import com.ryuqq.coordinator.core.spi.SyncProjector;

/**
 * Commit된 고객 event 수를 동기 projection으로 돌려주는 projector.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class CustomerActivityProjector implements SyncProjector {

    public static final String NAME = "customer-activity";

    private final PayloadCodec codec;

    public CustomerActivityProjector(PayloadCodec codec) {
        this.codec = codec;
    }

    public record CustomerActivity(int committedEvents, long lastSequence) {
    }

    static void register(TypeRegistry.Builder builder) {
        builder.register("fixture.customer.CustomerActivity", CustomerActivity.class);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean accepts(String domain) {
        return CustomerDomain.DOMAIN.equals(domain);
    }

    @Override
    public Projection project(EventBook committed) {
        long last = committed.nextSequence() - 1;
        CustomerActivity activity = new CustomerActivity(committed.pages().size(), last);
        return new Projection(committed.cover(), NAME, last, codec.pack(activity));
    }
}
