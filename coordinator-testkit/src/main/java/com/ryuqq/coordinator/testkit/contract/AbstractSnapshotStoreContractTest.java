package com.ryuqq.coordinator.testkit.contract;

import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.model.Snapshot;
import com.ryuqq.coordinator.core.model.TypedPayload;
import com.ryuqq.coordinator.core.spi.SnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the {@link SnapshotStore} SPI.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public abstract class AbstractSnapshotStoreContractTest {

    protected SnapshotStore snapshotStore;

    protected abstract SnapshotStore createSnapshotStore();

    @BeforeEach
    void setUpSnapshotStore() {
        snapshotStore = createSnapshotStore();
    }

    @Test
    void testGet_Missing_IsEmpty() {
        assertTrue(snapshotStore.get("contract", RootId.random()).isEmpty());
    }

    @Test
    void testPut_ReplacesPreviousSnapshot() {
        // Given
        RootId root = RootId.random();
        snapshotStore.put("contract", root, snapshot(3));

        // When
        snapshotStore.put("contract", root, snapshot(7));

        // Then
        Optional<Snapshot> stored = snapshotStore.get("contract", root);
        assertTrue(stored.isPresent());
        assertEquals(7, stored.get().sequence());
    }

    @Test
    void testSnapshots_AreScopedByDomain() {
        RootId root = RootId.random();
        snapshotStore.put("contract", root, snapshot(1));

        assertTrue(snapshotStore.get("other", root).isEmpty());
    }

    @Test
    void testDelete_RemovesSnapshot() {
        RootId root = RootId.random();
        snapshotStore.put("contract", root, snapshot(1));

        snapshotStore.delete("contract", root);

        assertTrue(snapshotStore.get("contract", root).isEmpty());
    }

    private static Snapshot snapshot(long sequence) {
        byte[] body = ("{\"at\":" + sequence + "}").getBytes(StandardCharsets.UTF_8);
        return new Snapshot(sequence, TypedPayload.ofType("contract.State", body));
    }
}
