package com.ryuqq.coordinator.core.spi;

import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.model.Snapshot;

import java.util.Optional;

/**
 * Snapshot Store SPI.
 *
 * <p>Snapshots are a replay optimization only. Losing one is harmless: state is rebuilt from
 * the event history. Implementations keep at most one snapshot per (domain, root).</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public interface SnapshotStore {

    Optional<Snapshot> get(String domain, RootId root);

    /**
     * Stores a snapshot, replacing any previous one for the root.
     *
     * @param domain the domain
     * @param root the aggregate root
     * @param snapshot the snapshot
     * @throws com.ryuqq.coordinator.core.error.StorageException if the store is unavailable
     */
    void put(String domain, RootId root, Snapshot snapshot);

    void delete(String domain, RootId root);
}
