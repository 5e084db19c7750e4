package com.ryuqq.coordinator.adapter.inmemory.store;

import com.ryuqq.coordinator.core.model.RootId;
import com.ryuqq.coordinator.core.model.Snapshot;
import com.ryuqq.coordinator.core.spi.SnapshotStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SnapshotStore} SPI.
 *
 * <p>Keeps the latest snapshot per (domain, root).</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentHashMap<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<Snapshot> get(String domain, RootId root) {
        return Optional.ofNullable(snapshots.get(key(domain, root)));
    }

    @Override
    public void put(String domain, RootId root, Snapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        snapshots.put(key(domain, root), snapshot);
    }

    @Override
    public void delete(String domain, RootId root) {
        snapshots.remove(key(domain, root));
    }

    public int size() {
        return snapshots.size();
    }

    public void clear() {
        snapshots.clear();
    }

    private static String key(String domain, RootId root) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain cannot be null or blank");
        }
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        return domain + ":" + root.asString();
    }
}
