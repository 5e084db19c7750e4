/**
 * In-memory EventStore and SnapshotStore adapter implementations.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.coordinator.adapter.inmemory.store.InMemoryEventStore}:
 *       per-root monitor guarding an append-only page list</li>
 *   <li>{@link com.ryuqq.coordinator.adapter.inmemory.store.InMemorySnapshotStore}:
 *       latest snapshot per (domain, root)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests, embedding and reference only</li>
 * </ul>
 *
 * @see com.ryuqq.coordinator.core.spi.EventStore
 * @see com.ryuqq.coordinator.core.spi.SnapshotStore
 * @author Coordinator Team
 * @since 1.0.0
 */
package com.ryuqq.coordinator.adapter.inmemory.store;
