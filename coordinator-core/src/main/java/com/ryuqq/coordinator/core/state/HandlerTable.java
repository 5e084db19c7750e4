package com.ryuqq.coordinator.core.state;

import com.ryuqq.coordinator.core.model.TypedPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered suffix-matching dispatch table.
 *
 * <p>Entries are evaluated in registration order and the first entry whose suffix the
 * full type name ends with wins. Registering a suffix that overlaps an earlier one (one
 * ends with the other) is allowed, because first-match semantics still decide, but it is
 * logged as a warning since the later entry may be unreachable for some type names.</p>
 *
 * <p><strong>Matching Example:</strong></p>
 * <pre>
 * table.register("Created", a);          // entry 0
 * table.register("CustomerCreated", b);  // entry 1, overlaps entry 0 (warning)
 *
 * table.find("examples.CustomerCreated") → a (registration order wins)
 * </pre>
 *
 * <p><strong>Thread Safety:</strong> build the table on one thread, then share it read-only.</p>
 *
 * @param <H> handler type
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class HandlerTable<H> {

    private static final Logger log = LoggerFactory.getLogger(HandlerTable.class);

    private final String owner;
    private final List<Entry<H>> entries = new ArrayList<>();

    /**
     * 생성자.
     *
     * @param owner 로그에 표시할 소유 컴포넌트 이름
     */
    public HandlerTable(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
        this.owner = owner;
    }

    /**
     * Registers a handler for a type-name suffix.
     *
     * @param suffix short type name (e.g. {@code CreateCustomer})
     * @param handler the handler
     * @throws IllegalArgumentException if suffix is blank, handler is null, or the exact suffix is already registered
     */
    public void register(String suffix, H handler) {
        if (suffix == null || suffix.isBlank()) {
            throw new IllegalArgumentException("suffix cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        for (Entry<H> existing : entries) {
            if (existing.suffix().equals(suffix)) {
                throw new IllegalArgumentException("Duplicate handler for " + suffix + " in " + owner);
            }
            if (existing.suffix().endsWith(suffix) || suffix.endsWith(existing.suffix())) {
                log.warn("Overlapping type suffixes in {}: '{}' and '{}' (first registered wins)",
                    owner, existing.suffix(), suffix);
            }
        }
        entries.add(new Entry<>(suffix, handler));
    }

    /**
     * Finds the first entry matching a full type name.
     *
     * @param fullTypeName full type name (or type URL)
     * @return the matching entry, or empty if none matches
     */
    public Optional<Entry<H>> find(String fullTypeName) {
        String typeName = TypedPayload.typeNameOf(fullTypeName);
        for (Entry<H> entry : entries) {
            if (typeName.endsWith(entry.suffix())) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Registered suffixes in registration order.
     *
     * @return suffixes
     */
    public List<String> suffixes() {
        List<String> suffixes = new ArrayList<>(entries.size());
        for (Entry<H> entry : entries) {
            suffixes.add(entry.suffix());
        }
        return Collections.unmodifiableList(suffixes);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * One registered (suffix, handler) pair.
     *
     * @param suffix registered short type name
     * @param handler the handler
     * @param <H> handler type
     */
    public record Entry<H>(String suffix, H handler) {
    }
}
