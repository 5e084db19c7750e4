package com.ryuqq.coordinator.core.merge;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.model.TypedPayload;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Field-level structural diff between two versions of a state.
 *
 * <p>The state type is walked property by property through Jackson's bean introspection:</p>
 * <ul>
 *   <li>Map-typed properties produce one {@link FieldPath} per key that was added,
 *       removed, or whose value changed ({@code seats[3]}). A map is never collapsed to a
 *       single path, so two writers touching different keys stay disjoint.</li>
 *   <li>Every other property is compared as a whole value (structurally, via its JSON tree)
 *       and produces a plain path ({@code name}) when it differs.</li>
 * </ul>
 *
 * <p>{@link #areDisjoint} is a plain set-intersection test. It is the only check the
 * sequencing engine consults before letting a stale explicit write through.</p>
 *
 * <p><strong>Thread Safety:</strong> stateless apart from the codec's mapper, which is thread-safe.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class MergeAnalyzer {

    private final PayloadCodec codec;

    /**
     * Creates an analyzer.
     *
     * @param codec codec whose mapper introspects state types and decodes payloads
     * @throws IllegalArgumentException if codec is null
     */
    public MergeAnalyzer(PayloadCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.codec = codec;
    }

    /**
     * Returns true if the two sets share no path.
     *
     * @param a changed paths of one writer
     * @param b changed paths of the other writer
     * @return true if no path appears in both sets
     */
    public static boolean areDisjoint(Set<FieldPath> a, Set<FieldPath> b) {
        Set<FieldPath> smaller = a.size() <= b.size() ? a : b;
        Set<FieldPath> larger = smaller == a ? b : a;
        for (FieldPath path : smaller) {
            if (larger.contains(path)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Computes the paths that differ between two state values.
     *
     * @param before state before the mutation (null treated as absent)
     * @param after state after the mutation (null treated as absent)
     * @return changed paths, in property order
     * @throws IllegalArgumentException if both values are non-null and of different classes
     */
    public Set<FieldPath> changedFields(Object before, Object after) {
        if (before == null && after == null) {
            return Collections.emptySet();
        }
        if (before != null && after != null && before.getClass() != after.getClass()) {
            throw new IllegalArgumentException(
                "Cannot diff different state types: " + before.getClass().getName() + " vs " + after.getClass().getName());
        }
        Class<?> type = before != null ? before.getClass() : after.getClass();
        ObjectMapper mapper = codec.mapper();
        BeanDescription description = mapper.getSerializationConfig().introspect(mapper.constructType(type));

        Set<FieldPath> changed = new LinkedHashSet<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor == null) {
                continue;
            }
            accessor.fixAccess(false);
            Object oldValue = before == null ? null : accessor.getValue(before);
            Object newValue = after == null ? null : accessor.getValue(after);
            String name = property.getName();

            if (property.getPrimaryType().isMapLikeType()) {
                diffMap(name, (Map<?, ?>) oldValue, (Map<?, ?>) newValue, changed);
            } else if (!sameValue(oldValue, newValue)) {
                changed.add(FieldPath.of(name));
            }
        }
        return changed;
    }

    /**
     * Computes changed paths between two encoded states.
     *
     * <p>Registered types are decoded and introspected. For unregistered types the JSON
     * trees are compared: top-level fields by value, and object-valued fields key by key.</p>
     *
     * @param before encoded state before
     * @param after encoded state after
     * @return changed paths
     * @throws com.ryuqq.coordinator.core.error.DecodeFailureException if a payload cannot be decoded
     */
    public Set<FieldPath> changedFields(TypedPayload before, TypedPayload after) {
        if (codec.registry().contains(before.getTypeName()) && before.getTypeName().equals(after.getTypeName())) {
            return changedFields(codec.unpack(before), codec.unpack(after));
        }
        return changedTreeFields(codec.readTree(before), codec.readTree(after));
    }

    private Set<FieldPath> changedTreeFields(JsonNode before, JsonNode after) {
        Set<String> names = new TreeSet<>();
        before.fieldNames().forEachRemaining(names::add);
        after.fieldNames().forEachRemaining(names::add);

        Set<FieldPath> changed = new LinkedHashSet<>();
        for (String name : names) {
            JsonNode oldValue = before.get(name);
            JsonNode newValue = after.get(name);
            if (oldValue != null && newValue != null && oldValue.isObject() && newValue.isObject()) {
                Set<String> keys = new TreeSet<>();
                oldValue.fieldNames().forEachRemaining(keys::add);
                newValue.fieldNames().forEachRemaining(keys::add);
                for (String key : keys) {
                    if (!Objects.equals(oldValue.get(key), newValue.get(key))) {
                        changed.add(FieldPath.of(name, key));
                    }
                }
            } else if (!Objects.equals(oldValue, newValue)) {
                changed.add(FieldPath.of(name));
            }
        }
        return changed;
    }

    private void diffMap(String name, Map<?, ?> before, Map<?, ?> after, Set<FieldPath> changed) {
        Map<String, Object> oldEntries = byStringKey(before);
        Map<String, Object> newEntries = byStringKey(after);

        Set<String> keys = new TreeSet<>(oldEntries.keySet());
        keys.addAll(newEntries.keySet());
        for (String key : keys) {
            boolean presentBefore = oldEntries.containsKey(key);
            boolean presentAfter = newEntries.containsKey(key);
            if (presentBefore != presentAfter || !sameValue(oldEntries.get(key), newEntries.get(key))) {
                changed.add(FieldPath.of(name, key));
            }
        }
    }

    private static Map<String, Object> byStringKey(Map<?, ?> map) {
        Map<String, Object> entries = new HashMap<>();
        if (map != null) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return entries;
    }

    private boolean sameValue(Object a, Object b) {
        if (Objects.equals(a, b)) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        JsonNode left = codec.mapper().valueToTree(a);
        JsonNode right = codec.mapper().valueToTree(b);
        return left.equals(right);
    }
}
