package com.ryuqq.coordinator.core.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Schema type registry.
 *
 * <p>Maps fully-qualified wire type names (e.g. {@code examples.CustomerCreated}) to the
 * Java classes used to decode them. The registry is built once, explicitly, and the
 * resulting handle is passed to every component that needs it (codec, routers, merge
 * analysis). There is no process-wide singleton.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * TypeRegistry registry = TypeRegistry.builder()
 *     .register("examples.CreateCustomer", CreateCustomer.class)
 *     .register("examples.CustomerCreated", CustomerCreated.class)
 *     .build();
 * </pre>
 *
 * <p><strong>Thread Safety:</strong> instances are immutable.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class TypeRegistry {

    private final Map<String, Class<?>> classesByName;
    private final Map<Class<?>, String> namesByClass;

    private TypeRegistry(Map<String, Class<?>> classesByName, Map<Class<?>, String> namesByClass) {
        this.classesByName = Collections.unmodifiableMap(new LinkedHashMap<>(classesByName));
        this.namesByClass = Collections.unmodifiableMap(new LinkedHashMap<>(namesByClass));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns an empty registry.
     *
     * @return registry with no types
     */
    public static TypeRegistry empty() {
        return new Builder().build();
    }

    /**
     * Looks up the class registered for a full type name.
     *
     * @param fullTypeName the full type name
     * @return the class, or empty if the name is not registered
     */
    public Optional<Class<?>> classFor(String fullTypeName) {
        return Optional.ofNullable(classesByName.get(fullTypeName));
    }

    /**
     * Looks up the full type name registered for a class.
     *
     * @param type the Java class
     * @return the full type name
     * @throws IllegalArgumentException if the class is not registered
     */
    public String nameOf(Class<?> type) {
        String name = namesByClass.get(type);
        if (name == null) {
            throw new IllegalArgumentException("Type not registered: " + type.getName());
        }
        return name;
    }

    public boolean contains(String fullTypeName) {
        return classesByName.containsKey(fullTypeName);
    }

    public Set<String> typeNames() {
        return classesByName.keySet();
    }

    /**
     * Builder for {@link TypeRegistry}.
     */
    public static final class Builder {

        private final Map<String, Class<?>> classesByName = new LinkedHashMap<>();
        private final Map<Class<?>, String> namesByClass = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a type.
         *
         * @param fullTypeName the full wire type name
         * @param type the Java class
         * @return this builder
         * @throws IllegalArgumentException if the name or class is already registered
         */
        public Builder register(String fullTypeName, Class<?> type) {
            if (fullTypeName == null || fullTypeName.isBlank()) {
                throw new IllegalArgumentException("fullTypeName cannot be null or blank");
            }
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
            if (classesByName.containsKey(fullTypeName)) {
                throw new IllegalArgumentException("Type name already registered: " + fullTypeName);
            }
            if (namesByClass.containsKey(type)) {
                throw new IllegalArgumentException("Class already registered: " + type.getName());
            }
            classesByName.put(fullTypeName, type);
            namesByClass.put(type, fullTypeName);
            return this;
        }

        /**
         * Copies every entry of another registry.
         *
         * @param other the registry to merge
         * @return this builder
         */
        public Builder registerAll(TypeRegistry other) {
            other.classesByName.forEach(this::register);
            return this;
        }

        public TypeRegistry build() {
            return new TypeRegistry(classesByName, namesByClass);
        }
    }
}
