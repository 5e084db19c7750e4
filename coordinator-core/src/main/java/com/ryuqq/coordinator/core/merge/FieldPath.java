package com.ryuqq.coordinator.core.merge;

/**
 * 변경된 state 위치.
 *
 * <p>스칼라/일반 필드는 필드 이름만, map 필드는 변경된 key마다 하나의 경로를 가집니다.</p>
 *
 * <ul>
 *   <li>{@code name} - 필드 전체</li>
 *   <li>{@code seats[3]} - map 필드 seats의 key "3"</li>
 * </ul>
 *
 * @param field 필드 이름
 * @param key map key (map 필드가 아니면 null)
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record FieldPath(String field, String key) {

    public FieldPath {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
    }

    public static FieldPath of(String field) {
        return new FieldPath(field, null);
    }

    public static FieldPath of(String field, String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new FieldPath(field, key);
    }

    public boolean isKeyed() {
        return key != null;
    }

    @Override
    public String toString() {
        return key == null ? field : field + "[" + key + "]";
    }
}
