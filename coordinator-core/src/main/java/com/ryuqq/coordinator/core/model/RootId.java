package com.ryuqq.coordinator.core.model;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Aggregate 루트 식별자 (opaque byte id).
 *
 * <p>RootId는 (domain, root) 일관성 경계의 root 부분이며, 저장소와 버스는
 * 바이트 값 자체만 비교합니다. 대부분의 경우 UUID 16바이트를 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>RootId.random() - 새 aggregate</li>
 *   <li>RootId.of(uuid) - 기존 UUID 래핑</li>
 *   <li>RootId.fromName("corr-123") - correlation id 기반 process manager root</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시 배열을 복사하며, 조회 시에도 복사본을 반환합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class RootId {

    private final byte[] value;

    private RootId(byte[] value) {
        if (value == null || value.length == 0) {
            throw new IllegalArgumentException("RootId cannot be null or empty");
        }
        this.value = value.clone();
    }

    /**
     * 바이트 배열로 RootId 생성.
     *
     * @param value root 바이트 (비어 있으면 안 됨)
     * @return RootId 인스턴스
     * @throws IllegalArgumentException value가 null이거나 비어 있는 경우
     */
    public static RootId fromBytes(byte[] value) {
        return new RootId(value);
    }

    /**
     * UUID로 RootId 생성.
     *
     * @param uuid UUID
     * @return RootId 인스턴스
     * @throws IllegalArgumentException uuid가 null인 경우
     */
    public static RootId of(UUID uuid) {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
        ByteBuffer buffer = ByteBuffer.allocate(16);
        buffer.putLong(uuid.getMostSignificantBits());
        buffer.putLong(uuid.getLeastSignificantBits());
        return new RootId(buffer.array());
    }

    /**
     * 무작위 UUID 기반 RootId 생성.
     *
     * @return RootId 인스턴스
     */
    public static RootId random() {
        return of(UUID.randomUUID());
    }

    /**
     * 이름 기반(UUID v3) RootId 생성.
     *
     * <p>동일한 이름은 항상 동일한 RootId가 됩니다. Process manager의 root는
     * correlation id로부터 이 방식으로 결정됩니다.</p>
     *
     * @param name 이름 (비어 있으면 안 됨)
     * @return RootId 인스턴스
     * @throws IllegalArgumentException name이 null이거나 비어 있는 경우
     */
    public static RootId fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        return of(UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Root 바이트 조회 (복사본).
     *
     * @return root 바이트
     */
    public byte[] toBytes() {
        return value.clone();
    }

    /**
     * 16바이트 값이면 UUID 문자열, 아니면 16진수 문자열.
     *
     * @return 사람이 읽을 수 있는 root 표현
     */
    public String asString() {
        if (value.length == 16) {
            ByteBuffer buffer = ByteBuffer.wrap(value);
            return new UUID(buffer.getLong(), buffer.getLong()).toString();
        }
        return HexFormat.of().formatHex(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RootId rootId = (RootId) o;
        return Arrays.equals(value, rootId.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "RootId{" + asString() + '}';
    }
}
