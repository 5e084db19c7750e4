package com.ryuqq.coordinator.core.model;

import java.util.Arrays;

/**
 * 스키마 타입이 지정된 판별(discriminated) 메시지.
 *
 * <p>모든 command, event, snapshot state는 완전한 타입 이름을 담은 type URL과
 * 인코딩된 값(opaque bytes)으로 전달됩니다. 코어의 dispatch는 항상
 * type URL의 마지막 구성요소(타입 이름)로만 매칭하며, 바이트 구조는 보지 않습니다.</p>
 *
 * <p><strong>Type URL 형식:</strong></p>
 * <pre>
 * type.coordinator/examples.CustomerCreated
 * └── prefix ─────┘└── full type name ────┘
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 (바이트는 복사본 보관)</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class TypedPayload {

    /** 기본 type URL prefix. */
    public static final String TYPE_URL_PREFIX = "type.coordinator/";

    private final String typeUrl;
    private final byte[] value;

    private TypedPayload(String typeUrl, byte[] value) {
        if (typeUrl == null || typeUrl.isBlank()) {
            throw new IllegalArgumentException("typeUrl cannot be null or blank");
        }
        this.typeUrl = typeUrl;
        this.value = value == null ? new byte[0] : value.clone();
    }

    /**
     * TypedPayload 생성.
     *
     * @param typeUrl type URL (비어 있으면 안 됨)
     * @param value 인코딩된 값 (null이면 빈 배열)
     * @return TypedPayload 인스턴스
     */
    public static TypedPayload of(String typeUrl, byte[] value) {
        return new TypedPayload(typeUrl, value);
    }

    /**
     * 완전한 타입 이름으로 TypedPayload 생성 (기본 prefix 사용).
     *
     * @param fullTypeName 완전한 타입 이름 (예: examples.CustomerCreated)
     * @param value 인코딩된 값
     * @return TypedPayload 인스턴스
     */
    public static TypedPayload ofType(String fullTypeName, byte[] value) {
        return new TypedPayload(TYPE_URL_PREFIX + fullTypeName, value);
    }

    /**
     * type URL에서 타입 이름 추출.
     *
     * <p>"type.coordinator/examples.PlayerState" → "examples.PlayerState"</p>
     *
     * @param typeUrl type URL
     * @return 마지막 '/' 이후의 타입 이름
     */
    public static String typeNameOf(String typeUrl) {
        int slash = typeUrl.lastIndexOf('/');
        return slash < 0 ? typeUrl : typeUrl.substring(slash + 1);
    }

    public String getTypeUrl() {
        return typeUrl;
    }

    /**
     * 완전한 타입 이름 조회.
     *
     * @return type URL의 마지막 구성요소
     */
    public String getTypeName() {
        return typeNameOf(typeUrl);
    }

    /**
     * 인코딩된 값 조회 (복사본).
     *
     * @return 인코딩된 바이트
     */
    public byte[] getValue() {
        return value.clone();
    }

    /**
     * 등록된 짧은 이름과 suffix 매칭.
     *
     * <p>완전한 타입 이름이 suffix로 끝나면 매칭됩니다. 패키지 prefix를 몰라도
     * handler를 등록할 수 있게 하기 위한 규칙입니다.</p>
     *
     * @param suffix 등록된 짧은 이름 (예: CustomerCreated)
     * @return 매칭 여부
     */
    public boolean matches(String suffix) {
        return getTypeName().endsWith(suffix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypedPayload that = (TypedPayload) o;
        return typeUrl.equals(that.typeUrl) && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * typeUrl.hashCode() + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "TypedPayload{" + typeUrl + ", " + value.length + " bytes}";
    }
}
