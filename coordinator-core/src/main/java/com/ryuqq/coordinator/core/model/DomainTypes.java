package com.ryuqq.coordinator.core.model;

import java.util.List;

/**
 * 한 도메인에서 소비하거나 생성하는 타입 이름 목록.
 *
 * @param domain 도메인 이름
 * @param types 짧은 타입 이름 목록
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record DomainTypes(String domain, List<String> types) {

    public DomainTypes {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain cannot be null or blank");
        }
        types = types == null ? List.of() : List.copyOf(types);
    }
}
