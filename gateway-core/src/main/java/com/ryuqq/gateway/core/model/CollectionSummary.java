package com.ryuqq.gateway.core.model;

/**
 * 컬렉션 목록 항목.
 *
 * @param name 컬렉션 이름
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CollectionSummary(String name) {

    public CollectionSummary {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }
}
