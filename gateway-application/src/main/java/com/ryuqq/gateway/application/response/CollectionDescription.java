package com.ryuqq.gateway.application.response;

/**
 * 컬렉션 목록 응답 항목.
 *
 * @param name 컬렉션 이름
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CollectionDescription(String name) {

    public CollectionDescription {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }
}
