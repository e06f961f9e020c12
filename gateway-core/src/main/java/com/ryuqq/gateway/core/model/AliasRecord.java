package com.ryuqq.gateway.core.model;

/**
 * 코디네이터가 보관하는 별칭 매핑.
 *
 * @param aliasName 별칭 이름
 * @param collectionName 별칭이 가리키는 컬렉션 이름
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record AliasRecord(
    String aliasName,
    String collectionName
) {

    public AliasRecord {
        if (aliasName == null) {
            throw new IllegalArgumentException("aliasName cannot be null");
        }
        if (collectionName == null) {
            throw new IllegalArgumentException("collectionName cannot be null");
        }
    }
}
