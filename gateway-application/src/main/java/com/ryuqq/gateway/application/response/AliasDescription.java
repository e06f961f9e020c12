package com.ryuqq.gateway.application.response;

import com.ryuqq.gateway.core.model.AliasRecord;

/**
 * 별칭 목록 응답 항목.
 *
 * @param aliasName 별칭 이름
 * @param collectionName 별칭이 가리키는 컬렉션 이름
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record AliasDescription(
    String aliasName,
    String collectionName
) {

    public AliasDescription {
        if (aliasName == null) {
            throw new IllegalArgumentException("aliasName cannot be null");
        }
        if (collectionName == null) {
            throw new IllegalArgumentException("collectionName cannot be null");
        }
    }

    public static AliasDescription from(AliasRecord record) {
        return new AliasDescription(record.aliasName(), record.collectionName());
    }
}
