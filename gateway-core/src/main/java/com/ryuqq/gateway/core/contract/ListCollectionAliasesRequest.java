package com.ryuqq.gateway.core.contract;

/**
 * 특정 컬렉션의 별칭 목록 조회 요청.
 *
 * @param collectionName 조회할 컬렉션 이름 (응답의 각 항목에 그대로 붙음)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record ListCollectionAliasesRequest(String collectionName) {

    public ListCollectionAliasesRequest {
        if (collectionName == null) {
            throw new IllegalArgumentException("collectionName cannot be null");
        }
    }
}
