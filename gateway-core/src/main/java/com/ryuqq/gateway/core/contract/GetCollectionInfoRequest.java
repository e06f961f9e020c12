package com.ryuqq.gateway.core.contract;

/**
 * 컬렉션 정보 조회 요청.
 *
 * @param collectionName 조회할 컬렉션 이름 (코디네이터에 그대로 전달)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record GetCollectionInfoRequest(String collectionName) {

    public GetCollectionInfoRequest {
        if (collectionName == null) {
            throw new IllegalArgumentException("collectionName cannot be null");
        }
    }
}
