package com.ryuqq.gateway.application.response;

import com.ryuqq.gateway.core.model.CollectionInfo;

/**
 * 컬렉션 정보 조회 응답.
 *
 * @param result 컬렉션 정보
 * @param time 코디네이터 호출 경과 시간 (초)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record GetCollectionInfoResponse(
    CollectionInfo result,
    double time
) {

    public GetCollectionInfoResponse {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        Timings.requireValid(time);
    }
}
