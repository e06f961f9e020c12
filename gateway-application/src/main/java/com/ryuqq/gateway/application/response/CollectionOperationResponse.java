package com.ryuqq.gateway.application.response;

import com.ryuqq.gateway.core.outcome.OperationResult;

/**
 * 변경 작업 응답.
 *
 * @param result 작업 적용 여부
 * @param time 코디네이터 호출 경과 시간 (초, 0 이상)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CollectionOperationResponse(
    boolean result,
    double time
) {

    public CollectionOperationResponse {
        Timings.requireValid(time);
    }

    /**
     * 코디네이터 결과로 응답 생성.
     *
     * @param time 경과 시간 (초)
     * @param result 코디네이터 결과
     * @return 응답
     * @throws IllegalArgumentException result가 null이거나 time이 유효하지 않은 경우
     */
    public static CollectionOperationResponse of(double time, OperationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return new CollectionOperationResponse(result.applied(), time);
    }
}
