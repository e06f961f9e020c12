package com.ryuqq.gateway.core.contract;

/**
 * 벡터 파라미터 와이어 메시지.
 *
 * @param size 벡터 차원 (null 허용, 변환 시 필수)
 * @param distance 거리 함수 이름 (예: Cosine, null 허용, 변환 시 필수)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record VectorParamsMessage(
    Long size,
    String distance
) {
}
