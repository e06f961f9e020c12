package com.ryuqq.gateway.core.model;

/**
 * 이름 있는 벡터 하나의 저장 파라미터.
 *
 * @param size 벡터 차원 (양수)
 * @param distance 거리 함수
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record VectorParams(
    long size,
    Distance distance
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException size가 양수가 아니거나 distance가 null인 경우
     */
    public VectorParams {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive (current: " + size + ")");
        }
        if (distance == null) {
            throw new IllegalArgumentException("distance cannot be null");
        }
    }
}
