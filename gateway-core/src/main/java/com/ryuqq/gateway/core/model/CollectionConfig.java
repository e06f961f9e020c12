package com.ryuqq.gateway.core.model;

import java.util.Map;

/**
 * 컬렉션 생성 설정.
 *
 * <p>숫자 필드가 null이면 코디네이터 기본값을 사용합니다.</p>
 *
 * @param vectors 벡터 이름별 파라미터 (빈 맵 허용)
 * @param shardNumber 샤드 수 (null 허용)
 * @param replicationFactor 복제 계수 (null 허용)
 * @param writeConsistencyFactor 쓰기 일관성 계수 (null 허용)
 * @param onDiskPayload 페이로드 디스크 저장 여부 (null 허용)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CollectionConfig(
    Map<String, VectorParams> vectors,
    Integer shardNumber,
    Integer replicationFactor,
    Integer writeConsistencyFactor,
    Boolean onDiskPayload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException vectors가 null이거나 숫자 필드가 양수가 아닌 경우
     */
    public CollectionConfig {
        if (vectors == null) {
            throw new IllegalArgumentException("vectors cannot be null");
        }
        requirePositive("shardNumber", shardNumber);
        requirePositive("replicationFactor", replicationFactor);
        requirePositive("writeConsistencyFactor", writeConsistencyFactor);
        vectors = Map.copyOf(vectors);
    }

    private static void requirePositive(String field, Integer value) {
        if (value != null && value <= 0) {
            throw new IllegalArgumentException(field + " must be positive (current: " + value + ")");
        }
    }
}
