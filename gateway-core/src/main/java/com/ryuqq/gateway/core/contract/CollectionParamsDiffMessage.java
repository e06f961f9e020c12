package com.ryuqq.gateway.core.contract;

/**
 * 컬렉션 파라미터 변경분 와이어 메시지.
 *
 * @param replicationFactor 새 복제 계수 (null 허용)
 * @param writeConsistencyFactor 새 쓰기 일관성 계수 (null 허용)
 * @param onDiskPayload 새 페이로드 디스크 저장 여부 (null 허용)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CollectionParamsDiffMessage(
    Integer replicationFactor,
    Integer writeConsistencyFactor,
    Boolean onDiskPayload
) {
}
