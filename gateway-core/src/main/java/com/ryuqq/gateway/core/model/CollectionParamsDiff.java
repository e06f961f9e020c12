package com.ryuqq.gateway.core.model;

/**
 * 컬렉션 파라미터 변경분.
 *
 * <p>null 필드는 "변경 없음"을 의미합니다. 모든 필드가 null인 변경분도 유효합니다.</p>
 *
 * @param replicationFactor 새 복제 계수 (null 허용)
 * @param writeConsistencyFactor 새 쓰기 일관성 계수 (null 허용)
 * @param onDiskPayload 새 페이로드 디스크 저장 여부 (null 허용)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CollectionParamsDiff(
    Integer replicationFactor,
    Integer writeConsistencyFactor,
    Boolean onDiskPayload
) {

    private static final CollectionParamsDiff EMPTY = new CollectionParamsDiff(null, null, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 숫자 필드가 양수가 아닌 경우
     */
    public CollectionParamsDiff {
        if (replicationFactor != null && replicationFactor <= 0) {
            throw new IllegalArgumentException("replicationFactor must be positive (current: " + replicationFactor + ")");
        }
        if (writeConsistencyFactor != null && writeConsistencyFactor <= 0) {
            throw new IllegalArgumentException("writeConsistencyFactor must be positive (current: " + writeConsistencyFactor + ")");
        }
    }

    /**
     * 변경 사항이 없는 Diff.
     *
     * @return 빈 CollectionParamsDiff
     */
    public static CollectionParamsDiff empty() {
        return EMPTY;
    }

    /**
     * 변경 사항 존재 여부.
     *
     * @return 하나 이상의 필드가 설정된 경우 false
     */
    public boolean isEmpty() {
        return replicationFactor == null && writeConsistencyFactor == null && onDiskPayload == null;
    }
}
