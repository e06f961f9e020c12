package com.ryuqq.gateway.core.model;

/**
 * 컬렉션 상세 정보.
 *
 * @param status 컬렉션 상태
 * @param pointsCount 저장된 포인트 수 (0 이상)
 * @param config 생성 시 설정 (Diff 적용 후)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CollectionInfo(
    CollectionStatus status,
    long pointsCount,
    CollectionConfig config
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 pointsCount가 음수인 경우
     */
    public CollectionInfo {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (pointsCount < 0) {
            throw new IllegalArgumentException("pointsCount must be non-negative (current: " + pointsCount + ")");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
    }
}
