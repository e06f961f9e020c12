package com.ryuqq.gateway.core.outcome;

/**
 * 컬렉션 메타 작업 제출 결과.
 *
 * <p>코디네이터가 작업을 성공적으로 처리했을 때 반환합니다.
 * 실패는 이 타입이 아니라 {@link com.ryuqq.gateway.core.spi.CoordinatorException}으로 전달됩니다.</p>
 *
 * @param applied 작업이 적용되었는지 여부 (예: 타임아웃 내 합의 완료)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record OperationResult(boolean applied) {

    private static final OperationResult APPLIED = new OperationResult(true);
    private static final OperationResult NOT_APPLIED = new OperationResult(false);

    /**
     * 적용된 결과.
     *
     * @return applied가 true인 결과
     */
    public static OperationResult success() {
        return APPLIED;
    }

    /**
     * 적용되지 않은 결과 (예: 대기 타임아웃 내 합의 미완료).
     *
     * @return applied가 false인 결과
     */
    public static OperationResult failure() {
        return NOT_APPLIED;
    }
}
