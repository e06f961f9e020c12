package com.ryuqq.gateway.adapter.dispatcher;

/**
 * 디스패처 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>slowOperationThresholdMs: 이 시간을 넘긴 코디네이터 호출은 WARN 로그 (기본 1000ms)</li>
 * </ul>
 *
 * <p>타임아웃 상한이나 재시도 설정은 두지 않습니다. 둘 다 코디네이터의 책임입니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 * @param slowOperationThresholdMs 느린 호출 경고 기준 (밀리초, 양수여야 함)
 */
public record DispatcherConfig(long slowOperationThresholdMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: slowOperationThresholdMs=1000ms</p>
     */
    public DispatcherConfig() {
        this(1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DispatcherConfig {
        if (slowOperationThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "slowOperationThresholdMs must be positive (current: " + slowOperationThresholdMs + ")"
            );
        }
    }

    /**
     * slowOperationThresholdMs만 변경한 새 인스턴스 생성.
     */
    public DispatcherConfig withSlowOperationThresholdMs(long slowOperationThresholdMs) {
        return new DispatcherConfig(slowOperationThresholdMs);
    }
}
