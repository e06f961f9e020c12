package com.ryuqq.gateway.core.contract;

import java.time.Duration;
import java.util.Optional;

/**
 * 선택적 대기 타임아웃을 가진 요청.
 *
 * <p>모든 변경 요청이 구현하는 공통 능력입니다. 디스패처는 이 인터페이스만 보고
 * 타임아웃을 추출하므로 작업 종류와 무관하게 동작합니다.</p>
 *
 * <p><strong>정책:</strong></p>
 * <ul>
 *   <li>timeout = N (초) → 정확히 N초의 Duration</li>
 *   <li>timeout = null → empty (코디네이터 기본 동작)</li>
 *   <li>상한 검증 없음: 상한은 코디네이터가 판단</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface WithTimeout {

    /**
     * 와이어 타임아웃 값 (초 단위).
     *
     * @return 타임아웃 초, 지정되지 않은 경우 null
     */
    Long timeout();

    /**
     * 코디네이터에 전달할 대기 타임아웃.
     *
     * @return 타임아웃 Duration, 지정되지 않은 경우 empty
     */
    default Optional<Duration> waitTimeout() {
        return Optional.ofNullable(timeout()).map(Duration::ofSeconds);
    }

    /**
     * 와이어 레코드 생성 시 타임아웃 값 검증.
     *
     * @param timeout 타임아웃 초 (null 허용)
     * @throws IllegalArgumentException timeout이 음수인 경우
     */
    static void requireNonNegative(Long timeout) {
        if (timeout != null && timeout < 0) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
    }
}
