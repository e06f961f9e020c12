package com.ryuqq.gateway.core.spi;

/**
 * 코디네이터 오류 분류.
 *
 * <p>디스패처는 이 분류만 보고 전송 상태 코드를 결정합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum CoordinatorErrorKind {

    /** 코디네이터가 판단한 잘못된 입력 */
    BAD_INPUT,

    /** 처리할 수 없는 요청 */
    BAD_REQUEST,

    /** 컬렉션 또는 별칭 없음 */
    NOT_FOUND,

    /** 컬렉션 또는 별칭 중복 */
    ALREADY_EXISTS,

    /** 권한 없음 */
    FORBIDDEN,

    /** 쓰기 잠금 상태 */
    LOCKED,

    /** 선행 조건 불충족 */
    PRECONDITION_FAILED,

    /** 요청 한도 초과 */
    RATE_LIMIT_EXCEEDED,

    /** 대기 타임아웃 초과 */
    TIMEOUT,

    /** 일시적으로 처리 불가 (예: 합의 정족수 부족) */
    UNAVAILABLE,

    /** 데이터 체크섬 불일치 */
    CHECKSUM_MISMATCH,

    /** 코디네이터 내부 오류 */
    SERVICE_ERROR
}
