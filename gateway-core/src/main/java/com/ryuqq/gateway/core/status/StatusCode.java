package com.ryuqq.gateway.core.status;

/**
 * 전송 계층 상태 코드.
 *
 * <p>gRPC 상태 코드와 이름 및 번호가 같습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum StatusCode {

    OK(0),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    INTERNAL(13),
    UNAVAILABLE(14),
    DATA_LOSS(15);

    private final int value;

    StatusCode(int value) {
        this.value = value;
    }

    /**
     * 숫자 코드 조회.
     *
     * @return 숫자 코드
     */
    public int value() {
        return value;
    }
}
