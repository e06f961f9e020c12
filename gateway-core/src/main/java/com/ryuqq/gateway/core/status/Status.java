package com.ryuqq.gateway.core.status;

/**
 * 분류된 전송 계층 상태.
 *
 * <p>호출자에게 돌려줄 오류는 항상 이 타입으로 분류됩니다.</p>
 *
 * @param code 상태 코드
 * @param description 상세 설명
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record Status(
    StatusCode code,
    String description
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code가 null이거나 description이 null/blank인 경우
     */
    public Status {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
    }

    public static Status invalidArgument(String description) {
        return new Status(StatusCode.INVALID_ARGUMENT, description);
    }

    public static Status internal(String description) {
        return new Status(StatusCode.INTERNAL, description);
    }

    /**
     * StatusException으로 변환.
     *
     * @return 이 상태를 담은 StatusException
     */
    public StatusException asException() {
        return new StatusException(this);
    }

    /**
     * 원인을 포함한 StatusException으로 변환.
     *
     * @param cause 원인
     * @return 이 상태와 원인을 담은 StatusException
     */
    public StatusException asException(Throwable cause) {
        return new StatusException(this, cause);
    }

    @Override
    public String toString() {
        return code + ": " + description;
    }
}
