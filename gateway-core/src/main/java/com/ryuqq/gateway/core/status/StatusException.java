package com.ryuqq.gateway.core.status;

/**
 * 분류된 상태를 담은 예외.
 *
 * <p>서비스의 모든 실패 경로는 이 예외로 종료됩니다.
 * 비동기 호출에서는 {@link java.util.concurrent.CompletableFuture}의 예외 완료 값으로 전달됩니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class StatusException extends RuntimeException {

    private final Status status;

    public StatusException(Status status) {
        this(status, null);
    }

    public StatusException(Status status, Throwable cause) {
        super(requireStatus(status).toString(), cause);
        this.status = status;
    }

    private static Status requireStatus(Status status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return status;
    }

    /**
     * 상태 조회.
     *
     * @return 분류된 상태
     */
    public Status getStatus() {
        return status;
    }

    /**
     * 상태 코드 조회.
     *
     * @return 상태 코드
     */
    public StatusCode getCode() {
        return status.code();
    }
}
