package com.ryuqq.gateway.core.spi;

/**
 * 분류된 코디네이터 오류.
 *
 * <p>{@link CoordinatorClient} 구현체는 실패 시 이 예외로 future를 완료해야 합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class CoordinatorException extends RuntimeException {

    private final CoordinatorErrorKind kind;

    public CoordinatorException(CoordinatorErrorKind kind, String message) {
        this(kind, message, null);
    }

    public CoordinatorException(CoordinatorErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public static CoordinatorException notFound(String message) {
        return new CoordinatorException(CoordinatorErrorKind.NOT_FOUND, message);
    }

    public static CoordinatorException alreadyExists(String message) {
        return new CoordinatorException(CoordinatorErrorKind.ALREADY_EXISTS, message);
    }

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    public CoordinatorErrorKind getKind() {
        return kind;
    }
}
