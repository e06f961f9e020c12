package com.ryuqq.gateway.adapter.dispatcher;

import com.ryuqq.gateway.core.spi.CoordinatorErrorKind;
import com.ryuqq.gateway.core.spi.CoordinatorException;
import com.ryuqq.gateway.core.status.Status;
import com.ryuqq.gateway.core.status.StatusCode;
import com.ryuqq.gateway.core.status.StatusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 코디네이터 오류 → 전송 상태 변환기.
 *
 * <p><strong>고정 변환표:</strong></p>
 * <pre>
 * BAD_INPUT, BAD_REQUEST        → INVALID_ARGUMENT
 * NOT_FOUND                     → NOT_FOUND
 * ALREADY_EXISTS                → ALREADY_EXISTS
 * FORBIDDEN                     → PERMISSION_DENIED
 * LOCKED, PRECONDITION_FAILED   → FAILED_PRECONDITION
 * RATE_LIMIT_EXCEEDED           → RESOURCE_EXHAUSTED
 * TIMEOUT                       → DEADLINE_EXCEEDED
 * UNAVAILABLE                   → UNAVAILABLE
 * CHECKSUM_MISMATCH             → DATA_LOSS
 * SERVICE_ERROR                 → INTERNAL
 * </pre>
 *
 * <p><strong>그 외 오류:</strong></p>
 * <ul>
 *   <li>{@link StatusException}: 이미 분류됨, 그대로 전달</li>
 *   <li>분류되지 않은 예외: INTERNAL (원인 보존)</li>
 * </ul>
 *
 * <p>변환만 수행하며 재시도하지 않습니다. Stateless이므로 thread-safe합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class CoordinatorErrorMapper {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorErrorMapper.class);

    /**
     * 오류 분류에 대응하는 상태 코드.
     *
     * @param kind 코디네이터 오류 분류
     * @return 상태 코드
     */
    public StatusCode toStatusCode(CoordinatorErrorKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return switch (kind) {
            case BAD_INPUT, BAD_REQUEST -> StatusCode.INVALID_ARGUMENT;
            case NOT_FOUND -> StatusCode.NOT_FOUND;
            case ALREADY_EXISTS -> StatusCode.ALREADY_EXISTS;
            case FORBIDDEN -> StatusCode.PERMISSION_DENIED;
            case LOCKED, PRECONDITION_FAILED -> StatusCode.FAILED_PRECONDITION;
            case RATE_LIMIT_EXCEEDED -> StatusCode.RESOURCE_EXHAUSTED;
            case TIMEOUT -> StatusCode.DEADLINE_EXCEEDED;
            case UNAVAILABLE -> StatusCode.UNAVAILABLE;
            case CHECKSUM_MISMATCH -> StatusCode.DATA_LOSS;
            case SERVICE_ERROR -> StatusCode.INTERNAL;
        };
    }

    /**
     * 임의의 실패를 StatusException으로 변환.
     *
     * <p>{@link CompletionException}, {@link ExecutionException} 래퍼는 벗겨낸 뒤 분류합니다.</p>
     *
     * @param error 코디네이터 호출 실패
     * @return 분류된 StatusException
     * @throws IllegalArgumentException error가 null인 경우
     */
    public StatusException toException(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        Throwable cause = unwrap(error);

        if (cause instanceof StatusException statusException) {
            return statusException;
        }
        if (cause instanceof CoordinatorException coordinatorException) {
            StatusCode code = toStatusCode(coordinatorException.getKind());
            log.debug("Coordinator failed with {} mapped to {}", coordinatorException.getKind(), code);
            return new Status(code, describe(coordinatorException)).asException(coordinatorException);
        }

        log.warn("Unclassified coordinator failure mapped to {}", StatusCode.INTERNAL, cause);
        return Status.internal("coordinator failure: " + describe(cause)).asException(cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
