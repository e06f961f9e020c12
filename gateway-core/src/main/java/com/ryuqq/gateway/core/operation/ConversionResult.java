package com.ryuqq.gateway.core.operation;

import com.ryuqq.gateway.core.status.Status;
import com.ryuqq.gateway.core.status.StatusCode;

/**
 * 요청 → {@link CollectionMetaOperation} 변환 결과.
 *
 * <p>변환 실패를 예외 대신 값으로 표현합니다:</p>
 * <ul>
 *   <li>{@link Converted}: 변환 성공, 제출할 작업 포함</li>
 *   <li>{@link Rejected}: 요청 형태 오류, INVALID_ARGUMENT 상태 포함</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ConversionResult result = request.convert();
 * if (result instanceof ConversionResult.Rejected rejected) {
 *     return CompletableFuture.failedFuture(rejected.status().asException());
 * }
 * CollectionMetaOperation operation = ((ConversionResult.Converted) result).operation();
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public sealed interface ConversionResult permits ConversionResult.Converted, ConversionResult.Rejected {

    /**
     * 변환 성공 결과 생성.
     *
     * @param operation 변환된 작업
     * @return Converted 인스턴스
     */
    static ConversionResult converted(CollectionMetaOperation operation) {
        return new Converted(operation);
    }

    /**
     * 변환 실패 결과 생성 (INVALID_ARGUMENT).
     *
     * @param reason 실패 사유
     * @return Rejected 인스턴스
     */
    static ConversionResult rejected(String reason) {
        return new Rejected(Status.invalidArgument(reason));
    }

    /**
     * 변환 성공 여부.
     *
     * @return 성공 시 true
     */
    default boolean isConverted() {
        return this instanceof Converted;
    }

    /**
     * 변환 성공.
     *
     * @param operation 변환된 작업
     */
    record Converted(CollectionMetaOperation operation) implements ConversionResult {

        public Converted {
            if (operation == null) {
                throw new IllegalArgumentException("operation cannot be null");
            }
        }
    }

    /**
     * 변환 실패.
     *
     * @param status 분류된 상태 (항상 INVALID_ARGUMENT)
     */
    record Rejected(Status status) implements ConversionResult {

        public Rejected {
            if (status == null) {
                throw new IllegalArgumentException("status cannot be null");
            }
            if (status.code() != StatusCode.INVALID_ARGUMENT) {
                throw new IllegalArgumentException("rejected conversion must be INVALID_ARGUMENT (current: " + status.code() + ")");
            }
        }
    }
}
