package com.ryuqq.gateway.core.operation;

/**
 * {@link CollectionMetaOperation}으로 변환 가능한 요청.
 *
 * <p>구현체는 순수 함수여야 합니다: I/O 없음, 부수 효과 없음.
 * 형태 오류는 {@link ConversionResult.Rejected}로 반환하며 예외를 던지지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface OperationConvertible {

    /**
     * 내부 작업으로 변환.
     *
     * @return 변환 결과 (non-null)
     */
    ConversionResult convert();
}
