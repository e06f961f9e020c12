package com.ryuqq.gateway.core.contract;

import com.ryuqq.gateway.core.model.CollectionName;
import com.ryuqq.gateway.core.operation.ConversionResult;
import com.ryuqq.gateway.core.operation.DeleteCollectionOperation;
import com.ryuqq.gateway.core.operation.OperationConvertible;

import java.util.Optional;

/**
 * 컬렉션 삭제 요청.
 *
 * @param collectionName 삭제할 컬렉션 이름
 * @param timeout 대기 타임아웃 초 (null 허용, 음수 불가)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record DeleteCollection(
    String collectionName,
    Long timeout
) implements WithTimeout, OperationConvertible {

    public DeleteCollection {
        WithTimeout.requireNonNegative(timeout);
    }

    @Override
    public ConversionResult convert() {
        Optional<String> violation = Conversions.collectionName(collectionName);
        if (violation.isPresent()) {
            return ConversionResult.rejected(violation.get());
        }
        return ConversionResult.converted(new DeleteCollectionOperation(CollectionName.of(collectionName)));
    }
}
