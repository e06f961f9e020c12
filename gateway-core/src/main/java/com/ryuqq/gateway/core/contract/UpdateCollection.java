package com.ryuqq.gateway.core.contract;

import com.ryuqq.gateway.core.model.CollectionName;
import com.ryuqq.gateway.core.model.CollectionParamsDiff;
import com.ryuqq.gateway.core.operation.ConversionResult;
import com.ryuqq.gateway.core.operation.OperationConvertible;
import com.ryuqq.gateway.core.operation.UpdateCollectionOperation;

import java.util.Optional;

/**
 * 컬렉션 파라미터 변경 요청.
 *
 * @param collectionName 대상 컬렉션 이름
 * @param params 변경분 (null이면 변경 없음)
 * @param timeout 대기 타임아웃 초 (null 허용, 음수 불가)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record UpdateCollection(
    String collectionName,
    CollectionParamsDiffMessage params,
    Long timeout
) implements WithTimeout, OperationConvertible {

    public UpdateCollection {
        WithTimeout.requireNonNegative(timeout);
    }

    @Override
    public ConversionResult convert() {
        Optional<String> nameViolation = Conversions.collectionName(collectionName);
        if (nameViolation.isPresent()) {
            return ConversionResult.rejected(nameViolation.get());
        }
        if (params == null) {
            return ConversionResult.converted(
                new UpdateCollectionOperation(CollectionName.of(collectionName), CollectionParamsDiff.empty()));
        }

        Optional<String> violation = Conversions.firstViolation(
            Conversions.positive("replication_factor", params.replicationFactor()),
            Conversions.positive("write_consistency_factor", params.writeConsistencyFactor())
        );
        if (violation.isPresent()) {
            return ConversionResult.rejected(violation.get());
        }

        CollectionParamsDiff diff = new CollectionParamsDiff(
            params.replicationFactor(), params.writeConsistencyFactor(), params.onDiskPayload());
        return ConversionResult.converted(new UpdateCollectionOperation(CollectionName.of(collectionName), diff));
    }
}
