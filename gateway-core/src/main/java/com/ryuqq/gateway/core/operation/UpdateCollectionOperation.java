package com.ryuqq.gateway.core.operation;

import com.ryuqq.gateway.core.model.CollectionName;
import com.ryuqq.gateway.core.model.CollectionParamsDiff;

/**
 * 컬렉션 파라미터 변경 작업.
 *
 * @param collectionName 대상 컬렉션 이름
 * @param paramsDiff 적용할 변경분 (비어 있을 수 있음)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record UpdateCollectionOperation(
    CollectionName collectionName,
    CollectionParamsDiff paramsDiff
) implements CollectionMetaOperation {

    public UpdateCollectionOperation {
        if (collectionName == null) {
            throw new IllegalArgumentException("collectionName cannot be null");
        }
        if (paramsDiff == null) {
            throw new IllegalArgumentException("paramsDiff cannot be null");
        }
    }

    @Override
    public String kind() {
        return "update_collection";
    }
}
