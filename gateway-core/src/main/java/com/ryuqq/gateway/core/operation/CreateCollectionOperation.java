package com.ryuqq.gateway.core.operation;

import com.ryuqq.gateway.core.model.CollectionConfig;
import com.ryuqq.gateway.core.model.CollectionName;

/**
 * 컬렉션 생성 작업.
 *
 * @param collectionName 생성할 컬렉션 이름
 * @param config 생성 설정
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CreateCollectionOperation(
    CollectionName collectionName,
    CollectionConfig config
) implements CollectionMetaOperation {

    public CreateCollectionOperation {
        if (collectionName == null) {
            throw new IllegalArgumentException("collectionName cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
    }

    @Override
    public String kind() {
        return "create_collection";
    }
}
