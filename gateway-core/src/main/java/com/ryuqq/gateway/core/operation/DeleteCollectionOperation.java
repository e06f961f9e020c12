package com.ryuqq.gateway.core.operation;

import com.ryuqq.gateway.core.model.CollectionName;

/**
 * 컬렉션 삭제 작업.
 *
 * @param collectionName 삭제할 컬렉션 이름
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record DeleteCollectionOperation(CollectionName collectionName) implements CollectionMetaOperation {

    public DeleteCollectionOperation {
        if (collectionName == null) {
            throw new IllegalArgumentException("collectionName cannot be null");
        }
    }

    @Override
    public String kind() {
        return "delete_collection";
    }
}
