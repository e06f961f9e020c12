package com.ryuqq.gateway.core.operation;

import com.ryuqq.gateway.core.model.AliasName;
import com.ryuqq.gateway.core.model.CollectionName;

/**
 * 단일 별칭 변경.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public sealed interface AliasOperation
    permits AliasOperation.CreateAlias, AliasOperation.RenameAlias, AliasOperation.DeleteAlias {

    /**
     * 컬렉션에 새 별칭 연결.
     *
     * @param collectionName 대상 컬렉션
     * @param aliasName 새 별칭
     */
    record CreateAlias(CollectionName collectionName, AliasName aliasName) implements AliasOperation {

        public CreateAlias {
            if (collectionName == null) {
                throw new IllegalArgumentException("collectionName cannot be null");
            }
            if (aliasName == null) {
                throw new IllegalArgumentException("aliasName cannot be null");
            }
        }
    }

    /**
     * 기존 별칭 이름 변경.
     *
     * @param oldAliasName 기존 별칭
     * @param newAliasName 새 별칭
     */
    record RenameAlias(AliasName oldAliasName, AliasName newAliasName) implements AliasOperation {

        public RenameAlias {
            if (oldAliasName == null) {
                throw new IllegalArgumentException("oldAliasName cannot be null");
            }
            if (newAliasName == null) {
                throw new IllegalArgumentException("newAliasName cannot be null");
            }
        }
    }

    /**
     * 별칭 삭제.
     *
     * @param aliasName 삭제할 별칭
     */
    record DeleteAlias(AliasName aliasName) implements AliasOperation {

        public DeleteAlias {
            if (aliasName == null) {
                throw new IllegalArgumentException("aliasName cannot be null");
            }
        }
    }
}
