package com.ryuqq.gateway.core.contract;

import com.ryuqq.gateway.core.model.AliasName;
import com.ryuqq.gateway.core.model.CollectionName;
import com.ryuqq.gateway.core.operation.AliasOperation;

import java.util.Optional;

/**
 * 별칭 변경 와이어 메시지 (one-of).
 *
 * <p>세 필드 중 정확히 하나만 설정되어야 합니다. 그렇지 않으면 변환 시 거부됩니다.</p>
 *
 * @param createAlias 별칭 생성 (null 허용)
 * @param renameAlias 별칭 이름 변경 (null 허용)
 * @param deleteAlias 별칭 삭제 (null 허용)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record AliasOperationMessage(
    CreateAliasMessage createAlias,
    RenameAliasMessage renameAlias,
    DeleteAliasMessage deleteAlias
) {

    public static AliasOperationMessage create(String collectionName, String aliasName) {
        return new AliasOperationMessage(new CreateAliasMessage(collectionName, aliasName), null, null);
    }

    public static AliasOperationMessage rename(String oldAliasName, String newAliasName) {
        return new AliasOperationMessage(null, new RenameAliasMessage(oldAliasName, newAliasName), null);
    }

    public static AliasOperationMessage delete(String aliasName) {
        return new AliasOperationMessage(null, null, new DeleteAliasMessage(aliasName));
    }

    /**
     * 메시지 형태 검증.
     *
     * @param index actions 목록 내 위치 (오류 메시지용)
     * @return 위반 사유, 유효한 경우 empty
     */
    Optional<String> violation(int index) {
        int set = (createAlias != null ? 1 : 0) + (renameAlias != null ? 1 : 0) + (deleteAlias != null ? 1 : 0);
        if (set != 1) {
            return Optional.of("malformed alias operation at index " + index
                + ": exactly one of create_alias, rename_alias, delete_alias must be set (current: " + set + ")");
        }

        Optional<String> violation;
        if (createAlias != null) {
            violation = Conversions.firstViolation(
                Conversions.collectionName(createAlias.collectionName()),
                Conversions.aliasName(createAlias.aliasName())
            );
        } else if (renameAlias != null) {
            violation = Conversions.firstViolation(
                Conversions.aliasName(renameAlias.oldAliasName()),
                Conversions.aliasName(renameAlias.newAliasName())
            );
        } else {
            violation = Conversions.aliasName(deleteAlias.aliasName());
        }
        return violation.map(reason -> "alias operation at index " + index + ": " + reason);
    }

    /**
     * 내부 별칭 작업으로 변환.
     *
     * <p>{@link #violation(int)}이 empty를 반환한 메시지에만 호출합니다.</p>
     *
     * @return 변환된 별칭 작업
     */
    AliasOperation toAliasOperation() {
        if (createAlias != null) {
            return new AliasOperation.CreateAlias(
                CollectionName.of(createAlias.collectionName()), AliasName.of(createAlias.aliasName()));
        }
        if (renameAlias != null) {
            return new AliasOperation.RenameAlias(
                AliasName.of(renameAlias.oldAliasName()), AliasName.of(renameAlias.newAliasName()));
        }
        return new AliasOperation.DeleteAlias(AliasName.of(deleteAlias.aliasName()));
    }
}
