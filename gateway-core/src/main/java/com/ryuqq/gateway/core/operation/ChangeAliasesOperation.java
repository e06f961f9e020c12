package com.ryuqq.gateway.core.operation;

import java.util.List;

/**
 * 별칭 일괄 변경 작업.
 *
 * <p>코디네이터는 actions를 순서대로, 하나의 단위로 적용해야 합니다.</p>
 *
 * @param actions 별칭 변경 목록 (빈 목록 허용)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record ChangeAliasesOperation(List<AliasOperation> actions) implements CollectionMetaOperation {

    public ChangeAliasesOperation {
        if (actions == null) {
            throw new IllegalArgumentException("actions cannot be null");
        }
        actions = List.copyOf(actions);
    }

    @Override
    public String kind() {
        return "change_aliases";
    }
}
