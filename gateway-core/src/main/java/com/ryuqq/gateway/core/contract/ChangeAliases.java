package com.ryuqq.gateway.core.contract;

import com.ryuqq.gateway.core.operation.AliasOperation;
import com.ryuqq.gateway.core.operation.ChangeAliasesOperation;
import com.ryuqq.gateway.core.operation.ConversionResult;
import com.ryuqq.gateway.core.operation.OperationConvertible;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 별칭 일괄 변경 요청.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ChangeAliases request = new ChangeAliases(List.of(
 *     AliasOperationMessage.delete("current"),
 *     AliasOperationMessage.create("books_v2", "current")
 * ), null);
 * </pre>
 *
 * @param actions 별칭 변경 목록 (null이면 빈 목록, null 원소는 변환 시 거부)
 * @param timeout 대기 타임아웃 초 (null 허용, 음수 불가)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record ChangeAliases(
    List<AliasOperationMessage> actions,
    Long timeout
) implements WithTimeout, OperationConvertible {

    public ChangeAliases {
        WithTimeout.requireNonNegative(timeout);
        actions = actions == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(actions));
    }

    @Override
    public ConversionResult convert() {
        List<AliasOperation> converted = new ArrayList<>(actions.size());
        for (int i = 0; i < actions.size(); i++) {
            AliasOperationMessage action = actions.get(i);
            if (action == null) {
                return ConversionResult.rejected("malformed alias operation at index " + i + ": action is missing");
            }
            Optional<String> violation = action.violation(i);
            if (violation.isPresent()) {
                return ConversionResult.rejected(violation.get());
            }
            converted.add(action.toAliasOperation());
        }
        return ConversionResult.converted(new ChangeAliasesOperation(converted));
    }
}
