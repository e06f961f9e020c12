package com.ryuqq.gateway.core.contract;

import com.ryuqq.gateway.core.model.AliasName;
import com.ryuqq.gateway.core.model.CollectionName;

import java.util.Optional;

/**
 * 와이어 요청 변환 시 사용하는 검증 헬퍼.
 *
 * <p>모든 메서드는 위반 사유를 반환할 뿐 예외를 던지지 않습니다.</p>
 */
final class Conversions {

    private Conversions() {
    }

    static Optional<String> collectionName(String value) {
        return CollectionName.validate(value);
    }

    static Optional<String> aliasName(String value) {
        return AliasName.validate(value);
    }

    static Optional<String> positive(String field, Integer value) {
        if (value != null && value <= 0) {
            return Optional.of(field + " must be positive (current: " + value + ")");
        }
        return Optional.empty();
    }

    /**
     * 첫 번째 위반 사유.
     *
     * @param checks 순서대로 평가할 검증 결과
     * @return 첫 번째 위반 사유, 모두 통과하면 empty
     */
    @SafeVarargs
    static Optional<String> firstViolation(Optional<String>... checks) {
        for (Optional<String> check : checks) {
            if (check.isPresent()) {
                return check;
            }
        }
        return Optional.empty();
    }
}
