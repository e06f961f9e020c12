package com.ryuqq.gateway.core.model;

import java.util.Optional;

/**
 * 컬렉션 별칭 이름.
 *
 * <p>하나의 컬렉션을 가리키는 대체 이름입니다. 별칭은 언제든 다른 컬렉션으로 옮겨질 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>금지 문자: {@code < > : " / \ | ? *} 및 NUL</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class AliasName {

    private final String value;

    private AliasName(String value) {
        validate(value).ifPresent(reason -> {
            throw new IllegalArgumentException(reason);
        });
        this.value = value;
    }

    /**
     * AliasName 생성.
     *
     * @param value 별칭 이름
     * @return AliasName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AliasName of(String value) {
        return new AliasName(value);
    }

    /**
     * 예외 없이 이름을 검증합니다.
     *
     * @param value 검증할 값
     * @return 위반 사유, 유효한 경우 empty
     */
    public static Optional<String> validate(String value) {
        return NameRules.violation("alias name", value);
    }

    /**
     * 별칭 이름 조회.
     *
     * @return 별칭 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AliasName that = (AliasName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AliasName{" + value + '}';
    }
}
