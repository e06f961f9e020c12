package com.ryuqq.gateway.core.model;

import java.util.Optional;

/**
 * 컬렉션 이름.
 *
 * <p>코디네이터가 관리하는 컬렉션을 식별합니다.</p>
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
public final class CollectionName {

    private final String value;

    private CollectionName(String value) {
        validate(value).ifPresent(reason -> {
            throw new IllegalArgumentException(reason);
        });
        this.value = value;
    }

    /**
     * CollectionName 생성.
     *
     * @param value 컬렉션 이름
     * @return CollectionName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CollectionName of(String value) {
        return new CollectionName(value);
    }

    /**
     * 예외 없이 이름을 검증합니다.
     *
     * @param value 검증할 값
     * @return 위반 사유, 유효한 경우 empty
     */
    public static Optional<String> validate(String value) {
        return NameRules.violation("collection name", value);
    }

    /**
     * 컬렉션 이름 조회.
     *
     * @return 컬렉션 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CollectionName that = (CollectionName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CollectionName{" + value + '}';
    }
}
