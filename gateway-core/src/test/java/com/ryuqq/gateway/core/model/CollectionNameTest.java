package com.ryuqq.gateway.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CollectionName / AliasName 유닛 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class CollectionNameTest {

    @Test
    void 정상_생성() {
        // when
        CollectionName name = CollectionName.of("books_v2");

        // then
        assertThat(name.getValue()).isEqualTo("books_v2");
    }

    @Test
    void null_값으로_생성_시_예외_발생() {
        assertThatThrownBy(() -> CollectionName.of(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("collection name cannot be null or blank");
    }

    @Test
    void 빈_문자열로_생성_시_예외_발생() {
        assertThatThrownBy(() -> CollectionName.of("  "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null or blank");
    }

    @Test
    void 최대_길이_초과_시_예외_발생() {
        // given
        String tooLong = "a".repeat(256);

        // when & then
        assertThatThrownBy(() -> CollectionName.of(tooLong))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot exceed 255 characters (current: 256)");
    }

    @Test
    void 최대_길이는_허용() {
        assertThat(CollectionName.validate("a".repeat(255))).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"a/b", "a\\b", "a:b", "a*b", "a?b", "a<b", "a>b", "a|b", "a\"b"})
    void 금지_문자_포함_시_검증_실패(String value) {
        assertThat(CollectionName.validate(value))
            .hasValueSatisfying(reason -> assertThat(reason).contains("forbidden character"));
    }

    @Test
    void 별칭_검증_메시지는_alias_name으로_시작() {
        assertThat(AliasName.validate("")).contains("alias name cannot be null or blank");
    }

    @Test
    void 같은_값이면_동등() {
        assertThat(CollectionName.of("books")).isEqualTo(CollectionName.of("books"));
        assertThat(CollectionName.of("books").hashCode()).isEqualTo(CollectionName.of("books").hashCode());
        assertThat(AliasName.of("books")).isNotEqualTo(CollectionName.of("books"));
    }
}
