package com.ryuqq.gateway.core.model;

import java.util.Optional;

/**
 * 컬렉션/별칭 이름 공통 검증 규칙.
 *
 * <p>검증 실패 사유를 예외 대신 {@link Optional}로 반환하여
 * 변환 단계에서 태그된 결과로 다룰 수 있게 합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
final class NameRules {

    static final int MAX_LENGTH = 255;

    private static final String FORBIDDEN_CHARACTERS = "<>:\"/\\|?*\0";

    private NameRules() {
    }

    /**
     * 이름 검증.
     *
     * @param kind 오류 메시지에 사용할 이름 종류 (예: "collection name")
     * @param value 검증할 값
     * @return 위반 사유, 유효한 경우 empty
     */
    static Optional<String> violation(String kind, String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(kind + " cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            return Optional.of(kind + " length cannot exceed " + MAX_LENGTH + " characters (current: " + value.length() + ")");
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (FORBIDDEN_CHARACTERS.indexOf(c) >= 0) {
                return Optional.of(kind + " contains forbidden character '" + printable(c) + "': " + value);
            }
        }
        return Optional.empty();
    }

    private static String printable(char c) {
        return c == '\0' ? "\\0" : String.valueOf(c);
    }
}
