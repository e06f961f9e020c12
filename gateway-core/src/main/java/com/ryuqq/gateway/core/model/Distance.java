package com.ryuqq.gateway.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 벡터 거리 함수.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum Distance {

    COSINE("Cosine"),
    EUCLID("Euclid"),
    DOT("Dot"),
    MANHATTAN("Manhattan");

    private final String wireName;

    Distance(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 와이어 표기 이름 조회.
     *
     * @return 와이어 표기 이름 (예: Cosine)
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * 지원하는 와이어 표기 이름 목록 (오류 메시지용).
     *
     * @return 쉼표로 구분된 와이어 표기 이름 (예: Cosine, Euclid, Dot, Manhattan)
     */
    public static String supportedWireNames() {
        return Arrays.stream(values())
            .map(Distance::getWireName)
            .collect(Collectors.joining(", "));
    }

    /**
     * 와이어 표기 이름으로 Distance 조회 (대소문자 무시).
     *
     * @param wireName 와이어 표기 이름
     * @return 일치하는 Distance, 없으면 empty
     */
    public static Optional<Distance> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        for (Distance distance : values()) {
            if (distance.wireName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(distance);
            }
        }
        return Optional.empty();
    }
}
