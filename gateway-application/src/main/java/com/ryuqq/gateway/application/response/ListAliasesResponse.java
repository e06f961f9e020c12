package com.ryuqq.gateway.application.response;

import java.util.List;

/**
 * 별칭 목록 응답.
 *
 * @param aliases 별칭 목록 (코디네이터 반환 순서 유지)
 * @param time 코디네이터 호출 경과 시간 (초)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record ListAliasesResponse(
    List<AliasDescription> aliases,
    double time
) {

    public ListAliasesResponse {
        if (aliases == null) {
            throw new IllegalArgumentException("aliases cannot be null");
        }
        Timings.requireValid(time);
        aliases = List.copyOf(aliases);
    }
}
