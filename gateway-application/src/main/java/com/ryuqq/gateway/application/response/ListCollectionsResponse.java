package com.ryuqq.gateway.application.response;

import com.ryuqq.gateway.core.model.CollectionSummary;

import java.util.List;

/**
 * 컬렉션 목록 응답.
 *
 * @param collections 컬렉션 목록 (코디네이터 반환 순서 유지)
 * @param time 코디네이터 호출 경과 시간 (초)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record ListCollectionsResponse(
    List<CollectionDescription> collections,
    double time
) {

    public ListCollectionsResponse {
        if (collections == null) {
            throw new IllegalArgumentException("collections cannot be null");
        }
        Timings.requireValid(time);
        collections = List.copyOf(collections);
    }

    /**
     * 코디네이터 요약 목록으로 응답 생성.
     *
     * @param time 경과 시간 (초)
     * @param summaries 코디네이터가 반환한 컬렉션 요약
     * @return 응답
     */
    public static ListCollectionsResponse of(double time, List<CollectionSummary> summaries) {
        if (summaries == null) {
            throw new IllegalArgumentException("summaries cannot be null");
        }
        List<CollectionDescription> collections = summaries.stream()
            .map(summary -> new CollectionDescription(summary.name()))
            .toList();
        return new ListCollectionsResponse(collections, time);
    }
}
