package com.ryuqq.gateway.core.contract;

/**
 * 컬렉션 목록 조회 요청 (필드 없음).
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record ListCollectionsRequest() {
}
