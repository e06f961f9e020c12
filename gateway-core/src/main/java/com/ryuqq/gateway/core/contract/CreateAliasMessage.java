package com.ryuqq.gateway.core.contract;

/**
 * 별칭 생성 와이어 메시지.
 *
 * @param collectionName 대상 컬렉션 이름
 * @param aliasName 새 별칭
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CreateAliasMessage(String collectionName, String aliasName) {
}
