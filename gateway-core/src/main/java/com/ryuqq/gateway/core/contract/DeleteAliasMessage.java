package com.ryuqq.gateway.core.contract;

/**
 * 별칭 삭제 와이어 메시지.
 *
 * @param aliasName 삭제할 별칭
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record DeleteAliasMessage(String aliasName) {
}
