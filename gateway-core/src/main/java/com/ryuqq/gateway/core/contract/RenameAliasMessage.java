package com.ryuqq.gateway.core.contract;

/**
 * 별칭 이름 변경 와이어 메시지.
 *
 * @param oldAliasName 기존 별칭
 * @param newAliasName 새 별칭
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record RenameAliasMessage(String oldAliasName, String newAliasName) {
}
