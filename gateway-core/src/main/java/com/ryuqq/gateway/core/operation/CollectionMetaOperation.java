package com.ryuqq.gateway.core.operation;

/**
 * 코디네이터가 처리하는 컬렉션 메타 작업.
 *
 * <p>변경 요청은 모두 다음 네 가지 중 하나로 변환됩니다:</p>
 * <ul>
 *   <li>{@link CreateCollectionOperation}: 컬렉션 생성</li>
 *   <li>{@link UpdateCollectionOperation}: 컬렉션 파라미터 변경</li>
 *   <li>{@link DeleteCollectionOperation}: 컬렉션 삭제</li>
 *   <li>{@link ChangeAliasesOperation}: 별칭 일괄 변경</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 코디네이터 구현체가 모든 케이스를 다루도록 강제합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public sealed interface CollectionMetaOperation
    permits CreateCollectionOperation, UpdateCollectionOperation, DeleteCollectionOperation, ChangeAliasesOperation {

    /**
     * 로그와 오류 메시지에 사용할 작업 종류 이름.
     *
     * @return 작업 종류 (예: create_collection)
     */
    String kind();
}
