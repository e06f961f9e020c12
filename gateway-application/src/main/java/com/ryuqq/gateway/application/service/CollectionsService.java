package com.ryuqq.gateway.application.service;

import com.ryuqq.gateway.application.response.CollectionOperationResponse;
import com.ryuqq.gateway.application.response.GetCollectionInfoResponse;
import com.ryuqq.gateway.application.response.ListAliasesResponse;
import com.ryuqq.gateway.application.response.ListCollectionsResponse;
import com.ryuqq.gateway.core.contract.ChangeAliases;
import com.ryuqq.gateway.core.contract.CreateCollection;
import com.ryuqq.gateway.core.contract.DeleteCollection;
import com.ryuqq.gateway.core.contract.GetCollectionInfoRequest;
import com.ryuqq.gateway.core.contract.ListAliasesRequest;
import com.ryuqq.gateway.core.contract.ListCollectionAliasesRequest;
import com.ryuqq.gateway.core.contract.ListCollectionsRequest;
import com.ryuqq.gateway.core.contract.RequestEnvelope;
import com.ryuqq.gateway.core.contract.UpdateCollection;

import java.util.concurrent.CompletableFuture;

/**
 * 컬렉션 관리 서비스.
 *
 * <p>전송 계층이 호출하는 인바운드 포트입니다. 모든 메서드는 비블로킹으로 future를 반환하며,
 * 실패 시 future는 {@link com.ryuqq.gateway.core.status.StatusException}으로 예외 완료됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * service.create(RequestEnvelope.of(createCollection))
 *     .whenComplete((response, error) -&gt; {
 *         if (error != null) {
 *             // StatusException (CompletionException으로 감싸져 있을 수 있음)
 *         } else {
 *             // response.result(), response.time()
 *         }
 *     });
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface CollectionsService {

    /**
     * 컬렉션 정보 조회.
     *
     * @param request 조회 요청
     * @return 컬렉션 정보와 경과 시간
     * @throws IllegalArgumentException request가 null인 경우
     */
    CompletableFuture<GetCollectionInfoResponse> get(RequestEnvelope<GetCollectionInfoRequest> request);

    /**
     * 컬렉션 목록 조회.
     *
     * @param request 조회 요청
     * @return 컬렉션 목록과 경과 시간
     * @throws IllegalArgumentException request가 null인 경우
     */
    CompletableFuture<ListCollectionsResponse> list(RequestEnvelope<ListCollectionsRequest> request);

    /**
     * 컬렉션 생성.
     *
     * @param request 생성 요청
     * @return 성공 여부와 경과 시간
     * @throws IllegalArgumentException request가 null인 경우
     */
    CompletableFuture<CollectionOperationResponse> create(RequestEnvelope<CreateCollection> request);

    /**
     * 컬렉션 파라미터 변경.
     *
     * @param request 변경 요청
     * @return 성공 여부와 경과 시간
     * @throws IllegalArgumentException request가 null인 경우
     */
    CompletableFuture<CollectionOperationResponse> update(RequestEnvelope<UpdateCollection> request);

    /**
     * 컬렉션 삭제.
     *
     * @param request 삭제 요청
     * @return 성공 여부와 경과 시간
     * @throws IllegalArgumentException request가 null인 경우
     */
    CompletableFuture<CollectionOperationResponse> delete(RequestEnvelope<DeleteCollection> request);

    /**
     * 별칭 일괄 변경.
     *
     * @param request 별칭 변경 요청
     * @return 성공 여부와 경과 시간
     * @throws IllegalArgumentException request가 null인 경우
     */
    CompletableFuture<CollectionOperationResponse> updateAliases(RequestEnvelope<ChangeAliases> request);

    /**
     * 특정 컬렉션의 별칭 목록 조회.
     *
     * @param request 조회 요청
     * @return (별칭, 요청한 컬렉션 이름) 목록과 경과 시간
     * @throws IllegalArgumentException request가 null인 경우
     */
    CompletableFuture<ListAliasesResponse> listCollectionAliases(RequestEnvelope<ListCollectionAliasesRequest> request);

    /**
     * 전체 별칭 목록 조회.
     *
     * @param request 조회 요청
     * @return (별칭, 컬렉션) 목록과 경과 시간
     * @throws IllegalArgumentException request가 null인 경우
     */
    CompletableFuture<ListAliasesResponse> listAliases(RequestEnvelope<ListAliasesRequest> request);
}
