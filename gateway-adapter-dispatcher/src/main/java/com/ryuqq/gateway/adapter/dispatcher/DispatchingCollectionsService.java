package com.ryuqq.gateway.adapter.dispatcher;

import com.ryuqq.gateway.application.response.CollectionOperationResponse;
import com.ryuqq.gateway.application.response.GetCollectionInfoResponse;
import com.ryuqq.gateway.application.response.ListAliasesResponse;
import com.ryuqq.gateway.application.response.ListCollectionsResponse;
import com.ryuqq.gateway.application.service.CollectionsService;
import com.ryuqq.gateway.core.contract.ChangeAliases;
import com.ryuqq.gateway.core.contract.CreateCollection;
import com.ryuqq.gateway.core.contract.DeleteCollection;
import com.ryuqq.gateway.core.contract.GetCollectionInfoRequest;
import com.ryuqq.gateway.core.contract.ListAliasesRequest;
import com.ryuqq.gateway.core.contract.ListCollectionAliasesRequest;
import com.ryuqq.gateway.core.contract.ListCollectionsRequest;
import com.ryuqq.gateway.core.contract.RequestEnvelope;
import com.ryuqq.gateway.core.contract.UpdateCollection;
import com.ryuqq.gateway.core.spi.CoordinatorClient;

import java.util.concurrent.CompletableFuture;

/**
 * {@link CollectionsService} 구현체.
 *
 * <p>변경 요청은 {@link CollectionOperationDispatcher}로, 조회 요청은
 * {@link CollectionQueryAdapter}로 위임합니다. 둘은 같은 코디네이터와 오류 변환기를 공유합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CollectionsService service = new DispatchingCollectionsService(coordinator);
 * CollectionOperationResponse response = service.create(RequestEnvelope.of(request)).join();
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class DispatchingCollectionsService implements CollectionsService {

    private final CollectionOperationDispatcher dispatcher;
    private final CollectionQueryAdapter queries;

    /**
     * 생성자 (기본 설정).
     *
     * @param coordinator 코디네이터 클라이언트
     * @throws IllegalArgumentException coordinator가 null인 경우
     */
    public DispatchingCollectionsService(CoordinatorClient coordinator) {
        this(coordinator, new DispatcherConfig());
    }

    /**
     * 생성자 (설정 주입).
     *
     * @param coordinator 코디네이터 클라이언트
     * @param config 디스패처 설정
     * @throws IllegalArgumentException coordinator 또는 config가 null인 경우
     */
    public DispatchingCollectionsService(CoordinatorClient coordinator, DispatcherConfig config) {
        CoordinatorErrorMapper errorMapper = new CoordinatorErrorMapper();
        this.dispatcher = new CollectionOperationDispatcher(coordinator, errorMapper, config);
        this.queries = new CollectionQueryAdapter(coordinator, errorMapper);
    }

    @Override
    public CompletableFuture<GetCollectionInfoResponse> get(RequestEnvelope<GetCollectionInfoRequest> request) {
        return queries.getCollectionInfo(request);
    }

    @Override
    public CompletableFuture<ListCollectionsResponse> list(RequestEnvelope<ListCollectionsRequest> request) {
        return queries.listCollections(request);
    }

    @Override
    public CompletableFuture<CollectionOperationResponse> create(RequestEnvelope<CreateCollection> request) {
        return dispatcher.perform(request);
    }

    @Override
    public CompletableFuture<CollectionOperationResponse> update(RequestEnvelope<UpdateCollection> request) {
        return dispatcher.perform(request);
    }

    @Override
    public CompletableFuture<CollectionOperationResponse> delete(RequestEnvelope<DeleteCollection> request) {
        return dispatcher.perform(request);
    }

    @Override
    public CompletableFuture<CollectionOperationResponse> updateAliases(RequestEnvelope<ChangeAliases> request) {
        return dispatcher.perform(request);
    }

    @Override
    public CompletableFuture<ListAliasesResponse> listCollectionAliases(
        RequestEnvelope<ListCollectionAliasesRequest> request) {
        return queries.listCollectionAliases(request);
    }

    @Override
    public CompletableFuture<ListAliasesResponse> listAliases(RequestEnvelope<ListAliasesRequest> request) {
        return queries.listAliases(request);
    }
}
