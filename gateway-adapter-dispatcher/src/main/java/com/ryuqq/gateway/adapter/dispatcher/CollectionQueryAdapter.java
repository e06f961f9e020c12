package com.ryuqq.gateway.adapter.dispatcher;

import com.ryuqq.gateway.application.response.AliasDescription;
import com.ryuqq.gateway.application.response.GetCollectionInfoResponse;
import com.ryuqq.gateway.application.response.ListAliasesResponse;
import com.ryuqq.gateway.application.response.ListCollectionsResponse;
import com.ryuqq.gateway.core.contract.GetCollectionInfoRequest;
import com.ryuqq.gateway.core.contract.ListAliasesRequest;
import com.ryuqq.gateway.core.contract.ListCollectionAliasesRequest;
import com.ryuqq.gateway.core.contract.ListCollectionsRequest;
import com.ryuqq.gateway.core.contract.RequestEnvelope;
import com.ryuqq.gateway.core.spi.CoordinatorClient;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 조회 경로 어댑터.
 *
 * <p>변환 단계와 타임아웃 없이 코디네이터를 직접 호출하고, 결과에 경과 시간을 붙입니다.
 * 실패 분류는 {@link CollectionOperationDispatcher}와 같은 {@link CoordinatorErrorMapper}를 사용합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class CollectionQueryAdapter {

    private final CoordinatorClient coordinator;
    private final CoordinatorErrorMapper errorMapper;

    public CollectionQueryAdapter(CoordinatorClient coordinator) {
        this(coordinator, new CoordinatorErrorMapper());
    }

    public CollectionQueryAdapter(CoordinatorClient coordinator, CoordinatorErrorMapper errorMapper) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (errorMapper == null) {
            throw new IllegalArgumentException("errorMapper cannot be null");
        }
        this.coordinator = coordinator;
        this.errorMapper = errorMapper;
    }

    public CompletableFuture<GetCollectionInfoResponse> getCollectionInfo(RequestEnvelope<GetCollectionInfoRequest> request) {
        String collectionName = requireRequest(request).message().collectionName();
        Stopwatch stopwatch = Stopwatch.start();
        return CoordinatorCall.invoke(
            errorMapper,
            () -> coordinator.getCollectionInfo(collectionName),
            info -> new GetCollectionInfoResponse(info, stopwatch.elapsedSeconds()));
    }

    public CompletableFuture<ListCollectionsResponse> listCollections(RequestEnvelope<ListCollectionsRequest> request) {
        requireRequest(request);
        Stopwatch stopwatch = Stopwatch.start();
        return CoordinatorCall.invoke(
            errorMapper,
            coordinator::listCollections,
            summaries -> ListCollectionsResponse.of(stopwatch.elapsedSeconds(), summaries));
    }

    public CompletableFuture<ListAliasesResponse> listAliases(RequestEnvelope<ListAliasesRequest> request) {
        requireRequest(request);
        Stopwatch stopwatch = Stopwatch.start();
        return CoordinatorCall.invoke(
            errorMapper,
            coordinator::listAliases,
            records -> {
                double elapsed = stopwatch.elapsedSeconds();
                List<AliasDescription> aliases = records.stream()
                    .map(AliasDescription::from)
                    .toList();
                return new ListAliasesResponse(aliases, elapsed);
            });
    }

    /**
     * 특정 컬렉션의 별칭 목록 조회.
     *
     * <p>각 항목의 컬렉션 이름은 코디네이터 응답이 아니라 요청에서 받은 값을 그대로 사용합니다.</p>
     *
     * @param request 조회 요청
     * @return (별칭, 요청한 컬렉션 이름) 목록과 경과 시간
     */
    public CompletableFuture<ListAliasesResponse> listCollectionAliases(
        RequestEnvelope<ListCollectionAliasesRequest> request) {
        String collectionName = requireRequest(request).message().collectionName();
        Stopwatch stopwatch = Stopwatch.start();
        return CoordinatorCall.invoke(
            errorMapper,
            () -> coordinator.collectionAliases(collectionName),
            aliasNames -> {
                double elapsed = stopwatch.elapsedSeconds();
                // TODO: cross-check collectionName against the coordinator's own alias records once listAliases exposes them per collection
                List<AliasDescription> aliases = aliasNames.stream()
                    .map(aliasName -> new AliasDescription(aliasName, collectionName))
                    .toList();
                return new ListAliasesResponse(aliases, elapsed);
            });
    }

    private static <T> RequestEnvelope<T> requireRequest(RequestEnvelope<T> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return request;
    }
}
