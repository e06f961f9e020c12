package com.ryuqq.gateway.core.spi;

import com.ryuqq.gateway.core.model.AliasRecord;
import com.ryuqq.gateway.core.model.CollectionInfo;
import com.ryuqq.gateway.core.model.CollectionSummary;
import com.ryuqq.gateway.core.operation.CollectionMetaOperation;
import com.ryuqq.gateway.core.outcome.OperationResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Collection Coordinator SPI.
 *
 * <p>컬렉션 수명 주기, 합의, 저장을 담당하는 외부 협력자입니다.
 * 게이트웨이는 이 인터페이스 외의 어떤 것에도 의존하지 않습니다.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: 여러 요청이 동시에 같은 인스턴스를 사용합니다</li>
 *   <li>Non-blocking: 모든 메서드는 즉시 future를 반환해야 합니다</li>
 *   <li>실패는 {@link CoordinatorException}으로 future를 예외 완료합니다</li>
 *   <li>타임아웃 상한 검증과 동시 변경 간 순서 보장은 구현체 책임입니다</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * coordinator.submit(new DeleteCollectionOperation(CollectionName.of("books")), Optional.of(Duration.ofSeconds(30)))
 *     .thenAccept(result -&gt; log.info("applied: {}", result.applied()));
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface CoordinatorClient {

    /**
     * 컬렉션 메타 작업 제출.
     *
     * @param operation 제출할 작업
     * @param waitTimeout 최대 대기 시간 (empty면 코디네이터 기본값)
     * @return 작업 결과 future
     */
    CompletableFuture<OperationResult> submit(CollectionMetaOperation operation, Optional<Duration> waitTimeout);

    /**
     * 전체 컬렉션 목록 조회.
     *
     * @return 컬렉션 요약 목록 future
     */
    CompletableFuture<List<CollectionSummary>> listCollections();

    /**
     * 전체 별칭 목록 조회.
     *
     * @return 별칭 매핑 목록 future
     */
    CompletableFuture<List<AliasRecord>> listAliases();

    /**
     * 특정 컬렉션을 가리키는 별칭 이름 목록 조회.
     *
     * @param collectionName 컬렉션 이름
     * @return 별칭 이름 목록 future
     */
    CompletableFuture<List<String>> collectionAliases(String collectionName);

    /**
     * 컬렉션 상세 정보 조회.
     *
     * @param collectionName 컬렉션 이름
     * @return 컬렉션 정보 future (없으면 NOT_FOUND로 예외 완료)
     */
    CompletableFuture<CollectionInfo> getCollectionInfo(String collectionName);
}
