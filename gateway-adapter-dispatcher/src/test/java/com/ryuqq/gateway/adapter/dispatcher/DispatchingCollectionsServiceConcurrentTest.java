package com.ryuqq.gateway.adapter.dispatcher;

import com.ryuqq.gateway.application.response.CollectionOperationResponse;
import com.ryuqq.gateway.application.response.GetCollectionInfoResponse;
import com.ryuqq.gateway.application.service.CollectionsService;
import com.ryuqq.gateway.core.contract.CreateCollection;
import com.ryuqq.gateway.core.contract.GetCollectionInfoRequest;
import com.ryuqq.gateway.core.contract.RequestEnvelope;
import com.ryuqq.gateway.core.contract.VectorParamsMessage;
import com.ryuqq.gateway.core.model.CollectionConfig;
import com.ryuqq.gateway.core.model.CollectionInfo;
import com.ryuqq.gateway.core.model.CollectionStatus;
import com.ryuqq.gateway.core.operation.CreateCollectionOperation;
import com.ryuqq.gateway.testkit.stub.RecordingCoordinatorClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DispatchingCollectionsService 동시성 테스트.
 *
 * <p>서비스는 공유 가변 상태가 없으므로 동시 요청이 서로 간섭하지 않아야 합니다:</p>
 * <ul>
 *   <li>각 요청은 자신의 작업만 제출</li>
 *   <li>각 응답은 자신의 경과 시간을 보고</li>
 *   <li>코디네이터 대기 중에도 호출 스레드를 막지 않음</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class DispatchingCollectionsServiceConcurrentTest {

    private static final Duration COORDINATOR_DELAY = Duration.ofMillis(200);

    private RecordingCoordinatorClient coordinator;
    private CollectionsService service;

    @BeforeEach
    void setUp() {
        coordinator = new RecordingCoordinatorClient().withDelay(COORDINATOR_DELAY);
        service = new DispatchingCollectionsService(coordinator);
    }

    @Test
    void create_서로_다른_이름_2건_동시_호출_시_각자_정상_응답() throws Exception {
        // when
        CompletableFuture<CollectionOperationResponse> first = service.create(RequestEnvelope.of(create("a")));
        CompletableFuture<CollectionOperationResponse> second = service.create(RequestEnvelope.of(create("b")));

        // then
        assertThat(first.get(5, TimeUnit.SECONDS).result()).isTrue();
        assertThat(second.get(5, TimeUnit.SECONDS).result()).isTrue();
        assertThat(first.get().time()).isGreaterThanOrEqualTo(0.2);
        assertThat(second.get().time()).isGreaterThanOrEqualTo(0.2);
        assertThat(submittedNames()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void create_호출은_코디네이터_완료를_기다리지_않고_반환() {
        // when
        CompletableFuture<CollectionOperationResponse> future = service.create(RequestEnvelope.of(create("a")));

        // then
        assertThat(future).isNotDone();
        assertThat(coordinator.submitCount()).isEqualTo(1);
    }

    @Test
    void get_지연된_코디네이터_정보와_경과시간_반환() throws Exception {
        // given
        CollectionInfo info = new CollectionInfo(
            CollectionStatus.GREEN, 3L, new CollectionConfig(Map.of(), 1, 1, 1, false));
        coordinator.withCollectionInfo(info);

        // when
        CompletableFuture<GetCollectionInfoResponse> future =
            service.get(RequestEnvelope.of(new GetCollectionInfoRequest("books")));

        // then
        assertThat(future).isNotDone();
        GetCollectionInfoResponse response = future.get(5, TimeUnit.SECONDS);
        assertThat(response.result()).isEqualTo(info);
        assertThat(response.time()).isGreaterThanOrEqualTo(0.2);
        assertThat(coordinator.submitCount()).isZero();
    }

    @RepeatedTest(3)
    void create_10개_스레드_동시_호출_시_모두_정상_처리() throws Exception {
        // given
        int threadCount = 10;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<CompletableFuture<CollectionOperationResponse>>> submissions = new ArrayList<>();

        // when - 모든 스레드가 동시에 create 호출
        for (int i = 0; i < threadCount; i++) {
            String name = "collection-" + i;
            submissions.add(executorService.submit(() -> {
                startLatch.await();
                return service.create(RequestEnvelope.of(create(name)));
            }));
        }
        long start = System.nanoTime();
        startLatch.countDown();

        List<CollectionOperationResponse> responses = new ArrayList<>();
        for (Future<CompletableFuture<CollectionOperationResponse>> submission : submissions) {
            responses.add(submission.get(5, TimeUnit.SECONDS).get(5, TimeUnit.SECONDS));
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        executorService.shutdown();
        assertThat(executorService.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // then - 모든 응답 성공, 제출 내역은 요청과 1:1
        assertThat(responses).hasSize(threadCount).allMatch(CollectionOperationResponse::result);
        assertThat(submittedNames()).hasSize(threadCount).doesNotHaveDuplicates();
        // 지연이 겹쳐서 진행되어야 함
        assertThat(elapsedMs).isLessThan(COORDINATOR_DELAY.toMillis() * threadCount);
    }

    private List<String> submittedNames() {
        return coordinator.submissions().stream()
            .map(submission -> ((CreateCollectionOperation) submission.operation()).collectionName().getValue())
            .toList();
    }

    private static CreateCollection create(String name) {
        return new CreateCollection(
            name, Map.of("default", new VectorParamsMessage(4L, "Cosine")), null, null, null, null, null);
    }
}
