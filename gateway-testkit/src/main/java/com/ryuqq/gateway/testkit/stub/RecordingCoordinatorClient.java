package com.ryuqq.gateway.testkit.stub;

import com.ryuqq.gateway.core.model.AliasRecord;
import com.ryuqq.gateway.core.model.CollectionInfo;
import com.ryuqq.gateway.core.model.CollectionSummary;
import com.ryuqq.gateway.core.operation.CollectionMetaOperation;
import com.ryuqq.gateway.core.outcome.OperationResult;
import com.ryuqq.gateway.core.spi.CoordinatorClient;
import com.ryuqq.gateway.core.spi.CoordinatorException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 호출을 기록하는 스텁 {@link CoordinatorClient}.
 *
 * <p>응답, 지연, 실패를 미리 설정하고 호출 횟수와 제출 내역을 검증하는 데 사용합니다.
 * 지연은 {@link CompletableFuture#delayedExecutor(long, TimeUnit)}로 구현하여 호출 스레드를 막지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RecordingCoordinatorClient coordinator = new RecordingCoordinatorClient()
 *     .withDelay(Duration.ofMillis(100))
 *     .withCollectionAliases("books", "a", "b");
 *
 * // ... 서비스 호출 ...
 *
 * assertThat(coordinator.submitCount()).isZero();
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class RecordingCoordinatorClient implements CoordinatorClient {

    /**
     * 제출 1건.
     *
     * @param operation 제출된 작업
     * @param waitTimeout 함께 전달된 타임아웃
     */
    public record Submission(CollectionMetaOperation operation, Optional<Duration> waitTimeout) {
    }

    private final List<Submission> submissions = new CopyOnWriteArrayList<>();
    private final AtomicInteger submitCount = new AtomicInteger();
    private final AtomicInteger readCount = new AtomicInteger();
    private final Map<String, List<String>> collectionAliases = new ConcurrentHashMap<>();

    private volatile long delayMs;
    private volatile RuntimeException failure;
    private volatile OperationResult result = OperationResult.success();
    private volatile List<CollectionSummary> collections = List.of();
    private volatile List<AliasRecord> aliases = List.of();
    private volatile CollectionInfo collectionInfo;

    /**
     * 모든 호출을 지정한 시간만큼 늦게 완료.
     *
     * @param delay 지연 시간 (0 이상)
     * @return this
     */
    public RecordingCoordinatorClient withDelay(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative (current: " + delay + ")");
        }
        this.delayMs = delay.toMillis();
        return this;
    }

    /**
     * 모든 호출을 지정한 예외로 실패시킴.
     *
     * @param failure 예외 완료 값 (null이면 실패 해제)
     * @return this
     */
    public RecordingCoordinatorClient failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public RecordingCoordinatorClient returning(OperationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        this.result = result;
        return this;
    }

    public RecordingCoordinatorClient withCollections(String... names) {
        this.collections = Arrays.stream(names).map(CollectionSummary::new).toList();
        return this;
    }

    public RecordingCoordinatorClient withAliases(List<AliasRecord> aliases) {
        this.aliases = List.copyOf(aliases);
        return this;
    }

    public RecordingCoordinatorClient withCollectionAliases(String collectionName, String... aliasNames) {
        this.collectionAliases.put(collectionName, List.of(aliasNames));
        return this;
    }

    public RecordingCoordinatorClient withCollectionInfo(CollectionInfo collectionInfo) {
        this.collectionInfo = collectionInfo;
        return this;
    }

    @Override
    public CompletableFuture<OperationResult> submit(CollectionMetaOperation operation, Optional<Duration> waitTimeout) {
        submitCount.incrementAndGet();
        submissions.add(new Submission(operation, waitTimeout));
        return respond(() -> result);
    }

    @Override
    public CompletableFuture<List<CollectionSummary>> listCollections() {
        readCount.incrementAndGet();
        return respond(() -> collections);
    }

    @Override
    public CompletableFuture<List<AliasRecord>> listAliases() {
        readCount.incrementAndGet();
        return respond(() -> aliases);
    }

    @Override
    public CompletableFuture<List<String>> collectionAliases(String collectionName) {
        readCount.incrementAndGet();
        return respond(() -> collectionAliases.getOrDefault(collectionName, List.of()));
    }

    @Override
    public CompletableFuture<CollectionInfo> getCollectionInfo(String collectionName) {
        readCount.incrementAndGet();
        return respond(() -> {
            CollectionInfo info = collectionInfo;
            if (info == null) {
                throw CoordinatorException.notFound("Collection `" + collectionName + "` doesn't exist!");
            }
            return info;
        });
    }

    /**
     * submit 호출 횟수.
     *
     * @return 호출 횟수
     */
    public int submitCount() {
        return submitCount.get();
    }

    /**
     * 조회 메서드 호출 횟수 합계.
     *
     * @return 호출 횟수
     */
    public int readCount() {
        return readCount.get();
    }

    /**
     * 제출 내역 (제출 순서).
     *
     * @return 제출 내역 스냅샷
     */
    public List<Submission> submissions() {
        return List.copyOf(submissions);
    }

    /**
     * 마지막 제출.
     *
     * @return 마지막 제출
     * @throws IllegalStateException 제출 내역이 없는 경우
     */
    public Submission lastSubmission() {
        List<Submission> snapshot = submissions();
        if (snapshot.isEmpty()) {
            throw new IllegalStateException("no submission recorded");
        }
        return snapshot.get(snapshot.size() - 1);
    }

    private <T> CompletableFuture<T> respond(Supplier<T> value) {
        CompletableFuture<T> future = new CompletableFuture<>();
        Runnable complete = () -> {
            RuntimeException configuredFailure = failure;
            if (configuredFailure != null) {
                future.completeExceptionally(configuredFailure);
                return;
            }
            try {
                future.complete(value.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        };
        long delay = delayMs;
        if (delay > 0) {
            CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS).execute(complete);
        } else {
            complete.run();
        }
        return future;
    }
}
