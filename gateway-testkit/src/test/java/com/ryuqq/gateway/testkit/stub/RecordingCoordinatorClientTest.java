package com.ryuqq.gateway.testkit.stub;

import com.ryuqq.gateway.core.model.AliasRecord;
import com.ryuqq.gateway.core.model.CollectionConfig;
import com.ryuqq.gateway.core.model.CollectionInfo;
import com.ryuqq.gateway.core.model.CollectionName;
import com.ryuqq.gateway.core.model.CollectionStatus;
import com.ryuqq.gateway.core.model.CollectionSummary;
import com.ryuqq.gateway.core.operation.DeleteCollectionOperation;
import com.ryuqq.gateway.core.outcome.OperationResult;
import com.ryuqq.gateway.core.spi.CoordinatorErrorKind;
import com.ryuqq.gateway.core.spi.CoordinatorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RecordingCoordinatorClient 유닛 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class RecordingCoordinatorClientTest {

    private RecordingCoordinatorClient coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new RecordingCoordinatorClient();
    }

    @Test
    void submit_호출시_작업과_타임아웃을_기록() throws Exception {
        // given
        DeleteCollectionOperation operation = new DeleteCollectionOperation(CollectionName.of("books"));

        // when
        OperationResult result = coordinator.submit(operation, Optional.of(Duration.ofSeconds(7))).get();

        // then
        assertThat(result.applied()).isTrue();
        assertThat(coordinator.submitCount()).isEqualTo(1);
        assertThat(coordinator.lastSubmission().operation()).isEqualTo(operation);
        assertThat(coordinator.lastSubmission().waitTimeout()).contains(Duration.ofSeconds(7));
    }

    @Test
    void returning_설정시_해당_결과로_완료() throws Exception {
        // given
        coordinator.returning(OperationResult.failure());

        // when
        OperationResult result = coordinator
            .submit(new DeleteCollectionOperation(CollectionName.of("books")), Optional.empty()).get();

        // then
        assertThat(result.applied()).isFalse();
    }

    @Test
    void withDelay_설정시_지연_후_완료() throws Exception {
        // given
        coordinator.withDelay(Duration.ofMillis(100));
        long start = System.nanoTime();

        // when
        CompletableFuture<List<String>> future = coordinator.collectionAliases("books");

        // then
        assertThat(future).isNotDone();
        future.get(5, TimeUnit.SECONDS);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(100);
    }

    @Test
    void failingWith_설정시_모든_호출이_예외로_완료() {
        // given
        CoordinatorException failure = new CoordinatorException(CoordinatorErrorKind.UNAVAILABLE, "down");
        coordinator.failingWith(failure);

        // when & then
        assertThatThrownBy(() -> coordinator.listCollections().get())
            .isInstanceOf(ExecutionException.class)
            .hasCause(failure);
        assertThatThrownBy(() -> coordinator.submit(
                new DeleteCollectionOperation(CollectionName.of("books")), Optional.empty()).get())
            .hasCause(failure);
        assertThat(coordinator.submitCount()).isEqualTo(1);
    }

    @Test
    void 미리_설정한_조회_결과를_반환() throws Exception {
        // given
        coordinator
            .withCollections("a", "b")
            .withAliases(List.of(new AliasRecord("x", "a")))
            .withCollectionAliases("a", "x", "y");

        // when & then
        assertThat(coordinator.listCollections().get()).extracting(CollectionSummary::name).containsExactly("a", "b");
        assertThat(coordinator.listAliases().get()).containsExactly(new AliasRecord("x", "a"));
        assertThat(coordinator.collectionAliases("a").get()).containsExactly("x", "y");
        assertThat(coordinator.collectionAliases("b").get()).isEmpty();
        assertThat(coordinator.readCount()).isEqualTo(4);
    }

    @Test
    void getCollectionInfo_설정한_정보를_반환() throws Exception {
        // given
        CollectionInfo info = new CollectionInfo(
            CollectionStatus.YELLOW, 7L, new CollectionConfig(Map.of(), 1, 2, 1, true));
        coordinator.withCollectionInfo(info);

        // when
        CollectionInfo result = coordinator.getCollectionInfo("books").get(5, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo(info);
        assertThat(coordinator.readCount()).isEqualTo(1);
    }

    @Test
    void getCollectionInfo_미설정시_NOT_FOUND로_완료() {
        // when & then
        assertThatThrownBy(() -> coordinator.getCollectionInfo("books").get())
            .isInstanceOf(ExecutionException.class)
            .satisfies(e -> assertThat(((CoordinatorException) e.getCause()).getKind())
                .isEqualTo(CoordinatorErrorKind.NOT_FOUND));
    }

    @Test
    void lastSubmission_기록이_없으면_예외() {
        assertThatThrownBy(() -> coordinator.lastSubmission())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void withDelay_음수면_예외() {
        assertThatThrownBy(() -> coordinator.withDelay(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("delay must be non-negative");
    }
}
