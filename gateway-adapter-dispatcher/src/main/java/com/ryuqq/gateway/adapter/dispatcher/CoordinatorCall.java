package com.ryuqq.gateway.adapter.dispatcher;

import com.ryuqq.gateway.core.status.Status;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 코디네이터 호출 1회를 감싸는 헬퍼.
 *
 * <p>동기 예외와 예외 완료를 같은 경로로 모아 {@link CoordinatorErrorMapper}로 분류합니다.
 * 결과 변환(shaper)에서 발생한 예외도 같은 방식으로 분류됩니다.</p>
 */
final class CoordinatorCall {

    private CoordinatorCall() {
    }

    static <T, R> CompletableFuture<R> invoke(CoordinatorErrorMapper errorMapper,
                                              Supplier<CompletableFuture<T>> call,
                                              Function<T, R> shaper) {
        CompletableFuture<T> pending;
        try {
            pending = call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(errorMapper.toException(e));
        }
        if (pending == null) {
            return CompletableFuture.failedFuture(
                Status.internal("coordinator returned no future").asException());
        }
        return pending
            .thenApply(shaper)
            .exceptionallyCompose(error -> CompletableFuture.failedFuture(errorMapper.toException(error)));
    }
}
