package com.ryuqq.gateway.adapter.dispatcher;

import com.ryuqq.gateway.application.response.CollectionOperationResponse;
import com.ryuqq.gateway.core.contract.RequestEnvelope;
import com.ryuqq.gateway.core.contract.WithTimeout;
import com.ryuqq.gateway.core.operation.CollectionMetaOperation;
import com.ryuqq.gateway.core.operation.ConversionResult;
import com.ryuqq.gateway.core.operation.OperationConvertible;
import com.ryuqq.gateway.core.spi.CoordinatorClient;
import com.ryuqq.gateway.core.status.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 변경 작업 디스패처.
 *
 * <p>모든 변경 요청(create, update, delete, update_aliases)이 거치는 공통 파이프라인입니다.
 * 요청 타입은 {@link WithTimeout}과 {@link OperationConvertible}만 구현하면 되며,
 * 새 작업 종류를 추가해도 이 클래스는 바뀌지 않습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Envelope에서 요청 꺼내기</li>
 *   <li>대기 타임아웃 추출</li>
 *   <li>시작 시각 기록 (단조 시계)</li>
 *   <li>요청 → CollectionMetaOperation 변환 (실패 시 INVALID_ARGUMENT, 제출 없음)</li>
 *   <li>코디네이터에 (작업, 타임아웃) 비동기 제출</li>
 *   <li>성공 시: 경과 시간 + 결과로 응답 생성</li>
 *   <li>실패 시: {@link CoordinatorErrorMapper} 변환표로 분류 후 전파 (재시도 없음)</li>
 * </ol>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>Stateless 설계: 코디네이터 참조 외 공유 상태 없음 (thread-safe)</li>
 *   <li>비블로킹: 호출 스레드는 코디네이터 완료를 기다리지 않음</li>
 *   <li>취소, 재시도, 타임아웃 강제는 하지 않음 (코디네이터 책임)</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class CollectionOperationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CollectionOperationDispatcher.class);

    private final CoordinatorClient coordinator;
    private final CoordinatorErrorMapper errorMapper;
    private final DispatcherConfig config;

    /**
     * 생성자 (기본 설정).
     *
     * @param coordinator 코디네이터 클라이언트
     * @throws IllegalArgumentException coordinator가 null인 경우
     */
    public CollectionOperationDispatcher(CoordinatorClient coordinator) {
        this(coordinator, new CoordinatorErrorMapper(), new DispatcherConfig());
    }

    /**
     * 생성자 (의존성 주입).
     *
     * @param coordinator 코디네이터 클라이언트
     * @param errorMapper 오류 변환기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CollectionOperationDispatcher(CoordinatorClient coordinator,
                                         CoordinatorErrorMapper errorMapper,
                                         DispatcherConfig config) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (errorMapper == null) {
            throw new IllegalArgumentException("errorMapper cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.coordinator = coordinator;
        this.errorMapper = errorMapper;
        this.config = config;
    }

    /**
     * 변경 요청 처리.
     *
     * @param request 요청 Envelope
     * @param <R> 타임아웃과 변환 능력을 가진 요청 타입
     * @return 응답 future (실패 시 StatusException으로 예외 완료)
     * @throws IllegalArgumentException request가 null인 경우
     */
    public <R extends WithTimeout & OperationConvertible> CompletableFuture<CollectionOperationResponse> perform(
        RequestEnvelope<R> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        // 1. 요청 꺼내기
        R operationRequest = request.message();

        // 2. 타임아웃 추출
        Optional<Duration> waitTimeout = operationRequest.waitTimeout();

        // 3. 시작 시각
        Stopwatch stopwatch = Stopwatch.start();

        // 4. 변환 (실패 시 제출 없이 종료)
        ConversionResult conversion = operationRequest.convert();
        if (conversion instanceof ConversionResult.Rejected rejected) {
            log.debug("Rejected {}: {}", operationRequest.getClass().getSimpleName(), rejected.status().description());
            return CompletableFuture.failedFuture(rejected.status().asException());
        }
        if (!(conversion instanceof ConversionResult.Converted converted)) {
            return CompletableFuture.failedFuture(Status.internal(
                operationRequest.getClass().getSimpleName() + " produced no conversion result").asException());
        }
        CollectionMetaOperation operation = converted.operation();

        // 5~7. 제출, 응답 생성, 오류 분류
        log.debug("Submitting {} (waitTimeout={})", operation.kind(), waitTimeout.orElse(null));
        return CoordinatorCall.invoke(
            errorMapper,
            () -> coordinator.submit(operation, waitTimeout),
            result -> {
                double elapsed = stopwatch.elapsedSeconds();
                reportIfSlow(operation.kind(), stopwatch);
                return CollectionOperationResponse.of(elapsed, result);
            });
    }

    private void reportIfSlow(String kind, Stopwatch stopwatch) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(stopwatch.elapsedNanos());
        if (elapsedMs > config.slowOperationThresholdMs()) {
            log.warn("Slow {}: {}ms (threshold: {}ms)", kind, elapsedMs, config.slowOperationThresholdMs());
        }
    }
}
