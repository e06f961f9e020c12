/**
 * Dispatcher Adapter Layer - CollectionsService 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.adapter.dispatcher.DispatchingCollectionsService} - 서비스 포트 구현</li>
 *   <li>{@link com.ryuqq.gateway.adapter.dispatcher.CollectionOperationDispatcher} - 변경 작업 공통 파이프라인</li>
 *   <li>{@link com.ryuqq.gateway.adapter.dispatcher.CollectionQueryAdapter} - 조회 경로</li>
 *   <li>{@link com.ryuqq.gateway.adapter.dispatcher.CoordinatorErrorMapper} - 오류 분류 변환표</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-dispatcher (DispatchingCollectionsService)
 *   ↓ implements
 * application (CollectionsService interface)
 *   ↓ depends on
 * core (contract, operation, status)
 *   ↓ depends on
 * core/spi (CoordinatorClient interface)
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
package com.ryuqq.gateway.adapter.dispatcher;
