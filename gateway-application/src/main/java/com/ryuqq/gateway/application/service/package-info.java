/**
 * Gateway Application Layer - 컬렉션 관리 인바운드 포트.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.application.service.CollectionsService} - 컬렉션 관리 서비스</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-dispatcher 모듈에 위치</li>
 *   <li><strong>비블로킹:</strong> 모든 호출은 CompletableFuture 반환</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
package com.ryuqq.gateway.application.service;
