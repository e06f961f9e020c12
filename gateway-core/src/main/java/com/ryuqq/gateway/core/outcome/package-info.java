/**
 * 코디네이터 작업 결과 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.outcome.OperationResult} - 변경 작업 제출 결과</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
package com.ryuqq.gateway.core.outcome;
