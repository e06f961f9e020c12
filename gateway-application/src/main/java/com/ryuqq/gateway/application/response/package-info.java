/**
 * Service response package.
 *
 * <p>Every response pairs its payload with {@code time}: the wall-clock
 * duration of the coordinator call in seconds.</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.application.response.CollectionOperationResponse} - Mutation result</li>
 *   <li>{@link com.ryuqq.gateway.application.response.GetCollectionInfoResponse} - Collection details</li>
 *   <li>{@link com.ryuqq.gateway.application.response.ListCollectionsResponse} - Collection names</li>
 *   <li>{@link com.ryuqq.gateway.application.response.ListAliasesResponse} - Alias to collection pairs</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.application.response;
