/**
 * Wire request contract package.
 *
 * <p>Request records as the transport layer hands them over, plus the
 * {@link com.ryuqq.gateway.core.contract.RequestEnvelope} that carries them.</p>
 *
 * <h2>Mutating Requests</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.contract.CreateCollection}</li>
 *   <li>{@link com.ryuqq.gateway.core.contract.UpdateCollection}</li>
 *   <li>{@link com.ryuqq.gateway.core.contract.DeleteCollection}</li>
 *   <li>{@link com.ryuqq.gateway.core.contract.ChangeAliases}</li>
 * </ul>
 * <p>Each one implements {@link com.ryuqq.gateway.core.contract.WithTimeout} and
 * {@link com.ryuqq.gateway.core.operation.OperationConvertible}, which is all the
 * dispatcher needs to know about it.</p>
 *
 * <h2>Read Requests</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.contract.GetCollectionInfoRequest}</li>
 *   <li>{@link com.ryuqq.gateway.core.contract.ListCollectionsRequest}</li>
 *   <li>{@link com.ryuqq.gateway.core.contract.ListAliasesRequest}</li>
 *   <li>{@link com.ryuqq.gateway.core.contract.ListCollectionAliasesRequest}</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Wire fidelity:</strong> optional wire fields are nullable record components</li>
 *   <li><strong>Validation:</strong> shape errors are reported by {@code convert()}, not by constructors</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.contract;
