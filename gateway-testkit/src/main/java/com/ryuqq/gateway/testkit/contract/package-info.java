/**
 * Contract test base classes.
 *
 * <h2>Purpose</h2>
 * <p>Lets every {@link com.ryuqq.gateway.core.spi.CoordinatorClient} implementation run
 * the same behavioural suite by extending
 * {@link com.ryuqq.gateway.testkit.contract.AbstractCoordinatorClientContractTest}.</p>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.testkit.contract;
