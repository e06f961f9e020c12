/**
 * Coordinator SPI package.
 *
 * <p>The single outbound boundary of the gateway.</p>
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.spi.CoordinatorClient} - Asynchronous coordinator operations</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.spi.CoordinatorException} - Classified coordinator failure</li>
 *   <li>{@link com.ryuqq.gateway.core.spi.CoordinatorErrorKind} - Failure classification</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.spi;
