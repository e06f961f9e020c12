/**
 * In-memory coordinator adapter package.
 *
 * <p>Reference {@link com.ryuqq.gateway.core.spi.CoordinatorClient} implementation
 * for tests, demos and local development.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.adapter.inmemory.InMemoryCoordinatorClient} - Map-backed coordinator</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.adapter.inmemory;
