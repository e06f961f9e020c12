/**
 * Collection domain model package.
 *
 * <p>Value objects and records shared by the request contracts, the internal
 * operation model and the coordinator SPI.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.model.CollectionName} - Validated collection name</li>
 *   <li>{@link com.ryuqq.gateway.core.model.AliasName} - Validated alias name</li>
 * </ul>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.model.CollectionConfig} - Creation config</li>
 *   <li>{@link com.ryuqq.gateway.core.model.CollectionParamsDiff} - Update delta</li>
 *   <li>{@link com.ryuqq.gateway.core.model.CollectionInfo} - Collection details returned by the coordinator</li>
 *   <li>{@link com.ryuqq.gateway.core.model.AliasRecord} - Alias to collection mapping held by the coordinator</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.model;
