/**
 * Coordinator stubs for gateway tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.gateway.testkit.stub.RecordingCoordinatorClient} - Call-counting, delay and failure injecting stub</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.testkit.stub;
