/**
 * Transport status package.
 *
 * <p>Every failure that leaves the service is classified as a
 * {@link com.ryuqq.gateway.core.status.Status} and raised as a
 * {@link com.ryuqq.gateway.core.status.StatusException}.</p>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.status;
