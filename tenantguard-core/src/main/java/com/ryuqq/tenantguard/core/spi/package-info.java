/**
 * Service Provider Interfaces for external storage.
 *
 * <ul>
 *   <li>{@link com.ryuqq.tenantguard.core.spi.BucketStore} - atomic token bucket storage</li>
 *   <li>{@link com.ryuqq.tenantguard.core.spi.MetricsStore} - health snapshot history</li>
 * </ul>
 *
 * <p>In-memory implementations are provided by the {@code tenantguard-adapter-inmemory} module.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.spi;
