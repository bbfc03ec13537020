/**
 * In-memory health snapshot history.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.adapter.inmemory.metrics;
