package com.ryuqq.tenantguard.core.time;

import java.time.Instant;

/**
 * 시스템 시계 기반 {@link Clock} 구현.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class SystemClock implements Clock {

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public Instant instant() {
        return Instant.now();
    }
}
