package com.ryuqq.tenantguard.core.time;

import java.time.Duration;

/**
 * {@link Thread#sleep(long, int)} 기반 {@link Sleeper} 구현.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        Thread.sleep(duration.toMillis(), (int) (duration.toNanos() % 1_000_000L));
    }
}
