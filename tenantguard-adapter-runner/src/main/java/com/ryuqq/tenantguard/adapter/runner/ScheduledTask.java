package com.ryuqq.tenantguard.adapter.runner;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MaintenanceScheduler}에 등록된 주기 작업의 취소 핸들.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class ScheduledTask {

    private final String name;
    private final AtomicLong runs = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile ScheduledFuture<?> future;

    ScheduledTask(String name) {
        this.name = name;
    }

    void bind(ScheduledFuture<?> future) {
        this.future = future;
    }

    void recordRun() {
        runs.incrementAndGet();
    }

    void recordFailure() {
        failures.incrementAndGet();
    }

    /**
     * 이후 실행 취소. 실행 중인 회차는 끝까지 진행됩니다.
     *
     * @return 이 호출로 취소되었으면 true
     */
    public boolean cancel() {
        ScheduledFuture<?> current = future;
        return current != null && current.cancel(false);
    }

    public boolean isCancelled() {
        ScheduledFuture<?> current = future;
        return current != null && current.isCancelled();
    }

    public String getName() {
        return name;
    }

    /**
     * 완료된 실행 횟수 (실패 포함).
     */
    public long getRuns() {
        return runs.get();
    }

    public long getFailures() {
        return failures.get();
    }
}
