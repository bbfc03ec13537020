package com.ryuqq.tenantguard.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 감독되는 주기 작업 스케줄러.
 *
 * <p>등록한 작업마다 취소 핸들({@link ScheduledTask})을 돌려주며, {@link #shutdown()}은 모든 작업을 취소하고
 * 실행 중인 회차가 끝날 때까지 기다립니다.</p>
 *
 * <p><strong>예외 처리:</strong> 작업이 던진 예외는 error로 기록하고 다음 회차를 계속 실행합니다.
 * ({@link ScheduledExecutorService}는 예외가 빠져나가면 이후 실행을 조용히 중단합니다.)</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ScheduledExecutorService executor;
    private final long shutdownTimeoutMs;
    private final List<ScheduledTask> tasks = new CopyOnWriteArrayList<>();

    /**
     * 생성자.
     *
     * @param threads 작업 스레드 수
     * @param shutdownTimeoutMs 종료 대기 시간 (밀리초)
     */
    public MaintenanceScheduler(int threads, long shutdownTimeoutMs) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive (current: " + threads + ")");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
        this.executor = Executors.newScheduledThreadPool(threads, new MaintenanceThreadFactory());
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    /**
     * 고정 간격 주기 작업 등록.
     *
     * <p>이전 회차가 끝난 뒤 {@code interval}만큼 쉬고 다음 회차를 실행합니다.</p>
     *
     * @param name 작업 이름 (로그용)
     * @param interval 실행 간격
     * @param task 작업
     * @return 취소 핸들
     * @throws IllegalStateException 이미 종료된 경우
     */
    public ScheduledTask schedule(String name, Duration interval, Runnable task) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(interval, "interval cannot be null");
        Objects.requireNonNull(task, "task cannot be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }

        ScheduledTask handle = new ScheduledTask(name);
        long intervalMs = interval.toMillis();
        try {
            handle.bind(executor.scheduleWithFixedDelay(() -> runSupervised(handle, task),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("MaintenanceScheduler is shut down", e);
        }
        tasks.add(handle);
        log.info("Scheduled maintenance task '{}' every {}ms", name, intervalMs);
        return handle;
    }

    /**
     * 모든 작업 취소 후 종료 대기.
     *
     * <p>shutdownTimeout 안에 끝나지 않으면 실행 중인 작업을 인터럽트합니다.</p>
     */
    public void shutdown() {
        for (ScheduledTask task : tasks) {
            task.cancel();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Maintenance tasks did not finish within {}ms, interrupting", shutdownTimeoutMs);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Maintenance scheduler stopped ({} tasks)", tasks.size());
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    public List<ScheduledTask> getTasks() {
        return List.copyOf(tasks);
    }

    @Override
    public void close() {
        shutdown();
    }

    private static void runSupervised(ScheduledTask handle, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            handle.recordFailure();
            log.error("Maintenance task '{}' failed", handle.getName(), e);
        } finally {
            handle.recordRun();
        }
    }

    private static final class MaintenanceThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tenantguard-maintenance-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
