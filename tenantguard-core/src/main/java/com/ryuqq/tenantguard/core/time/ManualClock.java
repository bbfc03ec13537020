package com.ryuqq.tenantguard.core.time;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 수동으로 진행시키는 시계 (테스트용).
 *
 * <p>{@link Sleeper}도 함께 구현하며, {@link #sleep(Duration)} 호출 시 실제로 대기하지 않고
 * 요청된 시간만큼 시계를 진행시킨 뒤 요청 값을 기록합니다. 덕분에 백오프 대기와
 * 레이트 리밋 대기를 실제 시간 소모 없이 검증할 수 있습니다.</p>
 *
 * <p>Thread-safety: 모든 메서드는 synchronized.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class ManualClock implements Clock, Sleeper {

    private final Instant epoch;
    private long nanos;
    private final List<Duration> sleeps = new ArrayList<>();

    /**
     * 지정된 벽시계 시각에서 시작하는 시계 생성.
     *
     * @param start 시작 시각
     */
    public ManualClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.epoch = start;
        this.nanos = 0L;
    }

    /**
     * 고정된 기준 시각(2025-01-01T00:00:00Z)에서 시작하는 시계 생성.
     */
    public ManualClock() {
        this(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Override
    public synchronized long nanoTime() {
        return nanos;
    }

    @Override
    public synchronized Instant instant() {
        return epoch.plusNanos(nanos);
    }

    /**
     * 시계 진행.
     *
     * @param delta 진행할 시간 (음수 불가)
     */
    public synchronized void advance(Duration delta) {
        if (delta == null || delta.isNegative()) {
            throw new IllegalArgumentException("delta must be non-negative (current: " + delta + ")");
        }
        nanos += delta.toNanos();
    }

    /**
     * 밀리초 단위 시계 진행.
     *
     * @param millis 진행할 밀리초
     */
    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    @Override
    public synchronized void sleep(Duration duration) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("sleep interrupted");
        }
        if (duration == null || duration.isNegative()) {
            return;
        }
        sleeps.add(duration);
        nanos += duration.toNanos();
    }

    /**
     * 지금까지 요청된 sleep 목록.
     *
     * @return 요청 순서대로의 대기 시간 목록 (복사본)
     */
    public synchronized List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }
}
