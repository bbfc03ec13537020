package com.ryuqq.tenantguard.core.session;

import com.ryuqq.tenantguard.core.model.TenantId;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 테넌트가 점유한 세션 하나.
 *
 * <p>테넌트당 OPEN 슬롯은 최대 하나입니다. 상태 전이(OPEN → RELEASED)는 한 번만 성공하며,
 * {@link #markReleased()}의 반환값으로 정상 반납과 강제 회수 중 먼저 도착한 쪽을 가립니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class SessionSlot {

    private final TenantId tenantId;
    private final Instant acquiredAt;
    private final long acquiredAtNanos;
    private final AtomicReference<SessionStatus> status = new AtomicReference<>(SessionStatus.OPEN);
    private final AtomicInteger messages = new AtomicInteger();
    private final AtomicInteger channels = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();

    public SessionSlot(TenantId tenantId, Instant acquiredAt, long acquiredAtNanos) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId cannot be null");
        this.acquiredAt = Objects.requireNonNull(acquiredAt, "acquiredAt cannot be null");
        this.acquiredAtNanos = acquiredAtNanos;
    }

    public void recordMessage() {
        messages.incrementAndGet();
    }

    public void recordChannel() {
        channels.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    /**
     * 호출자가 보고한 통계를 누적.
     *
     * @param stats 추가할 통계
     */
    public void add(SessionStats stats) {
        messages.addAndGet(stats.messagesProcessed());
        channels.addAndGet(stats.channelsProcessed());
        errors.addAndGet(stats.errors());
    }

    /**
     * RELEASED로 전이.
     *
     * @return 이 호출이 전이시켰으면 true, 이미 반납된 슬롯이면 false
     */
    public boolean markReleased() {
        return status.compareAndSet(SessionStatus.OPEN, SessionStatus.RELEASED);
    }

    public boolean isOpen() {
        return status.get() == SessionStatus.OPEN;
    }

    public SessionStatus getStatus() {
        return status.get();
    }

    public TenantId getTenantId() {
        return tenantId;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public long getAcquiredAtNanos() {
        return acquiredAtNanos;
    }

    public int getMessages() {
        return messages.get();
    }

    public int getChannels() {
        return channels.get();
    }

    public int getErrors() {
        return errors.get();
    }
}
