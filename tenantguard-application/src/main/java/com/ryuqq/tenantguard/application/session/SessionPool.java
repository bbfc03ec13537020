package com.ryuqq.tenantguard.application.session;

import com.ryuqq.tenantguard.application.registry.TenantEntry;
import com.ryuqq.tenantguard.application.registry.TenantRegistry;
import com.ryuqq.tenantguard.core.exception.OperationCancelledException;
import com.ryuqq.tenantguard.core.exception.PoolExhaustedException;
import com.ryuqq.tenantguard.core.exception.SessionBusyException;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.session.PoolStatus;
import com.ryuqq.tenantguard.core.session.SessionPoolConfig;
import com.ryuqq.tenantguard.core.session.SessionRecord;
import com.ryuqq.tenantguard.core.session.SessionSlot;
import com.ryuqq.tenantguard.core.session.SessionStats;
import com.ryuqq.tenantguard.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테넌트 세션 풀.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>테넌트당 열린 세션은 하나 (이미 있으면 대기 없이 {@link SessionBusyException})</li>
 *   <li>전체 동시 세션은 maxTotalConnections 이하 (공정 세마포어, acquireTimeout 초과 시 {@link PoolExhaustedException})</li>
 *   <li>sessionTimeout보다 오래 열린 세션은 {@link #reapStale()}에서 강제 회수되고 오류 1건으로 기록</li>
 * </ul>
 *
 * <p><strong>획득 순서:</strong></p>
 * <pre>
 * 1. 열린 슬롯이 있으면 즉시 SessionBusyException
 * 2. 전역 permit 획득 (acquireTimeout까지 대기)
 * 3. 슬롯 compare-and-set (경합에서 지면 permit 반환 후 SessionBusyException)
 * </pre>
 *
 * <p>permit은 슬롯이 OPEN에서 RELEASED로 전이되는 순간 정확히 한 번 반환됩니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class SessionPool {

    private static final Logger log = LoggerFactory.getLogger(SessionPool.class);

    private final SessionPoolConfig config;
    private final TenantRegistry registry;
    private final Clock clock;
    private final Semaphore permits;
    private final Deque<SessionRecord> history = new ArrayDeque<>();
    private final AtomicLong staleReclaimed = new AtomicLong();

    public SessionPool(SessionPoolConfig config, TenantRegistry registry, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.permits = new Semaphore(config.maxTotalConnections(), true);
    }

    /**
     * 세션 획득.
     *
     * @param tenantId 테넌트 ID
     * @return 열린 세션 슬롯
     * @throws SessionBusyException 테넌트가 이미 세션을 점유 중인 경우
     * @throws PoolExhaustedException acquireTimeout 안에 전역 슬롯을 얻지 못한 경우
     * @throws OperationCancelledException 대기 중 인터럽트된 경우
     */
    public SessionSlot acquireSession(TenantId tenantId) {
        TenantEntry entry = registry.entryFor(tenantId);
        if (entry.session().get() != null) {
            throw new SessionBusyException(tenantId);
        }

        boolean acquired;
        try {
            acquired = permits.tryAcquire(config.acquireTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(
                "Interrupted while waiting for a session slot for tenant " + tenantId.getValue(), e
            );
        }
        if (!acquired) {
            log.warn("Session pool exhausted for tenant {} (max: {}, timeout: {}ms)",
                tenantId.getValue(), config.maxTotalConnections(), config.acquireTimeoutMs());
            throw new PoolExhaustedException(tenantId, config.maxTotalConnections(), config.acquireTimeoutMs());
        }

        SessionSlot slot = new SessionSlot(tenantId, clock.instant(), clock.nanoTime());
        if (!entry.session().compareAndSet(null, slot)) {
            permits.release();
            throw new SessionBusyException(tenantId);
        }
        if (log.isDebugEnabled()) {
            log.debug("Session acquired for tenant {} (active: {})", tenantId.getValue(), activeSessions());
        }
        return slot;
    }

    /**
     * 테넌트의 현재 세션 반납.
     *
     * @param tenantId 테넌트 ID
     * @param stats 호출자가 보고하는 처리 통계
     * @return 반납 이력 (열린 세션이 없으면 empty)
     */
    public Optional<SessionRecord> releaseSession(TenantId tenantId, SessionStats stats) {
        Optional<SessionSlot> slot = getActiveSession(tenantId);
        if (slot.isEmpty()) {
            log.warn("Release requested for tenant {} without an open session", tenantId.getValue());
            return Optional.empty();
        }
        return release(slot.get(), stats);
    }

    /**
     * 특정 슬롯 반납.
     *
     * <p>이미 반납되었거나 강제 회수된 슬롯이면 아무것도 하지 않습니다.</p>
     *
     * @param slot 반납할 슬롯
     * @param stats 호출자가 보고하는 처리 통계
     * @return 반납 이력 (이미 반납된 슬롯이면 empty)
     */
    public Optional<SessionRecord> release(SessionSlot slot, SessionStats stats) {
        Objects.requireNonNull(slot, "slot cannot be null");
        Objects.requireNonNull(stats, "stats cannot be null");
        return finish(slot, stats, false);
    }

    public Optional<SessionSlot> getActiveSession(TenantId tenantId) {
        return registry.find(tenantId).map(entry -> entry.session().get());
    }

    /**
     * 오래된 세션 강제 회수.
     *
     * @return 회수한 세션 수
     */
    public int reapStale() {
        long now = clock.nanoTime();
        long timeoutNanos = Duration.ofMillis(config.sessionTimeoutMs()).toNanos();
        int reclaimed = 0;
        for (TenantEntry entry : registry.entries()) {
            SessionSlot slot = entry.session().get();
            if (slot == null || now - slot.getAcquiredAtNanos() <= timeoutNanos) {
                continue;
            }
            if (finish(slot, SessionStats.empty(), true).isPresent()) {
                reclaimed++;
                staleReclaimed.incrementAndGet();
                log.warn("Force-released stale session of tenant {} (acquired at {})",
                    slot.getTenantId().getValue(), slot.getAcquiredAt());
            }
        }
        return reclaimed;
    }

    /**
     * 풀 현황.
     *
     * @return 활성 세션 수와 최근 이력 평균
     */
    public PoolStatus getPoolStatus() {
        List<SessionRecord> recent = recentHistory();
        double durationSum = 0;
        double messageSum = 0;
        double channelSum = 0;
        long errorSum = 0;
        for (SessionRecord record : recent) {
            durationSum += record.durationMs();
            messageSum += record.messagesProcessed();
            channelSum += record.channelsProcessed();
            errorSum += record.errors();
        }
        int count = recent.size();
        int active = activeSessions();
        return new PoolStatus(
            active,
            config.maxTotalConnections(),
            permits.availablePermits(),
            (double) active / config.maxTotalConnections(),
            count,
            count == 0 ? 0.0 : durationSum / count,
            count == 0 ? 0.0 : messageSum / count,
            count == 0 ? 0.0 : channelSum / count,
            errorSum,
            staleReclaimed.get()
        );
    }

    /**
     * 반납 이력 (오래된 순).
     *
     * @return 이력 사본
     */
    public List<SessionRecord> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public SessionPoolConfig getConfig() {
        return config;
    }

    /**
     * 열린 슬롯 수.
     *
     * <p>permit 수로 계산하지 않습니다. CAS에서 지는 획득 시도가 잠깐 쥔 permit은 세션이 아닙니다.</p>
     */
    private int activeSessions() {
        int open = 0;
        for (TenantEntry entry : registry.entries()) {
            SessionSlot slot = entry.session().get();
            if (slot != null && slot.isOpen()) {
                open++;
            }
        }
        return open;
    }

    private Optional<SessionRecord> finish(SessionSlot slot, SessionStats stats, boolean forced) {
        if (!slot.markReleased()) {
            return Optional.empty();
        }
        try {
            slot.add(stats);
            if (forced) {
                slot.recordError();
            }
            Instant releasedAt = clock.instant();
            long durationMs = Duration.ofNanos(Math.max(0, clock.nanoTime() - slot.getAcquiredAtNanos())).toMillis();
            SessionRecord record = new SessionRecord(slot.getTenantId(), slot.getAcquiredAt(), releasedAt, durationMs,
                slot.getMessages(), slot.getChannels(), slot.getErrors(), forced);
            appendHistory(record);
            log.debug("Session released for tenant {} after {}ms (forced: {})",
                slot.getTenantId().getValue(), durationMs, forced);
            return Optional.of(record);
        } finally {
            registry.find(slot.getTenantId()).ifPresent(entry -> entry.session().compareAndSet(slot, null));
            permits.release();
        }
    }

    private void appendHistory(SessionRecord record) {
        synchronized (history) {
            history.addLast(record);
            while (history.size() > config.historySize()) {
                history.removeFirst();
            }
        }
    }

    private List<SessionRecord> recentHistory() {
        List<SessionRecord> all = getHistory();
        int from = Math.max(0, all.size() - config.recentWindowSize());
        return all.subList(from, all.size());
    }
}
