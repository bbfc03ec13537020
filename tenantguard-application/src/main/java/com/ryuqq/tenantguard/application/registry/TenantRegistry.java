package com.ryuqq.tenantguard.application.registry;

import com.ryuqq.tenantguard.core.health.HealthMetrics;
import com.ryuqq.tenantguard.core.health.HealthMetricsSnapshot;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.tenantguard.core.protection.TenantCircuitBreaker;
import com.ryuqq.tenantguard.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테넌트별 상태 저장소.
 *
 * <p>엔트리는 처음 사용할 때 생성되고, {@link #removeIdle(Duration)} 정리에서 제거될 때까지 유지됩니다.
 * 프로세스 시작 시 한 번 생성하여 각 서비스에 전달합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class TenantRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);

    private final ConcurrentHashMap<TenantId, TenantEntry> entries = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig breakerConfig;
    private final Clock clock;

    public TenantRegistry(CircuitBreakerConfig breakerConfig, Clock clock) {
        this.breakerConfig = Objects.requireNonNull(breakerConfig, "breakerConfig cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * 테넌트 엔트리 조회 (없으면 생성) 후 활동 시각 갱신.
     *
     * @param tenantId 테넌트 ID
     * @return 엔트리
     */
    public TenantEntry entryFor(TenantId tenantId) {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        long now = clock.nanoTime();
        TenantEntry entry = entries.computeIfAbsent(tenantId, id -> newEntry(id, new HealthMetrics(id), now));
        entry.touch(now);
        return entry;
    }

    /**
     * 생성하지 않고 조회.
     *
     * @param tenantId 테넌트 ID
     * @return 엔트리 (없으면 empty)
     */
    public Optional<TenantEntry> find(TenantId tenantId) {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        return Optional.ofNullable(entries.get(tenantId));
    }

    /**
     * 현재 엔트리 목록 (약한 일관성 스냅샷).
     *
     * @return 엔트리 목록
     */
    public List<TenantEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }

    /**
     * 저장된 건강 지표로 엔트리 복원.
     *
     * <p>이미 요청을 기록한 엔트리가 있으면 실시간 지표를 유지하고 복원하지 않습니다.</p>
     *
     * @param snapshot 복원할 지표
     * @return 복원했으면 true
     */
    public boolean restore(HealthMetricsSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        long now = clock.nanoTime();
        AtomicBoolean restored = new AtomicBoolean();
        entries.compute(snapshot.tenantId(), (id, existing) -> {
            if (existing != null && existing.getMetrics().snapshot().totalRequests() > 0) {
                return existing;
            }
            restored.set(true);
            return newEntry(id, HealthMetrics.restore(snapshot), now);
        });
        return restored.get();
    }

    /**
     * 유휴 엔트리 제거.
     *
     * <p>마지막 활동 후 {@code idleTtl}이 지났고, 열린 세션이 없고, SUSPENDED가 아닌 엔트리만 제거합니다.
     * 판정과 제거는 키 단위로 원자적으로 수행되므로 동시에 생성/조회되는 엔트리는 제거되지 않습니다.</p>
     *
     * @param idleTtl 유휴 기준 시간
     * @return 제거된 엔트리 수
     */
    public int removeIdle(Duration idleTtl) {
        Objects.requireNonNull(idleTtl, "idleTtl cannot be null");
        long cutoff = clock.nanoTime() - idleTtl.toNanos();
        AtomicInteger removed = new AtomicInteger();
        for (TenantId tenantId : entries.keySet()) {
            entries.computeIfPresent(tenantId, (id, entry) -> {
                if (entry.isRemovable(cutoff)) {
                    removed.incrementAndGet();
                    return null;
                }
                return entry;
            });
        }
        if (removed.get() > 0) {
            log.info("Removed {} idle tenant entries (remaining: {})", removed.get(), entries.size());
        }
        return removed.get();
    }

    private TenantEntry newEntry(TenantId tenantId, HealthMetrics metrics, long nowNanos) {
        return new TenantEntry(tenantId, new TenantCircuitBreaker(tenantId, breakerConfig, clock), metrics, nowNanos);
    }
}
