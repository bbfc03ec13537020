package com.ryuqq.tenantguard.application.breaker;

import com.ryuqq.tenantguard.application.registry.TenantEntry;
import com.ryuqq.tenantguard.application.registry.TenantRegistry;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.protection.CircuitBreaker;
import com.ryuqq.tenantguard.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.tenantguard.core.protection.CircuitBreakerState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 테넌트별 Circuit Breaker 조회/관리.
 *
 * <p>브레이커는 {@link TenantRegistry} 엔트리가 소유하며, 처음 조회할 때 CLOSED 상태로 생성됩니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class CircuitBreakerRegistry {

    private final TenantRegistry registry;

    public CircuitBreakerRegistry(TenantRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    /**
     * 테넌트 브레이커 조회 (없으면 생성).
     *
     * @param tenantId 테넌트 ID
     * @return 브레이커
     */
    public CircuitBreaker getBreaker(TenantId tenantId) {
        return registry.entryFor(tenantId).getBreaker();
    }

    /**
     * 테넌트 브레이커 상태 조회 (생성하지 않음).
     *
     * @param tenantId 테넌트 ID
     * @return 상태 스냅샷 (추적 중이 아니면 empty)
     */
    public Optional<CircuitBreakerSnapshot> getState(TenantId tenantId) {
        return registry.find(tenantId).map(entry -> entry.getBreaker().snapshot());
    }

    /**
     * 브레이커를 CLOSED로 강제 리셋.
     *
     * @param tenantId 테넌트 ID
     * @return 추적 중인 테넌트여서 리셋했으면 true
     */
    public boolean resetBreaker(TenantId tenantId) {
        Optional<TenantEntry> entry = registry.find(tenantId);
        entry.ifPresent(e -> e.getBreaker().reset());
        return entry.isPresent();
    }

    /**
     * 모든 브레이커 상태 (테넌트 ID 순).
     *
     * @return 테넌트별 스냅샷
     */
    public Map<TenantId, CircuitBreakerSnapshot> getAllStates() {
        Map<TenantId, CircuitBreakerSnapshot> states = new TreeMap<>();
        for (TenantEntry entry : registry.entries()) {
            states.put(entry.getTenantId(), entry.getBreaker().snapshot());
        }
        return states;
    }

    public List<TenantId> getOpenBreakers() {
        return tenantsIn(CircuitBreakerState.OPEN);
    }

    public List<TenantId> getHalfOpenBreakers() {
        return tenantsIn(CircuitBreakerState.HALF_OPEN);
    }

    private List<TenantId> tenantsIn(CircuitBreakerState state) {
        List<TenantId> tenants = new ArrayList<>();
        for (Map.Entry<TenantId, CircuitBreakerSnapshot> entry : getAllStates().entrySet()) {
            if (entry.getValue().state() == state) {
                tenants.add(entry.getKey());
            }
        }
        return tenants;
    }
}
