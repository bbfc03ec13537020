package com.ryuqq.tenantguard.application.guard;

import com.ryuqq.tenantguard.adapter.inmemory.bucket.InMemoryBucketStore;
import com.ryuqq.tenantguard.application.admin.TenantGuardAdmin;
import com.ryuqq.tenantguard.application.config.TenantGuardConfig;
import com.ryuqq.tenantguard.application.config.TenantGuardConfigLoader;
import com.ryuqq.tenantguard.core.health.HealthMetricsSnapshot;
import com.ryuqq.tenantguard.core.health.HealthStatus;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.protection.CircuitBreakerState;
import com.ryuqq.tenantguard.core.ratelimit.LimitScope;
import com.ryuqq.tenantguard.core.time.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TenantGuard 조립과 관리 API 테스트.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
@DisplayName("TenantGuard 테스트")
class TenantGuardTest {

    private static final TenantId TENANT = TenantId.of("bot-1");

    private TenantGuardConfig config;
    private ManualClock clock;

    @BeforeEach
    void setUp() {
        config = TenantGuardConfigLoader.loadFromClasspath("tenantguard-test.properties");
        clock = new ManualClock();
    }

    private TenantGuard build() {
        return TenantGuard.builder(config)
            .bucketStore(new InMemoryBucketStore())
            .clock(clock)
            .sleeper(clock)
            .random(() -> 0.5)
            .build();
    }

    @Test
    @DisplayName("BucketStore 없이 build하면 IllegalStateException")
    void build_BucketStore_필수() {
        assertThatThrownBy(() -> TenantGuard.builder(config).build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("bucketStore");
    }

    @Test
    @DisplayName("구성 요소는 같은 레지스트리를 공유한다")
    void build_구성_요소_공유() {
        try (TenantGuard guard = build()) {
            // when
            guard.executor().execute(TENANT, () -> "ok");

            // then
            assertThat(guard.registry().find(TENANT)).isPresent();
            assertThat(guard.breakers().getState(TENANT).orElseThrow().state()).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(guard.healthMonitor().getMetrics(TENANT).orElseThrow().successfulRequests()).isEqualTo(1);
            assertThat(guard.clock()).isSameAs(clock);
            assertThat(guard.config()).isSameAs(config);
        }
    }

    @Test
    @DisplayName("관리 API는 각 구성 요소의 상태를 노출한다")
    void admin_상태_조회와_조치() {
        try (TenantGuard guard = build()) {
            // given
            TenantGuardAdmin admin = guard.admin();
            guard.executor().execute(TENANT, () -> "ok");
            guard.sessionPool().acquireSession(TenantId.of("bot-2"));

            // when
            admin.suspend(TENANT, "abuse report");
            clock.advance(Duration.ofSeconds(1));

            // then
            assertThat(admin.getRateLimitStats(LimitScope.TENANT).allowedCount()).isEqualTo(1);
            assertThat(admin.getRateLimitStats(LimitScope.GLOBAL).totalBuckets()).isEqualTo(1);
            assertThat(admin.getUnhealthyTenants()).extracting(HealthMetricsSnapshot::tenantId).containsExactly(TENANT);
            assertThat(admin.getHealthSummary().count(HealthStatus.SUSPENDED)).isEqualTo(1);
            assertThat(admin.getPoolStatus().activeSessions()).isEqualTo(1);
            assertThat(admin.getAllBreakerStates()).containsOnlyKeys(TENANT, TenantId.of("bot-2"));

            assertThat(admin.resume(TENANT)).contains(HealthStatus.HEALTHY);
            assertThat(admin.getMetrics(TENANT).orElseThrow().status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(admin.resetBreaker(TENANT)).isTrue();
        }
    }
}
