package com.ryuqq.tenantguard.adapter.runner;

import com.ryuqq.tenantguard.adapter.inmemory.bucket.InMemoryBucketStore;
import com.ryuqq.tenantguard.adapter.inmemory.metrics.InMemoryMetricsStore;
import com.ryuqq.tenantguard.application.config.TenantGuardConfigLoader;
import com.ryuqq.tenantguard.application.guard.TenantGuard;
import com.ryuqq.tenantguard.core.health.HealthStatus;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.time.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TenantGuardRuntime 통합 테스트.
 *
 * <p>In-Memory 저장소로 시작/종료 수명 주기를 검증합니다:</p>
 * <ul>
 *   <li>시작 시 저장된 스냅샷 복원</li>
 *   <li>세 가지 유지보수 작업 등록</li>
 *   <li>중복 시작 거부</li>
 *   <li>종료 시 스케줄러 정지</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
class TenantGuardRuntimeTest {

    private static final String RESOURCE = "tenantguard-runtime-test.properties";

    private ManualClock clock;
    private InMemoryMetricsStore metricsStore;
    private TenantGuardRuntime runtime;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        metricsStore = new InMemoryMetricsStore();
        runtime = newRuntime();
    }

    private TenantGuardRuntime newRuntime() {
        Properties properties = TenantGuardConfigLoader.readClasspath(RESOURCE);
        TenantGuard guard = TenantGuard.builder(TenantGuardConfigLoader.load(properties))
            .bucketStore(new InMemoryBucketStore())
            .clock(clock)
            .sleeper(clock)
            .build();
        return new TenantGuardRuntime(guard, metricsStore, MaintenanceConfig.fromProperties(properties));
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void start_유지보수_작업_세_개를_등록함() {
        // when
        runtime.start();

        // then
        assertThat(runtime.scheduler().getTasks())
            .extracting(ScheduledTask::getName)
            .containsExactly("stale-session-sweep", "idle-resource-sweep", "health-snapshot");
    }

    @Test
    void start_저장된_스냅샷으로_지표를_복원함() {
        // given: 이전 프로세스가 남긴 SUSPENDED 스냅샷
        TenantId tenantId = TenantId.of("bot-1");
        runtime.guard().healthMonitor().suspend(tenantId, "abuse report");
        runtime.persister().persistAll();
        runtime.close();
        runtime = newRuntime();

        // when
        runtime.start();

        // then
        assertThat(runtime.guard().healthMonitor().getMetrics(tenantId).orElseThrow().status())
            .isEqualTo(HealthStatus.SUSPENDED);
    }

    @Test
    void start_두_번_호출하면_IllegalStateException() {
        runtime.start();

        assertThatThrownBy(() -> runtime.start())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
    }

    @Test
    void close_스케줄러를_정지함() {
        // given
        runtime.start();

        // when
        runtime.close();

        // then
        assertThat(runtime.scheduler().isTerminated()).isTrue();
        assertThat(runtime.scheduler().getTasks()).allMatch(ScheduledTask::isCancelled);
    }
}
