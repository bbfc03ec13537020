package com.ryuqq.tenantguard.application.config;

import com.ryuqq.tenantguard.core.retry.BackoffStrategy;
import com.ryuqq.tenantguard.core.retry.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TenantGuardConfigLoader, PropertiesReader 테스트.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
@DisplayName("TenantGuardConfigLoader 테스트")
class TenantGuardConfigLoaderTest {

    private static final String RESOURCE = "tenantguard-test.properties";

    @Test
    @DisplayName("클래스패스 리소스에서 모든 설정을 읽는다")
    void loadFromClasspath_전체_설정() {
        // when
        TenantGuardConfig config = TenantGuardConfigLoader.loadFromClasspath(RESOURCE);

        // then
        assertThat(config.rateLimiter().keyPrefix()).isEqualTo("tg:test");
        assertThat(config.rateLimiter().global().capacity()).isEqualTo(30);
        assertThat(config.rateLimiter().perTenant().refillRatePerSecond()).isEqualTo(1.0);
        assertThat(config.circuitBreaker().failureThreshold()).isEqualTo(5);
        assertThat(config.circuitBreaker().timeoutMs()).isEqualTo(60_000);
        assertThat(config.health().latencyEmaAlpha()).isEqualTo(0.3);
        assertThat(config.session().maxTotalConnections()).isEqualTo(50);
        assertThat(config.executor().asyncWorkers()).isEqualTo(8);
        assertThat(config.tenantIdleTtlMs()).isEqualTo(86_400_000);
    }

    @Test
    @DisplayName("분류별 재시도 정책과 전략 이름을 읽는다")
    void loadFromClasspath_재시도_정책() {
        TenantGuardConfig config = TenantGuardConfigLoader.loadFromClasspath(RESOURCE);

        RetryPolicy rateLimited = config.retry().rateLimited();
        assertThat(rateLimited.honorServerWait()).isTrue();
        assertThat(rateLimited.jitter()).isFalse();
        assertThat(config.retry().transientNetwork().baseDelayMs()).isEqualTo(500);
        assertThat(config.retry().unknown().strategy()).isEqualTo(BackoffStrategy.FIBONACCI);
    }

    @Test
    @DisplayName("값이 없으면 전체 키 이름과 함께 실패한다")
    void load_누락된_키() {
        // given
        Properties properties = TenantGuardConfigLoader.readClasspath(RESOURCE);
        properties.remove("tenantguard.session.history-size");

        // when & then
        assertThatThrownBy(() -> TenantGuardConfigLoader.load(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Missing required property: tenantguard.session.history-size");
    }

    @Test
    @DisplayName("형식이 틀리면 기대 타입과 현재 값을 알려준다")
    void load_형식_오류() {
        // given
        Properties properties = TenantGuardConfigLoader.readClasspath(RESOURCE);
        properties.setProperty("tenantguard.circuit-breaker.failure-threshold", "five");

        // when & then
        assertThatThrownBy(() -> TenantGuardConfigLoader.load(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tenantguard.circuit-breaker.failure-threshold")
            .hasMessageContaining("expected integer")
            .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("범위 검증은 각 설정 레코드가 수행한다")
    void load_범위_검증() {
        Properties properties = TenantGuardConfigLoader.readClasspath(RESOURCE);
        properties.setProperty("tenantguard.health.critical-error-rate", "0.1");

        assertThatThrownBy(() -> TenantGuardConfigLoader.load(properties))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("없는 리소스는 IllegalArgumentException")
    void loadFromClasspath_없는_리소스() {
        assertThatThrownBy(() -> TenantGuardConfigLoader.loadFromClasspath("missing.properties"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing.properties");
    }

    @Test
    @DisplayName("PropertiesReader는 값의 공백을 제거하고 boolean과 enum을 엄격히 읽는다")
    void propertiesReader_타입별_읽기() {
        // given
        Properties properties = new Properties();
        properties.setProperty("x.name", "  tenant  ");
        properties.setProperty("x.flag", "TRUE");
        properties.setProperty("x.bad-flag", "yes");
        properties.setProperty("x.strategy", "fixed");
        PropertiesReader reader = new PropertiesReader(properties, "x.");

        // then
        assertThat(reader.requireString("name")).isEqualTo("tenant");
        assertThat(reader.requireBoolean("flag")).isTrue();
        assertThat(reader.requireEnum("strategy", BackoffStrategy.class)).isEqualTo(BackoffStrategy.FIXED);
        assertThatThrownBy(() -> reader.requireBoolean("bad-flag"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("expected boolean");
    }
}
