package com.ryuqq.tenantguard.application.config;

import com.ryuqq.tenantguard.application.executor.GuardedExecutorConfig;
import com.ryuqq.tenantguard.core.health.HealthThresholds;
import com.ryuqq.tenantguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.tenantguard.core.ratelimit.BucketConfig;
import com.ryuqq.tenantguard.core.ratelimit.RateLimiterConfig;
import com.ryuqq.tenantguard.core.retry.BackoffStrategy;
import com.ryuqq.tenantguard.core.retry.RetryPolicies;
import com.ryuqq.tenantguard.core.retry.RetryPolicy;
import com.ryuqq.tenantguard.core.session.SessionPoolConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * {@link Properties}에서 {@link TenantGuardConfig}를 읽는 로더.
 *
 * <p>모든 키는 {@code tenantguard.} 접두사 아래에 있으며 필수입니다.</p>
 *
 * <pre>
 * tenantguard.rate-limit.key-prefix=tenantguard
 * tenantguard.rate-limit.global.capacity=30
 * tenantguard.rate-limit.global.refill-rate=30
 * tenantguard.rate-limit.tenant.capacity=20
 * tenantguard.rate-limit.tenant.refill-rate=1
 * tenantguard.rate-limit.idle-bucket-ttl-ms=3600000
 * tenantguard.circuit-breaker.failure-threshold=5
 * tenantguard.circuit-breaker.success-threshold=2
 * tenantguard.circuit-breaker.timeout-ms=60000
 * tenantguard.retry.rate-limited.max-retries=3        (transient-network, unknown 동일 구조)
 * tenantguard.retry.rate-limited.base-delay-ms=1000
 * tenantguard.retry.rate-limited.max-delay-ms=60000
 * tenantguard.retry.rate-limited.strategy=exponential
 * tenantguard.retry.rate-limited.exponential-base=2.0
 * tenantguard.retry.rate-limited.jitter=false
 * tenantguard.retry.rate-limited.honor-server-wait=true
 * tenantguard.health.max-consecutive-failures=5
 * tenantguard.health.warning-error-rate=0.2
 * tenantguard.health.critical-error-rate=0.5
 * tenantguard.health.warning-latency-ms=2000
 * tenantguard.health.critical-latency-ms=5000
 * tenantguard.health.latency-ema-alpha=0.3
 * tenantguard.session.max-total-connections=50
 * tenantguard.session.acquire-timeout-ms=30000
 * tenantguard.session.session-timeout-ms=3600000
 * tenantguard.session.history-size=1000
 * tenantguard.session.recent-window-size=100
 * tenantguard.executor.tokens-per-call=1
 * tenantguard.executor.max-admission-wait-ms=0
 * tenantguard.executor.async-workers=8
 * tenantguard.executor.shutdown-timeout-ms=30000
 * tenantguard.registry.tenant-idle-ttl-ms=86400000
 * </pre>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class TenantGuardConfigLoader {

    public static final String PREFIX = "tenantguard.";

    private TenantGuardConfigLoader() {
    }

    /**
     * 클래스패스 리소스에서 로드.
     *
     * @param resource 리소스 경로 (예: {@code tenantguard.properties})
     * @return 설정
     * @throws IllegalArgumentException 리소스가 없거나 값이 누락/잘못된 경우
     */
    public static TenantGuardConfig loadFromClasspath(String resource) {
        return load(readClasspath(resource));
    }

    /**
     * Properties에서 로드.
     *
     * @param properties 설정 원본
     * @return 설정
     * @throws IllegalArgumentException 값이 누락/잘못된 경우
     */
    public static TenantGuardConfig load(Properties properties) {
        PropertiesReader reader = new PropertiesReader(properties, PREFIX);

        RateLimiterConfig rateLimiter = new RateLimiterConfig(
            reader.requireString("rate-limit.key-prefix"),
            new BucketConfig(reader.requireInt("rate-limit.global.capacity"),
                reader.requireDouble("rate-limit.global.refill-rate")),
            new BucketConfig(reader.requireInt("rate-limit.tenant.capacity"),
                reader.requireDouble("rate-limit.tenant.refill-rate")),
            reader.requireLong("rate-limit.idle-bucket-ttl-ms")
        );

        CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig(
            reader.requireInt("circuit-breaker.failure-threshold"),
            reader.requireInt("circuit-breaker.success-threshold"),
            reader.requireLong("circuit-breaker.timeout-ms")
        );

        RetryPolicies retry = new RetryPolicies(
            retryPolicy(reader, "retry.rate-limited."),
            retryPolicy(reader, "retry.transient-network."),
            retryPolicy(reader, "retry.unknown.")
        );

        HealthThresholds health = new HealthThresholds(
            reader.requireInt("health.max-consecutive-failures"),
            reader.requireDouble("health.warning-error-rate"),
            reader.requireDouble("health.critical-error-rate"),
            reader.requireDouble("health.warning-latency-ms"),
            reader.requireDouble("health.critical-latency-ms"),
            reader.requireDouble("health.latency-ema-alpha")
        );

        SessionPoolConfig session = new SessionPoolConfig(
            reader.requireInt("session.max-total-connections"),
            reader.requireLong("session.acquire-timeout-ms"),
            reader.requireLong("session.session-timeout-ms"),
            reader.requireInt("session.history-size"),
            reader.requireInt("session.recent-window-size")
        );

        GuardedExecutorConfig executor = new GuardedExecutorConfig(
            reader.requireInt("executor.tokens-per-call"),
            reader.requireLong("executor.max-admission-wait-ms"),
            reader.requireInt("executor.async-workers"),
            reader.requireLong("executor.shutdown-timeout-ms")
        );

        return new TenantGuardConfig(rateLimiter, circuitBreaker, retry, health, session, executor,
            reader.requireLong("registry.tenant-idle-ttl-ms"));
    }

    /**
     * 클래스패스 리소스를 Properties로 읽기.
     *
     * @param resource 리소스 경로
     * @return 읽은 Properties
     */
    public static Properties readClasspath(String resource) {
        Objects.requireNonNull(resource, "resource cannot be null");
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = TenantGuardConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Configuration resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return properties;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration resource: " + resource, e);
        }
    }

    private static RetryPolicy retryPolicy(PropertiesReader reader, String prefix) {
        return new RetryPolicy(
            reader.requireInt(prefix + "max-retries"),
            reader.requireLong(prefix + "base-delay-ms"),
            reader.requireLong(prefix + "max-delay-ms"),
            reader.requireEnum(prefix + "strategy", BackoffStrategy.class),
            reader.requireDouble(prefix + "exponential-base"),
            reader.requireBoolean(prefix + "jitter"),
            reader.requireBoolean(prefix + "honor-server-wait")
        );
    }
}
