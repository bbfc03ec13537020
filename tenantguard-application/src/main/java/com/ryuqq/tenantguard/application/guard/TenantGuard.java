package com.ryuqq.tenantguard.application.guard;

import com.ryuqq.tenantguard.application.admin.DefaultTenantGuardAdmin;
import com.ryuqq.tenantguard.application.admin.TenantGuardAdmin;
import com.ryuqq.tenantguard.application.breaker.CircuitBreakerRegistry;
import com.ryuqq.tenantguard.application.config.TenantGuardConfig;
import com.ryuqq.tenantguard.application.executor.GuardedExecutor;
import com.ryuqq.tenantguard.application.health.HealthMonitor;
import com.ryuqq.tenantguard.application.ratelimit.TenantRateLimiter;
import com.ryuqq.tenantguard.application.registry.TenantRegistry;
import com.ryuqq.tenantguard.application.retry.RetryExecutor;
import com.ryuqq.tenantguard.application.session.SessionPool;
import com.ryuqq.tenantguard.core.retry.ErrorClassifier;
import com.ryuqq.tenantguard.core.retry.TypedErrorClassifier;
import com.ryuqq.tenantguard.core.spi.BucketStore;
import com.ryuqq.tenantguard.core.time.Clock;
import com.ryuqq.tenantguard.core.time.Sleeper;
import com.ryuqq.tenantguard.core.time.SystemClock;
import com.ryuqq.tenantguard.core.time.ThreadSleeper;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 보호 계층 전체를 한 번에 구성하는 진입점.
 *
 * <p>프로세스 시작 시 한 번 생성하여 필요한 곳에 전달합니다. 숨겨진 전역 상태는 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * TenantGuard guard = TenantGuard.builder(TenantGuardConfigLoader.loadFromClasspath("tenantguard.properties"))
 *     .bucketStore(new InMemoryBucketStore())
 *     .build();
 *
 * Message sent = guard.executor().execute(TenantId.of("bot-42"), () -> client.send(message));
 * }</pre>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class TenantGuard implements AutoCloseable {

    private final TenantGuardConfig config;
    private final TenantRegistry registry;
    private final TenantRateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final RetryExecutor retryExecutor;
    private final HealthMonitor healthMonitor;
    private final SessionPool sessionPool;
    private final GuardedExecutor executor;
    private final TenantGuardAdmin admin;
    private final Clock clock;

    private TenantGuard(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.registry = new TenantRegistry(config.circuitBreaker(), clock);
        this.rateLimiter = new TenantRateLimiter(config.rateLimiter(), builder.bucketStore, clock, builder.sleeper);
        this.breakers = new CircuitBreakerRegistry(registry);
        this.retryExecutor = new RetryExecutor(config.retry(), builder.classifier, builder.sleeper, builder.random);
        this.healthMonitor = new HealthMonitor(registry, config.health(), builder.classifier, clock);
        this.sessionPool = new SessionPool(config.session(), registry, clock);
        this.executor = new GuardedExecutor(registry, rateLimiter, retryExecutor, healthMonitor, sessionPool,
            builder.classifier, clock, config.executor());
        this.admin = new DefaultTenantGuardAdmin(rateLimiter, breakers, healthMonitor, sessionPool);
    }

    public static Builder builder(TenantGuardConfig config) {
        return new Builder(config);
    }

    public TenantGuardConfig config() {
        return config;
    }

    public TenantRegistry registry() {
        return registry;
    }

    public TenantRateLimiter rateLimiter() {
        return rateLimiter;
    }

    public CircuitBreakerRegistry breakers() {
        return breakers;
    }

    public RetryExecutor retryExecutor() {
        return retryExecutor;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public SessionPool sessionPool() {
        return sessionPool;
    }

    public GuardedExecutor executor() {
        return executor;
    }

    public TenantGuardAdmin admin() {
        return admin;
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public void close() {
        executor.close();
    }

    /**
     * TenantGuard 빌더.
     *
     * <p>bucketStore는 필수입니다. 시간, 대기, 분류기, 난수원은 지정하지 않으면
     * 시스템 시계, 스레드 sleep, {@link TypedErrorClassifier}, ThreadLocalRandom을 사용합니다.</p>
     */
    public static final class Builder {

        private final TenantGuardConfig config;
        private BucketStore bucketStore;
        private Clock clock = new SystemClock();
        private Sleeper sleeper = new ThreadSleeper();
        private ErrorClassifier classifier = new TypedErrorClassifier();
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        private Builder(TenantGuardConfig config) {
            this.config = Objects.requireNonNull(config, "config cannot be null");
        }

        public Builder bucketStore(BucketStore bucketStore) {
            this.bucketStore = Objects.requireNonNull(bucketStore, "bucketStore cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier cannot be null");
            return this;
        }

        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random cannot be null");
            return this;
        }

        /**
         * TenantGuard 생성.
         *
         * @return 구성된 TenantGuard
         * @throws IllegalStateException bucketStore가 지정되지 않은 경우
         */
        public TenantGuard build() {
            if (bucketStore == null) {
                throw new IllegalStateException("bucketStore must be set before build()");
            }
            return new TenantGuard(this);
        }
    }
}
