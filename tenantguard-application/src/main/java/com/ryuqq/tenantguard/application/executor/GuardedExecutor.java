package com.ryuqq.tenantguard.application.executor;

import com.ryuqq.tenantguard.application.health.HealthMonitor;
import com.ryuqq.tenantguard.application.ratelimit.TenantRateLimiter;
import com.ryuqq.tenantguard.application.registry.TenantEntry;
import com.ryuqq.tenantguard.application.registry.TenantRegistry;
import com.ryuqq.tenantguard.application.retry.RetryExecutor;
import com.ryuqq.tenantguard.application.session.SessionPool;
import com.ryuqq.tenantguard.core.exception.CircuitOpenException;
import com.ryuqq.tenantguard.core.exception.ErrorCategory;
import com.ryuqq.tenantguard.core.exception.GuardException;
import com.ryuqq.tenantguard.core.exception.OperationCancelledException;
import com.ryuqq.tenantguard.core.exception.RateLimitExceededException;
import com.ryuqq.tenantguard.core.exception.UpstreamCallException;
import com.ryuqq.tenantguard.core.executor.SessionCall;
import com.ryuqq.tenantguard.core.executor.UpstreamCall;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.ratelimit.RateLimitDecision;
import com.ryuqq.tenantguard.core.retry.ErrorClassifier;
import com.ryuqq.tenantguard.core.session.SessionSlot;
import com.ryuqq.tenantguard.core.session.SessionStats;
import com.ryuqq.tenantguard.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 업스트림 호출 하나를 보호 계층 전체로 감싸는 실행기.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * 1. 레이트 리밋 (전역 + 테넌트), 거부 시 maxAdmissionWait 이내면 대기 후 1회 재시도
 *    여전히 거부 → RateLimitExceededException(retryAfter)
 * 2. RetryExecutor 실행, 매 시도는 테넌트 Circuit Breaker로 감쌈
 * 3. 최종 결과를 HealthMonitor에 기록
 *    (첫 시도부터 거부된 CircuitOpenException과 취소는 업스트림 결과가 아니므로 기록하지 않음,
 *     재시도 중 브레이커가 열리면 RetryExecutor가 마지막 업스트림 예외를 전달하므로 실패로 기록)
 * 4. 최종 오류가 RATE_LIMITED이고 대기 힌트가 있으면 테넌트 버킷에 반영
 * </pre>
 *
 * <p>호출자는 항상 {@link GuardException} 계층의 예외를 받습니다. 타입이 없는 업스트림 예외는
 * 분류 결과와 원본을 담은 {@link UpstreamCallException}으로 전달됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try {
 *     Message sent = executor.execute(tenantId, () -> botClient.sendMessage(chatId, text));
 * } catch (RateLimitExceededException e) {
 *     scheduleLater(e.getRetryAfter());
 * } catch (CircuitOpenException e) {
 *     skipTenantFor(e.getTimeoutRemaining());
 * }
 * }</pre>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class GuardedExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GuardedExecutor.class);

    private final TenantRegistry registry;
    private final TenantRateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final HealthMonitor healthMonitor;
    private final SessionPool sessionPool;
    private final ErrorClassifier classifier;
    private final Clock clock;
    private final GuardedExecutorConfig config;
    private final ExecutorService workers;

    public GuardedExecutor(
        TenantRegistry registry,
        TenantRateLimiter rateLimiter,
        RetryExecutor retryExecutor,
        HealthMonitor healthMonitor,
        SessionPool sessionPool,
        ErrorClassifier classifier,
        Clock clock,
        GuardedExecutorConfig config
    ) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter cannot be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor cannot be null");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor cannot be null");
        this.sessionPool = Objects.requireNonNull(sessionPool, "sessionPool cannot be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.workers = Executors.newFixedThreadPool(config.asyncWorkers(), new WorkerThreadFactory());
    }

    /**
     * 보호된 호출 실행.
     *
     * @param tenantId 테넌트 ID
     * @param call 업스트림 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws RateLimitExceededException 레이트 리밋에 걸린 경우
     * @throws CircuitOpenException 테넌트 브레이커가 OPEN이어서 업스트림을 한 번도 호출하지 않은 경우
     * @throws GuardException 그 밖의 분류된 실패
     */
    public <T> T execute(TenantId tenantId, UpstreamCall<T> call) {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        Objects.requireNonNull(call, "call cannot be null");

        TenantEntry entry = registry.entryFor(tenantId);
        admit(tenantId);

        long startedAt = clock.nanoTime();
        try {
            T result = retryExecutor.execute(call, entry.getBreaker());
            healthMonitor.recordSuccess(tenantId, elapsedMs(startedAt));
            return result;
        } catch (CircuitOpenException | OperationCancelledException e) {
            throw e;
        } catch (Exception e) {
            ErrorCategory category = classifier.classify(e);
            healthMonitor.recordFailure(tenantId, e);
            if (category == ErrorCategory.RATE_LIMITED) {
                classifier.waitHint(e).ifPresent(hint -> rateLimiter.throttle(tenantId, hint));
            }
            throw toGuardException(tenantId, category, e);
        }
    }

    /**
     * 세션을 점유한 상태로 보호된 호출 실행.
     *
     * <p>세션은 정상 종료, 예외, 취소 모든 경로에서 반납됩니다. 실패하면 세션 오류 1건이 기록됩니다.</p>
     *
     * @param tenantId 테넌트 ID
     * @param call 세션 안에서 실행할 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     */
    public <T> T executeWithSession(TenantId tenantId, SessionCall<T> call) {
        Objects.requireNonNull(call, "call cannot be null");
        SessionSlot slot = sessionPool.acquireSession(tenantId);
        try {
            return execute(tenantId, () -> call.call(slot));
        } catch (RuntimeException e) {
            slot.recordError();
            throw e;
        } finally {
            sessionPool.release(slot, SessionStats.empty());
        }
    }

    /**
     * 공유 워커 풀에서 보호된 호출을 비동기 실행.
     *
     * <p>{@code future.cancel(true)}는 대기 지점(레이트 리밋 대기, 재시도 백오프, 세션 대기)을 인터럽트하며,
     * 작업은 {@link OperationCancelledException}으로 끝납니다.</p>
     *
     * @param tenantId 테넌트 ID
     * @param call 업스트림 호출
     * @param <T> 결과 타입
     * @return 결과 Future
     * @throws IllegalStateException 이미 종료된 경우
     */
    public <T> Future<T> submit(TenantId tenantId, UpstreamCall<T> call) {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        Objects.requireNonNull(call, "call cannot be null");
        try {
            return workers.submit(() -> execute(tenantId, call));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("GuardedExecutor is closed", e);
        }
    }

    /**
     * 워커 풀 종료.
     *
     * <p>shutdownTimeout 동안 진행 중 작업을 기다린 뒤 남은 작업을 인터럽트합니다.</p>
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Guarded workers did not finish within {}ms, interrupting", config.shutdownTimeoutMs());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public GuardedExecutorConfig getConfig() {
        return config;
    }

    private void admit(TenantId tenantId) {
        RateLimitDecision decision = config.maxAdmissionWaitMs() > 0
            ? rateLimiter.acquireWithDelay(tenantId, config.tokensPerCall(), Duration.ofMillis(config.maxAdmissionWaitMs()))
            : rateLimiter.acquire(tenantId, config.tokensPerCall());
        if (!decision.allowed()) {
            throw new RateLimitExceededException(tenantId, decision.retryAfter());
        }
    }

    private double elapsedMs(long startedAt) {
        return Math.max(0, clock.nanoTime() - startedAt) / 1_000_000d;
    }

    private static GuardException toGuardException(TenantId tenantId, ErrorCategory category, Exception error) {
        if (error instanceof GuardException guard) {
            return guard;
        }
        return new UpstreamCallException(category,
            "Upstream call failed for tenant " + tenantId.getValue() + ": " + error.getMessage(), error);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tenantguard-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
