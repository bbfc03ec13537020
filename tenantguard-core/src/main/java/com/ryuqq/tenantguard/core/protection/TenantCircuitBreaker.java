package com.ryuqq.tenantguard.core.protection;

import com.ryuqq.tenantguard.core.exception.CircuitOpenException;
import com.ryuqq.tenantguard.core.exception.OperationCancelledException;
import com.ryuqq.tenantguard.core.executor.UpstreamCall;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 테넌트 하나를 보호하는 Circuit Breaker 구현체.
 *
 * <p>상태와 카운터는 인스턴스 모니터로 보호됩니다. 업스트림 호출 자체는 락 밖에서 실행되므로
 * 느린 호출이 같은 테넌트의 상태 조회를 막지 않습니다.</p>
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>CLOSED: 실패마다 failureCount 증가, failureThreshold 도달 시 OPEN. 성공하면 failureCount 초기화</li>
 *   <li>OPEN: 쿨다운 전 호출은 {@link CircuitOpenException}으로 거부. 경과 후 첫 호출에서 HALF_OPEN</li>
 *   <li>HALF_OPEN: 성공마다 successCount 증가, successThreshold 도달 시 CLOSED. 실패 시 즉시 OPEN</li>
 * </ul>
 *
 * <p>취소({@link InterruptedException}, {@link OperationCancelledException})는 업스트림 실패가 아니므로
 * 집계하지 않습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class TenantCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(TenantCircuitBreaker.class);

    private final TenantId tenantId;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private long openedAtNanos;
    private Instant openedAt;

    /**
     * TenantCircuitBreaker 생성.
     *
     * @param tenantId 테넌트 ID
     * @param config 브레이커 설정
     * @param clock 시간 소스
     */
    public TenantCircuitBreaker(TenantId tenantId, CircuitBreakerConfig config, Clock clock) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public TenantId getTenantId() {
        return tenantId;
    }

    @Override
    public <T> T call(UpstreamCall<T> call) throws Exception {
        Objects.requireNonNull(call, "call cannot be null");
        Duration remaining = acquireOrRemaining();
        if (remaining != null) {
            throw new CircuitOpenException(tenantId, remaining);
        }

        T result;
        try {
            result = call.call();
        } catch (InterruptedException | OperationCancelledException e) {
            throw e;
        } catch (Exception e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }

    @Override
    public boolean tryAcquire() {
        return acquireOrRemaining() == null;
    }

    /**
     * 호출 허용 시 null, 거부 시 남은 쿨다운 반환.
     */
    private synchronized Duration acquireOrRemaining() {
        if (state != CircuitBreakerState.OPEN) {
            return null;
        }
        long remainingNanos = remainingNanos(clock.nanoTime());
        if (remainingNanos > 0) {
            return Duration.ofNanos(remainingNanos);
        }
        transitionTo(CircuitBreakerState.HALF_OPEN);
        return null;
    }

    @Override
    public synchronized void recordSuccess() {
        switch (state) {
            case CLOSED -> failureCount = 0;
            case HALF_OPEN -> {
                successCount++;
                if (successCount >= config.successThreshold()) {
                    transitionTo(CircuitBreakerState.CLOSED);
                }
            }
            case OPEN -> {
                // 다른 호출이 먼저 OPEN으로 전환한 뒤 늦게 끝난 호출
            }
        }
    }

    @Override
    public synchronized void recordFailure(Throwable throwable) {
        switch (state) {
            case CLOSED -> {
                failureCount++;
                if (failureCount >= config.failureThreshold()) {
                    log.warn("Circuit opening for tenant {} after {} consecutive failures (last: {})",
                        tenantId.getValue(), failureCount, describe(throwable));
                    open();
                }
            }
            case HALF_OPEN -> {
                log.warn("Probe failed in HALF_OPEN for tenant {}, reopening (cause: {})",
                    tenantId.getValue(), describe(throwable));
                open();
            }
            case OPEN -> {
                // 이미 OPEN
            }
        }
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    @Override
    public synchronized CircuitBreakerSnapshot snapshot() {
        Duration remaining = state == CircuitBreakerState.OPEN
            ? Duration.ofNanos(Math.max(0, remainingNanos(clock.nanoTime())))
            : Duration.ZERO;
        return new CircuitBreakerSnapshot(tenantId, state, failureCount, successCount, openedAt, remaining);
    }

    @Override
    public synchronized void reset() {
        if (state != CircuitBreakerState.CLOSED) {
            log.info("Circuit for tenant {} manually reset from {}", tenantId.getValue(), state);
        }
        state = CircuitBreakerState.CLOSED;
        failureCount = 0;
        successCount = 0;
    }

    private void open() {
        openedAtNanos = clock.nanoTime();
        openedAt = clock.instant();
        transitionTo(CircuitBreakerState.OPEN);
    }

    private void transitionTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = next;
        failureCount = 0;
        successCount = 0;
        log.info("Circuit state change for tenant {}: {} -> {}", tenantId.getValue(), previous, next);
    }

    private long remainingNanos(long nowNanos) {
        long timeoutNanos = Duration.ofMillis(config.timeoutMs()).toNanos();
        return timeoutNanos - (nowNanos - openedAtNanos);
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
