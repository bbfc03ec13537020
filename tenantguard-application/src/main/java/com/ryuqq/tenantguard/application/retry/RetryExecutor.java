package com.ryuqq.tenantguard.application.retry;

import com.ryuqq.tenantguard.core.exception.CircuitOpenException;
import com.ryuqq.tenantguard.core.exception.ErrorCategory;
import com.ryuqq.tenantguard.core.exception.NonRetryableException;
import com.ryuqq.tenantguard.core.exception.OperationCancelledException;
import com.ryuqq.tenantguard.core.executor.UpstreamCall;
import com.ryuqq.tenantguard.core.protection.CircuitBreaker;
import com.ryuqq.tenantguard.core.retry.BackoffCalculator;
import com.ryuqq.tenantguard.core.retry.ErrorClassifier;
import com.ryuqq.tenantguard.core.retry.RetryPolicies;
import com.ryuqq.tenantguard.core.retry.RetryPolicy;
import com.ryuqq.tenantguard.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 분류 기반 재시도 실행기.
 *
 * <p><strong>실행 루프:</strong></p>
 * <pre>
 * loop:
 *   호출 (브레이커가 있으면 breaker.call로 감싸서)
 *   성공 → 결과 반환
 *   CircuitOpenException → 첫 시도면 즉시 전파 (재시도 횟수 소비 없음)
 *                          이전 시도가 있었으면 마지막 업스트림 예외 전파 (CircuitOpenException은 suppressed)
 *   PERMANENT → NonRetryableException (재시도 없음)
 *   CIRCUIT_OPEN, POOL_EXHAUSTED → 즉시 전파
 *   재시도 남음 → delay 대기 후 재시도
 *   재시도 소진 → 원본 예외 전파
 * </pre>
 *
 * <p>RATE_LIMITED이고 정책이 {@code honorServerWait}이면 업스트림 대기 힌트를 그대로 대기합니다.
 * 그 외에는 {@link BackoffCalculator}로 계산한 지연을 사용합니다.</p>
 *
 * <p>대기 중 인터럽트되면 인터럽트 플래그를 복원하고 {@link OperationCancelledException}을 던집니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicies policies;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;
    private final Map<ErrorCategory, BackoffCalculator> calculators = new EnumMap<>(ErrorCategory.class);

    public RetryExecutor(RetryPolicies policies, ErrorClassifier classifier, Sleeper sleeper) {
        this(policies, classifier, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수원을 지정하여 생성.
     *
     * @param policies 분류별 정책
     * @param classifier 오류 분류기
     * @param sleeper 대기 수단
     * @param random jitter용 [0, 1) 난수 공급자
     */
    public RetryExecutor(RetryPolicies policies, ErrorClassifier classifier, Sleeper sleeper, DoubleSupplier random) {
        this.policies = Objects.requireNonNull(policies, "policies cannot be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        Objects.requireNonNull(random, "random cannot be null");
        for (ErrorCategory category : ErrorCategory.values()) {
            calculators.put(category, new BackoffCalculator(policies.forCategory(category), random));
        }
    }

    /**
     * 브레이커 없이 재시도 실행.
     *
     * @param call 업스트림 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws Exception 재시도를 소진한 원본 예외 또는 {@link NonRetryableException}
     */
    public <T> T execute(UpstreamCall<T> call) throws Exception {
        return execute(call, null);
    }

    /**
     * 매 시도를 브레이커로 감싸서 재시도 실행.
     *
     * @param call 업스트림 호출
     * @param breaker 시도마다 통과할 브레이커 (null이면 직접 호출)
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws CircuitOpenException 브레이커가 첫 시도를 거부한 경우
     * @throws NonRetryableException PERMANENT로 분류된 경우
     * @throws OperationCancelledException 대기 또는 호출 중 인터럽트된 경우
     * @throws Exception 재시도를 소진한 원본 예외, 또는 재시도 중 브레이커가 열린 경우 마지막 업스트림 예외
     */
    public <T> T execute(UpstreamCall<T> call, CircuitBreaker breaker) throws Exception {
        Objects.requireNonNull(call, "call cannot be null");
        int retries = 0;
        Exception lastFailure = null;
        while (true) {
            try {
                return breaker == null ? call.call() : breaker.call(call);
            } catch (CircuitOpenException e) {
                if (lastFailure == null) {
                    throw e;
                }
                log.warn("Circuit opened after {} attempts, surfacing last upstream error: {}",
                    retries, lastFailure.getMessage());
                lastFailure.addSuppressed(e);
                throw lastFailure;
            } catch (OperationCancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Upstream call interrupted", e);
            } catch (Exception e) {
                ErrorCategory category = classifier.classify(e);
                if (category == ErrorCategory.PERMANENT) {
                    throw new NonRetryableException(
                        "Permanent upstream error: " + e.getMessage(), retries + 1, e
                    );
                }
                if (!category.isRetryable()) {
                    throw e;
                }

                RetryPolicy policy = policies.forCategory(category);
                if (retries >= policy.maxRetries()) {
                    log.debug("Retry budget exhausted for {} after {} attempts", category, retries + 1);
                    throw e;
                }

                long delayMs = delayFor(category, policy, retries, e);
                log.warn("Retrying {} error (retry {}/{}) in {}ms: {}",
                    category, retries + 1, policy.maxRetries(), delayMs, e.getMessage());
                lastFailure = e;
                pause(delayMs);
                retries++;
            }
        }
    }

    private long delayFor(ErrorCategory category, RetryPolicy policy, int retry, Exception error) {
        if (category == ErrorCategory.RATE_LIMITED && policy.honorServerWait()) {
            Optional<Duration> hint = classifier.waitHint(error);
            if (hint.isPresent()) {
                return hint.get().toMillis();
            }
        }
        return calculators.get(category).calculateDelayMs(retry);
    }

    private void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(Duration.ofMillis(delayMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted during retry backoff", e);
        }
    }
}
