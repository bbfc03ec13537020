/**
 * 오류 분류 체계 패키지.
 *
 * <p>모든 보호 계층 오류는 {@link com.ryuqq.tenantguard.core.exception.GuardException}을 상속하며
 * {@link com.ryuqq.tenantguard.core.exception.ErrorCategory}로 분류됩니다.</p>
 *
 * <h2>분류별 예외</h2>
 * <ul>
 *   <li>RATE_LIMITED: {@code RateLimitedException} (업스트림), {@code RateLimitExceededException} (로컬)</li>
 *   <li>TRANSIENT_NETWORK: {@code TransientNetworkException}</li>
 *   <li>PERMANENT: {@code PermanentException}, {@code NonRetryableException}</li>
 *   <li>CIRCUIT_OPEN: {@code CircuitOpenException}</li>
 *   <li>POOL_EXHAUSTED: {@code PoolExhaustedException}, {@code SessionBusyException}</li>
 *   <li>UNKNOWN: {@code OperationCancelledException}</li>
 *   <li>분류 결과를 그대로 담는 경우: {@code UpstreamCallException} (재시도 소진)</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.exception;
