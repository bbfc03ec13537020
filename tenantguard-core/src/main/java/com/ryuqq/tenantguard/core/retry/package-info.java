/**
 * 오류 분류와 재시도 지연 계산.
 *
 * <p>업스트림 오류를 {@link com.ryuqq.tenantguard.core.exception.ErrorCategory}로 분류하고,
 * 분류별 {@link com.ryuqq.tenantguard.core.retry.RetryPolicy}에 따라 재시도 간격을 계산합니다.</p>
 *
 * <table>
 *   <caption>분류별 기본 정책</caption>
 *   <tr><th>분류</th><th>재시도</th><th>지연</th></tr>
 *   <tr><td>RATE_LIMITED</td><td>3회 이하</td><td>서버 대기 힌트 우선, 없으면 지수</td></tr>
 *   <tr><td>TRANSIENT_NETWORK</td><td>2회 이하</td><td>지수 + jitter</td></tr>
 *   <tr><td>UNKNOWN</td><td>2회 이하</td><td>지수 + jitter (보수적 base)</td></tr>
 *   <tr><td>PERMANENT</td><td>0</td><td>즉시 non-retryable로 전달</td></tr>
 * </table>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.retry;
