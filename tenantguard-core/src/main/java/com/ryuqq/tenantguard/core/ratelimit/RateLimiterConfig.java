package com.ryuqq.tenantguard.core.ratelimit;

/**
 * 2단계 레이트 리미터 설정.
 *
 * <p>버킷 키는 {@code <keyPrefix>:<scope>:<identifier>} 형식입니다.
 * 여러 배포가 하나의 공유 저장소를 사용할 때 keyPrefix로 구분합니다.</p>
 *
 * @param keyPrefix 버킷 키 접두사 (예: "tg:rate")
 * @param global 전역 버킷 설정
 * @param perTenant 테넌트별 버킷 설정
 * @param idleBucketTtlMs 이 시간 동안 접근이 없으면 버킷 정리 (밀리초)
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record RateLimiterConfig(
    String keyPrefix,
    BucketConfig global,
    BucketConfig perTenant,
    long idleBucketTtlMs
) {

    public RateLimiterConfig {
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("keyPrefix cannot be null or blank");
        }
        if (global == null) {
            throw new IllegalArgumentException("global cannot be null");
        }
        if (perTenant == null) {
            throw new IllegalArgumentException("perTenant cannot be null");
        }
        if (idleBucketTtlMs <= 0) {
            throw new IllegalArgumentException(
                "idleBucketTtlMs must be positive (current: " + idleBucketTtlMs + ")"
            );
        }
    }

    /**
     * 범위별 버킷 설정 조회.
     *
     * @param scope 범위
     * @return 해당 범위의 버킷 설정
     */
    public BucketConfig forScope(LimitScope scope) {
        return scope == LimitScope.GLOBAL ? global : perTenant;
    }

    /**
     * 버킷 키 생성.
     *
     * @param scope 범위
     * @param identifier 범위 내 식별자
     * @return 버킷 키
     */
    public String bucketKey(LimitScope scope, String identifier) {
        return scopePrefix(scope) + identifier;
    }

    /**
     * 범위 키 접두사 ({@code <keyPrefix>:<scope>:}).
     *
     * @param scope 범위
     * @return 키 접두사
     */
    public String scopePrefix(LimitScope scope) {
        return keyPrefix + ":" + scope.keyPart() + ":";
    }

    /**
     * perTenant만 변경한 새 인스턴스 생성.
     */
    public RateLimiterConfig withPerTenant(BucketConfig perTenant) {
        return new RateLimiterConfig(keyPrefix, global, perTenant, idleBucketTtlMs);
    }

    /**
     * global만 변경한 새 인스턴스 생성.
     */
    public RateLimiterConfig withGlobal(BucketConfig global) {
        return new RateLimiterConfig(keyPrefix, global, perTenant, idleBucketTtlMs);
    }

    /**
     * idleBucketTtlMs만 변경한 새 인스턴스 생성.
     */
    public RateLimiterConfig withIdleBucketTtlMs(long idleBucketTtlMs) {
        return new RateLimiterConfig(keyPrefix, global, perTenant, idleBucketTtlMs);
    }
}
