package com.ryuqq.tenantguard.core.exception;

/**
 * 공유 버킷 저장소에 접근할 수 없음.
 *
 * <p>{@link com.ryuqq.tenantguard.core.spi.BucketStore} 구현체가 인프라 장애 시 던집니다.
 * 레이트 리미터는 이 경우에 한해 fail-open으로 호출을 허용합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class BucketStoreUnavailableException extends RuntimeException {

    public BucketStoreUnavailableException(String message) {
        super(message);
    }

    public BucketStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
