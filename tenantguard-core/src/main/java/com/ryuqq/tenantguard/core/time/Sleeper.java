package com.ryuqq.tenantguard.core.time;

import java.time.Duration;

/**
 * 호출 스레드 대기 SPI.
 *
 * <p>재시도 백오프 대기와 레이트 리미터의 제한 대기는 이 인터페이스를 통해서만 수행됩니다.
 * 두 지점 모두 호출한 작업만 멈추며, 다른 테넌트의 작업에는 영향을 주지 않습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public interface Sleeper {

    /**
     * 지정된 시간만큼 대기.
     *
     * @param duration 대기 시간 (0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void sleep(Duration duration) throws InterruptedException;
}
