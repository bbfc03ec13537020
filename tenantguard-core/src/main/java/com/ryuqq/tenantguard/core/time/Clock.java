package com.ryuqq.tenantguard.core.time;

import java.time.Instant;

/**
 * 시간 소스.
 *
 * <p>버킷 리필, 브레이커 쿨다운, 세션 지속 시간처럼 경과 시간을 계산하는 곳은
 * {@link #nanoTime()}을, 스냅샷 타임스탬프처럼 외부에 노출되는 시각은
 * {@link #instant()}를 사용합니다.</p>
 *
 * <p>테스트에서는 {@link ManualClock}을 주입하여 시간을 결정적으로 제어합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public interface Clock {

    /**
     * 단조 증가 시각 (나노초).
     *
     * @return 임의 기준점으로부터의 나노초
     */
    long nanoTime();

    /**
     * 현재 벽시계 시각.
     *
     * @return 현재 시각
     */
    Instant instant();
}
