package com.ryuqq.tenantguard.adapter.runner;

import com.ryuqq.tenantguard.application.session.SessionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 오래된 세션 회수기.
 *
 * <p>sessionTimeout보다 오래 열린 세션을 강제 반납하여, 반납 없이 사라진 호출자가
 * 전역 슬롯과 테넌트 단일 세션 자리를 계속 점유하지 않게 합니다.</p>
 *
 * <p><strong>회수 시나리오:</strong></p>
 * <pre>
 * 1. 호출자가 acquireSession() 후 반납 전에 멈춤 (프로세스 hang, 예외 경로 누락)
 * 2. 슬롯: OPEN 유지, 전역 permit 점유
 * 3. StaleSessionReaper 주기 스캔
 * 4. sessionTimeout 초과 슬롯 발견 → 강제 반납, 오류 1건 기록
 * 5. 호출자가 나중에 반납하면 이미 RELEASED이므로 무시
 * </pre>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class StaleSessionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleSessionReaper.class);

    private final SessionPool sessionPool;

    public StaleSessionReaper(SessionPool sessionPool) {
        this.sessionPool = Objects.requireNonNull(sessionPool, "sessionPool cannot be null");
    }

    @Override
    public void run() {
        scan();
    }

    /**
     * 오래된 세션 스캔 및 회수.
     *
     * @return 회수한 세션 수
     */
    public int scan() {
        int reclaimed = sessionPool.reapStale();
        if (reclaimed > 0) {
            log.info("Stale session sweep completed: {} reclaimed", reclaimed);
        } else {
            log.debug("Stale session sweep completed: nothing to reclaim");
        }
        return reclaimed;
    }
}
