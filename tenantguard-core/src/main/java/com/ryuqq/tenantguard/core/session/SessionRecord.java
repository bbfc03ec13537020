package com.ryuqq.tenantguard.core.session;

import com.ryuqq.tenantguard.core.model.TenantId;

import java.time.Instant;

/**
 * 반납된 세션의 이력 한 건.
 *
 * @param tenantId 테넌트 ID
 * @param acquiredAt 점유 시각
 * @param releasedAt 반납 시각
 * @param durationMs 점유 시간 (밀리초)
 * @param messagesProcessed 처리한 메시지 수
 * @param channelsProcessed 처리한 채널 수
 * @param errors 오류 수 (강제 회수는 1 추가)
 * @param forced 오래된 세션으로 강제 회수되었으면 true
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record SessionRecord(
    TenantId tenantId,
    Instant acquiredAt,
    Instant releasedAt,
    long durationMs,
    int messagesProcessed,
    int channelsProcessed,
    int errors,
    boolean forced
) {
}
