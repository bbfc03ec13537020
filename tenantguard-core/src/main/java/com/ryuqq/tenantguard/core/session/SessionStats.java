package com.ryuqq.tenantguard.core.session;

/**
 * 세션 반납 시 호출자가 보고하는 처리 통계.
 *
 * <p>슬롯에 누적된 카운터에 더해집니다.</p>
 *
 * @param messagesProcessed 처리한 메시지 수
 * @param channelsProcessed 처리한 채널 수
 * @param errors 세션 중 발생한 오류 수
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record SessionStats(int messagesProcessed, int channelsProcessed, int errors) {

    private static final SessionStats EMPTY = new SessionStats(0, 0, 0);

    public SessionStats {
        if (messagesProcessed < 0 || channelsProcessed < 0 || errors < 0) {
            throw new IllegalArgumentException(
                "session stats must be non-negative (messages: " + messagesProcessed
                    + ", channels: " + channelsProcessed + ", errors: " + errors + ")"
            );
        }
    }

    public static SessionStats empty() {
        return EMPTY;
    }
}
