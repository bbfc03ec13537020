package com.ryuqq.tenantguard.adapter.runner;

import com.ryuqq.tenantguard.application.config.PropertiesReader;
import com.ryuqq.tenantguard.application.config.TenantGuardConfigLoader;

import java.util.Properties;

/**
 * 백그라운드 정리 작업 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>sessionSweepIntervalMs: 오래된 세션 회수 주기</li>
 *   <li>idleSweepIntervalMs: 유휴 버킷/테넌트 엔트리 정리 주기</li>
 *   <li>healthSnapshotIntervalMs: 건강 스냅샷 저장 주기</li>
 *   <li>snapshotRetentionMs: 스냅샷 보관 기간</li>
 *   <li>shutdownTimeoutMs: 종료 시 실행 중인 작업을 기다리는 시간</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 * @param sessionSweepIntervalMs 세션 회수 주기 (밀리초, 양수여야 함)
 * @param idleSweepIntervalMs 유휴 정리 주기 (밀리초, 양수여야 함)
 * @param healthSnapshotIntervalMs 스냅샷 주기 (밀리초, 양수여야 함)
 * @param snapshotRetentionMs 스냅샷 보관 기간 (밀리초, 양수여야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record MaintenanceConfig(
    long sessionSweepIntervalMs,
    long idleSweepIntervalMs,
    long healthSnapshotIntervalMs,
    long snapshotRetentionMs,
    long shutdownTimeoutMs
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MaintenanceConfig {
        requirePositive("sessionSweepIntervalMs", sessionSweepIntervalMs);
        requirePositive("idleSweepIntervalMs", idleSweepIntervalMs);
        requirePositive("healthSnapshotIntervalMs", healthSnapshotIntervalMs);
        requirePositive("snapshotRetentionMs", snapshotRetentionMs);
        requirePositive("shutdownTimeoutMs", shutdownTimeoutMs);
    }

    /**
     * Properties에서 로드.
     *
     * <pre>
     * tenantguard.maintenance.session-sweep-interval-ms=60000
     * tenantguard.maintenance.idle-sweep-interval-ms=300000
     * tenantguard.maintenance.health-snapshot-interval-ms=300000
     * tenantguard.maintenance.snapshot-retention-ms=604800000
     * tenantguard.maintenance.shutdown-timeout-ms=10000
     * </pre>
     *
     * @param properties 설정 원본
     * @return 설정
     * @throws IllegalArgumentException 값이 누락/잘못된 경우
     */
    public static MaintenanceConfig fromProperties(Properties properties) {
        PropertiesReader reader = new PropertiesReader(properties, TenantGuardConfigLoader.PREFIX + "maintenance.");
        return new MaintenanceConfig(
            reader.requireLong("session-sweep-interval-ms"),
            reader.requireLong("idle-sweep-interval-ms"),
            reader.requireLong("health-snapshot-interval-ms"),
            reader.requireLong("snapshot-retention-ms"),
            reader.requireLong("shutdown-timeout-ms")
        );
    }

    /**
     * sessionSweepIntervalMs만 변경한 새 인스턴스 생성.
     */
    public MaintenanceConfig withSessionSweepIntervalMs(long sessionSweepIntervalMs) {
        return new MaintenanceConfig(sessionSweepIntervalMs, idleSweepIntervalMs, healthSnapshotIntervalMs,
            snapshotRetentionMs, shutdownTimeoutMs);
    }

    /**
     * snapshotRetentionMs만 변경한 새 인스턴스 생성.
     */
    public MaintenanceConfig withSnapshotRetentionMs(long snapshotRetentionMs) {
        return new MaintenanceConfig(sessionSweepIntervalMs, idleSweepIntervalMs, healthSnapshotIntervalMs,
            snapshotRetentionMs, shutdownTimeoutMs);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }
}
