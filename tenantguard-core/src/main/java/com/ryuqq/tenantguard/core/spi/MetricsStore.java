package com.ryuqq.tenantguard.core.spi;

import com.ryuqq.tenantguard.core.health.HealthSnapshotRecord;
import com.ryuqq.tenantguard.core.model.TenantId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Health Snapshot Persistence SPI.
 *
 * <p>Sink and query contract for long-term tenant health history. Concrete storage
 * (relational table, time-series database, ...) lives outside this library.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Append periodic per-tenant snapshots</li>
 *   <li>Return a tenant's history in ascending timestamp order</li>
 *   <li>Support restore of the latest snapshot at startup</li>
 *   <li>Retention cleanup</li>
 * </ul>
 *
 * <p>Implementations must be thread-safe.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public interface MetricsStore {

    /**
     * Appends one snapshot.
     *
     * @param record snapshot to store
     */
    void storeSnapshot(HealthSnapshotRecord record);

    /**
     * Loads a tenant's snapshots taken at or after {@code since}.
     *
     * @param tenantId tenant
     * @param since inclusive lower bound
     * @return snapshots ordered by timestamp ascending (empty if none)
     */
    List<HealthSnapshotRecord> loadHistory(TenantId tenantId, Instant since);

    /**
     * Loads the most recent snapshot of every tenant that has one.
     *
     * @return one record per tenant
     */
    List<HealthSnapshotRecord> loadLatest();

    /**
     * Loads the most recent snapshot of one tenant.
     *
     * @param tenantId tenant
     * @return latest snapshot, or empty if none
     */
    Optional<HealthSnapshotRecord> loadLatest(TenantId tenantId);

    /**
     * Loads snapshots taken at or after {@code since} whose status was UNHEALTHY or SUSPENDED.
     *
     * @param since inclusive lower bound
     * @return snapshots ordered by timestamp ascending
     */
    List<HealthSnapshotRecord> loadUnhealthySince(Instant since);

    /**
     * Deletes snapshots taken strictly before {@code cutoff}.
     *
     * @param cutoff exclusive upper bound
     * @return number of deleted snapshots
     */
    int deleteOlderThan(Instant cutoff);
}
