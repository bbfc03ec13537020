package com.ryuqq.tenantguard.adapter.inmemory.metrics;

import com.ryuqq.tenantguard.core.health.HealthSnapshotRecord;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.spi.MetricsStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link MetricsStore}.
 *
 * <p>Snapshots are kept per tenant in a {@link ConcurrentSkipListMap} ordered by timestamp, so
 * history queries are ordered tail views. A second snapshot of the same tenant at the same instant
 * replaces the first.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>history:</strong> ConcurrentHashMap&lt;TenantId, ConcurrentSkipListMap&lt;Instant, HealthSnapshotRecord&gt;&gt;</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>storeSnapshot:</strong> O(log N) per tenant</li>
 *   <li><strong>loadHistory:</strong> O(log N + M) for M returned snapshots</li>
 *   <li><strong>loadUnhealthySince / deleteOlderThan:</strong> O(T log N) over T tenants</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class InMemoryMetricsStore implements MetricsStore {

    private final ConcurrentHashMap<TenantId, ConcurrentSkipListMap<Instant, HealthSnapshotRecord>> history =
        new ConcurrentHashMap<>();

    @Override
    public void storeSnapshot(HealthSnapshotRecord record) {
        Objects.requireNonNull(record, "record cannot be null");
        history.compute(record.tenantId(), (id, snapshots) -> {
            ConcurrentSkipListMap<Instant, HealthSnapshotRecord> target =
                snapshots != null ? snapshots : new ConcurrentSkipListMap<>();
            target.put(record.timestamp(), record);
            return target;
        });
    }

    @Override
    public List<HealthSnapshotRecord> loadHistory(TenantId tenantId, Instant since) {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        Objects.requireNonNull(since, "since cannot be null");
        ConcurrentSkipListMap<Instant, HealthSnapshotRecord> snapshots = history.get(tenantId);
        if (snapshots == null) {
            return List.of();
        }
        return new ArrayList<>(snapshots.tailMap(since, true).values());
    }

    @Override
    public List<HealthSnapshotRecord> loadLatest() {
        List<HealthSnapshotRecord> latest = new ArrayList<>();
        for (ConcurrentSkipListMap<Instant, HealthSnapshotRecord> snapshots : history.values()) {
            Map.Entry<Instant, HealthSnapshotRecord> last = snapshots.lastEntry();
            if (last != null) {
                latest.add(last.getValue());
            }
        }
        latest.sort(Comparator.comparing(HealthSnapshotRecord::tenantId));
        return latest;
    }

    @Override
    public Optional<HealthSnapshotRecord> loadLatest(TenantId tenantId) {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        ConcurrentSkipListMap<Instant, HealthSnapshotRecord> snapshots = history.get(tenantId);
        if (snapshots == null) {
            return Optional.empty();
        }
        Map.Entry<Instant, HealthSnapshotRecord> last = snapshots.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public List<HealthSnapshotRecord> loadUnhealthySince(Instant since) {
        Objects.requireNonNull(since, "since cannot be null");
        List<HealthSnapshotRecord> unhealthy = new ArrayList<>();
        for (ConcurrentSkipListMap<Instant, HealthSnapshotRecord> snapshots : history.values()) {
            for (HealthSnapshotRecord record : snapshots.tailMap(since, true).values()) {
                if (record.metrics().status().isProblematic()) {
                    unhealthy.add(record);
                }
            }
        }
        unhealthy.sort(Comparator.comparing(HealthSnapshotRecord::timestamp)
            .thenComparing(HealthSnapshotRecord::tenantId));
        return unhealthy;
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff cannot be null");
        int deleted = 0;
        for (ConcurrentSkipListMap<Instant, HealthSnapshotRecord> snapshots : history.values()) {
            Map<Instant, HealthSnapshotRecord> expired = snapshots.headMap(cutoff, false);
            deleted += expired.size();
            expired.clear();
        }
        for (TenantId tenantId : history.keySet()) {
            history.computeIfPresent(tenantId, (id, snapshots) -> snapshots.isEmpty() ? null : snapshots);
        }
        return deleted;
    }
}
