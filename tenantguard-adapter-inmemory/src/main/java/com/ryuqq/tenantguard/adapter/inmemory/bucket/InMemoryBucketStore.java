package com.ryuqq.tenantguard.adapter.inmemory.bucket;

import com.ryuqq.tenantguard.core.ratelimit.TokenBucket;
import com.ryuqq.tenantguard.core.spi.BucketStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link BucketStore} for single-process deployments and tests.
 *
 * <p>Each read-modify-write runs inside {@link ConcurrentHashMap#compute}, which holds the
 * per-bin lock for the key. Updates to the same key are therefore serialized while updates to
 * different keys proceed in parallel. The updater is invoked exactly once per call.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>buckets:</strong> ConcurrentHashMap&lt;String, TokenBucket&gt; - immutable bucket per key</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Never throws {@code BucketStoreUnavailableException}; fail-open never triggers</li>
 *   <li>State is not shared across processes and is lost on restart</li>
 *   <li>Prefix scans are O(N) over all keys</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class InMemoryBucketStore implements BucketStore {

    private final ConcurrentHashMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public TokenBucket compareAndUpdate(String key, Supplier<TokenBucket> initial, UnaryOperator<TokenBucket> updater) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(initial, "initial cannot be null");
        Objects.requireNonNull(updater, "updater cannot be null");
        return buckets.compute(key, (k, current) -> {
            TokenBucket base = current != null ? current : initial.get();
            TokenBucket next = updater.apply(base);
            if (next == null) {
                throw new IllegalStateException("updater returned null for key " + k);
            }
            return next;
        });
    }

    @Override
    public Optional<TokenBucket> find(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        return Optional.ofNullable(buckets.get(key));
    }

    @Override
    public Map<String, TokenBucket> findByPrefix(String keyPrefix) {
        Objects.requireNonNull(keyPrefix, "keyPrefix cannot be null");
        Map<String, TokenBucket> matches = new HashMap<>();
        buckets.forEach((key, bucket) -> {
            if (key.startsWith(keyPrefix)) {
                matches.put(key, bucket);
            }
        });
        return matches;
    }

    @Override
    public int removeIdle(String keyPrefix, long cutoffNanos) {
        Objects.requireNonNull(keyPrefix, "keyPrefix cannot be null");
        AtomicInteger removed = new AtomicInteger();
        for (String key : buckets.keySet()) {
            if (!key.startsWith(keyPrefix)) {
                continue;
            }
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (bucket.isIdleSince(cutoffNanos)) {
                    removed.incrementAndGet();
                    return null;
                }
                return bucket;
            });
        }
        return removed.get();
    }

    /**
     * 저장된 버킷 수.
     *
     * @return 버킷 수
     */
    public int size() {
        return buckets.size();
    }
}
