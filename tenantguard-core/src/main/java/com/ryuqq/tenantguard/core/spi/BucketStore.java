package com.ryuqq.tenantguard.core.spi;

import com.ryuqq.tenantguard.core.exception.BucketStoreUnavailableException;
import com.ryuqq.tenantguard.core.ratelimit.TokenBucket;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Token Bucket Storage SPI.
 *
 * <p>This interface abstracts where token buckets live so that a single process can keep them
 * in memory while several processes can share them through an external store.</p>
 *
 * <p><strong>Atomicity Contract:</strong></p>
 * <pre>
 * compareAndUpdate(key, initial, updater):
 *   current = stored(key) ?: initial.get()
 *   next    = updater.apply(current)
 *   store next only if stored(key) is still current, otherwise re-read and re-apply
 * </pre>
 *
 * <p>The updater may therefore be invoked more than once for a single call and must be free of
 * side effects other than capturing its latest result. Only the value returned by the final
 * invocation is committed.</p>
 *
 * <p><strong>Failure Semantics:</strong></p>
 * <ul>
 *   <li>Infrastructure outages must surface as {@link BucketStoreUnavailableException}.
 *       The rate limiter treats this (and only this) as a reason to fail open.</li>
 *   <li>Any other exception, including one thrown by the updater, propagates unchanged.</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>Per-key atomicity: updates to different keys need not be serialized</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public interface BucketStore {

    /**
     * Atomically reads, transforms and writes the bucket stored under {@code key}.
     *
     * @param key bucket key ({@code <prefix>:<scope>:<id>})
     * @param initial supplies the bucket to start from when none is stored
     * @param updater pure transformation of the current bucket
     * @return the committed bucket
     * @throws BucketStoreUnavailableException if the backing store cannot be reached
     */
    TokenBucket compareAndUpdate(String key, Supplier<TokenBucket> initial, UnaryOperator<TokenBucket> updater);

    /**
     * Reads the bucket stored under {@code key}.
     *
     * @param key bucket key
     * @return the stored bucket, or empty if none exists
     * @throws BucketStoreUnavailableException if the backing store cannot be reached
     */
    Optional<TokenBucket> find(String key);

    /**
     * Reads every bucket whose key starts with {@code keyPrefix}.
     *
     * @param keyPrefix key prefix, typically one scope ({@code <prefix>:<scope>:})
     * @return snapshot of matching buckets keyed by full key
     * @throws BucketStoreUnavailableException if the backing store cannot be reached
     */
    Map<String, TokenBucket> findByPrefix(String keyPrefix);

    /**
     * Removes buckets under {@code keyPrefix} that have not been accessed since {@code cutoffNanos}.
     *
     * <p>A bucket accessed concurrently with the purge must not be removed.</p>
     *
     * @param keyPrefix key prefix
     * @param cutoffNanos monotonic time; buckets last accessed before it are removed
     * @return number of removed buckets
     * @throws BucketStoreUnavailableException if the backing store cannot be reached
     */
    int removeIdle(String keyPrefix, long cutoffNanos);
}
