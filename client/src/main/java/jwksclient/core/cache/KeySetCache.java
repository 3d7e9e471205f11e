package jwksclient.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jwksclient.core.model.JsonWebKey;
import jwksclient.core.model.JsonWebKeySet;
import jwksclient.core.model.JwksClientException;
import jwksclient.core.port.out.JwksMetrics;

/**
 * Single-slot cache for a JSON Web Key Set with on-demand refresh.
 *
 * <p>Lookups run in two phases:
 * <ol>
 *   <li><b>Snapshot</b>: under the read lock, read the current entry, decide whether it is expired
 *       and look the key up. The lock is released before anything else happens.</li>
 *   <li><b>Refresh</b>: only when the key is missing or the entry is expired. Under the write lock
 *       the caller either joins the fetch already in flight, notices that another refresh replaced
 *       the entry since its snapshot and uses that, or starts the one fetch everybody else will join.</li>
 * </ol>
 *
 * <p>The write lock is never held across the fetch itself; the in-flight handle is what
 * serializes refreshes, so at most one fetch runs per cache instance. A successful fetch replaces
 * the entry as a whole under the write lock. A failed fetch leaves the entry untouched, and lookups
 * that already found the key in the expired entry get that stale key instead of the failure.
 *
 * <p>Thread-safety: safe for concurrent use; no background tasks are started.
 */
public class KeySetCache {

    private static final Logger LOG = Logger.getLogger(KeySetCache.class);
    private static final Duration MAX_MILLIS = Duration.ofMillis(Long.MAX_VALUE);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final long timeToLiveMillis;
    private final Clock clock;
    private final JwksMetrics metrics;

    // Both guarded by lock
    private CacheEntry entry = CacheEntry.initial();
    private Uni<JsonWebKeySet> inFlight;

    public KeySetCache(Duration timeToLive, Clock clock, JwksMetrics metrics) {
        Objects.requireNonNull(timeToLive, "timeToLive is required");
        if (timeToLive.isNegative() || timeToLive.isZero()) {
            throw new IllegalArgumentException("timeToLive must be positive: " + timeToLive);
        }
        this.timeToLiveMillis = saturatedMillis(timeToLive);
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Look up a key, refreshing the key set from {@code fetcher} when needed.
     *
     * <p>Fails with {@link JwksClientException} ({@code KEY_NOT_FOUND}) when the key is absent after a
     * successful refresh, or with the fetch failure when refreshing failed and no cached key exists.
     *
     * @param keyId   the key identifier (kid) to look up
     * @param fetcher produces the fetch of a new key set; invoked at most once per refresh
     * @return the key
     */
    public Uni<JsonWebKey> getOrRefresh(String keyId, Supplier<Uni<JsonWebKeySet>> fetcher) {
        Objects.requireNonNull(fetcher, "fetcher is required");
        return Uni.createFrom().deferred(() -> {
            final var observed = snapshot();
            final var cached = observed.keySet().findKey(keyId);

            if (cached.isPresent() && !observed.isExpired(clock.millis())) {
                LOG.debugv("Using cached key {0}", keyId);
                metrics.recordCacheHit();
                return Uni.createFrom().item(cached.get());
            }

            return refresh(observed, fetcher)
                    .map(keySet -> keySet.findKey(keyId))
                    .onFailure()
                    .recoverWithUni(error -> recoverWithStale(cached, error))
                    .map(refreshed -> resolve(keyId, refreshed, cached));
        });
    }

    /**
     * Refresh the key set unless a refresh is already running or has completed since {@code observed}
     * was read.
     *
     * @param observed the entry the caller based its decision on
     * @param fetcher  produces the fetch of a new key set
     * @return the key set that is current once the refresh settles
     */
    Uni<JsonWebKeySet> refresh(CacheEntry observed, Supplier<Uni<JsonWebKeySet>> fetcher) {
        return Uni.createFrom().deferred(() -> {
            lock.writeLock().lock();
            try {
                if (inFlight != null) {
                    LOG.debug("Joining JWKS refresh already in flight");
                    metrics.recordCoalescedRefresh();
                    return inFlight;
                }
                // Identity: any successful refresh installs a new entry object
                if (entry != observed) {
                    LOG.debug("JWKS was refreshed concurrently, skipping fetch");
                    metrics.recordCoalescedRefresh();
                    return Uni.createFrom().item(entry.keySet());
                }
                inFlight = createFetch(fetcher);
                return inFlight;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    /**
     * The current entry, read under the read lock.
     */
    CacheEntry snapshot() {
        lock.readLock().lock();
        try {
            return entry;
        } finally {
            lock.readLock().unlock();
        }
    }

    private Uni<JsonWebKeySet> createFetch(Supplier<Uni<JsonWebKeySet>> fetcher) {
        final var startTime = clock.millis();
        LOG.debug("Refreshing JWKS");

        return Uni.createFrom()
                .deferred(fetcher::get)
                .invoke(keySet -> {
                    install(keySet);
                    metrics.recordFetch(true, clock.millis() - startTime);
                    LOG.debugv("Cached {0} keys", keySet.size());
                })
                .onFailure()
                .invoke(error -> {
                    metrics.recordFetch(false, clock.millis() - startTime);
                    LOG.warnv("Failed to refresh JWKS: {0}", error.getMessage());
                })
                .onTermination()
                .invoke(this::clearInFlight)
                .memoize()
                .indefinitely();
    }

    private void install(JsonWebKeySet keySet) {
        final var replacement = new CacheEntry(keySet, expiresAt(clock.millis()));
        lock.writeLock().lock();
        try {
            entry = replacement;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Saturates at Long.MAX_VALUE, so a very long TTL means "never expires"
    private long expiresAt(long nowMillis) {
        if (nowMillis > Long.MAX_VALUE - timeToLiveMillis) {
            return Long.MAX_VALUE;
        }
        return nowMillis + timeToLiveMillis;
    }

    private static long saturatedMillis(Duration timeToLive) {
        if (timeToLive.compareTo(MAX_MILLIS) >= 0) {
            return Long.MAX_VALUE;
        }
        return timeToLive.toMillis();
    }

    // Only the fetch that set the handle clears it; nothing replaces a non-null handle
    private void clearInFlight() {
        lock.writeLock().lock();
        try {
            inFlight = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // An empty result makes resolve() fall back to the stale key
    private Uni<Optional<JsonWebKey>> recoverWithStale(Optional<JsonWebKey> cached, Throwable error) {
        if (cached.isEmpty()) {
            return Uni.createFrom().failure(error);
        }
        return Uni.createFrom().item(Optional.empty());
    }

    private JsonWebKey resolve(String keyId, Optional<JsonWebKey> refreshed, Optional<JsonWebKey> cached) {
        if (refreshed.isPresent()) {
            return refreshed.get();
        }
        if (cached.isPresent()) {
            LOG.debugv("Serving stale key {0}", keyId);
            metrics.recordStaleKeyServed();
            return cached.get();
        }
        throw JwksClientException.keyNotFound(keyId);
    }
}
