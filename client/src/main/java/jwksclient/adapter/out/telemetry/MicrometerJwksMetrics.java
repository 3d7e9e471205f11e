package jwksclient.adapter.out.telemetry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import jwksclient.core.port.out.JwksMetrics;

/**
 * Micrometer implementation of {@link JwksMetrics}.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code jwks.client.cache.hits} - Lookups answered from a fresh key set</li>
 *   <li>{@code jwks.client.fetch.total} - Key set fetches by outcome</li>
 *   <li>{@code jwks.client.fetch.duration} - Key set fetch latency by outcome</li>
 *   <li>{@code jwks.client.refresh.coalesced} - Refreshes that reused another caller's fetch</li>
 *   <li>{@code jwks.client.stale.served} - Expired keys served after a failed or incomplete refresh</li>
 * </ul>
 */
public class MicrometerJwksMetrics implements JwksMetrics {

    private final MeterRegistry registry;
    private final Counter cacheHits;
    private final Counter coalescedRefreshes;
    private final Counter staleKeysServed;

    public MicrometerJwksMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.cacheHits = Counter.builder("jwks.client.cache.hits")
                .description("JWKS lookups answered from a fresh cached key set")
                .register(registry);
        this.coalescedRefreshes = Counter.builder("jwks.client.refresh.coalesced")
                .description("JWKS refreshes that joined a fetch in flight or found the key set already replaced")
                .register(registry);
        this.staleKeysServed = Counter.builder("jwks.client.stale.served")
                .description("Expired keys served because the refresh did not yield a usable key")
                .register(registry);
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordFetch(boolean success, long durationMs) {
        final var outcome = success ? "success" : "failure";

        Counter.builder("jwks.client.fetch.total")
                .description("Total JWKS fetches")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("jwks.client.fetch.duration")
                .description("JWKS fetch latency")
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordCoalescedRefresh() {
        coalescedRefreshes.increment();
    }

    @Override
    public void recordStaleKeyServed() {
        staleKeysServed.increment();
    }
}
