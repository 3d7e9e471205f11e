package jwksclient.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MicrometerJwksMetrics")
class MicrometerJwksMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerJwksMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerJwksMetrics(registry);
    }

    @Test
    @DisplayName("should count cache hits, coalesced refreshes and stale serves")
    void shouldCountCacheEvents() {
        metrics.recordCacheHit();
        metrics.recordCacheHit();
        metrics.recordCoalescedRefresh();
        metrics.recordStaleKeyServed();

        assertEquals(2.0, registry.get("jwks.client.cache.hits").counter().count());
        assertEquals(1.0, registry.get("jwks.client.refresh.coalesced").counter().count());
        assertEquals(1.0, registry.get("jwks.client.stale.served").counter().count());
    }

    @Test
    @DisplayName("should record fetches by outcome with latency")
    void shouldRecordFetchesByOutcome() {
        metrics.recordFetch(true, 120);
        metrics.recordFetch(true, 80);
        metrics.recordFetch(false, 10_000);

        assertEquals(2.0, registry.get("jwks.client.fetch.total").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.get("jwks.client.fetch.total").tag("outcome", "failure").counter().count());

        final var successTimer = registry.get("jwks.client.fetch.duration").tag("outcome", "success").timer();
        assertNotNull(successTimer);
        assertEquals(2, successTimer.count());
        assertEquals(200.0, successTimer.totalTime(TimeUnit.MILLISECONDS));
    }
}
