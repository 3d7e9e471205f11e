package jwksclient.core.service;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import jwksclient.core.cache.KeySetCache;
import jwksclient.core.config.JwksClientConfig;
import jwksclient.core.port.out.JwksMetrics;
import jwksclient.core.port.out.JwksSource;
import jwksclient.core.port.out.TokenVerifier;

/**
 * Builder for {@link JwksClient}.
 */
public class JwksClientBuilder {

    private Duration timeToLive = JwksClient.DEFAULT_TIME_TO_LIVE;
    private Clock clock = Clock.systemUTC();
    private TokenVerifier verifier;
    private JwksMetrics metrics = JwksMetrics.noop();

    JwksClientBuilder() {}

    /**
     * How long a fetched key set is served before a lookup refreshes it (default 24 hours).
     */
    public JwksClientBuilder timeToLive(Duration timeToLive) {
        this.timeToLive = timeToLive;
        return this;
    }

    public JwksClientBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Verifier used by {@code decode}; defaults to {@link Jose4jTokenVerifier}.
     */
    public JwksClientBuilder verifier(TokenVerifier verifier) {
        this.verifier = verifier;
        return this;
    }

    public JwksClientBuilder metrics(JwksMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * Apply the client settings from configuration.
     */
    public JwksClientBuilder config(JwksClientConfig config) {
        return timeToLive(config.timeToLive());
    }

    public JwksClient build(JwksSource source) {
        Objects.requireNonNull(source, "source is required");
        final var cache = new KeySetCache(timeToLive, clock, metrics);
        return new JwksClient(source, cache, verifier != null ? verifier : new Jose4jTokenVerifier());
    }
}
