package jwksclient.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the JWKS client.
 *
 * <p>Configuration prefix: {@code jwks-client}
 *
 * <p>This configuration controls:
 * <ul>
 *   <li>How long a fetched key set is served before it is refreshed</li>
 *   <li>Where the key set is fetched from and the HTTP timeouts used to fetch it</li>
 * </ul>
 */
@ConfigMapping(prefix = "jwks-client")
public interface JwksClientConfig {

    /**
     * Time-to-live of a fetched key set.
     *
     * <p>A lookup after the TTL has elapsed refreshes the key set; if the refresh fails the
     * expired keys are still served.
     *
     * @return Cache TTL duration (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration timeToLive();

    /**
     * Key set source configuration.
     */
    SourceConfig source();

    /**
     * HTTP source settings.
     */
    interface SourceConfig {

        /**
         * Absolute URL of the JWKS document, e.g. {@code https://tenant.eu.auth0.com/.well-known/jwks.json}.
         */
        String url();

        /**
         * Maximum time to establish a TCP connection to the JWKS endpoint.
         *
         * @return Connect timeout duration (default: 20 seconds)
         */
        @WithDefault("PT20S")
        Duration connectTimeout();

        /**
         * Maximum time for a complete fetch, from sending the request to parsing the body.
         *
         * @return Fetch timeout duration (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration timeout();
    }
}
