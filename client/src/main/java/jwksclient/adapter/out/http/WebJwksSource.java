package jwksclient.adapter.out.http;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

import io.smallrye.mutiny.Uni;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import jwksclient.core.config.JwksClientConfig;
import jwksclient.core.model.JsonWebKeySet;
import jwksclient.core.port.out.JwksFetchException;
import jwksclient.core.port.out.JwksFetchException.Kind;
import jwksclient.core.port.out.JwksSource;

/**
 * Fetches a JSON Web Key Set over HTTP(S).
 *
 * <p>Each {@link #fetchKeys()} issues exactly one GET to the configured location; there are no
 * retries. The connect timeout is applied by the web client, the total timeout covers the whole
 * request including reading the body.
 *
 * <p>When no {@link Vertx} is supplied the source creates its own and closes it in {@link #close()}.
 */
public class WebJwksSource implements JwksSource, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(WebJwksSource.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(20);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final URI location;
    private final Duration timeout;
    private final Vertx ownedVertx;
    private final WebClient webClient;
    private final JsonWebKeySetParser parser;

    private WebJwksSource(Builder builder, URI location) {
        this.location = location;
        this.timeout = builder.timeout;
        this.ownedVertx = builder.vertx == null ? Vertx.vertx() : null;
        final var vertx = builder.vertx != null ? builder.vertx : ownedVertx;
        final var options =
                new WebClientOptions().setConnectTimeout(Math.toIntExact(builder.connectTimeout.toMillis()));
        this.webClient = WebClient.create(vertx, options);
        this.parser = new JsonWebKeySetParser();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a source from the {@code jwks-client.source} configuration, sharing the given Vert.x instance.
     */
    public static WebJwksSource fromConfig(Vertx vertx, JwksClientConfig.SourceConfig config) {
        Objects.requireNonNull(vertx, "vertx is required");
        return builder()
                .vertx(vertx)
                .connectTimeout(config.connectTimeout())
                .timeout(config.timeout())
                .build(URI.create(config.url()));
    }

    public URI location() {
        return location;
    }

    @Override
    public Uni<JsonWebKeySet> fetchKeys() {
        final var url = location.toString();
        final var startTime = System.currentTimeMillis();
        LOG.debugv("Fetching JWKS from {0}", url);

        return webClient
                .getAbs(url)
                .putHeader("Accept", "application/json")
                .send()
                .map(response -> {
                    final var status = response.statusCode();
                    if (status < 200 || status > 299) {
                        LOG.warnv("JWKS endpoint {0} returned status {1}", url, status);
                        throw JwksFetchException.httpStatus(status, url);
                    }
                    final var keySet = parser.parse(response.bodyAsString());
                    LOG.debugv(
                            "Fetched {0} keys from {1} in {2}ms",
                            keySet.size(),
                            url,
                            System.currentTimeMillis() - startTime);
                    return keySet;
                })
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new JwksFetchException(
                        Kind.TIMEOUT, "JWKS endpoint " + url + " did not respond within " + timeout.toMillis() + "ms"))
                .onFailure(error -> !(error instanceof JwksFetchException))
                .transform(error -> new JwksFetchException(
                        Kind.TRANSPORT, "Failed to fetch JWKS from " + url + ": " + error.getMessage(), error));
    }

    @Override
    public void close() {
        webClient.close();
        if (ownedVertx != null) {
            ownedVertx.close().await().indefinitely();
        }
    }

    /**
     * Builder for {@link WebJwksSource}.
     */
    public static final class Builder {

        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Vertx vertx;

        private Builder() {}

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requirePositive(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = requirePositive(timeout, "timeout");
            return this;
        }

        /**
         * Vert.x instance to run the web client on. The source does not close a supplied instance.
         */
        public Builder vertx(Vertx vertx) {
            this.vertx = vertx;
            return this;
        }

        public WebJwksSource build(URI location) {
            Objects.requireNonNull(location, "location is required");
            final var scheme = location.getScheme();
            if (!location.isAbsolute() || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new IllegalArgumentException("JWKS location must be an absolute http(s) URI: " + location);
            }
            return new WebJwksSource(this, location);
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " is required");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
