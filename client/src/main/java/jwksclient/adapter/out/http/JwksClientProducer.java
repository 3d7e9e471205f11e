package jwksclient.adapter.out.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.mutiny.core.Vertx;

import jwksclient.adapter.out.telemetry.MicrometerJwksMetrics;
import jwksclient.core.config.JwksClientConfig;
import jwksclient.core.port.out.JwksMetrics;
import jwksclient.core.service.JwksClient;

/**
 * Produces a configured {@link JwksClient} for CDI containers.
 * Metrics are recorded when a {@link MeterRegistry} bean is available.
 * The client and its source are singletons so that every injection point shares one cache.
 */
@ApplicationScoped
public class JwksClientProducer {

    private final JwksClientConfig config;
    private final Vertx vertx;
    private final Instance<MeterRegistry> meterRegistry;

    @Inject
    public JwksClientProducer(JwksClientConfig config, Vertx vertx, Instance<MeterRegistry> meterRegistry) {
        this.config = config;
        this.vertx = vertx;
        this.meterRegistry = meterRegistry;
    }

    @Produces
    @Singleton
    public WebJwksSource jwksSource() {
        return WebJwksSource.fromConfig(vertx, config.source());
    }

    @Produces
    @Singleton
    public JwksClient jwksClient(WebJwksSource source) {
        return JwksClient.builder().config(config).metrics(metrics()).build(source);
    }

    void closeSource(@Disposes WebJwksSource source) {
        source.close();
    }

    private JwksMetrics metrics() {
        return meterRegistry.isResolvable() ? new MicrometerJwksMetrics(meterRegistry.get()) : JwksMetrics.noop();
    }
}
