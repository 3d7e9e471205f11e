package jwksclient.adapter.out.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.time.Duration;

import jakarta.enterprise.inject.Instance;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import jwksclient.core.config.JwksClientConfig;

@DisplayName("JwksClientProducer")
@ExtendWith(MockitoExtension.class)
class JwksClientProducerTest {

    private static final String URL = "https://auth.example.com/.well-known/jwks.json";

    @Mock
    private JwksClientConfig config;

    @Mock
    private JwksClientConfig.SourceConfig sourceConfig;

    @Mock
    private Instance<MeterRegistry> meterRegistry;

    private Vertx vertx;
    private JwksClientProducer producer;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        producer = new JwksClientProducer(config, vertx, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        vertx.close().await().indefinitely();
    }

    @Test
    @DisplayName("should build the source from the source configuration")
    void shouldBuildSourceFromConfig() {
        when(config.source()).thenReturn(sourceConfig);
        when(sourceConfig.url()).thenReturn(URL);
        when(sourceConfig.connectTimeout()).thenReturn(Duration.ofSeconds(20));
        when(sourceConfig.timeout()).thenReturn(Duration.ofSeconds(10));

        final var source = producer.jwksSource();
        try {
            assertEquals(URL, source.location().toString());
        } finally {
            producer.closeSource(source);
        }
    }

    @Test
    @DisplayName("should build a client with Micrometer metrics when a registry is available")
    void shouldBuildClientWithMetrics() {
        final var registry = new SimpleMeterRegistry();
        when(config.timeToLive()).thenReturn(Duration.ofMinutes(10));
        when(meterRegistry.isResolvable()).thenReturn(true);
        when(meterRegistry.get()).thenReturn(registry);
        final var source = WebJwksSource.builder().vertx(vertx).build(URI.create(URL));

        try {
            assertNotNull(producer.jwksClient(source));
            assertNotNull(registry.find("jwks.client.cache.hits").counter());
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("should build a client without metrics when no registry is available")
    void shouldBuildClientWithoutMetrics() {
        when(config.timeToLive()).thenReturn(Duration.ofMinutes(10));
        when(meterRegistry.isResolvable()).thenReturn(false);
        final var source = WebJwksSource.builder().vertx(vertx).build(URI.create(URL));

        try {
            assertNotNull(producer.jwksClient(source));
        } finally {
            source.close();
        }
    }
}
