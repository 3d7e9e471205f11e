package jwksclient.adapter.out.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import jwksclient.core.model.JsonWebKeySet;
import jwksclient.core.model.RsaPublicJwk;
import jwksclient.core.port.out.JwksFetchException;

@DisplayName("StaticJwksSource")
class StaticJwksSourceTest {

    private static final Duration AWAIT = Duration.ofSeconds(1);
    private static final JsonWebKeySet KEY_SET = JsonWebKeySet.of(RsaPublicJwk.of("key-1", "modulus", "AQAB"));

    @Test
    @DisplayName("should serve the configured key set and count fetches")
    void shouldServeConfiguredKeySet() {
        final var source = new StaticJwksSource(KEY_SET);

        assertSame(KEY_SET, source.fetchKeys().await().atMost(AWAIT));
        assertSame(KEY_SET, source.fetchKeys().await().atMost(AWAIT));
        assertEquals(2, source.fetchCount());
    }

    @Test
    @DisplayName("should not count a fetch until it is subscribed")
    void shouldCountOnSubscription() {
        final var source = StaticJwksSource.empty();

        final var pending = source.fetchKeys();

        assertEquals(0, source.fetchCount());
        assertTrue(pending.await().atMost(AWAIT).isEmpty());
        assertEquals(1, source.fetchCount());
    }

    @Test
    @DisplayName("should fail until a key set is configured again")
    void shouldFailUntilKeySetReplaced() {
        final var source = new StaticJwksSource(KEY_SET);
        final var failure = new JwksFetchException(JwksFetchException.Kind.TRANSPORT, "offline");

        source.failWith(failure);
        final var error =
                assertThrows(JwksFetchException.class, () -> source.fetchKeys().await().atMost(AWAIT));
        assertSame(failure, error);

        final var replacement = JsonWebKeySet.empty();
        source.setKeySet(replacement);
        assertSame(replacement, source.fetchKeys().await().atMost(AWAIT));
    }
}
