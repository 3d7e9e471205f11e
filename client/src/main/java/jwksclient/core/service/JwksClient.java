package jwksclient.core.service;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.lang.JoseException;

import jwksclient.core.cache.KeySetCache;
import jwksclient.core.model.JsonWebKey;
import jwksclient.core.model.JwksClientException;
import jwksclient.core.port.out.InvalidTokenException;
import jwksclient.core.port.out.JwksSource;
import jwksclient.core.port.out.TokenVerifier;

/**
 * Client for looking up verification keys from a JSON Web Key Set and decoding tokens signed with them.
 *
 * <p>Keys are served from a {@link KeySetCache}; the {@link JwksSource} is only contacted when a key
 * is unknown or the cached set has outlived its time-to-live. One instance should be shared by all
 * callers so that they share the cache.
 *
 * <p>Every failure is reported as a {@link JwksClientException}.
 */
public class JwksClient {

    private static final Logger LOG = Logger.getLogger(JwksClient.class);

    public static final Duration DEFAULT_TIME_TO_LIVE = Duration.ofHours(24);

    private final JwksSource source;
    private final KeySetCache cache;
    private final TokenVerifier verifier;
    private final ObjectMapper objectMapper;

    JwksClient(JwksSource source, KeySetCache cache, TokenVerifier verifier) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.cache = cache;
        this.verifier = verifier;
        this.objectMapper = new ObjectMapper()
                .registerModule(new Jdk8Module())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static JwksClientBuilder builder() {
        return new JwksClientBuilder();
    }

    /**
     * Retrieve a key from the cache, fetching the key set from the source when the key is unknown or
     * the cached set has expired.
     *
     * <p>If the key is still missing after fetching, fails with {@code KEY_NOT_FOUND}.
     */
    public Uni<JsonWebKey> get(String keyId) {
        return cache.getOrRefresh(keyId, source::fetchKeys).onFailure().transform(JwksClientException::wrap);
    }

    /**
     * Same as {@link #get(String)}, with the key wrapped in an {@link Optional}. Failures, including
     * {@code KEY_NOT_FOUND}, are propagated exactly as {@code get} does.
     */
    public Uni<Optional<JsonWebKey>> getOptional(String keyId) {
        return get(keyId).map(Optional::of);
    }

    /**
     * Verify a token with the key named by its {@code kid} header and decode its claims.
     *
     * <p>Pass an empty collection to skip audience validation. A {@code null} audience fails the
     * returned {@code Uni} with a {@link NullPointerException}.
     *
     * @param token    compact serialized JWT
     * @param audience accepted audiences
     * @return the token claims
     */
    public Uni<Map<String, Object>> decode(String token, Collection<String> audience) {
        if (audience == null) {
            return Uni.createFrom()
                    .failure(new NullPointerException("audience must not be null, pass an empty collection instead"));
        }
        return extractKeyId(token)
                .flatMap(keyId -> get(keyId).map(key -> verify(token, key, audience)))
                .onFailure()
                .transform(JwksClientException::wrap);
    }

    /**
     * Same as {@link #decode(String, Collection)}, binding the claims to {@code claimsType}.
     */
    public <T> Uni<T> decode(String token, Collection<String> audience, Class<T> claimsType) {
        return decode(token, audience).map(claims -> {
            try {
                return objectMapper.convertValue(claims, claimsType);
            } catch (IllegalArgumentException e) {
                throw JwksClientException.tokenDecode(
                        "Claims cannot be bound to " + claimsType.getSimpleName(), null, e);
            }
        });
    }

    private Uni<String> extractKeyId(String token) {
        return Uni.createFrom().item(() -> {
            if (token == null || token.isBlank()) {
                throw JwksClientException.tokenDecode("Token is empty", null, null);
            }
            final String keyId;
            try {
                final var jws = new JsonWebSignature();
                jws.setCompactSerialization(token);
                keyId = jws.getKeyIdHeaderValue();
            } catch (JoseException e) {
                throw JwksClientException.tokenDecode("Failed to parse token header: " + e.getMessage(), null, e);
            }
            if (keyId == null || keyId.isBlank()) {
                throw JwksClientException.missingKid();
            }
            return keyId;
        });
    }

    private Map<String, Object> verify(String token, JsonWebKey key, Collection<String> audience) {
        // TODO: verify EC keys (ES256/ES384/ES512) once TokenVerifier accepts an EcPublicJwk
        final var rsaKey = key.asRsaPublicKey();
        try {
            final var claims = verifier.verify(token, rsaKey, key.algorithm(), audience);
            LOG.debugv("Decoded token signed with kid {0}", key.keyId());
            return claims;
        } catch (InvalidTokenException e) {
            if (e.isExpired()) {
                throw JwksClientException.expiredToken(e.getMessage(), key.keyId(), e);
            }
            throw JwksClientException.tokenDecode(e.getMessage(), key.keyId(), e);
        } catch (JwksClientException e) {
            throw e;
        } catch (RuntimeException e) {
            throw JwksClientException.tokenDecode("Token verification failed: " + e.getMessage(), key.keyId(), e);
        }
    }
}
