package jwksclient.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered set of public keys published by an identity provider.
 *
 * <p>An empty set is valid and is what a cache holds before its first fetch. Lookups scan the
 * keys in document order; if the provider publishes the same {@code kid} twice the first key wins.
 */
public final class JsonWebKeySet {

    private static final JsonWebKeySet EMPTY = new JsonWebKeySet(List.of());

    private final List<JsonWebKey> keys;

    public JsonWebKeySet(List<? extends JsonWebKey> keys) {
        this.keys = List.copyOf(Objects.requireNonNull(keys, "keys must not be null"));
    }

    public static JsonWebKeySet empty() {
        return EMPTY;
    }

    public static JsonWebKeySet of(JsonWebKey... keys) {
        return new JsonWebKeySet(Arrays.asList(keys));
    }

    /**
     * Find the first key with the given identifier.
     */
    public Optional<JsonWebKey> findKey(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return keys.stream().filter(key -> keyId.equals(key.keyId())).findFirst();
    }

    /**
     * Get the first key with the given identifier.
     *
     * @throws JwksClientException with reason {@code KEY_NOT_FOUND} when no key matches
     */
    public JsonWebKey getKey(String keyId) {
        return findKey(keyId).orElseThrow(() -> JwksClientException.keyNotFound(keyId));
    }

    /**
     * Same contract as {@link #getKey(String)}. Keys are immutable, so nothing is removed from the set.
     */
    public JsonWebKey takeKey(String keyId) {
        return getKey(keyId);
    }

    public List<JsonWebKey> keys() {
        return keys;
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JsonWebKeySet other)) {
            return false;
        }
        return keys.equals(other.keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return "JsonWebKeySet{kids=" + keys.stream().map(JsonWebKey::keyId).toList() + "}";
    }
}
