package jwksclient.core.cache;

import java.util.Objects;

import jwksclient.core.model.JsonWebKeySet;

/**
 * Cached key set together with the instant (epoch milliseconds) after which it is stale.
 *
 * @param keySet          the cached key set
 * @param expiresAtMillis expiry in epoch milliseconds; the set is still fresh at exactly this instant
 */
record CacheEntry(JsonWebKeySet keySet, long expiresAtMillis) {

    CacheEntry {
        Objects.requireNonNull(keySet, "keySet is required");
    }

    /**
     * Entry a cache starts with: no keys and already stale, so the first lookup fetches.
     */
    static CacheEntry initial() {
        return new CacheEntry(JsonWebKeySet.empty(), Long.MIN_VALUE);
    }

    boolean isExpired(long nowMillis) {
        return nowMillis > expiresAtMillis;
    }
}
