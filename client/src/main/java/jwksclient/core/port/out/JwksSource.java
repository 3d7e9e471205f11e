package jwksclient.core.port.out;

import io.smallrye.mutiny.Uni;

import jwksclient.core.model.JsonWebKeySet;

/**
 * Port for retrieving the current JSON Web Key Set from wherever it is published.
 *
 * <p>Implementations perform exactly one retrieval per call. Retry and backoff are not their
 * concern; the cache decides what to do with a failure.
 */
public interface JwksSource {

    /**
     * Fetch the key set.
     *
     * @return the key set, or a failure (usually a {@link JwksFetchException})
     */
    Uni<JsonWebKeySet> fetchKeys();
}
