package jwksclient.core.port.out;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import jwksclient.core.model.RsaPublicJwk;

/**
 * Port for verifying a signed token against a public key and decoding its claims.
 */
public interface TokenVerifier {

    /**
     * Verify the token signature and standard claims.
     *
     * @param token     compact serialized JWS
     * @param key       RSA public key to verify the signature with
     * @param algorithm algorithm the key is restricted to; when empty a default RSA policy applies
     * @param audience  accepted audiences; an empty collection disables audience validation
     * @return the decoded claims
     * @throws InvalidTokenException if the token is malformed, badly signed, expired or for another audience
     */
    Map<String, Object> verify(String token, RsaPublicJwk key, Optional<String> algorithm, Collection<String> audience);
}
