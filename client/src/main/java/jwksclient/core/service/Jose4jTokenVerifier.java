package jwksclient.core.service;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import jwksclient.core.model.RsaPublicJwk;
import jwksclient.core.port.out.InvalidTokenException;
import jwksclient.core.port.out.TokenVerifier;

/**
 * {@link TokenVerifier} backed by jose4j.
 *
 * <p>Validates:
 * <ul>
 *   <li>the signature, restricted to the key's declared algorithm or, when it declares none, to the
 *       RSA signature algorithms</li>
 *   <li>expiration (exp, required) and not-before (nbf), with {@value #CLOCK_SKEW_SECONDS}s leeway</li>
 *   <li>audience (aud), only when at least one audience is supplied</li>
 * </ul>
 */
public class Jose4jTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(Jose4jTokenVerifier.class);
    static final int CLOCK_SKEW_SECONDS = 60;

    private static final String[] DEFAULT_RSA_ALGORITHMS = {
        AlgorithmIdentifiers.RSA_USING_SHA256,
        AlgorithmIdentifiers.RSA_USING_SHA384,
        AlgorithmIdentifiers.RSA_USING_SHA512,
        AlgorithmIdentifiers.RSA_PSS_USING_SHA256,
        AlgorithmIdentifiers.RSA_PSS_USING_SHA384,
        AlgorithmIdentifiers.RSA_PSS_USING_SHA512
    };

    @Override
    public Map<String, Object> verify(
            String token, RsaPublicJwk key, Optional<String> algorithm, Collection<String> audience) {
        final var constraints = algorithm
                .map(alg -> new AlgorithmConstraints(ConstraintType.PERMIT, alg))
                .orElseGet(() -> new AlgorithmConstraints(ConstraintType.PERMIT, DEFAULT_RSA_ALGORITHMS));

        final var builder = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds(CLOCK_SKEW_SECONDS)
                .setJwsAlgorithmConstraints(constraints)
                .setVerificationKey(toPublicKey(key).getPublicKey());

        if (!audience.isEmpty()) {
            builder.setExpectedAudience(audience.toArray(new String[0]));
        } else {
            builder.setSkipDefaultAudienceValidation();
        }

        try {
            final var claims = builder.build().processToClaims(token);
            return new HashMap<>(claims.getClaimsMap());
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT validation failed for kid {0}: {1}", key.keyId(), e.getMessage());
            throw new InvalidTokenException(summarizeJwtError(e), e.hasExpired(), e);
        }
    }

    private PublicJsonWebKey toPublicKey(RsaPublicJwk key) {
        final Map<String, Object> params = new HashMap<>();
        params.put(PublicJsonWebKey.KEY_TYPE_PARAMETER, RsaJsonWebKey.KEY_TYPE);
        params.put(RsaJsonWebKey.MODULUS_MEMBER_NAME, key.modulus());
        params.put(RsaJsonWebKey.EXPONENT_MEMBER_NAME, key.exponent());
        try {
            return PublicJsonWebKey.Factory.newPublicJwk(params);
        } catch (JoseException e) {
            throw new InvalidTokenException("Invalid RSA key material for kid " + key.keyId(), false, e);
        }
    }

    private String summarizeJwtError(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "Token has expired";
        }
        if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID) || e.hasErrorCode(ErrorCodes.AUDIENCE_MISSING)) {
            return "Invalid token audience";
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return "Invalid token signature";
        }
        if (e.getMessage().contains("algorithm")) {
            return "Token algorithm not permitted for this key";
        }
        return "Token validation failed";
    }
}
