package jwksclient.core.model;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A single public verification key from a JSON Web Key Set.
 *
 * <p>The key family is a closed set selected by the {@code kty} member. Consumers that
 * only handle one family should narrow with {@link #asRsaPublicKey()} or
 * {@link #asEcPublicKey()}, or switch over {@link #keyType()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kty")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RsaPublicJwk.class, name = "RSA"),
    @JsonSubTypes.Type(value = EcPublicJwk.class, name = "EC")
})
public sealed interface JsonWebKey permits RsaPublicJwk, EcPublicJwk {

    /**
     * Key identifier ({@code kid}).
     */
    String keyId();

    /**
     * Algorithm the key is intended for ({@code alg}), e.g. {@code RS256}.
     */
    Optional<String> algorithm();

    /**
     * Intended use ({@code use}).
     */
    Optional<KeyUse> use();

    KeyType keyType();

    /**
     * Narrow this key to its RSA representation.
     *
     * @throws JwksClientException with reason {@code UNSUPPORTED_KEY_TYPE} if this is not an RSA key
     */
    default RsaPublicJwk asRsaPublicKey() {
        return switch (keyType()) {
            case RSA -> (RsaPublicJwk) this;
            case EC -> throw JwksClientException.unsupportedKeyType(this);
        };
    }

    /**
     * Narrow this key to its elliptic curve representation.
     *
     * @throws JwksClientException with reason {@code UNSUPPORTED_KEY_TYPE} if this is not an EC key
     */
    default EcPublicJwk asEcPublicKey() {
        return switch (keyType()) {
            case EC -> (EcPublicJwk) this;
            case RSA -> throw JwksClientException.unsupportedKeyType(this);
        };
    }
}
