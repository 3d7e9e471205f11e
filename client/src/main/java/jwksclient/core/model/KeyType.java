package jwksclient.core.model;

/**
 * Key families a {@link JsonWebKey} can belong to, named after the JWK {@code kty} member.
 */
public enum KeyType {
    RSA,
    EC
}
