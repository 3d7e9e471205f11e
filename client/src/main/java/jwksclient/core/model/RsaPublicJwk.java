package jwksclient.core.model;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RSA public key.
 *
 * @param keyId        key identifier ({@code kid})
 * @param algorithm    intended algorithm ({@code alg})
 * @param use          intended use ({@code use})
 * @param modulus      base64url encoded modulus ({@code n})
 * @param exponent     base64url encoded public exponent ({@code e})
 * @param certificates X.509 certificate chain ({@code x5c}), leaf first
 * @param thumbprint   base64url SHA-1 thumbprint of the leaf certificate ({@code x5t})
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RsaPublicJwk(
        @JsonProperty("kid") String keyId,
        @JsonProperty("alg") Optional<String> algorithm,
        @JsonProperty("use") Optional<KeyUse> use,
        @JsonProperty("n") String modulus,
        @JsonProperty("e") String exponent,
        @JsonProperty("x5c") List<String> certificates,
        @JsonProperty("x5t") Optional<String> thumbprint)
        implements JsonWebKey {

    public RsaPublicJwk {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("kid cannot be null or blank");
        }
        if (modulus == null || modulus.isBlank()) {
            throw new IllegalArgumentException("RSA modulus (n) cannot be null or blank");
        }
        if (exponent == null || exponent.isBlank()) {
            throw new IllegalArgumentException("RSA exponent (e) cannot be null or blank");
        }
        if (algorithm == null) {
            algorithm = Optional.empty();
        }
        if (use == null) {
            use = Optional.empty();
        }
        certificates = certificates == null ? List.of() : List.copyOf(certificates);
        if (thumbprint == null) {
            thumbprint = Optional.empty();
        }
    }

    /**
     * Creates a key carrying only the mandatory members.
     */
    public static RsaPublicJwk of(String keyId, String modulus, String exponent) {
        return new RsaPublicJwk(
                keyId, Optional.empty(), Optional.empty(), modulus, exponent, List.of(), Optional.empty());
    }

    @Override
    public KeyType keyType() {
        return KeyType.RSA;
    }
}
