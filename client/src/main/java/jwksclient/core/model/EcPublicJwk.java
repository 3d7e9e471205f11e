package jwksclient.core.model;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Elliptic curve public key.
 *
 * @param keyId     key identifier ({@code kid})
 * @param algorithm intended algorithm ({@code alg})
 * @param use       intended use ({@code use})
 * @param curve     curve name ({@code crv}), e.g. {@code P-256}
 * @param x         base64url encoded x coordinate
 * @param y         base64url encoded y coordinate
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EcPublicJwk(
        @JsonProperty("kid") String keyId,
        @JsonProperty("alg") Optional<String> algorithm,
        @JsonProperty("use") Optional<KeyUse> use,
        @JsonProperty("crv") String curve,
        @JsonProperty("x") String x,
        @JsonProperty("y") String y)
        implements JsonWebKey {

    public EcPublicJwk {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("kid cannot be null or blank");
        }
        if (curve == null || curve.isBlank()) {
            throw new IllegalArgumentException("EC curve (crv) cannot be null or blank");
        }
        if (x == null || x.isBlank() || y == null || y.isBlank()) {
            throw new IllegalArgumentException("EC coordinates (x, y) cannot be null or blank");
        }
        if (algorithm == null) {
            algorithm = Optional.empty();
        }
        if (use == null) {
            use = Optional.empty();
        }
    }

    @Override
    public KeyType keyType() {
        return KeyType.EC;
    }
}
