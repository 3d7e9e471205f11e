package jwksclient.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Intended use of a public key (JWK {@code use} member).
 */
public enum KeyUse {
    /** Signature verification */
    @JsonProperty("sig")
    SIG,

    /** Encryption */
    @JsonProperty("enc")
    ENC
}
