package jwksclient.core.model;

import java.util.Optional;

/**
 * The single error type surfaced by the JWKS client.
 *
 * <p>{@link #reason()} classifies the failure and {@link #getCause()} keeps the original error
 * (a fetch failure from the key source, or the verifier's rejection of a token).
 */
public class JwksClientException extends RuntimeException {

    /**
     * Failure classification.
     */
    public enum Reason {
        /** The key set could not be fetched and no cached key could stand in */
        FETCH_FAILED,
        /** The key identifier is not present in the key set */
        KEY_NOT_FOUND,
        /** The token is malformed, badly signed, expired or meant for another audience */
        TOKEN_DECODE,
        /** The token header carries no key identifier */
        MISSING_KID,
        /** The selected key belongs to a family that cannot verify tokens yet */
        UNSUPPORTED_KEY_TYPE
    }

    private final Reason reason;
    private final String keyId;
    private final boolean tokenExpired;

    public JwksClientException(Reason reason, String message, String keyId, Throwable cause) {
        this(reason, message, keyId, cause, false);
    }

    private JwksClientException(Reason reason, String message, String keyId, Throwable cause, boolean tokenExpired) {
        super(message, cause);
        this.reason = reason;
        this.keyId = keyId;
        this.tokenExpired = tokenExpired;
    }

    public static JwksClientException fetchFailed(Throwable cause) {
        return new JwksClientException(
                Reason.FETCH_FAILED, "Failed fetching the key set: " + cause.getMessage(), null, cause);
    }

    public static JwksClientException keyNotFound(String keyId) {
        return new JwksClientException(Reason.KEY_NOT_FOUND, "Cannot find key for key_id: " + keyId, keyId, null);
    }

    public static JwksClientException missingKid() {
        return new JwksClientException(Reason.MISSING_KID, "Missing kid value in the JWT token header", null, null);
    }

    public static JwksClientException unsupportedKeyType(JsonWebKey key) {
        return new JwksClientException(
                Reason.UNSUPPORTED_KEY_TYPE,
                "Key type " + key.keyType() + " is not supported for this operation (kid: " + key.keyId() + ")",
                key.keyId(),
                null);
    }

    public static JwksClientException tokenDecode(String message, String keyId, Throwable cause) {
        return new JwksClientException(Reason.TOKEN_DECODE, "Token decoding error: " + message, keyId, cause, false);
    }

    public static JwksClientException expiredToken(String message, String keyId, Throwable cause) {
        return new JwksClientException(Reason.TOKEN_DECODE, "Token decoding error: " + message, keyId, cause, true);
    }

    /**
     * Wrap any failure into a {@code JwksClientException}, returning it unchanged if it already is one.
     * Anything else reached the client through the key source and is reported as a fetch failure.
     */
    public static JwksClientException wrap(Throwable error) {
        if (error instanceof JwksClientException clientException) {
            return clientException;
        }
        return fetchFailed(error);
    }

    public Reason reason() {
        return reason;
    }

    public Optional<String> keyId() {
        return Optional.ofNullable(keyId);
    }

    /**
     * Whether the token was rejected because its {@code exp} claim has passed.
     */
    public boolean isTokenExpired() {
        return tokenExpired;
    }
}
