package jwksclient.core.port.out;

import java.util.OptionalInt;

/**
 * Exception thrown when a {@link JwksSource} cannot produce a key set.
 *
 * <p>{@link #kind()} separates transport problems from responses that arrived but were unusable.
 */
public class JwksFetchException extends RuntimeException {

    public enum Kind {
        /** Connection could not be established or broke mid-request */
        TRANSPORT,
        /** No complete response within the configured timeout */
        TIMEOUT,
        /** The endpoint answered with a non-2xx status */
        HTTP_STATUS,
        /** The response body is not a usable JWKS document */
        PARSE
    }

    private final Kind kind;
    private final Integer statusCode;

    public JwksFetchException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public JwksFetchException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    private JwksFetchException(Kind kind, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static JwksFetchException httpStatus(int statusCode, String location) {
        return new JwksFetchException(
                Kind.HTTP_STATUS, "JWKS endpoint " + location + " returned status " + statusCode, statusCode, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * HTTP status code, present only for {@link Kind#HTTP_STATUS}.
     */
    public OptionalInt statusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
