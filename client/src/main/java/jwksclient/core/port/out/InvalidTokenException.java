package jwksclient.core.port.out;

/**
 * Exception thrown by a {@link TokenVerifier} when a token is rejected.
 */
public class InvalidTokenException extends RuntimeException {

    private final boolean expired;

    public InvalidTokenException(String message, boolean expired, Throwable cause) {
        super(message, cause);
        this.expired = expired;
    }

    /**
     * Whether the rejection was caused by the {@code exp} claim being in the past.
     */
    public boolean isExpired() {
        return expired;
    }
}
