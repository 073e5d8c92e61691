package info.mouts.orderpipeline.exception;

/**
 * Raised when a subscription to an order queue cannot be set up.
 */
public class EventConsumeException extends RuntimeException {
    public EventConsumeException(String message, Throwable cause) {
        super(message, cause);
    }
}
