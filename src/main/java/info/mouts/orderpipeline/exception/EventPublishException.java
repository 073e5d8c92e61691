package info.mouts.orderpipeline.exception;

/**
 * Raised when an order event could not be handed to the broker.
 * Callers decide whether the whole event should be retried.
 */
public class EventPublishException extends RuntimeException {
    public EventPublishException(String message) {
        super(message);
    }

    public EventPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
