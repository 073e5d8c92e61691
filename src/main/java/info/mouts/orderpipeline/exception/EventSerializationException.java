package info.mouts.orderpipeline.exception;

/**
 * The event could not be encoded to JSON. Nothing was sent to the broker.
 */
public class EventSerializationException extends EventPublishException {
    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
