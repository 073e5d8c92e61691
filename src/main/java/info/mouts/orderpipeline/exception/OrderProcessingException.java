package info.mouts.orderpipeline.exception;

/**
 * Signals that a delivery could not be processed and must be returned to the
 * queue.
 */
public class OrderProcessingException extends RuntimeException {
    public OrderProcessingException(String message) {
        super(message);
    }

    public OrderProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
