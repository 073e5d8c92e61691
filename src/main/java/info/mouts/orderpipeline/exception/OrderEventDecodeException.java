package info.mouts.orderpipeline.exception;

/**
 * The delivery body is not a JSON object carrying a textual
 * {@code order_status}.
 */
public class OrderEventDecodeException extends OrderProcessingException {
    public OrderEventDecodeException(String message) {
        super(message);
    }

    public OrderEventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
