package info.mouts.orderpipeline.exception;

/**
 * Raised when the transport connection to RabbitMQ cannot be established or a
 * channel cannot be opened on it.
 */
public class BrokerConnectionException extends RuntimeException {
    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
