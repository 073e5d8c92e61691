package info.mouts.orderpipeline.exception;

public class ClientNotificationException extends RuntimeException {
    public ClientNotificationException(String clientId, Throwable cause) {
        super("Failed to send notification to client " + clientId, cause);
    }
}
