package info.mouts.orderpipeline.exception;

import java.time.Duration;

public class PublishTimeoutException extends EventPublishException {
    public PublishTimeoutException(String queueName, Duration timeout, Throwable cause) {
        super("Broker did not confirm publish to queue " + queueName + " within " + timeout, cause);
    }
}
