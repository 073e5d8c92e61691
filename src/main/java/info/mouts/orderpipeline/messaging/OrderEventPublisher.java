package info.mouts.orderpipeline.messaging;

import info.mouts.orderpipeline.domain.OrderEvent;
import info.mouts.orderpipeline.exception.EventPublishException;

public interface OrderEventPublisher {
    /**
     * Publishes an order event to a queue.
     *
     * @param queueName The target queue; blank or null selects the configured
     *                  default queue.
     * @param event     The event to publish.
     * @throws EventPublishException If the event could not be serialized, no
     *                               channel was available, or the broker did not
     *                               confirm the message in time.
     */
    void publish(String queueName, OrderEvent event);
}
