package info.mouts.orderpipeline.service;

import java.util.Map;

import info.mouts.orderpipeline.domain.OrderEvent;
import info.mouts.orderpipeline.exception.EventPublishException;
import info.mouts.orderpipeline.exception.InvalidOrderRequestException;

public interface OrderService {
    /**
     * Accepts a new order and hands it to the kitchen queue.
     * The payload is passed through as is, with {@code order_status} set to
     * {@code ORDERED} and {@code client_id} set to the owning client.
     *
     * @param payload  The order as received from the client.
     * @param clientId The client that should receive updates, may be null.
     * @return The event that was published.
     * @throws InvalidOrderRequestException If the payload is empty.
     * @throws EventPublishException        If the order could not be published.
     */
    OrderEvent placeOrder(Map<String, Object> payload, String clientId);
}
