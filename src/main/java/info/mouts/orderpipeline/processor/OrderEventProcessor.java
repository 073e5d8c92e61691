package info.mouts.orderpipeline.processor;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import info.mouts.orderpipeline.domain.OrderEvent;
import info.mouts.orderpipeline.domain.OrderStatus;
import info.mouts.orderpipeline.dto.OrderNotificationDTO;
import info.mouts.orderpipeline.exception.ClientNotificationException;
import info.mouts.orderpipeline.exception.EventPublishException;
import info.mouts.orderpipeline.exception.OrderEventDecodeException;
import info.mouts.orderpipeline.exception.OrderProcessingException;
import info.mouts.orderpipeline.messaging.MessageProcessor;
import info.mouts.orderpipeline.messaging.OrderEventPublisher;
import info.mouts.orderpipeline.registry.ConnectionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * The order state machine. Every delivery of the order queue, including the
 * stages this processor published itself, passes through
 * {@link #process(byte[])}:
 *
 * <ul>
 * <li>{@code ORDERED}: re-published as {@code PREPARING}</li>
 * <li>{@code PREPARING}: held for the preparation delay, then re-published as
 * {@code PREPARED}</li>
 * <li>{@code PREPARED}: marked {@code DELIVERED} and pushed to the owning
 * client, nothing is re-published</li>
 * <li>anything else: logged and dropped</li>
 * </ul>
 *
 * <p>
 * A failed re-publish notifies the owning client with a cancellation message and
 * fails the delivery so that the consumer requeues it.
 * </p>
 */
@Slf4j
public class OrderEventProcessor implements MessageProcessor {
    private static final TypeReference<Map<String, Object>> EVENT_TYPE = new TypeReference<>() {
    };

    private final OrderEventPublisher publisher;
    private final ConnectionRegistry connectionRegistry;
    private final PreparationDelay preparationDelay;
    private final ObjectMapper objectMapper;
    private final String orderQueue;
    private final String defaultClientId;

    private Timer processingTimer;
    private Counter deliveredOrdersCounter;
    private Counter cancelledOrdersCounter;
    private Counter droppedEventsCounter;

    /**
     * Constructs an instance of {@code OrderEventProcessor}.
     *
     * @param publisher          The publisher used to advance an order to its next
     *                           stage.
     * @param connectionRegistry The live connections notifications are sent to.
     * @param preparationDelay   The simulated work of the {@code PREPARING} stage.
     * @param objectMapper       The Jackson mapper for events and notifications.
     * @param orderQueue         The queue stages are re-published to.
     * @param defaultClientId    The client notified for events without a
     *                           {@code client_id}.
     * @param meterRegistry      The registry for collecting metrics.
     */
    public OrderEventProcessor(OrderEventPublisher publisher, ConnectionRegistry connectionRegistry,
            PreparationDelay preparationDelay, ObjectMapper objectMapper, String orderQueue, String defaultClientId,
            MeterRegistry meterRegistry) {
        this.publisher = publisher;
        this.connectionRegistry = connectionRegistry;
        this.preparationDelay = preparationDelay;
        this.objectMapper = objectMapper;
        this.orderQueue = orderQueue;
        this.defaultClientId = defaultClientId;

        initializeMetrics(meterRegistry);
    }

    /**
     * Decodes one delivery body and runs the stage its status calls for.
     *
     * @param body The raw delivery body.
     * @throws OrderEventDecodeException If the body is not a JSON object with a
     *                                   textual {@code order_status}.
     * @throws OrderProcessingException  If the stage action failed.
     */
    @Override
    public void process(byte[] body) {
        OrderEvent event = decode(body);

        processingTimer.record(() -> dispatch(event));
    }

    /**
     * Decodes the wire payload into an {@link OrderEvent}.
     *
     * @param body The raw delivery body.
     * @return The decoded event.
     * @throws OrderEventDecodeException If the payload is malformed.
     */
    OrderEvent decode(byte[] body) {
        Map<String, Object> fields;
        try {
            fields = objectMapper.readValue(body, EVENT_TYPE);
        } catch (IOException e) {
            throw new OrderEventDecodeException("Order event is not a valid JSON object: " + e.getMessage(), e);
        }

        if (fields == null) {
            throw new OrderEventDecodeException("Order event is empty");
        }

        if (!(fields.get(OrderEvent.ORDER_STATUS_FIELD) instanceof String)) {
            throw new OrderEventDecodeException(
                    "Order event has no textual " + OrderEvent.ORDER_STATUS_FIELD + " field");
        }
        return new OrderEvent(fields);
    }

    private void dispatch(OrderEvent event) {
        OrderStatus status = event.getStatus().orElse(null);

        if (status == null) {
            log.warn("Dropping order event with unknown status {}", event.getRawStatus());
            droppedEventsCounter.increment();
            return;
        }

        if (status.isTerminal()) {
            log.info("Order event already in terminal status {}, nothing to do", status);
            droppedEventsCounter.increment();
            return;
        }

        switch (status) {
            case ORDERED -> advance(event, OrderStatus.PREPARING);
            case PREPARING -> prepare(event);
            case PREPARED -> deliver(event);
            default -> throw new IllegalStateException("Unhandled order status " + status);
        }
    }

    private void prepare(OrderEvent event) {
        try {
            preparationDelay.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrderProcessingException("Interrupted while preparing order", e);
        }

        advance(event, OrderStatus.PREPARED);
    }

    /**
     * Re-publishes the event with the next status. On failure the owning client
     * is told the order was cancelled and the failure is rethrown.
     *
     * @param event The current event.
     * @param next  The status to advance to.
     */
    private void advance(OrderEvent event, OrderStatus next) {
        OrderEvent advanced = event.withStatus(next);

        try {
            publisher.publish(orderQueue, advanced);
            log.info("Order advanced from {} to {}", event.getRawStatus(), next);
        } catch (EventPublishException e) {
            log.error("Failed to advance order from {} to {}: {}", event.getRawStatus(), next, e.getMessage());
            cancelledOrdersCounter.increment();
            notifyFailure(event, e);
            throw new OrderProcessingException("Failed to publish order with status " + next, e);
        }
    }

    private void deliver(OrderEvent event) {
        OrderEvent delivered = event.withStatus(OrderStatus.DELIVERED);

        OrderNotificationDTO notification = OrderNotificationDTO.builder()
                .type(OrderNotificationDTO.ORDER_DELIVERED)
                .message("Your order has been delivered")
                .order(delivered)
                .build();

        String clientId = clientIdOf(event);
        try {
            boolean sent = connectionRegistry.send(clientId, toJson(notification));
            deliveredOrdersCounter.increment();

            if (sent) {
                log.info("Order delivered, client [{}] notified", clientId);
            } else {
                log.info("Order delivered, client [{}] is not connected", clientId);
            }
        } catch (ClientNotificationException e) {
            throw new OrderProcessingException("Failed to notify client " + clientId + " of delivery", e);
        }
    }

    private void notifyFailure(OrderEvent event, Exception cause) {
        OrderNotificationDTO notification = OrderNotificationDTO.builder()
                .type(OrderNotificationDTO.ORDER_FAILED)
                .message("Your order could not be processed and has been cancelled")
                .error(cause.getMessage())
                .order(event.withStatus(OrderStatus.CANCELLED))
                .build();

        String clientId = clientIdOf(event);
        try {
            connectionRegistry.send(clientId, toJson(notification));
        } catch (ClientNotificationException | OrderProcessingException e) {
            log.warn("Could not send failure notification to client [{}]: {}", clientId, e.getMessage());
        }
    }

    private String clientIdOf(OrderEvent event) {
        return event.getClientId().orElse(defaultClientId);
    }

    private String toJson(OrderNotificationDTO notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new OrderProcessingException("Failed to encode notification: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Initializes the Micrometer metrics for the processor.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.processingTimer = Timer.builder("orders.processing.time")
                .description("Time taken to process a single order stage")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        this.deliveredOrdersCounter = Counter.builder("orders.delivered")
                .description("Total number of orders that reached DELIVERED")
                .register(registry);
        this.cancelledOrdersCounter = Counter.builder("orders.cancelled")
                .description("Total number of order stages that failed to publish")
                .register(registry);
        this.droppedEventsCounter = Counter.builder("orders.events.dropped")
                .description("Total number of events with a terminal or unknown status")
                .register(registry);
    }
}
