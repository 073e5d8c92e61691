package info.mouts.orderpipeline.service.impl;

import java.util.Map;

import org.springframework.stereotype.Service;

import info.mouts.orderpipeline.config.PipelineProperties;
import info.mouts.orderpipeline.domain.OrderEvent;
import info.mouts.orderpipeline.domain.OrderStatus;
import info.mouts.orderpipeline.exception.EventPublishException;
import info.mouts.orderpipeline.exception.InvalidOrderRequestException;
import info.mouts.orderpipeline.messaging.OrderEventPublisher;
import info.mouts.orderpipeline.service.OrderService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderService} interface.
 * Admission is a pass-through: the order is stamped and published, all
 * processing happens asynchronously in the pipeline.
 */
@Service
@Slf4j
public class OrderServiceImpl implements OrderService {
    private final OrderEventPublisher publisher;
    private final PipelineProperties properties;

    private Counter placedOrdersCounter;

    /**
     * Constructs an instance of {@code OrderServiceImpl}.
     *
     * @param publisher     The publisher for the kitchen queue.
     * @param properties    The pipeline settings (queue, default client).
     * @param meterRegistry The registry for collecting metrics.
     */
    public OrderServiceImpl(OrderEventPublisher publisher, PipelineProperties properties,
            MeterRegistry meterRegistry) {
        this.publisher = publisher;
        this.properties = properties;

        initializeMetrics(meterRegistry);
    }

    @Override
    public OrderEvent placeOrder(Map<String, Object> payload, String clientId) {
        if (payload == null || payload.isEmpty()) {
            throw new InvalidOrderRequestException("Invalid order data provided");
        }

        String owner = (clientId == null || clientId.isBlank()) ? properties.getDefaultClientId() : clientId;

        OrderEvent event = new OrderEvent(payload)
                .with(OrderEvent.CLIENT_ID_FIELD, owner)
                .withStatus(OrderStatus.ORDERED);

        try {
            publisher.publish(properties.getOrderQueue(), event);
        } catch (EventPublishException e) {
            log.error("Failed to send order for client [{}] to the kitchen: {}", owner, e.getMessage());
            throw e;
        }

        placedOrdersCounter.increment();
        log.info("Order accepted for client [{}]", owner);

        return event;
    }

    /**
     * Initializes the Micrometer metrics for the order service.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.placedOrdersCounter = Counter.builder("orders.placed")
                .description("Total number of orders accepted over HTTP")
                .register(registry);
    }
}
