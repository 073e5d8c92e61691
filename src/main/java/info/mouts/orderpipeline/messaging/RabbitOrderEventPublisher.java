package info.mouts.orderpipeline.messaging;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

import info.mouts.orderpipeline.broker.BrokerConnectionManager;
import info.mouts.orderpipeline.config.RabbitMqProperties;
import info.mouts.orderpipeline.domain.OrderEvent;
import info.mouts.orderpipeline.exception.BrokerConnectionException;
import info.mouts.orderpipeline.exception.EventPublishException;
import info.mouts.orderpipeline.exception.EventSerializationException;
import info.mouts.orderpipeline.exception.PublishTimeoutException;
import info.mouts.orderpipeline.util.RabbitMqUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes order events to RabbitMQ through the default (direct) exchange,
 * using the queue name as routing key.
 * Every call opens its own channel, switches it to confirm mode, waits for the
 * broker confirmation within the configured budget and closes the channel.
 */
@Slf4j
public class RabbitOrderEventPublisher implements OrderEventPublisher {
    private final BrokerConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final RabbitMqProperties properties;

    private Counter publishedEventsCounter;
    private Counter failedPublishCounter;

    /**
     * Constructs an instance of {@code RabbitOrderEventPublisher}.
     *
     * @param connectionManager The source of channels.
     * @param objectMapper      The Jackson mapper used to encode events.
     * @param properties        The broker settings (default queue, time budget).
     * @param meterRegistry     The registry for collecting metrics.
     */
    public RabbitOrderEventPublisher(BrokerConnectionManager connectionManager, ObjectMapper objectMapper,
            RabbitMqProperties properties, MeterRegistry meterRegistry) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
        this.properties = properties;

        initializeMetrics(meterRegistry);
    }

    @Override
    public void publish(String queueName, OrderEvent event) {
        String targetQueue = (queueName == null || queueName.isBlank()) ? properties.getDefaultQueue() : queueName;

        byte[] body = serialize(event);

        Channel channel;
        try {
            channel = connectionManager.acquire();
        } catch (BrokerConnectionException | IllegalStateException e) {
            failedPublishCounter.increment();
            throw new EventPublishException("RabbitMQ channel is unavailable: " + e.getMessage(), e);
        }

        try {
            channel.confirmSelect();
            channel.basicPublish(RabbitMqUtils.DEFAULT_EXCHANGE, targetQueue, persistentJson(), body);
            channel.waitForConfirmsOrDie(properties.getPublishTimeout().toMillis());

            publishedEventsCounter.increment();
            log.info("Event published to queue {} with status {}", targetQueue, event.getRawStatus());
            log.debug("Published event: {}", event);
        } catch (TimeoutException e) {
            failedPublishCounter.increment();
            throw new PublishTimeoutException(targetQueue, properties.getPublishTimeout(), e);
        } catch (IOException e) {
            failedPublishCounter.increment();
            throw new EventPublishException("Failed to publish event to queue " + targetQueue + ": " + e.getMessage(),
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failedPublishCounter.increment();
            throw new EventPublishException("Interrupted while publishing event to queue " + targetQueue, e);
        } catch (RuntimeException e) {
            // AlreadyClosedException and friends
            failedPublishCounter.increment();
            throw new EventPublishException("Failed to publish event to queue " + targetQueue + ": " + e.getMessage(),
                    e);
        } finally {
            connectionManager.closeQuietly(channel);
        }
    }

    /**
     * Encodes the event as UTF-8 JSON.
     *
     * @param event The event to encode.
     * @return The wire payload.
     * @throws EventSerializationException If Jackson cannot encode one of the
     *                                     event fields.
     */
    private byte[] serialize(OrderEvent event) {
        try {
            return objectMapper.writeValueAsString(event).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            failedPublishCounter.increment();
            log.error("Failed to serialize order event: {}", e.getMessage());
            throw new EventSerializationException("Failed to serialize order event: " + e.getOriginalMessage(), e);
        }
    }

    private AMQP.BasicProperties persistentJson() {
        return new AMQP.BasicProperties.Builder()
                .contentType(RabbitMqUtils.CONTENT_TYPE_JSON)
                .contentEncoding(StandardCharsets.UTF_8.name())
                .deliveryMode(RabbitMqUtils.PERSISTENT_DELIVERY_MODE)
                .build();
    }

    /**
     * Initializes the Micrometer metrics for the publisher.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.publishedEventsCounter = Counter.builder("orders.events.published")
                .description("Total number of order events confirmed by the broker")
                .register(registry);
        this.failedPublishCounter = Counter.builder("orders.events.publish.failed")
                .description("Total number of order events that could not be published")
                .register(registry);
    }
}
