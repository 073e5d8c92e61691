package info.mouts.orderpipeline.messaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;

import info.mouts.orderpipeline.broker.BrokerConnectionManager;
import info.mouts.orderpipeline.domain.OrderEvent;
import info.mouts.orderpipeline.domain.OrderStatus;
import info.mouts.orderpipeline.exception.EventPublishException;
import info.mouts.orderpipeline.processor.OrderEventProcessor;
import info.mouts.orderpipeline.processor.RandomPreparationDelay;
import info.mouts.orderpipeline.registry.ClientConnection;
import info.mouts.orderpipeline.registry.ConnectionRegistry;
import info.mouts.orderpipeline.util.RabbitMqUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Drives whole orders through consumer, processor and registry, with the broker
 * replaced by an in-memory queue that honours ack and requeue.
 */
public class OrderPipelineFlowTest {
    private static final String QUEUE = "kitchen-order-queue";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryQueue queue;
    private RecordingConnection client;
    private OrderEventConsumer consumer;
    private OrderEventProcessor processor;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        ConnectionRegistry registry = new ConnectionRegistry();

        queue = new InMemoryQueue();
        client = new RecordingConnection();
        registry.register("pizza", client);

        consumer = new OrderEventConsumer(mock(BrokerConnectionManager.class), Runnable::run, 1, meterRegistry);
        processor = new OrderEventProcessor(queue, registry,
                new RandomPreparationDelay(Duration.ZERO, Duration.ZERO), objectMapper, QUEUE, "pizza",
                meterRegistry);
    }

    private Map<String, Object> parse(String json) throws Exception {
        return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
        });
    }

    @Test
    @DisplayName("An order should pass through every stage and be delivered to its client")
    void order_shouldReachDelivered() throws Exception {
        queue.publish(QUEUE, RabbitMqUtils.createFakeOrderEvent(42, OrderStatus.ORDERED));

        queue.drain(consumer, processor);

        assertEquals(List.of("ORDERED", "PREPARING", "PREPARED"), queue.consumedStatuses);
        assertEquals(3, queue.acked);
        assertEquals(1, client.messages.size());

        Map<String, Object> notification = parse(client.messages.get(0));
        assertEquals("ORDER_DELIVERED", notification.get("type"));

        @SuppressWarnings("unchecked")
        Map<String, Object> order = (Map<String, Object>) notification.get("order");
        assertEquals(42, order.get("order_no"));
        assertEquals("DELIVERED", order.get("order_status"));
    }

    @Test
    @DisplayName("A failed stage publish should notify the client, requeue and recover on redelivery")
    void publishFailure_shouldNotifyAndRedeliver() throws Exception {
        queue.failNextPublishOf(OrderStatus.PREPARED);
        queue.publish(QUEUE, RabbitMqUtils.createFakeOrderEvent(42, OrderStatus.ORDERED));

        queue.drain(consumer, processor);

        assertEquals(List.of("ORDERED", "PREPARING", "PREPARING", "PREPARED"), queue.consumedStatuses);
        assertEquals(List.of(false, false, true, false), queue.redeliveredFlags);
        assertEquals(1, queue.requeued);

        assertEquals(2, client.messages.size());
        Map<String, Object> failure = parse(client.messages.get(0));
        assertEquals("ORDER_FAILED", failure.get("type"));
        assertTrue(((String) failure.get("error")).contains("simulated"));

        Map<String, Object> delivered = parse(client.messages.get(1));
        assertEquals("ORDER_DELIVERED", delivered.get("type"));
    }

    @Test
    @DisplayName("Several queued orders should each be delivered once")
    void manyOrders_shouldEachBeDelivered() throws Exception {
        for (int orderNo = 1; orderNo <= 10; orderNo++) {
            queue.publish(QUEUE, RabbitMqUtils.createFakeOrderEvent(orderNo, OrderStatus.ORDERED));
        }

        queue.drain(consumer, processor);

        assertEquals(10, client.messages.size());
        assertEquals(30, queue.acked);
    }

    private static class RecordingConnection implements ClientConnection {
        private final List<String> messages = new ArrayList<>();

        @Override
        public String getId() {
            return "recording";
        }

        @Override
        public void send(String message) {
            messages.add(message);
        }
    }

    /**
     * Single queue with broker-like delivery tags. Nacked deliveries go back to the
     * tail of the queue flagged as redelivered.
     */
    private class InMemoryQueue implements OrderEventPublisher {
        private final Deque<Delivery> ready = new ArrayDeque<>();
        private final Map<Long, Delivery> unacked = new HashMap<>();
        private final List<String> consumedStatuses = new ArrayList<>();
        private final List<Boolean> redeliveredFlags = new ArrayList<>();
        private final Channel channel = mock(Channel.class);
        private final AtomicBoolean failArmed = new AtomicBoolean();

        private OrderStatus failStatus;
        private long nextTag = 1;
        private int acked;
        private int requeued;

        InMemoryQueue() {
            try {
                doAnswer(invocation -> {
                    unacked.remove(invocation.<Long>getArgument(0));
                    acked++;
                    return null;
                }).when(channel).basicAck(anyLong(), eq(false));
                doAnswer(invocation -> {
                    Delivery delivery = unacked.remove(invocation.<Long>getArgument(0));
                    ready.addLast(new Delivery(delivery.body, true));
                    requeued++;
                    return null;
                }).when(channel).basicNack(anyLong(), eq(false), eq(true));
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }

        void failNextPublishOf(OrderStatus status) {
            failStatus = status;
            failArmed.set(true);
        }

        @Override
        public void publish(String queueName, OrderEvent event) {
            if (event.getStatus().orElse(null) == failStatus && failArmed.compareAndSet(true, false)) {
                throw new EventPublishException("simulated broker outage");
            }

            try {
                ready.addLast(new Delivery(objectMapper.writeValueAsBytes(event), false));
            } catch (JsonProcessingException e) {
                throw new EventPublishException("Failed to encode event", e);
            }
        }

        void drain(OrderEventConsumer consumer, MessageProcessor processor) throws Exception {
            Delivery delivery;
            while ((delivery = ready.pollFirst()) != null) {
                long tag = nextTag++;
                unacked.put(tag, delivery);

                consumedStatuses.add((String) parse(new String(delivery.body, StandardCharsets.UTF_8)).get("order_status"));
                redeliveredFlags.add(delivery.redelivered);

                consumer.handle(channel, tag, delivery.redelivered, delivery.body, processor);
            }
            assertTrue(unacked.isEmpty(), "every delivery must be acked or requeued");
        }
    }

    private static class Delivery {
        private final byte[] body;
        private final boolean redelivered;

        Delivery(byte[] body, boolean redelivered) {
            this.body = body;
            this.redelivered = redelivered;
        }
    }
}
