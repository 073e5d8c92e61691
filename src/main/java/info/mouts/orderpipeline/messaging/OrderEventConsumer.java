package info.mouts.orderpipeline.messaging;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

import info.mouts.orderpipeline.broker.BrokerConnectionManager;
import info.mouts.orderpipeline.exception.BrokerConnectionException;
import info.mouts.orderpipeline.exception.EventConsumeException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Subscribes to an order queue with manual acknowledgement and hands every
 * delivery to the worker pool.
 *
 * <p>
 * Each delivery gets exactly one acknowledgement decision: {@code basicAck} when
 * the {@link MessageProcessor} returns, {@code basicNack} with requeue when it
 * throws. Deliveries are processed concurrently and in no particular order.
 * Backpressure comes from the worker pool (a saturated pool runs the task on
 * the dispatching thread) and from the channel prefetch limit.
 * </p>
 */
@Slf4j
public class OrderEventConsumer {
    private final BrokerConnectionManager connectionManager;
    private final Executor workerExecutor;
    private final int prefetchCount;

    private Counter receivedEventsCounter;
    private Counter ackedEventsCounter;
    private Counter requeuedEventsCounter;

    /**
     * Constructs an instance of {@code OrderEventConsumer}.
     *
     * @param connectionManager The source of the subscription channel.
     * @param workerExecutor    The pool deliveries are processed on.
     * @param prefetchCount     Maximum number of unacknowledged deliveries.
     * @param meterRegistry     The registry for collecting metrics.
     */
    public OrderEventConsumer(BrokerConnectionManager connectionManager, Executor workerExecutor,
            int prefetchCount, MeterRegistry meterRegistry) {
        this.connectionManager = connectionManager;
        this.workerExecutor = workerExecutor;
        this.prefetchCount = prefetchCount;

        initializeMetrics(meterRegistry);
    }

    /**
     * Declares the queue, subscribes to it and blocks for as long as the
     * subscription is alive. Returns once the broker cancels the consumer or the
     * channel shuts down; the subscription is not re-established.
     *
     * @param queueName The queue to consume.
     * @param processor The processor invoked for every delivery.
     * @throws EventConsumeException If the subscription cannot be set up.
     */
    public void consume(String queueName, MessageProcessor processor) {
        Channel channel;
        try {
            channel = connectionManager.acquire();
        } catch (BrokerConnectionException e) {
            throw new EventConsumeException("Message channel is unavailable for queue " + queueName, e);
        }

        CountDownLatch subscriptionClosed = new CountDownLatch(1);

        try {
            connectionManager.declareQueue(channel, queueName);
            channel.basicQos(prefetchCount);

            String consumerTag = channel.basicConsume(queueName, false,
                    new DispatchingConsumer(channel, processor, subscriptionClosed));
            log.info("Starting message consumption on queue {} (consumer tag {})", queueName, consumerTag);
        } catch (IOException | BrokerConnectionException e) {
            connectionManager.closeQuietly(channel);
            throw new EventConsumeException("Failed to consume messages from queue " + queueName, e);
        }

        try {
            subscriptionClosed.await();
            log.warn("Subscription to queue {} has ended", queueName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Consumer thread for queue {} interrupted, leaving subscription", queueName);
        } finally {
            connectionManager.closeQuietly(channel);
        }
    }

    /**
     * Runs the processor for one delivery and acknowledges the outcome.
     *
     * @param channel     The channel the delivery arrived on.
     * @param deliveryTag The broker-assigned delivery tag.
     * @param redelivered Whether the broker delivered this message before.
     * @param body        The raw message body.
     * @param processor   The processor to run.
     */
    void handle(Channel channel, long deliveryTag, boolean redelivered, byte[] body, MessageProcessor processor) {
        boolean processed;
        try {
            processor.process(body);
            processed = true;
        } catch (RuntimeException e) {
            log.error("Message processing failed for delivery {} (redelivered={}): {}", deliveryTag, redelivered,
                    e.getMessage(), e);
            processed = false;
        }

        if (processed) {
            ack(channel, deliveryTag);
        } else {
            requeue(channel, deliveryTag);
        }
    }

    private void ack(Channel channel, long deliveryTag) {
        try {
            channel.basicAck(deliveryTag, false);
            ackedEventsCounter.increment();
        } catch (IOException | RuntimeException e) {
            log.error("Failed to acknowledge delivery {}, the broker will redeliver it: {}", deliveryTag,
                    e.getMessage());
        }
    }

    private void requeue(Channel channel, long deliveryTag) {
        try {
            channel.basicNack(deliveryTag, false, true);
            requeuedEventsCounter.increment();
        } catch (IOException | RuntimeException e) {
            log.error("Failed to requeue delivery {}, the broker will redeliver it: {}", deliveryTag,
                    e.getMessage());
        }
    }

    /**
     * Initializes the Micrometer metrics for the consumer.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.receivedEventsCounter = Counter.builder("orders.events.received")
                .description("Total number of deliveries received from the order queue")
                .register(registry);
        this.ackedEventsCounter = Counter.builder("orders.events.acked")
                .description("Total number of deliveries acknowledged after processing")
                .register(registry);
        this.requeuedEventsCounter = Counter.builder("orders.events.requeued")
                .description("Total number of deliveries returned to the queue after a failure")
                .register(registry);
    }

    private class DispatchingConsumer extends DefaultConsumer {
        private final MessageProcessor processor;
        private final CountDownLatch subscriptionClosed;

        DispatchingConsumer(Channel channel, MessageProcessor processor, CountDownLatch subscriptionClosed) {
            super(channel);
            this.processor = processor;
            this.subscriptionClosed = subscriptionClosed;
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                byte[] body) {
            receivedEventsCounter.increment();
            long deliveryTag = envelope.getDeliveryTag();

            try {
                workerExecutor.execute(
                        () -> handle(getChannel(), deliveryTag, envelope.isRedeliver(), body, processor));
            } catch (RejectedExecutionException e) {
                log.error("Worker pool rejected delivery {}, returning it to the queue", deliveryTag);
                requeue(getChannel(), deliveryTag);
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warn("Consumer {} was cancelled by the broker", consumerTag);
            subscriptionClosed.countDown();
        }

        @Override
        public void handleCancelOk(String consumerTag) {
            log.info("Consumer {} cancelled", consumerTag);
            subscriptionClosed.countDown();
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            if (sig.isInitiatedByApplication()) {
                log.info("Consumer {} stopped: channel closed by the application", consumerTag);
            } else {
                log.error("Consumer {} stopped: {}", consumerTag, sig.getMessage());
            }
            subscriptionClosed.countDown();
        }
    }
}
