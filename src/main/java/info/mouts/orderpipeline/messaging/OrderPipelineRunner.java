package info.mouts.orderpipeline.messaging;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.stereotype.Component;

import info.mouts.orderpipeline.config.PipelineProperties;
import info.mouts.orderpipeline.exception.EventConsumeException;
import info.mouts.orderpipeline.processor.OrderEventProcessor;
import lombok.extern.slf4j.Slf4j;

/**
 * Starts consuming the order queue once the application is up. The
 * subscription runs on its own daemon thread and ends when the broker
 * connection is closed on shutdown.
 */
@Component
@Slf4j
public class OrderPipelineRunner implements ApplicationRunner {
    private final OrderEventConsumer consumer;
    private final OrderEventProcessor processor;
    private final PipelineProperties properties;

    private final SimpleAsyncTaskExecutor subscriptionExecutor = new SimpleAsyncTaskExecutor("order-queue-consumer-");

    public OrderPipelineRunner(OrderEventConsumer consumer, OrderEventProcessor processor,
            PipelineProperties properties) {
        this.consumer = consumer;
        this.processor = processor;
        this.properties = properties;

        subscriptionExecutor.setDaemon(true);
    }

    @Override
    public void run(ApplicationArguments args) {
        String queue = properties.getOrderQueue();

        subscriptionExecutor.execute(() -> {
            try {
                consumer.consume(queue, processor);
            } catch (EventConsumeException e) {
                log.error("CRITICAL: failed to consume events from queue {}: {}", queue, e.getMessage(), e);
            } catch (RuntimeException e) {
                log.error("CRITICAL: consumer of queue {} stopped unexpectedly: {}", queue, e.getMessage(), e);
            }
        });
    }
}
