package info.mouts.orderpipeline.config;

import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.ConnectionFactory;

import info.mouts.orderpipeline.broker.BrokerConnectionManager;
import info.mouts.orderpipeline.messaging.OrderEventConsumer;
import info.mouts.orderpipeline.messaging.OrderEventPublisher;
import info.mouts.orderpipeline.messaging.RabbitOrderEventPublisher;
import info.mouts.orderpipeline.processor.OrderEventProcessor;
import info.mouts.orderpipeline.processor.PreparationDelay;
import info.mouts.orderpipeline.processor.RandomPreparationDelay;
import info.mouts.orderpipeline.registry.ConnectionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires the broker layer and the order pipeline. Every component receives the
 * typed settings it needs through its constructor.
 */
@Configuration
@Slf4j
public class RabbitMqConfig {

    /**
     * Configure the RabbitMQ client factory from {@code app.rabbitmq.*}.
     * Automatic recovery is disabled: reconnection is handled lazily by
     * {@link BrokerConnectionManager}.
     *
     * @return The configured ConnectionFactory
     */
    @Bean
    public ConnectionFactory rabbitConnectionFactory(RabbitMqProperties properties) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(properties.getHost());
        factory.setPort(properties.getPort());
        factory.setUsername(properties.getUsername());
        factory.setPassword(properties.getPassword());
        factory.setVirtualHost(properties.getVirtualHost());
        factory.setConnectionTimeout((int) properties.getConnectionTimeout().toMillis());
        factory.setAutomaticRecoveryEnabled(false);
        return factory;
    }

    /**
     * The connection manager opens its connection during context startup, so an
     * unreachable broker fails the application immediately.
     *
     * @return The BrokerConnectionManager
     */
    @Bean(initMethod = "connect")
    public BrokerConnectionManager brokerConnectionManager(ConnectionFactory rabbitConnectionFactory,
            RabbitMqProperties properties) {
        log.info("Connecting to RabbitMQ at {}", properties.describeEndpoint());
        return new BrokerConnectionManager(rabbitConnectionFactory, properties);
    }

    @Bean
    public OrderEventPublisher orderEventPublisher(BrokerConnectionManager brokerConnectionManager,
            ObjectMapper objectMapper, RabbitMqProperties properties, MeterRegistry meterRegistry) {
        return new RabbitOrderEventPublisher(brokerConnectionManager, objectMapper, properties, meterRegistry);
    }

    /**
     * Configure the pool order deliveries are processed on.
     * When all workers are busy and the queue is full, the dispatching thread runs
     * the delivery itself, which stops it from taking new deliveries until it is
     * done.
     *
     * @return The configured ThreadPoolTaskExecutor
     */
    @Bean
    public ThreadPoolTaskExecutor orderWorkerExecutor(PipelineProperties properties) {
        PipelineProperties.Workers workers = properties.getWorkers();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers.getCoreSize());
        executor.setMaxPoolSize(Math.max(workers.getCoreSize(), workers.getMaxSize()));
        executor.setQueueCapacity(workers.getQueueCapacity());
        executor.setThreadNamePrefix("order-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);

        log.info("Configured order worker pool: core={}, max={}, queue={}", workers.getCoreSize(),
                workers.getMaxSize(), workers.getQueueCapacity());
        return executor;
    }

    @Bean
    public OrderEventConsumer orderEventConsumer(BrokerConnectionManager brokerConnectionManager,
            ThreadPoolTaskExecutor orderWorkerExecutor, PipelineProperties properties, MeterRegistry meterRegistry) {
        return new OrderEventConsumer(brokerConnectionManager, orderWorkerExecutor, properties.getPrefetchCount(),
                meterRegistry);
    }

    @Bean
    public ConnectionRegistry connectionRegistry() {
        return new ConnectionRegistry();
    }

    @Bean
    public PreparationDelay preparationDelay(PipelineProperties properties) {
        return new RandomPreparationDelay(properties.getPreparation().getMinDelay(),
                properties.getPreparation().getMaxDelay());
    }

    @Bean
    public OrderEventProcessor orderEventProcessor(OrderEventPublisher orderEventPublisher,
            ConnectionRegistry connectionRegistry, PreparationDelay preparationDelay, ObjectMapper objectMapper,
            PipelineProperties properties, MeterRegistry meterRegistry) {
        return new OrderEventProcessor(orderEventPublisher, connectionRegistry, preparationDelay, objectMapper,
                properties.getOrderQueue(), properties.getDefaultClientId(), meterRegistry);
    }
}
