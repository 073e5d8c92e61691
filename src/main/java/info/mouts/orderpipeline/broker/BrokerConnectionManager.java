package info.mouts.orderpipeline.broker;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.DisposableBean;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;

import info.mouts.orderpipeline.config.RabbitMqProperties;
import info.mouts.orderpipeline.exception.BrokerConnectionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the single long-lived AMQP connection of the process and hands out
 * short-lived channels on top of it.
 *
 * <p>
 * The connection is (re)opened lazily whenever it is missing or reported as
 * closed. Opening it is fail-fast: any failure is surfaced to the caller as a
 * {@link BrokerConnectionException} and is not retried here. Opening a channel
 * on a live connection is retried exactly once.
 * </p>
 *
 * <p>
 * Channels returned by {@link #acquire()} belong to the caller, who must close
 * them and must not share them between threads.
 * </p>
 */
@Slf4j
public class BrokerConnectionManager implements DisposableBean {
    private final ConnectionFactory connectionFactory;
    private final RabbitMqProperties properties;

    private final Object lock = new Object();

    private Connection connection;
    private boolean closed;

    /**
     * Constructs an instance of {@code BrokerConnectionManager}.
     *
     * @param connectionFactory The RabbitMQ client factory, already populated with
     *                          host, port, credentials and virtual host.
     * @param properties        The broker settings, used for diagnostics.
     */
    public BrokerConnectionManager(ConnectionFactory connectionFactory, RabbitMqProperties properties) {
        this.connectionFactory = connectionFactory;
        this.properties = properties;
    }

    /**
     * Opens the transport connection eagerly. Called once at startup so that an
     * unreachable broker aborts the application instead of the first request.
     *
     * @throws BrokerConnectionException If the connection cannot be established.
     */
    public void connect() {
        synchronized (lock) {
            currentConnection();
        }
    }

    /**
     * Returns a new channel on the shared connection, reconnecting first if the
     * connection is gone.
     *
     * @return An open channel owned by the caller.
     * @throws BrokerConnectionException If the connection cannot be (re)opened or
     *                                   the channel cannot be created after one
     *                                   retry.
     * @throws IllegalStateException     If the manager has already been closed.
     */
    public Channel acquire() {
        Connection current;
        synchronized (lock) {
            current = currentConnection();
        }

        try {
            return createChannel(current);
        } catch (IOException | ShutdownSignalException | BrokerConnectionException e) {
            log.warn("Failed to open channel on {}, retrying once: {}", properties.describeEndpoint(),
                    e.getMessage());
        }

        // the connection may have died in the meantime
        synchronized (lock) {
            current = currentConnection();
        }

        try {
            return createChannel(current);
        } catch (IOException | ShutdownSignalException e) {
            log.error("Permanent channel failure on {}", properties.describeEndpoint(), e);
            throw new BrokerConnectionException(
                    "Failed to open a channel on " + properties.describeEndpoint() + " after one retry", e);
        }
    }

    /**
     * Asserts that the named queue exists as durable, non-exclusive and not
     * auto-deleted. Declaring an existing queue with the same properties has no
     * effect.
     *
     * @param queueName The queue to declare.
     * @throws BrokerConnectionException If no channel can be obtained or the broker
     *                                   rejects the declaration.
     */
    public void declareQueue(String queueName) {
        Channel channel = acquire();

        try {
            declareQueue(channel, queueName);
        } finally {
            closeQuietly(channel);
        }
    }

    /**
     * Declares the queue on a channel the caller already holds.
     *
     * @param channel   An open channel.
     * @param queueName The queue to declare.
     */
    public void declareQueue(Channel channel, String queueName) {
        try {
            channel.queueDeclare(queueName, true, false, false, null);
            log.debug("Queue {} declared (durable)", queueName);
        } catch (IOException e) {
            throw new BrokerConnectionException("Failed to declare queue " + queueName, e);
        }
    }

    /**
     * Closes a channel, logging instead of throwing if it is already gone
     * ({@code AlreadyClosedException} included).
     *
     * @param channel The channel to close, may be null.
     */
    public void closeQuietly(Channel channel) {
        if (channel == null) {
            return;
        }

        try {
            channel.close();
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.debug("Ignoring failure while closing channel {}: {}", channel.getChannelNumber(), e.getMessage());
        }
    }

    /**
     * Closes the transport connection. Subsequent {@link #acquire()} calls fail.
     */
    @Override
    public void destroy() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;

            if (connection != null && connection.isOpen()) {
                try {
                    connection.close();
                    log.info("RabbitMQ connection to {} closed", properties.describeEndpoint());
                } catch (IOException e) {
                    log.warn("Error while closing RabbitMQ connection: {}", e.getMessage(), e);
                }
            }
            connection = null;
        }
    }

    private Connection currentConnection() {
        if (closed) {
            throw new IllegalStateException("Broker connection manager has been closed");
        }

        if (connection == null || !connection.isOpen()) {
            boolean reconnecting = connection != null;
            connection = openConnection();

            if (reconnecting) {
                log.info("RabbitMQ connection to {} restored", properties.describeEndpoint());
            } else {
                log.info("Successfully established RabbitMQ connection to {}", properties.describeEndpoint());
            }
        }
        return connection;
    }

    private Connection openConnection() {
        try {
            return connectionFactory.newConnection("order-pipeline");
        } catch (IOException | TimeoutException e) {
            throw new BrokerConnectionException(
                    "Failed to connect to RabbitMQ at " + properties.describeEndpoint() + ": " + e.getMessage(), e);
        }
    }

    private Channel createChannel(Connection current) throws IOException {
        Channel channel = current.createChannel();

        if (channel == null) {
            // the client returns null once channel numbers are exhausted
            throw new BrokerConnectionException("No channel available on " + properties.describeEndpoint());
        }
        return channel;
    }
}
