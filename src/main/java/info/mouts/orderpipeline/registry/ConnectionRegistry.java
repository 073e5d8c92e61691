package info.mouts.orderpipeline.registry;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import info.mouts.orderpipeline.exception.ClientNotificationException;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory directory of live client connections, keyed by client id.
 * At most one connection is kept per client id; registering again replaces the
 * previous entry. Entries are only removed through {@link #unregister}, the
 * registry never evicts on its own.
 */
@Slf4j
public class ConnectionRegistry {
    private final ConcurrentMap<String, ClientConnection> connections = new ConcurrentHashMap<>();

    /**
     * Registers a connection for a client, replacing any existing one.
     *
     * @param clientId   The client identity.
     * @param connection The live connection.
     * @return The connection that was replaced, if any.
     */
    public Optional<ClientConnection> register(String clientId, ClientConnection connection) {
        ClientConnection previous = connections.put(clientId, connection);

        if (previous != null && previous != connection) {
            log.info("Client [{}] reconnected, connection {} replaces {}", clientId, connection.getId(),
                    previous.getId());
        } else {
            log.info("Client [{}] added to active connections ({} active)", clientId, size());
        }
        return Optional.ofNullable(previous);
    }

    public Optional<ClientConnection> lookup(String clientId) {
        return Optional.ofNullable(connections.get(clientId));
    }

    /**
     * Removes the entry for a client, but only if it still points to the given
     * connection. A newer connection registered under the same id is kept.
     *
     * @param clientId   The client identity.
     * @param connection The connection that went away.
     * @return {@code true} if the entry was removed.
     */
    public boolean unregister(String clientId, ClientConnection connection) {
        boolean removed = connections.remove(clientId, connection);

        if (removed) {
            log.info("Client [{}] removed from active connections ({} active)", clientId, size());
        }
        return removed;
    }

    /**
     * Sends a text message to the connection registered for a client.
     * Sending to a client that is not connected is not an error: nothing is
     * written and {@code false} is returned.
     *
     * @param clientId The client identity.
     * @param message  The message to send.
     * @return {@code true} if the message was written, {@code false} if no
     *         connection is registered for the client.
     * @throws ClientNotificationException If writing to the connection fails.
     */
    public boolean send(String clientId, String message) {
        ClientConnection connection = connections.get(clientId);

        if (connection == null) {
            log.debug("No active connection for client [{}], dropping message", clientId);
            return false;
        }

        try {
            connection.send(message);
            return true;
        } catch (IOException | IllegalStateException e) {
            throw new ClientNotificationException(clientId, e);
        }
    }

    public int size() {
        return connections.size();
    }
}
