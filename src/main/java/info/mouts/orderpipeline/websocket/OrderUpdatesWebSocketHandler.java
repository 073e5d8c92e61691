package info.mouts.orderpipeline.websocket;

import java.net.URI;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import info.mouts.orderpipeline.config.PipelineProperties;
import info.mouts.orderpipeline.registry.ClientConnection;
import info.mouts.orderpipeline.registry.ConnectionRegistry;
import info.mouts.orderpipeline.registry.WebSocketClientConnection;
import info.mouts.orderpipeline.util.RabbitMqUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts live client connections on {@code /ws} and keeps the
 * {@link ConnectionRegistry} in sync with them.
 *
 * <p>
 * The client identity is taken from the {@code clientId} query parameter and
 * falls back to the configured default client. Inbound frames are not
 * interpreted.
 * </p>
 */
@Component
@Slf4j
public class OrderUpdatesWebSocketHandler extends TextWebSocketHandler {
    static final String CLIENT_ID_ATTRIBUTE = "orderpipeline.clientId";
    static final String CONNECTION_ATTRIBUTE = "orderpipeline.connection";

    private final ConnectionRegistry connectionRegistry;
    private final PipelineProperties properties;

    public OrderUpdatesWebSocketHandler(ConnectionRegistry connectionRegistry, PipelineProperties properties) {
        this.connectionRegistry = connectionRegistry;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String clientId = resolveClientId(session.getUri());
        ClientConnection connection = new WebSocketClientConnection(session);

        session.getAttributes().put(CLIENT_ID_ATTRIBUTE, clientId);
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);

        connection.send(RabbitMqUtils.WELCOME_MESSAGE);
        connectionRegistry.register(clientId, connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring message from client [{}]: {}", session.getAttributes().get(CLIENT_ID_ATTRIBUTE),
                message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {} of client [{}]: {}", session.getId(),
                session.getAttributes().get(CLIENT_ID_ATTRIBUTE), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String clientId = (String) session.getAttributes().get(CLIENT_ID_ATTRIBUTE);
        ClientConnection connection = (ClientConnection) session.getAttributes().get(CONNECTION_ATTRIBUTE);

        log.info("Client [{}] disconnected: {}", clientId, status);

        if (clientId != null && connection != null) {
            connectionRegistry.unregister(clientId, connection);
        }
    }

    private String resolveClientId(URI uri) {
        if (uri == null) {
            return properties.getDefaultClientId();
        }

        String clientId = UriComponentsBuilder.fromUri(uri).build()
                .getQueryParams()
                .getFirst(RabbitMqUtils.CLIENT_ID_QUERY_PARAM);

        return (clientId == null || clientId.isBlank()) ? properties.getDefaultClientId() : clientId;
    }
}
