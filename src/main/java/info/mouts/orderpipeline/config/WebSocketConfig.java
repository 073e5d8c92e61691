package info.mouts.orderpipeline.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import info.mouts.orderpipeline.websocket.OrderUpdatesWebSocketHandler;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
    private final OrderUpdatesWebSocketHandler orderUpdatesWebSocketHandler;

    public WebSocketConfig(OrderUpdatesWebSocketHandler orderUpdatesWebSocketHandler) {
        this.orderUpdatesWebSocketHandler = orderUpdatesWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // any origin may subscribe to order updates
        registry.addHandler(orderUpdatesWebSocketHandler, "/ws").setAllowedOrigins("*");
    }
}
