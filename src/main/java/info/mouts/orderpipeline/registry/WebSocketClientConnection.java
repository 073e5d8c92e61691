package info.mouts.orderpipeline.registry;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * {@link ClientConnection} backed by a Spring {@link WebSocketSession}.
 * A {@code WebSocketSession} does not support concurrent sends, so writes are
 * guarded by a per-connection lock.
 */
public class WebSocketClientConnection implements ClientConnection {
    private final WebSocketSession session;
    private final ReentrantLock writeLock = new ReentrantLock();

    public WebSocketClientConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(String message) throws IOException {
        writeLock.lock();
        try {
            session.sendMessage(new TextMessage(message));
        } finally {
            writeLock.unlock();
        }
    }
}
