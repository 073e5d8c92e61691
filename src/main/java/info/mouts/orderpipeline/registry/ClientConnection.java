package info.mouts.orderpipeline.registry;

import java.io.IOException;

/**
 * A live duplex connection to one client. Implementations serialize concurrent
 * {@link #send(String)} calls so that frames never interleave on the wire.
 */
public interface ClientConnection {
    /**
     * @return The transport-level identifier of this connection.
     */
    String getId();

    void send(String message) throws IOException;
}
