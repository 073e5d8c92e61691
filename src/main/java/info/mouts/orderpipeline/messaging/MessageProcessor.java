package info.mouts.orderpipeline.messaging;

/**
 * Processes the body of a single delivery. Returning normally acknowledges the
 * delivery; throwing returns it to the queue.
 */
@FunctionalInterface
public interface MessageProcessor {
    void process(byte[] body);
}
