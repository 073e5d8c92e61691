package info.mouts.orderpipeline.processor;

/**
 * Simulated preparation work between the {@code PREPARING} and
 * {@code PREPARED} stages.
 */
@FunctionalInterface
public interface PreparationDelay {
    /**
     * Blocks the calling worker until preparation is done. Must not hold any
     * shared lock while waiting.
     *
     * @throws InterruptedException If the worker is interrupted while waiting.
     */
    void await() throws InterruptedException;
}
