package info.mouts.orderpipeline.processor;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import lombok.extern.slf4j.Slf4j;

/**
 * Sleeps for a uniformly chosen whole number of seconds in {@code [min, max]}.
 */
@Slf4j
public class RandomPreparationDelay implements PreparationDelay {
    private final long minSeconds;
    private final long maxSeconds;

    /**
     * Constructs an instance of {@code RandomPreparationDelay}.
     *
     * @param min The shortest delay, truncated to whole seconds.
     * @param max The longest delay, inclusive, truncated to whole seconds.
     * @throws IllegalArgumentException If {@code min} is negative or greater than
     *                                  {@code max}.
     */
    public RandomPreparationDelay(Duration min, Duration max) {
        if (min.isNegative() || min.compareTo(max) > 0) {
            throw new IllegalArgumentException("Invalid preparation delay range: " + min + " to " + max);
        }
        this.minSeconds = min.getSeconds();
        this.maxSeconds = max.getSeconds();
    }

    /**
     * Picks the next delay.
     *
     * @return A duration of whole seconds within the configured range.
     */
    public Duration nextDelay() {
        return Duration.ofSeconds(ThreadLocalRandom.current().nextLong(minSeconds, maxSeconds + 1));
    }

    @Override
    public void await() throws InterruptedException {
        Duration delay = nextDelay();

        log.debug("Preparing order for {} seconds", delay.getSeconds());
        Thread.sleep(delay.toMillis());
    }
}
