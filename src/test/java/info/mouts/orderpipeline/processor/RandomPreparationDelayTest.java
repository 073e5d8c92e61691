package info.mouts.orderpipeline.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class RandomPreparationDelayTest {

    @Test
    @DisplayName("Delays should be whole seconds within the inclusive range")
    void nextDelay_shouldStayInRange() {
        RandomPreparationDelay delay = new RandomPreparationDelay(Duration.ofSeconds(1), Duration.ofSeconds(6));
        Set<Long> seen = new HashSet<>();

        for (int i = 0; i < 2000; i++) {
            Duration next = delay.nextDelay();

            assertEquals(0, next.getNano());
            assertTrue(next.getSeconds() >= 1 && next.getSeconds() <= 6, "out of range: " + next);
            seen.add(next.getSeconds());
        }

        assertEquals(6, seen.size());
    }

    @Test
    @DisplayName("A zero range should not wait")
    void await_zeroRange_shouldReturnImmediately() throws InterruptedException {
        RandomPreparationDelay delay = new RandomPreparationDelay(Duration.ZERO, Duration.ZERO);

        long start = System.nanoTime();
        delay.await();

        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(1)) < 0);
    }

    @Test
    @DisplayName("Invalid ranges should be rejected")
    void constructor_invalidRange_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> new RandomPreparationDelay(Duration.ofSeconds(5), Duration.ofSeconds(2)));
        assertThrows(IllegalArgumentException.class,
                () -> new RandomPreparationDelay(Duration.ofSeconds(-1), Duration.ofSeconds(2)));
    }
}
