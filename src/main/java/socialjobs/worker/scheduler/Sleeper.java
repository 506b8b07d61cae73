package socialjobs.worker.scheduler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Pause between loop iterations that a stop request can cut short.
 */
public class Sleeper {

    private final CountDownLatch wake = new CountDownLatch(1);

    /**
     * Sleep for the given duration unless woken first.
     *
     * @return true if the full duration elapsed
     */
    public boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            return !wake.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * End the current sleep and every later one immediately.
     */
    public void wakeUp() {
        wake.countDown();
    }
}
