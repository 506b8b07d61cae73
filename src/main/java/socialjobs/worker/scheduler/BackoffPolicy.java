package socialjobs.worker.scheduler;

import java.time.Duration;

/**
 * Linear, capped retry delay: {@code min(cap, max(1, attempts) * base)}.
 */
public final class BackoffPolicy {

    private final Duration base;
    private final Duration cap;

    public BackoffPolicy(Duration base, Duration cap) {
        if (base == null || base.isZero() || base.isNegative()) {
            throw new IllegalArgumentException("Backoff base must be positive: " + base);
        }
        if (cap == null || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff cap " + cap + " must not be below base " + base);
        }
        this.base = base;
        this.cap = cap;
    }

    /**
     * Delay before the worker polls again after a failed attempt.
     *
     * @param attempts attempts consumed so far, including the one that just failed
     */
    public Duration delayFor(int attempts) {
        long factor = Math.max(1, attempts);
        if (factor > cap.toNanos() / base.toNanos()) {
            return cap;
        }
        Duration delay = base.multipliedBy(factor);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    public Duration base() {
        return base;
    }

    public Duration cap() {
        return cap;
    }
}
