package io.github.cyfko.reportql.core.execution;

import io.github.cyfko.reportql.core.config.ExecutionPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Throttle ensuring that outbound requests are at least a minimum interval apart.
 * <p>
 * The throttle owns the timestamp of the last outbound call. {@link #acquire()} checks the
 * elapsed time, sleeps for the remainder of the interval if needed and stamps the new call,
 * all while holding one lock: concurrent callers serialize through the same state and
 * cannot both observe a zero wait.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * One instance is meant to be shared by every query talking to the same service, either
 * the {@linkplain #processWide() process-wide} instance or one built per client. Tests
 * build their own instance with a fake {@link TimeSource}.
 * </p>
 *
 * <h2>Cancellation</h2>
 * <p>
 * If the waiting thread is interrupted, the timestamp is left untouched, the interrupt
 * flag is restored and a {@link CancellationException} is thrown.
 * </p>
 *
 * <pre>{@code
 * RequestThrottle throttle = new RequestThrottle(Duration.ofSeconds(1), TimeSource.system());
 * throttle.acquire();   // first call goes through
 * throttle.acquire();   // blocks ~1s
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RequestThrottle {

    private static final Logger log = Logger.getLogger(RequestThrottle.class.getName());

    private static volatile RequestThrottle processWide;

    private final long minimumIntervalNanos;
    private final TimeSource time;
    private final ReentrantLock lock = new ReentrantLock(true);

    private long lastCall;
    private boolean called;

    public RequestThrottle(Duration minimumInterval, TimeSource time) {
        Objects.requireNonNull(minimumInterval, "minimumInterval");
        if (minimumInterval.isNegative()) {
            throw new IllegalArgumentException("minimumInterval cannot be negative, got: " + minimumInterval);
        }
        this.minimumIntervalNanos = minimumInterval.toNanos();
        this.time = Objects.requireNonNull(time, "time source");
    }

    /**
     * Returns the throttle shared by the whole process, created on first use with the
     * default interval of {@link ExecutionPolicy#DEFAULT_MINIMUM_INTERVAL}.
     *
     * @return the shared throttle
     */
    public static RequestThrottle processWide() {
        RequestThrottle instance = processWide;
        if (instance == null) {
            synchronized (RequestThrottle.class) {
                instance = processWide;
                if (instance == null) {
                    instance = new RequestThrottle(ExecutionPolicy.DEFAULT_MINIMUM_INTERVAL, TimeSource.system());
                    processWide = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Waits until an outbound request is allowed and records it.
     *
     * @return how long the caller was held back
     * @throws CancellationException if interrupted while waiting
     */
    public Duration acquire() {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            throw cancelled(e);
        }

        try {
            long wait = 0;
            if (called) {
                long elapsed = time.nanoTime() - lastCall;
                wait = Math.max(0, minimumIntervalNanos - elapsed);
            }

            if (wait > 0) {
                long waitNanos = wait;
                log.fine(() -> String.format("Throttling outbound request for %d ms", waitNanos / 1_000_000));
                try {
                    time.sleep(wait);
                } catch (InterruptedException e) {
                    throw cancelled(e);
                }
            }

            lastCall = time.nanoTime();
            called = true;
            return Duration.ofNanos(wait);
        } finally {
            lock.unlock();
        }
    }

    public Duration getMinimumInterval() {
        return Duration.ofNanos(minimumIntervalNanos);
    }

    private static CancellationException cancelled(InterruptedException cause) {
        Thread.currentThread().interrupt();
        CancellationException cancellation = new CancellationException("Interrupted while waiting for the request throttle");
        cancellation.initCause(cause);
        return cancellation;
    }
}
