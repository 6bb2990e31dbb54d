package io.github.cyfko.reportql.core.execution;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic clock and sleeper used by {@link RequestThrottle}. Tests substitute a fake
 * implementation to observe waits without sleeping.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TimeSource {

    /**
     * @return current value of a monotonic clock, in nanoseconds
     */
    long nanoTime();

    /**
     * Blocks the calling thread.
     *
     * @param nanos how long to block
     * @throws InterruptedException if the thread is interrupted while blocked
     */
    void sleep(long nanos) throws InterruptedException;

    /**
     * @return the system monotonic clock backed by {@link System#nanoTime()}
     */
    static TimeSource system() {
        return new TimeSource() {
            @Override
            public long nanoTime() {
                return System.nanoTime();
            }

            @Override
            public void sleep(long nanos) throws InterruptedException {
                TimeUnit.NANOSECONDS.sleep(nanos);
            }
        };
    }
}
