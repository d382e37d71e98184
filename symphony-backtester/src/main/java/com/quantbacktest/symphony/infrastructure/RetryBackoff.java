package com.quantbacktest.symphony.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Delay schedule applied before a requeued job runs again.
 * The n-th failed attempt waits the n-th configured delay; attempts past the end reuse the last one.
 */
@Component
@Slf4j
public class RetryBackoff {

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final long[] delaysMs;
    private final Sleeper sleeper;

    @Autowired
    public RetryBackoff(@Value("${backtest.worker.backoff-ms:1000,3000,5000}") long[] delaysMs) {
        this(delaysMs, Thread::sleep);
    }

    RetryBackoff(long[] delaysMs, Sleeper sleeper) {
        if (delaysMs == null || delaysMs.length == 0) {
            throw new IllegalArgumentException("At least one backoff delay is required");
        }
        if (Arrays.stream(delaysMs).anyMatch(delay -> delay < 0)) {
            throw new IllegalArgumentException("Backoff delays must not be negative: " + Arrays.toString(delaysMs));
        }
        this.delaysMs = delaysMs.clone();
        this.sleeper = sleeper;
    }

    /**
     * @param failedAttempts attempts that already failed; zero means no wait
     */
    public long delayFor(int failedAttempts) {
        if (failedAttempts <= 0) {
            return 0;
        }
        return delaysMs[Math.min(failedAttempts, delaysMs.length) - 1];
    }

    public void await(int failedAttempts) throws InterruptedException {
        long delayMs = delayFor(failedAttempts);
        if (delayMs > 0) {
            log.info("Backing off {}ms before attempt {}", delayMs, failedAttempts + 1);
            sleeper.sleep(delayMs);
        }
    }

    public void pause(long millis) throws InterruptedException {
        sleeper.sleep(millis);
    }
}
