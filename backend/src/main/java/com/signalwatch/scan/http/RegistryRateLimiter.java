package com.signalwatch.scan.http;

import com.signalwatch.scan.model.RateLimitStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window request budget shared by every registry call in the process.
 * <p>
 * The window opens on the first request after the previous one expired. Counter updates and
 * rollover happen under this object's monitor; callers over budget sleep outside it and retry.
 */
public class RegistryRateLimiter {
    private final int maxRequests;
    private final Duration window;
    private final Duration maxWait;
    private final Clock clock;
    private final Sleeper sleeper;

    private Instant windowStart;
    private int used;

    public RegistryRateLimiter(int maxRequests, Duration window, Duration maxWait, Clock clock, Sleeper sleeper) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.maxWait = maxWait == null ? Duration.ZERO : maxWait;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public RegistryRateLimiter(int maxRequests, Duration window, Duration maxWait) {
        this(maxRequests, window, maxWait, Clock.systemUTC(), Sleeper.THREAD);
    }

    /**
     * Takes one request from the budget, blocking until the next window if the current one is spent.
     *
     * @param deadline caller deadline, or null for none; the wait never extends past it
     * @throws RateLimitExceededException when the next window opens after the deadline or the maximum wait
     */
    public void acquire(Instant deadline) {
        Instant waitLimit = clock.instant().plus(maxWait);
        if (deadline != null && deadline.isBefore(waitLimit)) {
            waitLimit = deadline;
        }
        while (true) {
            Instant resetAt;
            synchronized (this) {
                Instant now = clock.instant();
                rollWindowIfExpired(now);
                if (used < maxRequests) {
                    used++;
                    return;
                }
                resetAt = windowStart.plus(window);
            }
            if (resetAt.isAfter(waitLimit)) {
                throw new RateLimitExceededException(
                    "Registry rate limit of " + maxRequests + " requests per " + window.toSeconds()
                        + "s exhausted; window resets at " + resetAt
                );
            }
            Duration pause = Duration.between(clock.instant(), resetAt);
            if (!pause.isNegative() && !pause.isZero()) {
                try {
                    sleeper.sleep(pause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ScanCancelledException("interrupted_waiting_for_rate_limit");
                }
            }
        }
    }

    public synchronized RateLimitStatus status() {
        Instant now = clock.instant();
        if (windowStart == null || !now.isBefore(windowStart.plus(window))) {
            return new RateLimitStatus(maxRequests, maxRequests, window.toSeconds(), now.plus(window));
        }
        return new RateLimitStatus(maxRequests, maxRequests - used, window.toSeconds(), windowStart.plus(window));
    }

    private void rollWindowIfExpired(Instant now) {
        if (windowStart == null || !now.isBefore(windowStart.plus(window))) {
            windowStart = now;
            used = 0;
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = duration -> Thread.sleep(Math.max(1L, duration.toMillis()));

        void sleep(Duration duration) throws InterruptedException;
    }
}
