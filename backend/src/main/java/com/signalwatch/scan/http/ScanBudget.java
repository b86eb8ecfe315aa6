package com.signalwatch.scan.http;

import java.time.Clock;
import java.time.Instant;

/**
 * Deadline and cancellation signal for one scan. Checked before every registry call, before each
 * company starts and before each traversal depth level.
 */
public class ScanBudget {
    private final Instant deadline;
    private final Clock clock;
    private volatile boolean cancelled;
    private volatile String cancelReason;

    public ScanBudget(Instant deadline) {
        this(deadline, Clock.systemUTC());
    }

    public ScanBudget(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static ScanBudget unbounded() {
        return new ScanBudget(null);
    }

    public Instant deadline() {
        return deadline;
    }

    public void cancel(String reason) {
        this.cancelReason = reason == null ? "scan_cancelled" : reason;
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || isPastDeadline();
    }

    public void checkpoint() {
        if (cancelled) {
            throw new ScanCancelledException(cancelReason == null ? "scan_cancelled" : cancelReason);
        }
        if (isPastDeadline()) {
            throw new ScanCancelledException("scan_deadline_exceeded");
        }
    }

    private boolean isPastDeadline() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
