package com.dingdangmaoup.relay.upstream.retry;

import java.time.Duration;

/**
 * Exponential backoff with bounded jitter: {@code min(cap, base * 2^(attempt-1) + jitter)}
 * where {@code jitter} lies in {@code [0, base * jitterRatio)}. With {@code jitterRatio <= 1}
 * the delays never decrease from one attempt to the next.
 */
public class BackoffPolicy {

    private static final int MAX_SHIFT = 30;

    private final Duration base;
    private final Duration cap;
    private final double jitterRatio;

    public BackoffPolicy(Duration base, Duration cap, double jitterRatio) {
        if (base.isNegative() || cap.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.base = base;
        this.cap = cap.compareTo(base) < 0 ? base : cap;
        this.jitterRatio = Math.max(0.0, Math.min(1.0, jitterRatio));
    }

    /**
     * @param attempt attempts made so far, starting at 1
     * @param random  uniform sample in [0, 1)
     */
    public Duration delayFor(int attempt, double random) {
        int shift = Math.min(Math.max(attempt - 1, 0), MAX_SHIFT);
        long baseMillis = base.toMillis();
        long exponential = baseMillis > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : baseMillis << shift;
        long jitter = (long) (baseMillis * jitterRatio * Math.max(0.0, Math.min(random, 0.999999)));
        long total = exponential > Long.MAX_VALUE - jitter ? Long.MAX_VALUE : exponential + jitter;
        return Duration.ofMillis(Math.min(total, cap.toMillis()));
    }

    public Duration getCap() {
        return cap;
    }
}
