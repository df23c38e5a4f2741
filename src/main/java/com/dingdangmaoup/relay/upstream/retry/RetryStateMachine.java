package com.dingdangmaoup.relay.upstream.retry;

import com.dingdangmaoup.relay.error.ErrorKind;

/**
 * Pure transition function of the retry engine:
 * <pre>
 * INIT -> ATTEMPT -> {SUCCESS | NEED_AUTH_RETRY | NEED_REDIRECT | NEED_BACKOFF | EXHAUSTED}
 * </pre>
 * Every outbound call (primary attempt, redirect follow, CDN fallback, last resort)
 * consumes one unit of {@code maxAttempts}. No I/O, no clock, no randomness.
 */
public class RetryStateMachine {

    private final int maxAttempts;
    private final boolean lastResort;

    public RetryStateMachine(int maxAttempts, boolean lastResort) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.lastResort = lastResort;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Requests with a streamed body cannot be replayed and get exactly one attempt
     */
    public RetryState start(boolean replayable) {
        if (!replayable) {
            return RetryState.builder().phase(Phase.INIT).budget(1).build();
        }
        boolean reserve = lastResort && maxAttempts > 1;
        return RetryState.builder()
                .phase(Phase.INIT)
                .budget(reserve ? maxAttempts - 1 : maxAttempts)
                .lastResortAvailable(reserve)
                .build();
    }

    /**
     * Consume one unit of budget for a call against {@code host}
     */
    public RetryState beginAttempt(RetryState state, String host) {
        if (!state.hasBudget()) {
            throw new IllegalStateException("No attempts left: " + state.getAttempt() + "/" + state.getBudget());
        }
        return state.withPhase(Phase.ATTEMPT)
                .withAttempt(state.getAttempt() + 1)
                .withHostTried(host);
    }

    public RetryState onOutcome(RetryState state, OutcomeKind outcome, String detail) {
        return switch (outcome) {
            case SUCCESS -> state.withPhase(Phase.SUCCESS);
            case REDIRECT -> state.hasBudget()
                    ? state.withPhase(Phase.NEED_REDIRECT)
                    : state.failed(Phase.EXHAUSTED, ErrorKind.REDIRECT_EXHAUSTED, "no attempts left to follow redirect");
            case UNAUTHORIZED -> !state.isAuthRetried() && state.hasBudget()
                    ? state.toBuilder().phase(Phase.NEED_AUTH_RETRY).authRetried(true).build()
                    : state.failed(Phase.EXHAUSTED, ErrorKind.AUTH_FAILED, detail);
            case RATE_LIMITED -> backoffOrExhaust(state, ErrorKind.RATE_LIMITED, detail);
            case TRANSPORT_ERROR -> backoffOrExhaust(state, ErrorKind.TRANSPORT_ERROR, detail);
        };
    }

    /**
     * Result of the redirect and CDN fallback handler
     */
    public RetryState onRedirectResult(RetryState state, boolean succeeded, String detail) {
        if (succeeded) {
            return state.withPhase(Phase.SUCCESS);
        }
        return backoffOrExhaust(state, ErrorKind.REDIRECT_EXHAUSTED, detail);
    }

    /**
     * The token exchange itself failed, no point in another attempt
     */
    public RetryState onAuthFailed(RetryState state, String detail) {
        return state.failed(Phase.EXHAUSTED, ErrorKind.AUTH_FAILED, detail);
    }

    public boolean canUseLastResort(RetryState state) {
        return state.getPhase() == Phase.EXHAUSTED
                && state.isLastResortAvailable()
                && !state.isLastResortUsed()
                && state.getLastError().map(kind -> kind != ErrorKind.AUTH_FAILED).orElse(true);
    }

    /**
     * Take the reserved unit; the total never exceeds maxAttempts
     */
    public RetryState beginLastResort(RetryState state, String host) {
        if (!canUseLastResort(state)) {
            throw new IllegalStateException("Last resort not available in " + state.getPhase());
        }
        return state.toBuilder()
                .phase(Phase.ATTEMPT)
                .attempt(state.getAttempt() + 1)
                .budget(state.getAttempt() + 1)
                .lastResortUsed(true)
                .build()
                .withHostTried(host);
    }

    private static RetryState backoffOrExhaust(RetryState state, ErrorKind kind, String detail) {
        Phase next = state.hasBudget() ? Phase.NEED_BACKOFF : Phase.EXHAUSTED;
        return state.failed(next, kind, detail);
    }
}
