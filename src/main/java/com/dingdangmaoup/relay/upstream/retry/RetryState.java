package com.dingdangmaoup.relay.upstream.retry;

import com.dingdangmaoup.relay.error.ErrorKind;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one operation's retry bookkeeping. Never shared across requests.
 */
@Value
@With
@Builder(toBuilder = true)
public class RetryState {
    Phase phase;
    int attempt;
    /**
     * Attempts available to the regular loop, the last resort is accounted separately
     */
    int budget;
    boolean lastResortAvailable;
    boolean lastResortUsed;
    boolean authRetried;
    ErrorKind lastError;
    String lastErrorMessage;
    @Builder.Default
    Set<String> hostsTried = Set.of();
    Instant backoffDeadline;

    public Optional<ErrorKind> getLastError() {
        return Optional.ofNullable(lastError);
    }

    public Optional<Instant> getBackoffDeadline() {
        return Optional.ofNullable(backoffDeadline);
    }

    public boolean hasBudget() {
        return attempt < budget;
    }

    public boolean hasTried(String host) {
        return hostsTried.contains(host);
    }

    RetryState withHostTried(String host) {
        Set<String> hosts = new LinkedHashSet<>(hostsTried);
        hosts.add(host);
        return withHostsTried(Set.copyOf(hosts));
    }

    RetryState failed(Phase next, ErrorKind kind, String message) {
        return toBuilder().phase(next).lastError(kind).lastErrorMessage(message).build();
    }
}
