package com.dingdangmaoup.relay.upstream.auth;

import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * A bearer token for one (registry, scope). Replaced wholesale on refresh.
 */
@Value
public class AuthToken {
    String scope;
    String value;
    Instant expiresAt;

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public String toAuthorizationHeader() {
        return "Bearer " + value;
    }

    @Override
    public String toString() {
        return "AuthToken(scope=" + scope + ", expiresAt=" + expiresAt + ")";
    }
}
