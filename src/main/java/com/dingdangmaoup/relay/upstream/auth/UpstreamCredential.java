package com.dingdangmaoup.relay.upstream.auth;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Authorization attached to upstream attempts. Bearer credentials remember the token key
 * and expiry they came from so a long retry loop can renew them; basic credentials never
 * expire.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UpstreamCredential {
    String header;
    TokenKey key;
    Instant expiresAt;

    public static UpstreamCredential bearer(TokenKey key, AuthToken token) {
        return new UpstreamCredential(token.toAuthorizationHeader(), key, token.getExpiresAt().orElse(null));
    }

    public static UpstreamCredential basic(String header) {
        return new UpstreamCredential(header, null, null);
    }

    public Optional<TokenKey> getKey() {
        return Optional.ofNullable(key);
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "UpstreamCredential(key=" + key + ", expiresAt=" + expiresAt + ")";
    }
}
