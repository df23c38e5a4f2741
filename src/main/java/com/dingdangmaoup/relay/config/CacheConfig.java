package com.dingdangmaoup.relay.config;

import com.dingdangmaoup.relay.config.properties.AuthProperties;
import com.dingdangmaoup.relay.upstream.auth.AuthToken;
import com.dingdangmaoup.relay.upstream.auth.TokenCache;
import com.dingdangmaoup.relay.upstream.auth.TokenKey;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

    private final AuthProperties authProperties;

    @Bean
    public TokenCache tokenCache(Clock clock) {
        long maxEntries = authProperties.getTokenCache().getMaxEntries();
        AsyncCache<TokenKey, AuthToken> tokens = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new TokenExpiry(clock))
                .recordStats()
                .buildAsync();

        log.info("Initialized token cache with maxEntries={}", maxEntries);
        return new TokenCache(tokens, clock);
    }

    /**
     * Evicts each token at its own expiry instant
     */
    static class TokenExpiry implements Expiry<TokenKey, AuthToken> {

        private final Clock clock;

        TokenExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(TokenKey key, AuthToken token, long currentTime) {
            return nanosUntilExpiry(token);
        }

        @Override
        public long expireAfterUpdate(TokenKey key, AuthToken token, long currentTime, long currentDuration) {
            return nanosUntilExpiry(token);
        }

        @Override
        public long expireAfterRead(TokenKey key, AuthToken token, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long nanosUntilExpiry(AuthToken token) {
            return token.getExpiresAt()
                    .map(expiresAt -> {
                        Duration left = Duration.between(clock.instant(), expiresAt);
                        if (left.isNegative()) {
                            return 0L;
                        }
                        return left.getSeconds() >= Long.MAX_VALUE / 1_000_000_000L ? Long.MAX_VALUE : left.toNanos();
                    })
                    .orElse(Long.MAX_VALUE);
        }
    }
}
