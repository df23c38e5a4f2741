package com.dingdangmaoup.relay.upstream.auth;

import com.github.benmanes.caffeine.cache.AsyncCache;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Process-wide table of bearer tokens keyed by (registry, scope). At most one entry per
 * key; an entry is either unexpired or absent.
 * <p>
 * Each entry is the promise of a token exchange. Concurrent misses for a key join the
 * promise already in the cache, so they produce exactly one exchange and all see the
 * same token or the same failure. A failed exchange leaves no entry behind. Callers for
 * different keys never wait on each other.
 */
@Slf4j
public class TokenCache {

    private final AsyncCache<TokenKey, AuthToken> tokens;
    private final Clock clock;

    public TokenCache(AsyncCache<TokenKey, AuthToken> tokens, Clock clock) {
        this.tokens = tokens;
        this.clock = clock;
    }

    /**
     * Valid cached token, expired entries are dropped on the way. An exchange still in
     * flight counts as absent.
     */
    public Optional<AuthToken> get(TokenKey key) {
        CompletableFuture<AuthToken> entry = tokens.getIfPresent(key);
        AuthToken token = completedValue(entry);
        if (token == null) {
            return Optional.empty();
        }
        if (token.isExpired(clock.instant())) {
            log.debug("Token for {} expired at {}", key, token.getExpiresAt().orElse(null));
            tokens.asMap().remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(token);
    }

    /**
     * Cached token, or the one produced by the exchange shared with every concurrent
     * caller of the same key. A cancelled caller does not cancel the shared exchange.
     */
    public Mono<AuthToken> getOrFetch(TokenKey key, Supplier<Mono<AuthToken>> exchange) {
        return Mono.defer(() -> {
            Optional<AuthToken> cached = get(key);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            CompletableFuture<AuthToken> shared = tokens.get(key, (k, executor) -> {
                log.debug("Starting token exchange for {}", k);
                return exchange.get().toFuture();
            });
            return Mono.fromFuture(shared, true)
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException("Token exchange for " + key
                            + " completed without a token")));
        });
    }

    public void put(TokenKey key, AuthToken token) {
        tokens.put(key, CompletableFuture.completedFuture(token));
    }

    public void invalidate(TokenKey key) {
        tokens.synchronous().invalidate(key);
    }

    /**
     * Drop a token only if it is still the cached one, a concurrent refresh wins
     */
    public void invalidate(TokenKey key, AuthToken stale) {
        CompletableFuture<AuthToken> entry = tokens.getIfPresent(key);
        if (stale.equals(completedValue(entry))) {
            tokens.asMap().remove(key, entry);
        }
    }

    public void clear() {
        tokens.synchronous().invalidateAll();
        log.info("Cleared upstream token cache");
    }

    public long size() {
        return tokens.synchronous().estimatedSize();
    }

    private static AuthToken completedValue(CompletableFuture<AuthToken> entry) {
        if (entry == null || !entry.isDone() || entry.isCompletedExceptionally()) {
            return null;
        }
        return entry.join();
    }
}
