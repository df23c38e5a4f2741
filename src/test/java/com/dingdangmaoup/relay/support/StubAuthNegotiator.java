package com.dingdangmaoup.relay.support;

import com.dingdangmaoup.relay.config.properties.AuthProperties;
import com.dingdangmaoup.relay.error.AuthFailedException;
import com.dingdangmaoup.relay.events.UpstreamEventPublisher;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import com.dingdangmaoup.relay.upstream.auth.AuthNegotiator;
import com.dingdangmaoup.relay.upstream.auth.AuthToken;
import com.dingdangmaoup.relay.upstream.auth.TokenCache;
import com.dingdangmaoup.relay.upstream.auth.TokenKey;
import com.dingdangmaoup.relay.upstream.auth.UpstreamCredential;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Negotiator with canned answers, no token endpoint involved
 */
public class StubAuthNegotiator extends AuthNegotiator {

    private final AtomicInteger challenges = new AtomicInteger();
    private String preAuthorization;
    private String challengeAnswer = "fresh-token";
    private boolean failExchange;

    public StubAuthNegotiator(UpstreamEventPublisher events, Clock clock) {
        super(WebClient.create(), new TokenCache(Caffeine.newBuilder().<TokenKey, AuthToken>buildAsync(), clock),
                new AuthProperties(), events, clock);
    }

    /**
     * Bearer token handed out before the first attempt
     */
    public StubAuthNegotiator preAuthorization(String token) {
        this.preAuthorization = token;
        return this;
    }

    public StubAuthNegotiator failExchange() {
        this.failExchange = true;
        return this;
    }

    public int challenges() {
        return challenges.get();
    }

    @Override
    public Mono<Optional<UpstreamCredential>> preAuthorize(ResolvedRequest request) {
        return Mono.just(Optional.ofNullable(preAuthorization).map(token -> credential(request, token)));
    }

    @Override
    public Mono<UpstreamCredential> authorizeFromChallenge(ResolvedRequest request, HttpStatusCode upstreamStatus,
                                                           HttpHeaders upstreamHeaders, UpstreamCredential rejected) {
        challenges.incrementAndGet();
        if (failExchange) {
            return Mono.error(new AuthFailedException("Token request failed: 403"));
        }
        return Mono.just(credential(request, challengeAnswer));
    }

    private static UpstreamCredential credential(ResolvedRequest request, String token) {
        String scope = request.scope().orElse("");
        return UpstreamCredential.bearer(new TokenKey(request.getRegistry().getId(), scope),
                new AuthToken(scope, token, null));
    }
}
