package com.dingdangmaoup.relay.upstream.auth;

import com.dingdangmaoup.relay.config.properties.AuthProperties;
import com.dingdangmaoup.relay.error.AuthFailedException;
import com.dingdangmaoup.relay.events.UpstreamEvent;
import com.dingdangmaoup.relay.events.UpstreamEventPublisher;
import com.dingdangmaoup.relay.registry.RegistryCredentials;
import com.dingdangmaoup.relay.registry.RegistryDescriptor;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import com.dingdangmaoup.relay.upstream.model.TokenResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Obtains bearer tokens for upstream registries, either ahead of the first attempt or in
 * answer to a {@code WWW-Authenticate} challenge.
 */
@Slf4j
@Service
public class AuthNegotiator {

    private static final String NO_SCOPE = "";

    private final WebClient tokenWebClient;
    private final TokenCache tokenCache;
    private final AuthProperties authProperties;
    private final UpstreamEventPublisher events;
    private final Clock clock;

    /**
     * Last bearer challenge seen per registry id, tells us where to fetch tokens up front
     */
    private final ConcurrentHashMap<String, BearerChallenge> observedChallenges = new ConcurrentHashMap<>();

    public AuthNegotiator(@Qualifier("registryWebClient") WebClient tokenWebClient,
                          TokenCache tokenCache,
                          AuthProperties authProperties,
                          UpstreamEventPublisher events,
                          Clock clock) {
        this.tokenWebClient = tokenWebClient;
        this.tokenCache = tokenCache;
        this.authProperties = authProperties;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Authorization header to attach before the first attempt, if any. Never fails: a
     * failed pre-fetch falls back to anonymous and the 401 path takes over.
     */
    public Mono<Optional<UpstreamCredential>> preAuthorize(ResolvedRequest request) {
        if (request.isBaseProbe()) {
            return Mono.just(Optional.empty());
        }
        RegistryDescriptor registry = request.getRegistry();
        String scope = request.scope().orElse(null);
        if (scope == null) {
            return Mono.just(Optional.empty());
        }
        TokenKey key = new TokenKey(registry.getId(), scope);
        Optional<AuthToken> cached = tokenCache.get(key);
        if (cached.isPresent()) {
            log.debug("Using cached token for {}", key);
            return Mono.just(cached.map(token -> UpstreamCredential.bearer(key, token)));
        }

        BearerChallenge observed = observedChallenges.get(registry.getId());
        boolean challengeExpected = registry.hasCredentials() || registry.isRequiresAuth() || observed != null;
        Optional<URI> realm = realmFor(registry, observed);
        if (!request.isContentRequest() || !challengeExpected || realm.isEmpty()) {
            return Mono.just(Optional.empty());
        }

        return fetchAhead(request, key, realm.get(), observed, "Pre-authentication");
    }

    /**
     * Replace a bearer credential that expired while its operation was still retrying. The
     * token is refetched for the same key; without a known realm the attempt goes out
     * anonymously and the 401 path takes over. Never fails.
     */
    public Mono<Optional<UpstreamCredential>> renew(ResolvedRequest request, UpstreamCredential expired) {
        if (expired.getKey().isEmpty()) {
            return Mono.just(Optional.of(expired));
        }
        TokenKey key = expired.getKey().get();
        Optional<AuthToken> cached = tokenCache.get(key);
        if (cached.isPresent()) {
            log.debug("Token for {} was already renewed", key);
            return Mono.just(cached.map(token -> UpstreamCredential.bearer(key, token)));
        }
        RegistryDescriptor registry = request.getRegistry();
        BearerChallenge observed = observedChallenges.get(registry.getId());
        Optional<URI> realm = realmFor(registry, observed);
        if (realm.isEmpty()) {
            log.info("Token for {} expired and no realm is known, continuing anonymously", key);
            return Mono.just(Optional.empty());
        }
        return fetchAhead(request, key, realm.get(), observed, "Token renewal");
    }

    private Mono<Optional<UpstreamCredential>> fetchAhead(ResolvedRequest request, TokenKey key, URI realm,
                                                          BearerChallenge observed, String purpose) {
        RegistryDescriptor registry = request.getRegistry();
        String service = Optional.ofNullable(observed)
                .flatMap(BearerChallenge::getService)
                .orElse(registry.getService());
        return tokenCache.getOrFetch(key, () -> exchange(registry, realm, service, key.getScope(), request))
                .map(token -> Optional.of(UpstreamCredential.bearer(key, token)))
                .onErrorResume(error -> {
                    log.warn("{} for {} failed, continuing anonymously: {}", purpose, key, error.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    /**
     * Answer a 401 from the upstream. The token that was rejected, if any, is dropped from
     * the cache before a new one is fetched.
     */
    public Mono<UpstreamCredential> authorizeFromChallenge(ResolvedRequest request, HttpStatusCode upstreamStatus,
                                                           HttpHeaders upstreamHeaders, UpstreamCredential rejected) {
        RegistryDescriptor registry = request.getRegistry();
        String header = upstreamHeaders.getFirst(HttpHeaders.WWW_AUTHENTICATE);
        Optional<BearerChallenge> parsed = BearerChallenge.parse(header);
        if (parsed.isEmpty()) {
            return Mono.error(new AuthFailedException("Upstream " + registry.getId()
                    + " answered 401 without a WWW-Authenticate challenge", upstreamStatus, upstreamHeaders));
        }
        BearerChallenge challenge = parsed.get();

        if (challenge.isBasic()) {
            return registry.getCredentials()
                    .map(credentials -> Mono.just(UpstreamCredential.basic(credentials.toBasicHeader())))
                    .orElseGet(() -> Mono.error(new AuthFailedException("Upstream " + registry.getId()
                            + " requires basic credentials and none are configured", upstreamStatus, upstreamHeaders)));
        }
        if (!challenge.isBearer()) {
            return Mono.error(new AuthFailedException("Unsupported auth scheme " + challenge.getScheme()
                    + " from " + registry.getId(), upstreamStatus, upstreamHeaders));
        }

        Optional<URI> realm = realmFor(registry, challenge);
        if (realm.isEmpty()) {
            return Mono.error(new AuthFailedException("Malformed bearer challenge from " + registry.getId()
                    + ": " + header, upstreamStatus, upstreamHeaders));
        }
        observedChallenges.put(registry.getId(), challenge);

        String scope = challenge.getScope().or(request::scope).orElse(NO_SCOPE);
        String service = challenge.getService().orElse(registry.getService());
        TokenKey key = new TokenKey(registry.getId(), scope);
        if (rejected != null) {
            tokenCache.get(key)
                    .filter(token -> token.toAuthorizationHeader().equals(rejected.getHeader()))
                    .ifPresent(stale -> tokenCache.invalidate(key, stale));
        }

        return tokenCache.getOrFetch(key, () -> exchange(registry, realm.get(), service, scope, request))
                .map(token -> UpstreamCredential.bearer(key, token))
                .onErrorMap(error -> !(error instanceof AuthFailedException),
                        error -> new AuthFailedException("Token exchange for " + key + " failed: " + error.getMessage(), error));
    }

    /**
     * GET {realm}?service=...&scope=...&account=... with basic credentials when configured
     */
    Mono<AuthToken> exchange(RegistryDescriptor registry, URI realm, String service, String scope,
                             ResolvedRequest request) {
        Optional<RegistryCredentials> credentials = registry.getCredentials();
        UriComponentsBuilder uri = UriComponentsBuilder.fromUri(realm);
        if (service != null && !service.isBlank()) {
            uri.queryParam("service", service);
        }
        Arrays.stream(scope.split(" "))
                .filter(part -> !part.isBlank())
                .forEach(part -> uri.queryParam("scope", part));
        credentials.ifPresent(c -> uri.queryParam("account", c.getUsername()));
        URI tokenUri = uri.encode().build().toUri();

        if (credentials.isPresent()) {
            log.info("Requesting token for {} scope={} from {} with configured credentials", registry.getId(), scope, realm);
        } else {
            log.info("Requesting anonymous token for {} scope={} from {}", registry.getId(), scope, realm);
        }

        return tokenWebClient.get()
                .uri(tokenUri)
                .headers(headers -> credentials.ifPresent(c -> headers.set(HttpHeaders.AUTHORIZATION, c.toBasicHeader())))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), response -> Mono.error(
                        new AuthFailedException("Token request to " + realm + " failed: " + response.statusCode().value())))
                .bodyToMono(TokenResponse.class)
                .timeout(authProperties.getExchangeTimeout())
                .flatMap(body -> toToken(scope, body)
                        .map(Mono::just)
                        .orElseGet(() -> Mono.error(new AuthFailedException("Token endpoint " + realm
                                + " returned no token"))))
                .onErrorMap(error -> !(error instanceof AuthFailedException),
                        error -> new AuthFailedException("Token request to " + realm + " failed: " + error.getMessage(), error))
                .doOnNext(token -> events.publish(UpstreamEvent.builder()
                        .type(UpstreamEvent.Type.TOKEN_EXCHANGE)
                        .registryId(registry.getId())
                        .path(request.getUpstreamPath())
                        .detail("scope", scope)
                        .detail("expiresAt", String.valueOf(token.getExpiresAt().orElse(null)))
                        .build()))
                .doOnError(error -> events.publish(UpstreamEvent.builder()
                        .type(UpstreamEvent.Type.TOKEN_EXCHANGE_FAILED)
                        .registryId(registry.getId())
                        .path(request.getUpstreamPath())
                        .detail("scope", scope)
                        .detail("error", String.valueOf(error.getMessage()))
                        .build()));
    }

    private Optional<AuthToken> toToken(String scope, TokenResponse body) {
        String value = body.getEffectiveToken();
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Duration ttl = body.getExpiresIn() != null && body.getExpiresIn() > 0
                ? Duration.ofSeconds(body.getExpiresIn())
                : authProperties.getDefaultTokenTtl();
        Instant expiresAt = clock.instant().plus(ttl).minus(authProperties.getExpirySkew());
        return Optional.of(new AuthToken(scope, value, expiresAt));
    }

    private static Optional<URI> realmFor(RegistryDescriptor registry, BearerChallenge challenge) {
        Optional<URI> override = registry.getAuthServerOverride();
        if (override.isPresent()) {
            return override;
        }
        if (challenge == null) {
            return Optional.empty();
        }
        return challenge.getRealm().flatMap(AuthNegotiator::toUri);
    }

    private static Optional<URI> toUri(String realm) {
        try {
            URI uri = URI.create(realm);
            return uri.getScheme() != null && uri.getHost() != null ? Optional.of(uri) : Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed token realm {}", realm);
            return Optional.empty();
        }
    }

    /**
     * Forget tokens and observed challenges
     */
    public void clearCache() {
        tokenCache.clear();
        observedChallenges.clear();
    }
}
