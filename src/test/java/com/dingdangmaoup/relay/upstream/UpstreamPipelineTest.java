package com.dingdangmaoup.relay.upstream;

import com.dingdangmaoup.relay.error.AuthFailedException;
import com.dingdangmaoup.relay.error.ErrorKind;
import com.dingdangmaoup.relay.error.UpstreamFailureException;
import com.dingdangmaoup.relay.events.UpstreamEvent;
import com.dingdangmaoup.relay.events.UpstreamEventPublisher;
import com.dingdangmaoup.relay.registry.CdnEndpointList;
import com.dingdangmaoup.relay.registry.RegistryDescriptor;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import com.dingdangmaoup.relay.relay.ResponseRelay;
import com.dingdangmaoup.relay.config.properties.AuthProperties;
import com.dingdangmaoup.relay.support.MutableClock;
import com.dingdangmaoup.relay.support.ScriptedTransport;
import com.dingdangmaoup.relay.support.StubAuthNegotiator;
import com.dingdangmaoup.relay.support.StubRegistryServer;
import com.dingdangmaoup.relay.upstream.auth.AuthNegotiator;
import com.dingdangmaoup.relay.upstream.auth.AuthToken;
import com.dingdangmaoup.relay.upstream.auth.TokenCache;
import com.dingdangmaoup.relay.upstream.auth.TokenKey;
import com.dingdangmaoup.relay.upstream.redirect.RedirectHandler;
import com.dingdangmaoup.relay.upstream.retry.BackoffPolicy;
import com.dingdangmaoup.relay.upstream.retry.RetryStateMachine;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static com.dingdangmaoup.relay.support.ScriptedTransport.redirect;
import static com.dingdangmaoup.relay.support.ScriptedTransport.status;
import static com.dingdangmaoup.relay.support.ScriptedTransport.timeout;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end pipeline scenarios against a scripted upstream
 */
class UpstreamPipelineTest {

    private static final List<String> AGENTS = List.of("agent-a", "agent-b", "agent-c", "agent-d");

    private final List<Object> published = new CopyOnWriteArrayList<>();
    private UpstreamEventPublisher events;
    private ScriptedTransport transport;
    private StubAuthNegotiator auth;
    private UpstreamPipeline pipeline;
    private MockServerHttpResponse response;
    private RegistryDescriptor registry;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        events = new UpstreamEventPublisher(published::add);
        auth = new StubAuthNegotiator(events, Clock.systemUTC());
        pipeline = pipeline(auth, new BackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(5), 0.5), Clock.systemUTC());
        response = new MockServerHttpResponse();
        registry = RegistryDescriptor.builder()
                .id("docker")
                .primaryHost("registry.test")
                .cdnEndpoints(CdnEndpointList.of(List.of("cdn.test")))
                .build();
    }

    private UpstreamPipeline pipeline(AuthNegotiator negotiator, BackoffPolicy backoff, Clock clock) {
        UpstreamHeaders headers = new UpstreamHeaders(new UserAgentRotator(AGENTS), "X-Registry-Host", List.of());
        ResponseRelay relay = new ResponseRelay(headers, events);
        RetryStateMachine machine = new RetryStateMachine(5, true);
        RedirectHandler redirects = new RedirectHandler(transport, headers, relay, machine, events,
                request -> Duration.ofSeconds(1), 5);
        return new UpstreamPipeline(transport, negotiator, redirects, relay, headers, machine,
                backoff, () -> 0.5, request -> Duration.ofSeconds(1), events, clock);
    }

    private ResolvedRequest blob() {
        HttpHeaders inbound = new HttpHeaders();
        inbound.set(HttpHeaders.RANGE, "bytes=0-1023");
        return ResolvedRequest.builder()
                .registry(registry)
                .upstreamPath("/v2/library/alpine/blobs/sha256:abc123")
                .method(HttpMethod.GET)
                .blob(true)
                .repository("library/alpine")
                .reference("sha256:abc123")
                .originalHeaders(inbound)
                .build();
    }

    private ResolvedRequest manifest() {
        return ResolvedRequest.builder()
                .registry(registry)
                .upstreamPath("/v2/library/alpine/manifests/latest")
                .method(HttpMethod.GET)
                .manifest(true)
                .repository("library/alpine")
                .reference("latest")
                .build();
    }

    private List<UpstreamEvent> events(UpstreamEvent.Type type) {
        return published.stream()
                .map(UpstreamEvent.class::cast)
                .filter(event -> event.getType() == type)
                .collect(Collectors.toList());
    }

    private static HttpHeaders headers(String name, String value) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(name, value);
        return headers;
    }

    @Test
    void testChallenge_tokenFetched_retriedWithToken() {
        transport.then(status(401, headers(HttpHeaders.WWW_AUTHENTICATE,
                        "Bearer realm=\"https://auth.test/token\",service=\"registry.test\""), ""))
                .then(status(200, headers("Docker-Content-Digest", "sha256:m1"), "{\"schemaVersion\":2}"));

        StepVerifier.create(pipeline.proxy(manifest(), response)).verifyComplete();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("sha256:m1", response.getHeaders().getFirst("Docker-Content-Digest"));
        StepVerifier.create(response.getBodyAsString()).expectNext("{\"schemaVersion\":2}").verifyComplete();
        assertEquals(2, transport.calls().size());
        assertNull(transport.calls().get(0).getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("Bearer fresh-token", transport.calls().get(1).getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals(1, auth.challenges());
        assertEquals(1, events(UpstreamEvent.Type.COMPLETED).size());
    }

    @Test
    void testPreAuthorization_sentOnFirstAttempt() {
        auth.preAuthorization("early");
        transport.thenStatus(200);

        StepVerifier.create(pipeline.proxy(manifest(), response)).verifyComplete();

        assertEquals("Bearer early", transport.calls().get(0).getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals(0, auth.challenges());
    }

    @Test
    void testChallenge_rejectedTwice_authFailedWithUpstreamHeaders() {
        HttpHeaders challenge = headers(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"https://auth.test/token\"");
        transport.always(status(401, challenge, ""));

        StepVerifier.create(pipeline.proxy(manifest(), response))
                .expectErrorSatisfies(error -> {
                    AuthFailedException failure = assertInstanceOf(AuthFailedException.class, error);
                    assertEquals(401, failure.getStatus().value());
                    assertNotNull(failure.getUpstreamHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE));
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(2, transport.calls().size(), "One retry after a fresh token, no last resort");
        assertEquals(1, auth.challenges());
    }

    @Test
    void testChallenge_tokenExchangeFails_authFailed() {
        auth.failExchange();
        transport.always(status(401, headers(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"https://auth.test/token\""), ""));

        StepVerifier.create(pipeline.proxy(manifest(), response))
                .expectError(AuthFailedException.class)
                .verify(Duration.ofSeconds(5));
        assertEquals(1, transport.calls().size());
    }

    @Test
    void testRedirect_storageTimesOut_cdnFallbackServesBlob() {
        auth.preAuthorization("Bearer tok");
        transport.then(redirect("https://storage.test/blobs/abc?X-Amz-Signature=sig"))
                .then(timeout())
                .then(status(206, headers(HttpHeaders.CONTENT_RANGE, "bytes 0-1023/4096"), "layer-bytes"));

        StepVerifier.create(pipeline.proxy(blob(), response)).verifyComplete();

        assertEquals(HttpStatus.PARTIAL_CONTENT, response.getStatusCode());
        StepVerifier.create(response.getBodyAsString()).expectNext("layer-bytes").verifyComplete();
        assertEquals(List.of("registry.test", "storage.test", "cdn.test"), transport.hosts());

        UpstreamCall cdnCall = transport.calls().get(2);
        assertEquals("https://cdn.test/blobs/abc?X-Amz-Signature=sig", cdnCall.getUri().toString());
        assertEquals(UpstreamCall.Purpose.CDN_FALLBACK, cdnCall.getPurpose());
        assertNull(cdnCall.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        assertNull(transport.calls().get(1).getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("bytes=0-1023", cdnCall.getHeaders().getFirst(HttpHeaders.RANGE));
        assertEquals(1, events(UpstreamEvent.Type.CDN_FALLBACK).size());
    }

    @Test
    void testRedirect_manifestTargetFails_noCdnFallback() {
        transport.then(redirect("https://storage.test/manifest"))
                .then(timeout())
                .thenStatus(200);

        StepVerifier.create(pipeline.proxy(manifest(), response)).verifyComplete();

        // back to the primary host after backoff, CDN hosts serve blobs only
        assertEquals(List.of("registry.test", "storage.test", "registry.test"), transport.hosts());
        assertTrue(events(UpstreamEvent.Type.CDN_FALLBACK).isEmpty());
    }

    @Test
    void testRateLimited_backoffRotatesUserAgent_thenSucceeds() {
        HttpHeaders limited = new HttpHeaders();
        limited.set("RateLimit-Remaining", "0;w=21600");
        limited.set("Retry-After", "1");
        transport.then(status(429, limited, ""))
                .then(status(429, limited, ""))
                .then(status(429, limited, ""))
                .thenStatus(200);

        StepVerifier.create(pipeline.proxy(manifest(), response)).verifyComplete();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(4, transport.calls().size());
        List<String> agents = transport.calls().stream()
                .map(call -> call.getHeaders().getFirst(HttpHeaders.USER_AGENT))
                .collect(Collectors.toList());
        assertEquals(AGENTS, agents);
        assertEquals(3, events(UpstreamEvent.Type.RATE_LIMITED).size());
        assertEquals(3, events(UpstreamEvent.Type.RETRY_SCHEDULED).size());
        assertEquals("0;w=21600", events(UpstreamEvent.Type.RATE_LIMITED).get(0).getDetails().get("ratelimit-remaining"));
    }

    @Test
    void testRateLimited_persistently_surfacesRateLimitWithHeaders() {
        transport.always(status(429, headers("Retry-After", "60"), ""));

        StepVerifier.create(pipeline.proxy(manifest(), response))
                .expectErrorSatisfies(error -> {
                    UpstreamFailureException failure = assertInstanceOf(UpstreamFailureException.class, error);
                    assertEquals(ErrorKind.RATE_LIMITED, failure.getKind());
                    assertEquals(429, failure.getStatus().value());
                    assertEquals("60", failure.getUpstreamHeaders().getFirst("Retry-After"));
                })
                .verify(Duration.ofSeconds(5));
        assertEquals(5, transport.calls().size());
    }

    @Test
    void testUnavailable_neverMoreThanMaxAttempts_lastResortIncluded() {
        transport.always(status(503, new HttpHeaders(), ""));

        StepVerifier.create(pipeline.proxy(manifest(), response))
                .expectErrorSatisfies(error -> {
                    UpstreamFailureException failure = assertInstanceOf(UpstreamFailureException.class, error);
                    assertEquals(ErrorKind.TRANSPORT_ERROR, failure.getKind());
                    assertEquals(502, failure.getStatus().value());
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(5, transport.calls().size());
        assertEquals(UpstreamCall.Purpose.LAST_RESORT, transport.calls().get(4).getPurpose());
        assertEquals(1, events(UpstreamEvent.Type.LAST_RESORT).size());
        assertEquals(1, events(UpstreamEvent.Type.EXHAUSTED).size());
    }

    @Test
    void testTimeouts_surfaceAsGatewayTimeout() {
        transport.always(timeout());

        StepVerifier.create(pipeline.proxy(manifest(), response))
                .expectErrorSatisfies(error -> assertEquals(504,
                        assertInstanceOf(UpstreamFailureException.class, error).getStatus().value()))
                .verify(Duration.ofSeconds(5));
        assertEquals(5, transport.calls().size());
    }

    @Test
    void testLastResort_minimalRequestSucceeds() {
        auth.preAuthorization("Bearer tok");
        transport.thenStatus(503).thenStatus(503).thenStatus(503).thenStatus(503)
                .then(status(200, new HttpHeaders(), "manifest"));

        StepVerifier.create(pipeline.proxy(manifest(), response)).verifyComplete();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        UpstreamCall lastResort = transport.calls().get(4);
        assertEquals(UpstreamCall.Purpose.LAST_RESORT, lastResort.getPurpose());
        assertEquals("Bearer tok", lastResort.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        assertNull(lastResort.getHeaders().getFirst("Docker-Distribution-Api-Version"));
        assertEquals("agent-a", lastResort.getHeaders().getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    void testUpstreamNotFound_relayedWithoutRetry() {
        transport.then(status(404, new HttpHeaders(), "{\"errors\":[{\"code\":\"MANIFEST_UNKNOWN\"}]}"));

        StepVerifier.create(pipeline.proxy(manifest(), response)).verifyComplete();

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals(1, transport.calls().size());
    }

    @Test
    void testRequestWithBody_singleAttempt() {
        ResolvedRequest upload = manifest().toBuilder()
                .method(HttpMethod.PUT)
                .body(ScriptedTransport.body("{\"schemaVersion\":2}"))
                .hasBody(true)
                .build();
        transport.always(status(503, new HttpHeaders(), ""));

        StepVerifier.create(pipeline.proxy(upload, response))
                .expectError(UpstreamFailureException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(1, transport.calls().size());
        assertTrue(transport.calls().get(0).isHasBody());
    }

    @Test
    void testBaseProbe_unauthorized_answeredLocally() {
        ResolvedRequest probe = ResolvedRequest.builder()
                .registry(registry)
                .upstreamPath("/v2/")
                .method(HttpMethod.GET)
                .baseProbe(true)
                .build();
        transport.then(status(401, headers(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"https://auth.test/token\""), ""));

        StepVerifier.create(pipeline.proxy(probe, response)).verifyComplete();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("registry/2.0", response.getHeaders().getFirst(ResponseRelay.API_VERSION_HEADER));
        assertEquals(0, auth.challenges());
    }

    @Test
    void testMidStreamFailure_notRetried() {
        transport.then(call -> UpstreamOutcome.classify(call.getUri(), HttpStatus.OK, new HttpHeaders(),
                ScriptedTransport.body("partial").concatWith(Flux.error(new IllegalStateException("connection reset")))));

        StepVerifier.create(pipeline.proxy(blob(), response))
                .expectError(IllegalStateException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(1, transport.calls().size());
        assertTrue(response.isCommitted());
    }

    @Test
    void testBackoff_tokenExpiresMeanwhile_renewedBeforeNextAttempt() {
        StubRegistryServer tokenServer = new StubRegistryServer();
        try {
            MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
            TokenCache tokenCache = new TokenCache(Caffeine.newBuilder().<TokenKey, AuthToken>buildAsync(), clock);
            AuthNegotiator negotiator = new AuthNegotiator(WebClient.create(), tokenCache, new AuthProperties(),
                    events, clock);
            UpstreamPipeline renewing = pipeline(negotiator,
                    new BackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(5), 0.5), clock);
            registry = RegistryDescriptor.builder()
                    .id("docker")
                    .primaryHost("registry.test")
                    .requiresAuth(true)
                    .authServerOverride(URI.create("http://" + tokenServer.host() + "/token"))
                    .build();
            TokenKey key = new TokenKey("docker", "repository:library/alpine:pull");
            tokenCache.put(key, new AuthToken(key.getScope(), "old", clock.instant().plusSeconds(10)));

            // the first attempt hangs past the token's expiry before failing
            transport.then(call -> {
                        clock.advance(Duration.ofSeconds(30));
                        return UpstreamOutcome.classify(call.getUri(), HttpStatus.SERVICE_UNAVAILABLE,
                                new HttpHeaders(), Flux.empty());
                    })
                    .thenStatus(200);

            StepVerifier.create(renewing.proxy(manifest(), response))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertEquals(2, transport.calls().size());
            assertEquals("Bearer old", transport.calls().get(0).getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
            assertEquals("Bearer tok-1", transport.calls().get(1).getHeaders().getFirst(HttpHeaders.AUTHORIZATION),
                    "A token is never sent after its expiry");
            assertEquals(1, tokenServer.tokenCount());
            assertEquals("Bearer tok-1", tokenCache.get(key).orElseThrow().toAuthorizationHeader());
        } finally {
            tokenServer.stop();
        }
    }

    @Test
    void testClientDisconnect_duringBackoff_noFurtherAttempts() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.getOrSet();
        try {
            UpstreamPipeline slow = pipeline(auth,
                    new BackoffPolicy(Duration.ofSeconds(10), Duration.ofSeconds(10), 0.0), Clock.systemUTC());
            transport.always(status(503, new HttpHeaders(), ""));

            Disposable subscription = slow.proxy(manifest(), response).subscribe(done -> { }, error -> { });
            scheduler.advanceTimeBy(Duration.ofSeconds(5));
            assertEquals(1, transport.calls().size());
            assertEquals(1, events(UpstreamEvent.Type.RETRY_SCHEDULED).size());

            subscription.dispose();
            scheduler.advanceTimeBy(Duration.ofMinutes(10));

            assertEquals(1, transport.calls().size(), "A cancelled operation must not keep retrying");
            assertTrue(events(UpstreamEvent.Type.EXHAUSTED).isEmpty());
            assertFalse(response.isCommitted());
        } finally {
            VirtualTimeScheduler.reset();
        }
    }
}
