package com.dingdangmaoup.relay.upstream.redirect;

import com.dingdangmaoup.relay.events.UpstreamEvent;
import com.dingdangmaoup.relay.events.UpstreamEventPublisher;
import com.dingdangmaoup.relay.registry.CdnEndpointList;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import com.dingdangmaoup.relay.relay.ResponseRelay;
import com.dingdangmaoup.relay.upstream.PullOperation;
import com.dingdangmaoup.relay.upstream.UpstreamCall;
import com.dingdangmaoup.relay.upstream.UpstreamHeaders;
import com.dingdangmaoup.relay.upstream.UpstreamOutcome;
import com.dingdangmaoup.relay.upstream.UpstreamTransport;
import com.dingdangmaoup.relay.upstream.retry.OutcomeKind;
import com.dingdangmaoup.relay.upstream.retry.RetryStateMachine;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Iterator;
import java.util.function.Function;

/**
 * Follows upstream redirects by hand and, for blobs whose storage target fails, walks the
 * registry's CDN endpoint list. Every call consumes one unit of the operation's budget.
 */
@Slf4j
@RequiredArgsConstructor
public class RedirectHandler {

    private final UpstreamTransport transport;
    private final UpstreamHeaders upstreamHeaders;
    private final ResponseRelay relay;
    private final RetryStateMachine machine;
    private final UpstreamEventPublisher events;
    private final Function<ResolvedRequest, Duration> timeouts;
    private final int maxRedirects;

    /**
     * @return true once a response has been relayed to the client, false when every
     * target failed or the budget ran out
     */
    public Mono<Boolean> follow(PullOperation op) {
        URI location = op.getRedirectLocation();
        HttpHeaders headers = upstreamHeaders.forRedirect(op.getPrimaryHeaders());
        return followChain(op, location, headers, 0, UpstreamCall.Purpose.REDIRECT)
                .flatMap(target -> {
                    if (target.isDelivered()) {
                        return Mono.just(true);
                    }
                    CdnEndpointList cdn = op.getRequest().getRegistry().getCdnEndpoints();
                    if (!target.isHostFailure() || !op.getRequest().isBlob() || cdn.isEmpty()) {
                        return Mono.just(false);
                    }
                    log.warn("Storage host {} failed for {}, trying {} alternate host(s)",
                            hostOf(target.getUri()), op.getRequest().describe(), cdn.size());
                    return fallback(op, target.getUri(), headers, cdn.iterator());
                });
    }

    private Mono<Boolean> fallback(PullOperation op, URI failed, HttpHeaders headers, Iterator<String> hosts) {
        return Mono.defer(() -> {
            if (!op.getState().hasBudget()) {
                log.warn("No attempts left for CDN fallback of {}", op.getRequest().describe());
                return Mono.just(false);
            }
            String host = nextUntried(op, failed, hosts);
            if (host == null) {
                return Mono.just(false);
            }
            URI alternate = withHost(failed, host);
            events.publish(UpstreamEvent.builder()
                    .type(UpstreamEvent.Type.CDN_FALLBACK)
                    .registryId(op.getRequest().getRegistry().getId())
                    .path(op.getRequest().getUpstreamPath())
                    .attempt(op.attempt() + 1)
                    .detail("failedHost", hostOf(failed))
                    .detail("host", host)
                    .build());
            return followChain(op, alternate, headers, 0, UpstreamCall.Purpose.CDN_FALLBACK)
                    .flatMap(target -> target.isDelivered()
                            ? Mono.just(true)
                            : fallback(op, failed, headers, hosts));
        });
    }

    private Mono<Target> followChain(PullOperation op, URI uri, HttpHeaders headers, int hops,
                                     UpstreamCall.Purpose purpose) {
        return Mono.defer(() -> {
            if (!op.getState().hasBudget()) {
                return Mono.just(Target.failed(uri, false));
            }
            op.setState(machine.beginAttempt(op.getState(), hostOf(uri)));
            ResolvedRequest request = op.getRequest();
            UpstreamCall call = UpstreamCall.builder()
                    .method(HttpMethod.HEAD.equals(request.getMethod()) ? HttpMethod.HEAD : HttpMethod.GET)
                    .uri(uri)
                    .headers(headers)
                    .hasBody(false)
                    .timeout(timeouts.apply(request))
                    .purpose(purpose)
                    .build();
            events.publish(UpstreamEvent.builder()
                    .type(UpstreamEvent.Type.REDIRECT_FOLLOWED)
                    .registryId(request.getRegistry().getId())
                    .path(request.getUpstreamPath())
                    .attempt(op.attempt())
                    .detail("host", hostOf(uri))
                    .build());

            return transport.exchange(call, outcome -> onTargetOutcome(op, uri, hops, outcome))
                    .flatMap(target -> target.getNext() != null
                            ? followChain(op, target.getNext(), headers, hops + 1, purpose)
                            : Mono.just(target));
        });
    }

    private Mono<Target> onTargetOutcome(PullOperation op, URI uri, int hops, UpstreamOutcome outcome) {
        op.record(outcome);
        OutcomeKind kind = outcome.getKind();
        int status = outcome.getStatus().map(code -> code.value()).orElse(0);
        if (kind == OutcomeKind.SUCCESS && status != 401 && status != 403) {
            return relay.relay(op.getRequest(), outcome, op.attempt(), op.getResponse())
                    .thenReturn(Target.delivered(uri));
        }
        if (kind == OutcomeKind.REDIRECT) {
            if (hops + 1 >= maxRedirects) {
                log.warn("Too many redirects for {}, last target {}", op.getRequest().describe(), uri);
                return Mono.just(Target.failed(uri, false));
            }
            return Mono.just(Target.next(uri, outcome.getLocation()));
        }
        log.warn("Redirect target {} failed for {}: {}", hostOf(uri), op.getRequest().describe(), outcome.describe());
        return Mono.just(Target.failed(uri, kind == OutcomeKind.TRANSPORT_ERROR));
    }

    private static String nextUntried(PullOperation op, URI failed, Iterator<String> hosts) {
        while (hosts.hasNext()) {
            String host = hosts.next();
            if (!host.equalsIgnoreCase(hostOf(failed)) && !op.getState().hasTried(host)) {
                return host;
            }
        }
        return null;
    }

    /**
     * Same scheme, path and query on another host
     */
    static URI withHost(URI uri, String host) {
        StringBuilder target = new StringBuilder()
                .append(uri.getScheme()).append("://").append(host)
                .append(uri.getRawPath() == null ? "" : uri.getRawPath());
        if (uri.getRawQuery() != null) {
            target.append('?').append(uri.getRawQuery());
        }
        return URI.create(target.toString());
    }

    static String hostOf(URI uri) {
        return uri.getPort() < 0 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }

    /**
     * Result of following one redirect target
     */
    @Value
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    private static class Target {
        URI uri;
        boolean delivered;
        boolean hostFailure;
        URI next;

        static Target delivered(URI uri) {
            return new Target(uri, true, false, null);
        }

        static Target failed(URI uri, boolean hostFailure) {
            return new Target(uri, false, hostFailure, null);
        }

        static Target next(URI uri, URI next) {
            return new Target(uri, false, false, next);
        }
    }
}
