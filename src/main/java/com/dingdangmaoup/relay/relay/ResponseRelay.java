package com.dingdangmaoup.relay.relay;

import com.dingdangmaoup.relay.events.UpstreamEvent;
import com.dingdangmaoup.relay.events.UpstreamEventPublisher;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import com.dingdangmaoup.relay.upstream.UpstreamHeaders;
import com.dingdangmaoup.relay.upstream.UpstreamOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpResponse;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Streams an upstream response to the client: status verbatim, headers minus hop-by-hop
 * and upstream-internal ones, body chunk by chunk without buffering it.
 */
@Slf4j
@RequiredArgsConstructor
public class ResponseRelay {

    public static final String API_VERSION_HEADER = "Docker-Distribution-API-Version";

    private final UpstreamHeaders upstreamHeaders;
    private final UpstreamEventPublisher events;

    public Mono<Void> relay(ResolvedRequest request, UpstreamOutcome outcome, int attempt, ServerHttpResponse response) {
        HttpStatusCode status = outcome.getStatus().orElse(HttpStatus.BAD_GATEWAY);
        response.setStatusCode(status);
        // a failed earlier attempt may have staged headers before anything was committed
        response.getHeaders().clear();
        response.getHeaders().putAll(upstreamHeaders.forClient(outcome.getHeaders()));
        if (!response.getHeaders().containsKey(API_VERSION_HEADER)) {
            response.getHeaders().set(API_VERSION_HEADER, "registry/2.0");
        }

        if (status.value() == 403 || status.value() == 429) {
            Map<String, String> rateLimit = UpstreamOutcome.rateLimitHeaders(outcome.getHeaders());
            if (!rateLimit.isEmpty()) {
                events.publish(UpstreamEvent.builder()
                        .type(UpstreamEvent.Type.RATE_LIMITED)
                        .registryId(request.getRegistry().getId())
                        .path(request.getUpstreamPath())
                        .status(status.value())
                        .attempt(attempt)
                        .details(rateLimit)
                        .detail("relayed", "true")
                        .build());
            }
        }

        log.debug("Relaying {} for {}", status.value(), request.describe());
        return response.writeWith(outcome.getBody());
    }

    /**
     * Local answer to the /v2/ capability probe
     */
    public Mono<Void> probeOk(ServerHttpResponse response) {
        response.setStatusCode(HttpStatus.OK);
        HttpHeaders headers = response.getHeaders();
        headers.set(API_VERSION_HEADER, "registry/2.0");
        headers.setContentLength(0);
        return response.setComplete();
    }
}
