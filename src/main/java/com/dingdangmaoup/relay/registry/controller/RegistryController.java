package com.dingdangmaoup.relay.registry.controller;

import com.dingdangmaoup.relay.error.UnresolvedPathException;
import com.dingdangmaoup.relay.lifecycle.InFlightTracker;
import com.dingdangmaoup.relay.registry.resolve.PathResolver;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import com.dingdangmaoup.relay.relay.ResponseRelay;
import com.dingdangmaoup.relay.upstream.UpstreamPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Docker Registry API v2 entry point. Accepts any method on alias paths
 * ({@code /docker/library/ubuntu/manifests/latest}) and native paths
 * ({@code /v2/library/alpine/blobs/sha256:...}) and proxies them upstream.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class RegistryController {

    private final PathResolver pathResolver;
    private final UpstreamPipeline upstreamPipeline;
    private final ResponseRelay responseRelay;
    private final InFlightTracker inFlightTracker;

    @RequestMapping("/**")
    public Mono<Void> proxy(ServerHttpRequest request, ServerHttpResponse response) {
        String path = request.getPath().value();
        ResolvedRequest resolved;
        try {
            resolved = pathResolver.resolve(request);
        } catch (UnresolvedPathException e) {
            if (isCapabilityProbe(path)) {
                log.info("apiVersion probe without upstream, answering locally");
                return responseRelay.probeOk(response);
            }
            return Mono.error(e);
        }

        log.info("{} {} -> {}", request.getMethod(), path, resolved.describe());
        return inFlightTracker.track(upstreamPipeline.proxy(resolved, response));
    }

    private static boolean isCapabilityProbe(String path) {
        return "/v2".equals(path) || "/v2/".equals(path);
    }
}
