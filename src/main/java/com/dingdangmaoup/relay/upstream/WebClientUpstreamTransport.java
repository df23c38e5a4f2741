package com.dingdangmaoup.relay.upstream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClientRequest;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Issues upstream calls through the shared WebClient. Redirects are never followed here,
 * they surface as {@code REDIRECT} outcomes. The per-call timeout bounds the wait for the
 * response and every stall while reading it, not the length of a whole blob download.
 */
@Slf4j
@Component
public class WebClientUpstreamTransport implements UpstreamTransport {

    private final WebClient registryWebClient;

    public WebClientUpstreamTransport(@Qualifier("registryWebClient") WebClient registryWebClient) {
        this.registryWebClient = registryWebClient;
    }

    @Override
    public <T> Mono<T> exchange(UpstreamCall call, Function<UpstreamOutcome, Mono<T>> handler) {
        return Mono.defer(() -> {
            AtomicBoolean delivered = new AtomicBoolean(false);
            log.debug("{} {} {}", call.getPurpose(), call.getMethod(), call.getUri());

            WebClient.RequestBodySpec spec = registryWebClient.method(call.getMethod())
                    .uri(call.getUri())
                    .headers(headers -> headers.addAll(call.getHeaders()))
                    .httpRequest(request -> {
                        HttpClientRequest nativeRequest = request.getNativeRequest();
                        nativeRequest.responseTimeout(call.getTimeout());
                    });
            WebClient.RequestHeadersSpec<?> ready = call.isHasBody()
                    ? spec.body(BodyInserters.fromDataBuffers(call.getBody()))
                    : spec;

            return ready.exchangeToMono(response -> {
                        delivered.set(true);
                        log.debug("Response status for {} {}: {}", call.getMethod(), call.getUri(), response.statusCode());
                        return handler.apply(UpstreamOutcome.classify(call.getUri(), response.statusCode(),
                                response.headers().asHttpHeaders(), response.bodyToFlux(DataBuffer.class)));
                    })
                    .onErrorResume(error -> !delivered.get(), error -> {
                        log.debug("Transport error for {} {}: {}", call.getMethod(), call.getUri(), error.toString());
                        return handler.apply(UpstreamOutcome.transportError(error));
                    });
        });
    }
}
