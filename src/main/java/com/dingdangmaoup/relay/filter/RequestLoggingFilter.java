package com.dingdangmaoup.relay.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Logs inbound Docker client requests with their outcome and duration.
 * Enable by setting: relay.logging.request-logging=true
 */
@Slf4j
@Component
@Order(-1)
@ConditionalOnProperty(name = "relay.logging.request-logging", havingValue = "true", matchIfMissing = false)
public class RequestLoggingFilter implements WebFilter {

    @Value("${relay.logging.include-headers:false}")
    private boolean includeHeaders;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!log.isDebugEnabled()) {
            return chain.filter(exchange);
        }

        ServerHttpRequest request = exchange.getRequest();
        long started = System.nanoTime();
        log.debug("request method={} path={} query={} client={}", request.getMethod(), request.getPath().value(),
                request.getURI().getRawQuery(), request.getRemoteAddress());

        if (includeHeaders) {
            request.getHeaders().forEach((name, values) ->
                    log.debug("  {}: {}", name, isSecret(name) ? "****" : String.join(", ", values)));
        }

        return chain.filter(exchange)
                .doOnSuccess(v -> log.debug("response method={} path={} status={} durationMs={}",
                        request.getMethod(), request.getPath().value(), exchange.getResponse().getStatusCode(),
                        (System.nanoTime() - started) / 1_000_000))
                .doOnError(error -> log.error("Request {} {} failed: {}", request.getMethod(),
                        request.getPath().value(), error.getMessage()));
    }

    private static boolean isSecret(String header) {
        String lower = header.toLowerCase(Locale.ROOT);
        return lower.equals(HttpHeaders.AUTHORIZATION.toLowerCase(Locale.ROOT)) || lower.equals("cookie");
    }
}
