package com.dingdangmaoup.relay.upstream;

import com.dingdangmaoup.relay.upstream.retry.OutcomeKind;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.TimeoutException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classified result of one outbound call. For {@link OutcomeKind#SUCCESS} the body is a
 * lazy, non-restartable stream that must be consumed while the exchange is open.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UpstreamOutcome {

    private static final Set<Integer> REDIRECTS = Set.of(301, 302, 303, 307, 308);
    private static final Set<Integer> UNAVAILABLE = Set.of(500, 502, 503, 504);

    OutcomeKind kind;
    HttpStatusCode status;
    HttpHeaders headers;
    Flux<DataBuffer> body;
    URI location;
    Throwable error;
    boolean timedOut;

    /**
     * Map a received response onto an outcome. 5xx unavailability counts as a transport
     * failure; 403 only counts as rate limiting when rate-limit headers say so.
     */
    public static UpstreamOutcome classify(URI requestUri, HttpStatusCode status, HttpHeaders headers,
                                           Flux<DataBuffer> body) {
        int code = status.value();
        if (REDIRECTS.contains(code)) {
            Optional<URI> location = resolveLocation(requestUri, headers.getFirst(HttpHeaders.LOCATION));
            if (location.isPresent()) {
                return new UpstreamOutcome(OutcomeKind.REDIRECT, status, headers, Flux.empty(), location.get(), null, false);
            }
        }
        if (code == 401) {
            return new UpstreamOutcome(OutcomeKind.UNAUTHORIZED, status, headers, Flux.empty(), null, null, false);
        }
        if (code == 429 || (code == 403 && hasRateLimitHeaders(headers) && isRateLimitExhausted(headers))) {
            return new UpstreamOutcome(OutcomeKind.RATE_LIMITED, status, headers, Flux.empty(), null, null, false);
        }
        if (UNAVAILABLE.contains(code)) {
            return new UpstreamOutcome(OutcomeKind.TRANSPORT_ERROR, status, headers, Flux.empty(), null, null, code == 504);
        }
        return new UpstreamOutcome(OutcomeKind.SUCCESS, status, headers, body, null, null, false);
    }

    public static UpstreamOutcome transportError(Throwable error) {
        return new UpstreamOutcome(OutcomeKind.TRANSPORT_ERROR, null, HttpHeaders.EMPTY, Flux.empty(), null,
                error, isTimeout(error));
    }

    public static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof java.util.concurrent.TimeoutException
                    || current instanceof TimeoutException
                    || current instanceof ConnectTimeoutException
                    || current instanceof java.net.SocketTimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    public Optional<HttpStatusCode> getStatus() {
        return Optional.ofNullable(status);
    }

    public boolean isSuccess() {
        return kind == OutcomeKind.SUCCESS;
    }

    /**
     * Human readable reason used in logs and error messages
     */
    public String describe() {
        if (status != null) {
            return kind + " (" + status.value() + ")";
        }
        return kind + (error != null ? " (" + error.getClass().getSimpleName() + ": " + error.getMessage() + ")" : "");
    }

    /**
     * Rate-limit related headers (RateLimit-*, X-RateLimit-*, Docker-RateLimit-Source, Retry-After)
     */
    public static Map<String, String> rateLimitHeaders(HttpHeaders headers) {
        Map<String, String> found = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith("ratelimit-") || lower.startsWith("x-ratelimit-")
                    || lower.equals("docker-ratelimit-source") || lower.equals("retry-after")) {
                found.put(lower, String.join(",", values));
            }
        });
        return found;
    }

    private static boolean hasRateLimitHeaders(HttpHeaders headers) {
        return !rateLimitHeaders(headers).isEmpty();
    }

    /**
     * A 403 carrying RateLimit-Remaining greater than zero is a plain denial
     */
    private static boolean isRateLimitExhausted(HttpHeaders headers) {
        String remaining = Optional.ofNullable(headers.getFirst("RateLimit-Remaining"))
                .orElse(headers.getFirst("X-RateLimit-Remaining"));
        if (remaining == null) {
            return true;
        }
        String count = remaining.split(";", 2)[0].trim();
        try {
            return Long.parseLong(count) <= 0;
        } catch (NumberFormatException e) {
            return true;
        }
    }

    private static Optional<URI> resolveLocation(URI requestUri, String location) {
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        try {
            URI target = URI.create(location.trim());
            return Optional.of(requestUri != null ? requestUri.resolve(target) : target);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
