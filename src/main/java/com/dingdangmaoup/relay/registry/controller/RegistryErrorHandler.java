package com.dingdangmaoup.relay.registry.controller;

import com.dingdangmaoup.relay.error.RelayException;
import com.dingdangmaoup.relay.error.UnresolvedPathException;
import com.dingdangmaoup.relay.upstream.UpstreamHeaders;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import reactor.core.publisher.Mono;

/**
 * Every pipeline failure ends as a Registry V2 error response, with the upstream's
 * status and headers where they are known
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class RegistryErrorHandler {

    private final UpstreamHeaders upstreamHeaders;

    @ExceptionHandler(RelayException.class)
    public Mono<ResponseEntity<RegistryErrorResponse>> handleRelayException(RelayException ex,
                                                                           ServerHttpResponse response) {
        if (response.isCommitted()) {
            log.error("Response already committed, aborting: {}", ex.getMessage());
            return Mono.error(ex);
        }
        if (ex instanceof UnresolvedPathException) {
            log.info(ex.getMessage());
        } else {
            log.error("Request failed with {}: {}", ex.getStatus().value(), ex.getMessage());
        }

        HttpHeaders headers = upstreamHeaders.forClient(ex.getUpstreamHeaders());
        headers.remove(HttpHeaders.CONTENT_LENGTH);
        headers.remove(HttpHeaders.CONTENT_TYPE);
        headers.remove(HttpHeaders.CONTENT_ENCODING);
        headers.setContentType(MediaType.APPLICATION_JSON);

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .headers(headers)
                .body(RegistryErrorResponse.of(ex.getKind().getRegistryCode(), ex.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<RegistryErrorResponse>> handleUnexpected(Exception ex, ServerHttpResponse response) {
        if (response.isCommitted()) {
            log.error("Response already committed, aborting", ex);
            return Mono.error(ex);
        }
        log.error("Unexpected error while proxying", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(RegistryErrorResponse.of("UNKNOWN", "Internal error: " + ex.getMessage())));
    }
}
