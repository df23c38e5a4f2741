package com.dingdangmaoup.relay.upstream;

import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Seam between the retry engine and the HTTP client.
 */
public interface UpstreamTransport {

    /**
     * Issue {@code call} and pass its classified outcome to {@code handler} while the
     * exchange is still open, so a success body can be streamed straight through.
     * Failures before a response arrives reach the handler as a transport-error outcome;
     * failures raised after the handler started (e.g. mid-stream) are propagated.
     */
    <T> Mono<T> exchange(UpstreamCall call, Function<UpstreamOutcome, Mono<T>> handler);
}
