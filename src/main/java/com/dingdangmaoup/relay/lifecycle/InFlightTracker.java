package com.dingdangmaoup.relay.lifecycle;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts proxied requests that have not finished yet
 */
@Component
public class InFlightTracker {

    private final AtomicInteger inFlight = new AtomicInteger();

    public <T> Mono<T> track(Mono<T> operation) {
        return Mono.defer(() -> {
            inFlight.incrementAndGet();
            return operation.doFinally(signal -> inFlight.decrementAndGet());
        });
    }

    public int current() {
        return inFlight.get();
    }
}
