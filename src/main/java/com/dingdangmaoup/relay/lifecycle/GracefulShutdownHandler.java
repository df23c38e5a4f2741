package com.dingdangmaoup.relay.lifecycle;

import com.dingdangmaoup.relay.upstream.auth.AuthNegotiator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Stops advertising readiness, then waits (bounded) for in-flight pulls before the context goes away
 */
@Slf4j
@Component
public class GracefulShutdownHandler implements ApplicationListener<ContextClosedEvent> {

    private static final long POLL_MILLIS = 100;

    private final ReadinessProbe readinessProbe;
    private final InFlightTracker inFlightTracker;
    private final AuthNegotiator authNegotiator;
    private final Duration drainTimeout;

    public GracefulShutdownHandler(ReadinessProbe readinessProbe,
                                   InFlightTracker inFlightTracker,
                                   AuthNegotiator authNegotiator,
                                   @Value("${relay.lifecycle.drain-timeout:30s}") Duration drainTimeout) {
        this.readinessProbe = readinessProbe;
        this.inFlightTracker = inFlightTracker;
        this.authNegotiator = authNegotiator;
        this.drainTimeout = drainTimeout;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("=== Starting graceful shutdown ===");

        log.info("Step 1: Marking readiness probe as draining");
        readinessProbe.setDraining(true);

        log.info("Step 2: Waiting for {} in-flight requests (max {}s)",
                inFlightTracker.current(), drainTimeout.toSeconds());
        boolean drained = awaitDrained();
        if (!drained) {
            log.warn("Drain timeout reached with {} requests still in flight", inFlightTracker.current());
        }

        log.info("Step 3: Dropping cached registry tokens");
        authNegotiator.clearCache();

        log.info("=== Graceful shutdown completed ===");
    }

    boolean awaitDrained() {
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        while (inFlightTracker.current() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining");
                return false;
            }
        }
        return true;
    }
}
