package com.dingdangmaoup.relay.lifecycle;

import com.dingdangmaoup.relay.registry.RegistryCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Readiness for load balancers. Goes DOWN as soon as shutdown starts draining.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadinessProbe implements ReactiveHealthIndicator {

    private final RegistryCatalog registryCatalog;
    private final InFlightTracker inFlightTracker;

    private volatile boolean draining = false;

    @Override
    public Mono<Health> health() {
        if (draining) {
            return Mono.just(Health.down()
                    .withDetail("reason", "draining")
                    .withDetail("inFlight", inFlightTracker.current())
                    .build());
        }
        if (registryCatalog.size() == 0) {
            return Mono.just(Health.down()
                    .withDetail("reason", "no registries configured")
                    .build());
        }
        return Mono.just(Health.up()
                .withDetail("registries", registryCatalog.size())
                .withDetail("inFlight", inFlightTracker.current())
                .build());
    }

    public void setDraining(boolean draining) {
        this.draining = draining;
        log.info("Readiness probe draining state set to: {}", draining);
    }

    public boolean isDraining() {
        return draining;
    }
}
