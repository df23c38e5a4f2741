package com.dingdangmaoup.relay.metrics;

import com.dingdangmaoup.relay.events.UpstreamEvent;
import com.dingdangmaoup.relay.lifecycle.InFlightTracker;
import com.dingdangmaoup.relay.upstream.auth.TokenCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Pull pipeline metrics, fed by {@link UpstreamEvent}s
 */
@Slf4j
@Component
public class PullMetrics {

    private final MeterRegistry meterRegistry;

    public PullMetrics(MeterRegistry meterRegistry, InFlightTracker inFlightTracker, TokenCache tokenCache) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("relay.pulls.in_flight", inFlightTracker, InFlightTracker::current)
                .description("Proxied requests currently in progress")
                .register(meterRegistry);

        Gauge.builder("relay.auth.tokens", tokenCache, TokenCache::size)
                .description("Bearer tokens currently cached")
                .register(meterRegistry);
    }

    @EventListener
    public void onUpstreamEvent(UpstreamEvent event) {
        counter(event).increment();
    }

    public double count(UpstreamEvent.Type type, String registryId) {
        Counter counter = meterRegistry.find("relay.upstream.events")
                .tag("type", type.name().toLowerCase())
                .tag("registry", registryId)
                .counter();
        return counter == null ? 0 : counter.count();
    }

    private Counter counter(UpstreamEvent event) {
        return Counter.builder("relay.upstream.events")
                .tag("type", event.getType().name().toLowerCase())
                .tag("registry", event.getRegistryId() == null ? "unknown" : event.getRegistryId())
                .description("Upstream pipeline events by type")
                .register(meterRegistry);
    }
}
