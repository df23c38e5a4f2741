package com.dingdangmaoup.relay.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Outbound request configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "relay.upstream")
public class UpstreamProperties {

    /**
     * TCP connect timeout
     */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Per-attempt timeout for manifest and other requests
     */
    private Duration manifestTimeout = Duration.ofSeconds(30);

    /**
     * Per-attempt timeout for blob requests, layers can be gigabytes
     */
    private Duration blobTimeout = Duration.ofMinutes(5);

    /**
     * Abort an attempt when no bytes arrive for this long
     */
    private Duration idleTimeout = Duration.ofSeconds(60);

    /**
     * Maximum pooled connections to all upstreams
     */
    private int maxConnections = 200;

    /**
     * Maximum chained redirects followed for one attempt
     */
    private int maxRedirects = 5;

    /**
     * User-Agent values rotated across retries
     */
    private List<String> userAgents = new ArrayList<>(List.of(
            "docker/24.0.7 go/go1.20.10 git-commit/311b9ff kernel/6.1.0 os/linux arch/amd64 UpstreamClient(Docker-Client/24.0.7 \\(linux\\))",
            "docker/20.10.12 go/go1.16.12 git-commit/459d0df kernel/5.10.47 os/linux arch/amd64 UpstreamClient(Docker-Client/20.10.12 \\(linux\\))",
            "containerd/v1.7.11",
            "docker/25.0.3 go/go1.21.6 git-commit/f417435 kernel/6.5.0 os/linux arch/arm64 UpstreamClient(Docker-Client/25.0.3 \\(linux\\))"));

    /**
     * Response headers never relayed to the client (in addition to hop-by-hop headers)
     */
    private List<String> excludedResponseHeaders = new ArrayList<>(List.of(
            "Strict-Transport-Security",
            "Set-Cookie",
            "Via",
            "Alt-Svc"));

    /**
     * Retry configuration
     */
    private Retry retry = new Retry();

    @Data
    public static class Retry {
        /**
         * Maximum outbound attempts for one logical operation, last resort included
         */
        private int maxAttempts = 5;

        /**
         * First backoff delay, doubled after every failed attempt
         */
        private Duration baseDelay = Duration.ofMillis(500);

        /**
         * Upper bound for a single backoff delay
         */
        private Duration maxDelay = Duration.ofSeconds(10);

        /**
         * Random jitter added to each delay, as a fraction of the base delay (0..1)
         */
        private double jitterRatio = 0.5;

        /**
         * Reserve one attempt for a minimal-header request against the primary host
         */
        private boolean lastResort = true;
    }
}
