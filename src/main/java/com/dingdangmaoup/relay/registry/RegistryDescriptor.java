package com.dingdangmaoup.relay.registry;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Immutable description of one upstream registry, shared read-only by all requests.
 */
@Value
@Builder
public class RegistryDescriptor {
    String id;
    String primaryHost;
    @Singular
    List<String> aliasHosts;
    @Builder.Default
    String scheme = "https";
    boolean requiresAuth;
    URI authServerOverride;
    String service;
    String defaultNamespace;
    @Builder.Default
    CdnEndpointList cdnEndpoints = CdnEndpointList.empty();
    RegistryCredentials credentials;

    public Optional<URI> getAuthServerOverride() {
        return Optional.ofNullable(authServerOverride);
    }

    public Optional<RegistryCredentials> getCredentials() {
        return Optional.ofNullable(credentials);
    }

    public Optional<String> getDefaultNamespace() {
        return Optional.ofNullable(defaultNamespace).filter(ns -> !ns.isBlank());
    }

    public boolean hasCredentials() {
        return credentials != null;
    }

    /**
     * Base URL of the primary host, e.g. https://registry-1.docker.io
     */
    public String baseUrl() {
        return scheme + "://" + primaryHost;
    }

    public boolean matchesHost(String host) {
        if (host == null) {
            return false;
        }
        String candidate = host.trim().toLowerCase();
        return primaryHost.equalsIgnoreCase(candidate)
                || aliasHosts.stream().anyMatch(alias -> alias.equalsIgnoreCase(candidate));
    }
}
