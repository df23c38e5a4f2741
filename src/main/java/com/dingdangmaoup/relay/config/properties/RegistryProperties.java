package com.dingdangmaoup.relay.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Upstream registry catalog and routing configuration
 */
@Data
@Component
@ConfigurationProperties(prefix = "relay")
public class RegistryProperties {

    private Routing routing = new Routing();

    /**
     * Known upstream registries, the id doubles as the path alias
     */
    private List<Registry> registries = new ArrayList<>();

    @Data
    public static class Routing {
        /**
         * Registry id used for native /v2/ paths without a host hint
         */
        private String defaultRegistry = "docker";

        /**
         * Request header naming the upstream registry for native /v2/ paths
         */
        private String hostHintHeader = "X-Registry-Host";
    }

    @Data
    public static class Registry {
        private String id;

        /**
         * Additional path aliases
         */
        private List<String> aliases = new ArrayList<>();

        private String host;

        /**
         * Other host names that identify this registry in a host hint
         */
        private List<String> aliasHosts = new ArrayList<>();

        private String scheme = "https";

        private boolean requiresAuth = false;

        /**
         * Token realm that replaces the one announced in challenges
         */
        private String authServer;

        /**
         * Token service name used when no challenge has been observed yet
         */
        private String service;

        /**
         * Namespace prepended to single-component repository names
         */
        private String defaultNamespace;

        /**
         * Alternate hosts for blob downloads, tried in order
         */
        private List<String> cdnHosts = new ArrayList<>();

        private String username;

        private String password;
    }
}
