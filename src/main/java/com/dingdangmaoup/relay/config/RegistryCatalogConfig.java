package com.dingdangmaoup.relay.config;

import com.dingdangmaoup.relay.config.properties.RegistryProperties;
import com.dingdangmaoup.relay.registry.CdnEndpointList;
import com.dingdangmaoup.relay.registry.RegistryCatalog;
import com.dingdangmaoup.relay.registry.RegistryCredentials;
import com.dingdangmaoup.relay.registry.RegistryDescriptor;
import com.dingdangmaoup.relay.registry.resolve.PathResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;

/**
 * Turns the configured registry list into the immutable catalog used by the pipeline
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class RegistryCatalogConfig {

    private final RegistryProperties registryProperties;

    @Bean
    public RegistryCatalog registryCatalog() {
        RegistryCatalog.Builder builder = RegistryCatalog.builder()
                .defaultRegistry(registryProperties.getRouting().getDefaultRegistry());
        for (RegistryProperties.Registry registry : registryProperties.getRegistries()) {
            RegistryDescriptor descriptor = toDescriptor(registry);
            builder.register(descriptor, registry.getAliases());
            log.info("Registered upstream {} -> {}://{} (requiresAuth={}, credentials={}, cdnHosts={})",
                    descriptor.getId(), descriptor.getScheme(), descriptor.getPrimaryHost(),
                    descriptor.isRequiresAuth(), descriptor.hasCredentials(), descriptor.getCdnEndpoints());
        }
        RegistryCatalog catalog = builder.build();
        log.info("Registry catalog ready with {} upstream(s), default={}", catalog.size(),
                catalog.defaultRegistry().map(RegistryDescriptor::getId).orElse("none"));
        return catalog;
    }

    @Bean
    public PathResolver pathResolver(RegistryCatalog registryCatalog) {
        return new PathResolver(registryCatalog, registryProperties.getRouting().getHostHintHeader());
    }

    static RegistryDescriptor toDescriptor(RegistryProperties.Registry registry) {
        if (registry.getId() == null || registry.getId().isBlank()) {
            throw new IllegalArgumentException("Registry without id in relay.registries");
        }
        if (registry.getHost() == null || registry.getHost().isBlank()) {
            throw new IllegalArgumentException("Registry " + registry.getId() + " has no host");
        }
        return RegistryDescriptor.builder()
                .id(registry.getId().toLowerCase())
                .primaryHost(registry.getHost().trim())
                .aliasHosts(registry.getAliasHosts())
                .scheme(registry.getScheme())
                .requiresAuth(registry.isRequiresAuth())
                .authServerOverride(registry.getAuthServer() == null || registry.getAuthServer().isBlank()
                        ? null : URI.create(registry.getAuthServer().trim()))
                .service(registry.getService())
                .defaultNamespace(registry.getDefaultNamespace())
                .cdnEndpoints(CdnEndpointList.of(registry.getCdnHosts()))
                .credentials(RegistryCredentials.of(registry.getUsername(), registry.getPassword()).orElse(null))
                .build();
    }
}
