package com.dingdangmaoup.relay.registry;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static mapping from path aliases and host hints to upstream registries.
 * Built once at startup and never mutated afterwards.
 */
@Slf4j
public class RegistryCatalog {

    private final Map<String, RegistryDescriptor> byAlias;
    private final Map<String, RegistryDescriptor> byId;
    private final String defaultRegistryId;

    private RegistryCatalog(Map<String, RegistryDescriptor> byAlias,
                            Map<String, RegistryDescriptor> byId,
                            String defaultRegistryId) {
        this.byAlias = Collections.unmodifiableMap(byAlias);
        this.byId = Collections.unmodifiableMap(byId);
        this.defaultRegistryId = defaultRegistryId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RegistryDescriptor> findByAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byAlias.get(alias.toLowerCase()));
    }

    /**
     * Resolve a host hint, which may be an alias, a registry id or any host the registry answers to
     */
    public Optional<RegistryDescriptor> findByHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String normalized = hint.trim().toLowerCase();
        Optional<RegistryDescriptor> aliased = findByAlias(normalized);
        if (aliased.isPresent()) {
            return aliased;
        }
        return byId.values().stream()
                .filter(descriptor -> descriptor.matchesHost(normalized))
                .findFirst();
    }

    public Optional<RegistryDescriptor> defaultRegistry() {
        if (defaultRegistryId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(defaultRegistryId));
    }

    public Collection<RegistryDescriptor> registries() {
        return byId.values();
    }

    public int size() {
        return byId.size();
    }

    public static class Builder {
        private final Map<String, RegistryDescriptor> byAlias = new LinkedHashMap<>();
        private final Map<String, RegistryDescriptor> byId = new LinkedHashMap<>();
        private String defaultRegistryId;

        public Builder register(RegistryDescriptor descriptor, List<String> extraAliases) {
            String id = descriptor.getId().toLowerCase();
            if (byId.putIfAbsent(id, descriptor) != null) {
                throw new IllegalArgumentException("Duplicate registry id: " + id);
            }
            addAlias(id, descriptor);
            if (extraAliases != null) {
                extraAliases.forEach(alias -> addAlias(alias.toLowerCase(), descriptor));
            }
            return this;
        }

        public Builder register(RegistryDescriptor descriptor) {
            return register(descriptor, List.of());
        }

        public Builder defaultRegistry(String id) {
            this.defaultRegistryId = id == null || id.isBlank() ? null : id.toLowerCase();
            return this;
        }

        private void addAlias(String alias, RegistryDescriptor descriptor) {
            RegistryDescriptor previous = byAlias.putIfAbsent(alias, descriptor);
            if (previous != null && previous != descriptor) {
                throw new IllegalArgumentException("Alias " + alias + " is claimed by both "
                        + previous.getId() + " and " + descriptor.getId());
            }
        }

        public RegistryCatalog build() {
            if (defaultRegistryId != null && !byId.containsKey(defaultRegistryId)) {
                log.warn("Default registry {} is not in the catalog, native /v2/ paths need a host hint",
                        defaultRegistryId);
                defaultRegistryId = null;
            }
            return new RegistryCatalog(new LinkedHashMap<>(byAlias), new LinkedHashMap<>(byId), defaultRegistryId);
        }
    }
}
