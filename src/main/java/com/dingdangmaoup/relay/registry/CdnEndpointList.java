package com.dingdangmaoup.relay.registry;

import lombok.EqualsAndHashCode;

import java.util.Iterator;
import java.util.List;

/**
 * Ordered alternate hosts tried for blob downloads when the primary target fails.
 */
@EqualsAndHashCode
public final class CdnEndpointList implements Iterable<String> {

    private static final CdnEndpointList EMPTY = new CdnEndpointList(List.of());

    private final List<String> hosts;

    private CdnEndpointList(List<String> hosts) {
        this.hosts = hosts;
    }

    public static CdnEndpointList of(List<String> hosts) {
        if (hosts == null || hosts.isEmpty()) {
            return EMPTY;
        }
        return new CdnEndpointList(hosts.stream()
                .filter(host -> host != null && !host.isBlank())
                .map(String::trim)
                .distinct()
                .toList());
    }

    public static CdnEndpointList empty() {
        return EMPTY;
    }

    public List<String> hosts() {
        return hosts;
    }

    public boolean isEmpty() {
        return hosts.isEmpty();
    }

    public int size() {
        return hosts.size();
    }

    @Override
    public Iterator<String> iterator() {
        return hosts.iterator();
    }

    @Override
    public String toString() {
        return hosts.toString();
    }
}
