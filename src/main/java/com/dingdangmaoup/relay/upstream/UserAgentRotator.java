package com.dingdangmaoup.relay.upstream;

import java.util.List;

/**
 * Cycles through configured User-Agent strings, one step per retry
 */
public class UserAgentRotator {

    static final String FALLBACK_USER_AGENT = "docker/24.0.7 go/go1.20.10 os/linux arch/amd64";

    private final List<String> userAgents;

    public UserAgentRotator(List<String> userAgents) {
        List<String> usable = userAgents == null ? List.of() : userAgents.stream()
                .filter(agent -> agent != null && !agent.isBlank())
                .toList();
        this.userAgents = usable.isEmpty() ? List.of(FALLBACK_USER_AGENT) : usable;
    }

    public String forRotation(int rotation) {
        return userAgents.get(Math.floorMod(rotation, userAgents.size()));
    }

    public String primary() {
        return userAgents.get(0);
    }

    public int size() {
        return userAgents.size();
    }
}
