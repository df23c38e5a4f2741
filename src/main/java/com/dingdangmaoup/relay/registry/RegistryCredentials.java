package com.dingdangmaoup.relay.registry;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

@Value
public class RegistryCredentials {
    String username;
    String password;

    /**
     * Empty when either part is blank, which means anonymous access
     */
    public static Optional<RegistryCredentials> of(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new RegistryCredentials(username.trim(), password));
    }

    public String toBasicHeader() {
        String raw = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "RegistryCredentials(username=" + username + ", password=****)";
    }
}
