package com.dingdangmaoup.relay.upstream.auth;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed {@code WWW-Authenticate} header, e.g.
 * {@code Bearer realm="https://auth.docker.io/token",service="registry.docker.io",scope="repository:library/ubuntu:pull"}
 */
@Value
public class BearerChallenge {
    String scheme;
    Map<String, String> params;

    public static Optional<BearerChallenge> parse(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String trimmed = header.trim();
        int space = trimmed.indexOf(' ');
        String scheme = space < 0 ? trimmed : trimmed.substring(0, space);
        Map<String, String> params = space < 0 ? Map.of() : parseParams(trimmed.substring(space + 1));
        return Optional.of(new BearerChallenge(scheme, params));
    }

    /**
     * Comma separated key=value pairs, values optionally quoted. Commas inside quotes
     * belong to the value (scope lists such as {@code "repository:a:pull,push"}).
     */
    private static Map<String, String> parseParams(String raw) {
        Map<String, String> params = new LinkedHashMap<>();
        int i = 0;
        int length = raw.length();
        while (i < length) {
            while (i < length && (raw.charAt(i) == ',' || Character.isWhitespace(raw.charAt(i)))) {
                i++;
            }
            int eq = raw.indexOf('=', i);
            if (eq < 0) {
                break;
            }
            String key = raw.substring(i, eq).trim().toLowerCase(Locale.ROOT);
            i = eq + 1;
            StringBuilder value = new StringBuilder();
            if (i < length && raw.charAt(i) == '"') {
                i++;
                while (i < length && raw.charAt(i) != '"') {
                    if (raw.charAt(i) == '\\' && i + 1 < length) {
                        i++;
                    }
                    value.append(raw.charAt(i));
                    i++;
                }
                i++;
            } else {
                while (i < length && raw.charAt(i) != ',') {
                    value.append(raw.charAt(i));
                    i++;
                }
            }
            if (!key.isEmpty()) {
                params.put(key, value.toString().trim());
            }
        }
        return params;
    }

    public boolean isBearer() {
        return "bearer".equalsIgnoreCase(scheme);
    }

    public boolean isBasic() {
        return "basic".equalsIgnoreCase(scheme);
    }

    public Optional<String> getRealm() {
        return param("realm");
    }

    public Optional<String> getService() {
        return param("service");
    }

    public Optional<String> getScope() {
        return param("scope");
    }

    private Optional<String> param(String name) {
        return Optional.ofNullable(params.get(name)).filter(value -> !value.isEmpty());
    }
}
