package com.dingdangmaoup.relay.events;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structured diagnostic event emitted by the upstream pipeline
 */
@Value
@Builder
public class UpstreamEvent {

    public enum Type {
        TOKEN_EXCHANGE,
        TOKEN_EXCHANGE_FAILED,
        RATE_LIMITED,
        RETRY_SCHEDULED,
        REDIRECT_FOLLOWED,
        CDN_FALLBACK,
        LAST_RESORT,
        EXHAUSTED,
        COMPLETED
    }

    Type type;
    String registryId;
    String path;
    Integer status;
    int attempt;
    @Singular
    Map<String, String> details;
    @Builder.Default
    Instant timestamp = Instant.now();

    /**
     * key=value rendering used for log lines
     */
    public String toLogString() {
        StringBuilder line = new StringBuilder()
                .append("event=").append(type)
                .append(" registry=").append(registryId)
                .append(" path=").append(path)
                .append(" attempt=").append(attempt);
        if (status != null) {
            line.append(" status=").append(status);
        }
        if (!details.isEmpty()) {
            line.append(' ').append(details.entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining(" ")));
        }
        return line.toString();
    }
}
