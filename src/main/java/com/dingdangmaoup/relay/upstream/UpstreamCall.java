package com.dingdangmaoup.relay.upstream;

import lombok.Builder;
import lombok.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.time.Duration;

/**
 * One outbound HTTP call as issued by the executor
 */
@Value
@Builder(toBuilder = true)
public class UpstreamCall {

    public enum Purpose {
        PRIMARY,
        REDIRECT,
        CDN_FALLBACK,
        LAST_RESORT
    }

    HttpMethod method;
    URI uri;
    HttpHeaders headers;
    Flux<DataBuffer> body;
    boolean hasBody;
    Duration timeout;
    @Builder.Default
    Purpose purpose = Purpose.PRIMARY;

    public String getHost() {
        return uri.getPort() < 0 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }
}
