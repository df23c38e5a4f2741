package com.dingdangmaoup.relay.registry.resolve;

import com.dingdangmaoup.relay.registry.RegistryDescriptor;
import lombok.Builder;
import lombok.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.Optional;

/**
 * One inbound request mapped onto its upstream registry. Owned by the task handling
 * the request and discarded once the response has been relayed.
 */
@Value
@Builder(toBuilder = true)
public class ResolvedRequest {
    RegistryDescriptor registry;
    String upstreamPath;
    String query;
    HttpMethod method;
    boolean blob;
    boolean manifest;
    boolean baseProbe;
    String repository;
    String reference;
    @Builder.Default
    HttpHeaders originalHeaders = HttpHeaders.EMPTY;
    @Builder.Default
    Flux<DataBuffer> body = Flux.empty();
    boolean hasBody;

    public Optional<String> getRepository() {
        return Optional.ofNullable(repository);
    }

    public Optional<String> getQuery() {
        return Optional.ofNullable(query).filter(q -> !q.isEmpty());
    }

    /**
     * Full URL on the registry's primary host
     */
    public URI upstreamUri() {
        return URI.create(registry.baseUrl() + upstreamPath + getQuery().map(q -> "?" + q).orElse(""));
    }

    /**
     * Token scope for this request, e.g. repository:library/alpine:pull
     */
    public Optional<String> scope() {
        return getRepository().map(name -> "repository:" + name + ":" + (isReadOnly() ? "pull" : "pull,push"));
    }

    public boolean isReadOnly() {
        return HttpMethod.GET.equals(method) || HttpMethod.HEAD.equals(method) || HttpMethod.OPTIONS.equals(method);
    }

    /**
     * A streamed request body can only be sent once, so such requests get a single attempt
     */
    public boolean isReplayable() {
        return !hasBody;
    }

    /**
     * Blob or manifest endpoints, the surfaces worth pre-authenticating
     */
    public boolean isContentRequest() {
        return blob || manifest;
    }

    public String describe() {
        return method + " " + registry.getId() + upstreamPath;
    }
}
