package com.dingdangmaoup.relay.upstream;

import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import org.springframework.http.HttpHeaders;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Header policy for outbound requests and relayed responses
 */
public class UpstreamHeaders {

    static final String API_VERSION_HEADER = "Docker-Distribution-Api-Version";
    static final String API_VERSION = "registry/2.0";

    static final String MANIFEST_ACCEPT = String.join(", ",
            "application/vnd.docker.distribution.manifest.list.v2+json",
            "application/vnd.docker.distribution.manifest.v2+json",
            "application/vnd.oci.image.index.v1+json",
            "application/vnd.oci.image.manifest.v1+json",
            "application/vnd.docker.distribution.manifest.v1+prettyjws",
            "application/json");
    static final String BLOB_ACCEPT = String.join(", ",
            "application/octet-stream",
            "application/vnd.docker.image.rootfs.diff.tar.gzip",
            "application/vnd.oci.image.layer.v1.tar+gzip");

    /**
     * RFC 9110 hop-by-hop headers plus headers the HTTP client manages itself
     */
    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization", "proxy-connection",
            "te", "trailer", "transfer-encoding", "upgrade");

    private static final Set<String> NEVER_FORWARDED = Set.of(
            "host", "authorization", "cookie", "forwarded", "x-forwarded-for", "x-forwarded-host",
            "x-forwarded-proto", "x-real-ip");

    private final UserAgentRotator userAgents;
    private final String hostHintHeader;
    private final Set<String> excludedResponseHeaders;

    public UpstreamHeaders(UserAgentRotator userAgents, String hostHintHeader,
                           Collection<String> excludedResponseHeaders) {
        this.userAgents = userAgents;
        this.hostHintHeader = hostHintHeader == null ? "" : hostHintHeader.toLowerCase(Locale.ROOT);
        this.excludedResponseHeaders = excludedResponseHeaders.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Docker-client compatible headers for a call against the registry itself
     */
    public HttpHeaders forPrimary(ResolvedRequest request, Optional<String> authorization, int rotation) {
        HttpHeaders headers = new HttpHeaders();
        request.getOriginalHeaders().forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP.contains(lower) || NEVER_FORWARDED.contains(lower) || lower.equals(hostHintHeader)) {
                return;
            }
            if (lower.equals("content-length") && !request.isHasBody()) {
                return;
            }
            headers.addAll(name, values);
        });
        if (!headers.containsKey(HttpHeaders.ACCEPT)) {
            headers.set(HttpHeaders.ACCEPT, request.isBlob() ? BLOB_ACCEPT : MANIFEST_ACCEPT);
        }
        headers.set(API_VERSION_HEADER, API_VERSION);
        headers.set(HttpHeaders.USER_AGENT, userAgents.forRotation(rotation));
        if (request.isManifest()) {
            headers.set(HttpHeaders.CACHE_CONTROL, "max-age=0");
        }
        authorization.ifPresent(value -> headers.set(HttpHeaders.AUTHORIZATION, value));
        return headers;
    }

    /**
     * Headers for a redirect target: pre-signed storage URLs must not see registry
     * credentials, Range must survive
     */
    public HttpHeaders forRedirect(HttpHeaders primary) {
        HttpHeaders headers = new HttpHeaders();
        primary.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.equals("authorization") || lower.equals(API_VERSION_HEADER.toLowerCase(Locale.ROOT))
                    || lower.equals("content-length")) {
                return;
            }
            headers.addAll(name, values);
        });
        return headers;
    }

    /**
     * Bare request for the last-resort attempt
     */
    public HttpHeaders minimal(ResolvedRequest request, Optional<String> authorization) {
        HttpHeaders headers = new HttpHeaders();
        String accept = request.getOriginalHeaders().getFirst(HttpHeaders.ACCEPT);
        headers.set(HttpHeaders.ACCEPT, accept != null ? accept : (request.isBlob() ? BLOB_ACCEPT : MANIFEST_ACCEPT));
        Optional.ofNullable(request.getOriginalHeaders().getFirst(HttpHeaders.RANGE))
                .ifPresent(range -> headers.set(HttpHeaders.RANGE, range));
        headers.set(HttpHeaders.USER_AGENT, userAgents.primary());
        authorization.ifPresent(value -> headers.set(HttpHeaders.AUTHORIZATION, value));
        return headers;
    }

    /**
     * Response headers safe to hand back to the client
     */
    public HttpHeaders forClient(HttpHeaders upstream) {
        HttpHeaders headers = new HttpHeaders();
        upstream.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP.contains(lower) || excludedResponseHeaders.contains(lower)) {
                return;
            }
            headers.addAll(name, values);
        });
        return headers;
    }
}
