package com.dingdangmaoup.relay.registry.resolve;

import com.dingdangmaoup.relay.error.UnresolvedPathException;
import com.dingdangmaoup.relay.registry.RegistryCatalog;
import com.dingdangmaoup.relay.registry.RegistryDescriptor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps inbound paths onto upstream registries. Two shapes are recognized:
 * <ul>
 *     <li>alias form {@code /{alias}/...}, e.g. {@code /quay/v2/coreos/etcd/manifests/latest}</li>
 *     <li>native form {@code /v2/...}, the registry comes from a host hint or the default</li>
 * </ul>
 * Pure, no I/O.
 */
public class PathResolver {

    static final String NATIVE_PREFIX = "v2";
    static final String NS_QUERY_PARAM = "ns";

    private static final Pattern CONTENT_PATH =
            Pattern.compile("^/v2/(.+)/(manifests|blobs)/([^/]+)$");
    private static final Pattern DIGEST =
            Pattern.compile("^[A-Za-z0-9_+.-]+:[A-Za-z0-9=_-]+$");
    private static final Pattern REPOSITORY_PATH =
            Pattern.compile("^/v2/(.+?)/(manifests|blobs|tags|referrers)(/.*)?$");

    private final RegistryCatalog catalog;
    private final String hostHintHeader;

    public PathResolver(RegistryCatalog catalog, String hostHintHeader) {
        this.catalog = catalog;
        this.hostHintHeader = hostHintHeader;
    }

    public ResolvedRequest resolve(ServerHttpRequest request) {
        boolean hasBody = request.getHeaders().getContentLength() > 0
                || request.getHeaders().containsKey(HttpHeaders.TRANSFER_ENCODING);
        return resolve(request.getMethod(), request.getPath().value(), request.getURI().getRawQuery(),
                request.getHeaders(), hasBody ? request.getBody() : Flux.empty(), hasBody);
    }

    public ResolvedRequest resolve(HttpMethod method, String rawPath, String rawQuery, HttpHeaders headers,
                                   Flux<DataBuffer> body, boolean hasBody) {
        String path = rawPath == null || rawPath.isEmpty() ? "/" : rawPath;
        String first = firstSegment(path);

        RegistryDescriptor registry;
        String upstreamPath;
        if (NATIVE_PREFIX.equals(first)) {
            registry = resolveNative(path, rawQuery, headers);
            upstreamPath = normalizeV2(path);
        } else {
            registry = catalog.findByAlias(first)
                    .orElseThrow(() -> new UnresolvedPathException(path));
            String rest = path.substring(1 + first.length());
            upstreamPath = withNamespace(registry, toV2(rest));
        }

        ResolvedRequest.ResolvedRequestBuilder builder = ResolvedRequest.builder()
                .registry(registry)
                .upstreamPath(upstreamPath)
                .query(rawQuery)
                .method(method)
                .baseProbe("/v2/".equals(upstreamPath))
                .originalHeaders(headers != null ? HttpHeaders.readOnlyHttpHeaders(headers) : HttpHeaders.EMPTY)
                .body(hasBody && body != null ? body : Flux.empty())
                .hasBody(hasBody);

        Matcher content = CONTENT_PATH.matcher(upstreamPath);
        if (content.matches()) {
            boolean manifest = "manifests".equals(content.group(2));
            boolean blob = !manifest && DIGEST.matcher(content.group(3)).matches();
            builder.manifest(manifest).blob(blob).reference(content.group(3));
        }
        Matcher repository = REPOSITORY_PATH.matcher(upstreamPath);
        if (repository.matches()) {
            builder.repository(repository.group(1));
        }
        return builder.build();
    }

    private RegistryDescriptor resolveNative(String path, String rawQuery, HttpHeaders headers) {
        String hint = headers != null ? headers.getFirst(hostHintHeader) : null;
        if (hint == null && rawQuery != null) {
            List<String> ns = UriComponentsBuilder.newInstance().query(rawQuery).build()
                    .getQueryParams().get(NS_QUERY_PARAM);
            hint = ns != null && !ns.isEmpty() ? ns.get(0) : null;
        }
        if (hint != null && !hint.isBlank()) {
            return catalog.findByHint(hint).orElseThrow(() -> new UnresolvedPathException(path));
        }
        return catalog.defaultRegistry().orElseThrow(() -> new UnresolvedPathException(path));
    }

    private static String firstSegment(String path) {
        int start = path.startsWith("/") ? 1 : 0;
        int end = path.indexOf('/', start);
        return end < 0 ? path.substring(start) : path.substring(start, end);
    }

    private static String normalizeV2(String path) {
        return "/v2".equals(path) ? "/v2/" : path;
    }

    /**
     * Alias paths may omit the /v2 prefix
     */
    private static String toV2(String rest) {
        if (rest.isEmpty() || "/".equals(rest) || "/v2".equals(rest)) {
            return "/v2/";
        }
        if (rest.startsWith("/v2/")) {
            return rest;
        }
        return "/v2" + (rest.startsWith("/") ? rest : "/" + rest);
    }

    /**
     * /v2/ubuntu/manifests/latest on Docker Hub really means /v2/library/ubuntu/...
     */
    private static String withNamespace(RegistryDescriptor registry, String upstreamPath) {
        return registry.getDefaultNamespace()
                .map(namespace -> {
                    Matcher matcher = REPOSITORY_PATH.matcher(upstreamPath);
                    if (matcher.matches() && !matcher.group(1).contains("/")) {
                        return "/v2/" + namespace + "/" + upstreamPath.substring("/v2/".length());
                    }
                    return upstreamPath;
                })
                .orElse(upstreamPath);
    }
}
