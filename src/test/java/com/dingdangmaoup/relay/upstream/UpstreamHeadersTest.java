package com.dingdangmaoup.relay.upstream;

import com.dingdangmaoup.relay.registry.RegistryDescriptor;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamHeadersTest {

    private final UpstreamHeaders headers = new UpstreamHeaders(
            new UserAgentRotator(List.of("agent-a", "agent-b", "agent-c")),
            "X-Registry-Host",
            List.of("Strict-Transport-Security", "Set-Cookie"));

    private static ResolvedRequest blobRequest(HttpHeaders inbound) {
        return ResolvedRequest.builder()
                .registry(RegistryDescriptor.builder().id("docker").primaryHost("registry.test").build())
                .upstreamPath("/v2/library/alpine/blobs/sha256:abc123")
                .method(HttpMethod.GET)
                .blob(true)
                .repository("library/alpine")
                .originalHeaders(inbound)
                .build();
    }

    @Test
    void testForPrimary_dropsClientCredentialsAndHopByHop() {
        HttpHeaders inbound = new HttpHeaders();
        inbound.set(HttpHeaders.AUTHORIZATION, "Basic Y2xpZW50OnB3");
        inbound.set(HttpHeaders.CONNECTION, "keep-alive");
        inbound.set(HttpHeaders.HOST, "mirror.local");
        inbound.set("X-Registry-Host", "docker.io");
        inbound.set(HttpHeaders.RANGE, "bytes=0-99");

        HttpHeaders outbound = headers.forPrimary(blobRequest(inbound), Optional.of("Bearer tok"), 0);

        assertEquals("Bearer tok", outbound.getFirst(HttpHeaders.AUTHORIZATION));
        assertFalse(outbound.containsKey(HttpHeaders.CONNECTION));
        assertFalse(outbound.containsKey(HttpHeaders.HOST));
        assertFalse(outbound.containsKey("X-Registry-Host"));
        assertEquals("bytes=0-99", outbound.getFirst(HttpHeaders.RANGE));
        assertEquals("registry/2.0", outbound.getFirst("Docker-Distribution-Api-Version"));
        assertEquals(UpstreamHeaders.BLOB_ACCEPT, outbound.getFirst(HttpHeaders.ACCEPT));
    }

    @Test
    void testForPrimary_anonymous_hasNoAuthorization() {
        HttpHeaders outbound = headers.forPrimary(blobRequest(new HttpHeaders()), Optional.empty(), 0);

        assertFalse(outbound.containsKey(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testForPrimary_userAgentRotates() {
        ResolvedRequest request = blobRequest(new HttpHeaders());

        assertEquals("agent-a", headers.forPrimary(request, Optional.empty(), 0).getFirst(HttpHeaders.USER_AGENT));
        assertEquals("agent-b", headers.forPrimary(request, Optional.empty(), 1).getFirst(HttpHeaders.USER_AGENT));
        assertEquals("agent-a", headers.forPrimary(request, Optional.empty(), 3).getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    void testForPrimary_clientAcceptPreserved() {
        HttpHeaders inbound = new HttpHeaders();
        inbound.set(HttpHeaders.ACCEPT, "application/vnd.oci.image.index.v1+json");
        ResolvedRequest manifest = blobRequest(inbound).toBuilder()
                .upstreamPath("/v2/library/alpine/manifests/latest")
                .blob(false)
                .manifest(true)
                .build();

        HttpHeaders outbound = headers.forPrimary(manifest, Optional.empty(), 0);

        assertEquals("application/vnd.oci.image.index.v1+json", outbound.getFirst(HttpHeaders.ACCEPT));
        assertEquals("max-age=0", outbound.getFirst(HttpHeaders.CACHE_CONTROL));
    }

    @Test
    void testForRedirect_stripsAuthorization_keepsRange() {
        HttpHeaders inbound = new HttpHeaders();
        inbound.set(HttpHeaders.RANGE, "bytes=100-");
        HttpHeaders primary = headers.forPrimary(blobRequest(inbound), Optional.of("Bearer secret"), 0);

        HttpHeaders redirect = headers.forRedirect(primary);

        assertFalse(redirect.containsKey(HttpHeaders.AUTHORIZATION));
        assertFalse(redirect.containsKey("Docker-Distribution-Api-Version"));
        assertEquals("bytes=100-", redirect.getFirst(HttpHeaders.RANGE));
        assertEquals("agent-a", redirect.getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    void testMinimal_onlyEssentials() {
        HttpHeaders inbound = new HttpHeaders();
        inbound.set(HttpHeaders.RANGE, "bytes=0-9");
        inbound.set("X-Custom", "1");

        HttpHeaders minimal = headers.minimal(blobRequest(inbound), Optional.of("Bearer tok"));

        assertEquals(4, minimal.size());
        assertEquals("bytes=0-9", minimal.getFirst(HttpHeaders.RANGE));
        assertEquals("Bearer tok", minimal.getFirst(HttpHeaders.AUTHORIZATION));
        assertFalse(minimal.containsKey("X-Custom"));
    }

    @Test
    void testForClient_filtersExcludedAndHopByHop() {
        HttpHeaders upstream = new HttpHeaders();
        upstream.set(HttpHeaders.CONTENT_TYPE, "application/octet-stream");
        upstream.set(HttpHeaders.CONTENT_LENGTH, "1024");
        upstream.set("Docker-Content-Digest", "sha256:abc123");
        upstream.set(HttpHeaders.TRANSFER_ENCODING, "chunked");
        upstream.set("Strict-Transport-Security", "max-age=31536000");
        upstream.set(HttpHeaders.SET_COOKIE, "session=1");

        HttpHeaders client = headers.forClient(upstream);

        assertEquals("1024", client.getFirst(HttpHeaders.CONTENT_LENGTH));
        assertEquals("sha256:abc123", client.getFirst("Docker-Content-Digest"));
        assertFalse(client.containsKey(HttpHeaders.TRANSFER_ENCODING));
        assertFalse(client.containsKey("Strict-Transport-Security"));
        assertFalse(client.containsKey(HttpHeaders.SET_COOKIE));
    }
}
