package com.dingdangmaoup.relay.upstream;

import com.dingdangmaoup.relay.error.AuthFailedException;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import com.dingdangmaoup.relay.upstream.auth.UpstreamCredential;
import com.dingdangmaoup.relay.upstream.retry.RetryState;
import lombok.Getter;
import lombok.Setter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpResponse;

import java.net.URI;
import java.util.Optional;

/**
 * Mutable context of one logical upstream operation. Confined to the task serving the
 * request; steps run one after another, never concurrently.
 */
@Getter
@Setter
public class PullOperation {

    private final ResolvedRequest request;
    private final ServerHttpResponse response;
    private RetryState state;
    private UpstreamCredential credential;
    private int rotation;
    private HttpHeaders primaryHeaders = HttpHeaders.EMPTY;
    private URI redirectLocation;
    private HttpStatusCode lastStatus;
    private HttpHeaders lastHeaders = HttpHeaders.EMPTY;
    private Throwable lastError;
    private boolean lastTimedOut;
    private AuthFailedException authFailure;

    public PullOperation(ResolvedRequest request, ServerHttpResponse response, RetryState state) {
        this.request = request;
        this.response = response;
        this.state = state;
    }

    /**
     * Authorization header value for the next attempt
     */
    public Optional<String> authorization() {
        return Optional.ofNullable(credential).map(UpstreamCredential::getHeader);
    }

    /**
     * Remember what the upstream said last, for logging and for the error response
     */
    public void record(UpstreamOutcome outcome) {
        this.lastStatus = outcome.getStatus().orElse(null);
        this.lastHeaders = outcome.getHeaders();
        this.lastError = outcome.getError();
        this.lastTimedOut = outcome.isTimedOut();
    }

    public void rotate() {
        rotation++;
    }

    public int attempt() {
        return state.getAttempt();
    }
}
