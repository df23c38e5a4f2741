package com.dingdangmaoup.relay.error;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;

/**
 * Base class for failures that resolve to an HTTP response to the client
 */
public abstract class RelayException extends RuntimeException {

    private final ErrorKind kind;

    protected RelayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RelayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Status sent to the client
     */
    public HttpStatusCode getStatus() {
        return kind.getStatus();
    }

    /**
     * Upstream headers worth relaying along with the error, empty by default
     */
    public HttpHeaders getUpstreamHeaders() {
        return HttpHeaders.EMPTY;
    }
}
