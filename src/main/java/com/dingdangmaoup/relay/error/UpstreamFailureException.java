package com.dingdangmaoup.relay.error;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

/**
 * Retry budget exhausted on a transient failure: rate limiting, transport errors or
 * failed CDN fallbacks.
 */
public class UpstreamFailureException extends RelayException {

    private final HttpStatusCode upstreamStatus;
    private final HttpHeaders upstreamHeaders;
    private final boolean timedOut;

    public UpstreamFailureException(ErrorKind kind, String message, HttpStatusCode upstreamStatus,
                                    HttpHeaders upstreamHeaders, boolean timedOut, Throwable cause) {
        super(kind, message, cause);
        this.upstreamStatus = upstreamStatus;
        this.upstreamHeaders = upstreamHeaders != null ? upstreamHeaders : HttpHeaders.EMPTY;
        this.timedOut = timedOut;
    }

    @Override
    public HttpStatusCode getStatus() {
        return switch (getKind()) {
            case RATE_LIMITED -> upstreamStatus != null ? upstreamStatus : HttpStatus.TOO_MANY_REQUESTS;
            case TRANSPORT_ERROR -> timedOut ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
            default -> super.getStatus();
        };
    }

    public HttpStatusCode getUpstreamStatus() {
        return upstreamStatus;
    }

    @Override
    public HttpHeaders getUpstreamHeaders() {
        return upstreamHeaders;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
