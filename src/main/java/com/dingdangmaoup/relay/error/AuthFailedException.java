package com.dingdangmaoup.relay.error;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;

/**
 * Token exchange failed, or the upstream kept answering 401 after a fresh token.
 * When the upstream status is known (401 or 403) it is what the client sees.
 */
public class AuthFailedException extends RelayException {

    private final HttpStatusCode upstreamStatus;
    private final HttpHeaders upstreamHeaders;

    public AuthFailedException(String message) {
        this(message, null);
    }

    public AuthFailedException(String message, Throwable cause) {
        super(ErrorKind.AUTH_FAILED, message, cause);
        this.upstreamStatus = null;
        this.upstreamHeaders = HttpHeaders.EMPTY;
    }

    public AuthFailedException(String message, HttpStatusCode upstreamStatus, HttpHeaders upstreamHeaders) {
        super(ErrorKind.AUTH_FAILED, message);
        this.upstreamStatus = upstreamStatus;
        this.upstreamHeaders = upstreamHeaders != null ? upstreamHeaders : HttpHeaders.EMPTY;
    }

    @Override
    public HttpStatusCode getStatus() {
        if (upstreamStatus != null && (upstreamStatus.value() == 401 || upstreamStatus.value() == 403)) {
            return upstreamStatus;
        }
        return super.getStatus();
    }

    @Override
    public HttpHeaders getUpstreamHeaders() {
        return upstreamHeaders;
    }
}
