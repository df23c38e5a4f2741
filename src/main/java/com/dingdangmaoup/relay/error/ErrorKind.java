package com.dingdangmaoup.relay.error;

import org.springframework.http.HttpStatus;

/**
 * Failure classes of the upstream pipeline and the status each surfaces as
 */
public enum ErrorKind {
    UNRESOLVED_PATH(HttpStatus.NOT_FOUND, "NAME_UNKNOWN"),
    AUTH_FAILED(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "TOOMANYREQUESTS"),
    TRANSPORT_ERROR(HttpStatus.BAD_GATEWAY, "UNAVAILABLE"),
    REDIRECT_EXHAUSTED(HttpStatus.BAD_GATEWAY, "UNAVAILABLE");

    private final HttpStatus status;
    private final String registryCode;

    ErrorKind(HttpStatus status, String registryCode) {
        this.status = status;
        this.registryCode = registryCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * Error code used in Registry V2 JSON error bodies
     */
    public String getRegistryCode() {
        return registryCode;
    }
}
