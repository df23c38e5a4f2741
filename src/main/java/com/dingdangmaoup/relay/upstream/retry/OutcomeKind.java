package com.dingdangmaoup.relay.upstream.retry;

/**
 * Classified result of one outbound call
 */
public enum OutcomeKind {
    SUCCESS,
    REDIRECT,
    RATE_LIMITED,
    UNAUTHORIZED,
    TRANSPORT_ERROR
}
