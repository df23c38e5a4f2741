package com.dingdangmaoup.relay.upstream.retry;

/**
 * States of one logical upstream operation
 */
public enum Phase {
    INIT,
    ATTEMPT,
    SUCCESS,
    NEED_AUTH_RETRY,
    NEED_REDIRECT,
    NEED_BACKOFF,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCESS || this == EXHAUSTED;
    }
}
