package com.dingdangmaoup.relay.upstream.auth;

import lombok.Value;

/**
 * Key of the process-wide token table
 */
@Value
public class TokenKey {
    String registryId;
    String scope;

    @Override
    public String toString() {
        return registryId + "|" + scope;
    }
}
