package com.dingdangmaoup.relay.upstream.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Body returned by a Registry V2 token endpoint
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenResponse {
    private String token;

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("expires_in")
    private Integer expiresIn;

    @JsonProperty("issued_at")
    private String issuedAt;

    public String getEffectiveToken() {
        if (token != null && !token.isBlank()) {
            return token;
        }
        return accessToken;
    }
}
