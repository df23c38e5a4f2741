package com.dingdangmaoup.relay.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Bearer token exchange configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "relay.auth")
public class AuthProperties {

    /**
     * Timeout for one call to a token endpoint
     */
    private Duration exchangeTimeout = Duration.ofSeconds(10);

    /**
     * Lifetime assumed when the token endpoint omits expires_in
     */
    private Duration defaultTokenTtl = Duration.ofSeconds(60);

    /**
     * Tokens are treated as expired this long before their real expiry
     */
    private Duration expirySkew = Duration.ofSeconds(5);

    private TokenCache tokenCache = new TokenCache();

    @Data
    public static class TokenCache {
        /**
         * Maximum cached (registry, scope) entries
         */
        private long maxEntries = 10_000;
    }
}
