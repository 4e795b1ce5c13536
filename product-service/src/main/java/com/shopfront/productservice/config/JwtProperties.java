package com.shopfront.productservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Access token settings, bound from the {@code jwt.*} block of application.yml.
 * The defaults are for local development only; production deployments must
 * override the secret.
 */
@Data
@ConfigurationProperties(prefix = "jwt")
public class JwtProperties {

    private String secret = "dev-secret-key-change-in-production";

    // HS256, HS384 or HS512
    private String algorithm = "HS256";

    private long accessTokenExpireMinutes = 20;

    public Duration getAccessTokenTtl() {
        return Duration.ofMinutes(accessTokenExpireMinutes);
    }
}
