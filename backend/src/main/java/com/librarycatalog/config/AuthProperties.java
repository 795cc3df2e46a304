package com.librarycatalog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code library.auth.*} settings for the Google login flow.
 */
@Data
@ConfigurationProperties(prefix = "library.auth")
public class AuthProperties {

    /**
     * Public login entry point, also returned as {@code loginUrl} in 401 bodies.
     */
    private String loginPath = "/auth/google";

    /**
     * Spring Security endpoint that issues the redirect to the provider.
     */
    private String authorizationPath = "/oauth2/authorization/google";

    private String successRedirect = "/auth/dashboard";

    private String failureRedirect = "/auth/login/failed";

    /**
     * Connect and read timeout for calls to the provider (token and user-info).
     */
    private Duration providerTimeout = Duration.ofSeconds(10);
}
