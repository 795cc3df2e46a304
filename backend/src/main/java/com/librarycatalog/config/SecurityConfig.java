package com.librarycatalog.config;

import com.librarycatalog.auth.DiscardingAuthorizedClientRepository;
import com.librarycatalog.auth.OAuthLoginFailureHandler;
import com.librarycatalog.auth.OAuthLoginSuccessHandler;
import com.librarycatalog.security.AuthAttemptLoggingFilter;
import com.librarycatalog.security.SessionPrincipalFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.client.endpoint.OAuth2AccessTokenResponseClient;
import org.springframework.security.oauth2.client.endpoint.OAuth2AuthorizationCodeGrantRequest;
import org.springframework.security.oauth2.client.userinfo.OAuth2UserRequest;
import org.springframework.security.oauth2.client.userinfo.OAuth2UserService;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.context.RequestAttributeSecurityContextRepository;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final SessionPrincipalFilter sessionPrincipalFilter;
    private final AuthAttemptLoggingFilter authAttemptLoggingFilter;
    private final OAuthLoginSuccessHandler loginSuccessHandler;
    private final OAuthLoginFailureHandler loginFailureHandler;

    @Value("${library.cors.allowed-origins}")
    private List<String> allowedOrigins;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
            OAuth2UserService<OAuth2UserRequest, OAuth2User> googleProfileUserService,
            OAuth2AccessTokenResponseClient<OAuth2AuthorizationCodeGrantRequest> tokenResponseClient)
            throws Exception {
        http
            // session cookie is same-site; JSON API has no forms to protect
            .csrf(csrf -> csrf.disable())
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            // the session holds only our SessionReference, never a SecurityContext
            .securityContext(context -> context
                .securityContextRepository(new RequestAttributeSecurityContextRepository()))
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.IF_REQUIRED))
            // per-route checks live in AccessGuardInterceptor
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
            .oauth2Login(oauth -> oauth
                .redirectionEndpoint(redirect -> redirect.baseUri("/auth/*/callback"))
                .tokenEndpoint(token -> token.accessTokenResponseClient(tokenResponseClient))
                .userInfoEndpoint(userInfo -> userInfo.userService(googleProfileUserService))
                .authorizedClientRepository(new DiscardingAuthorizedClientRepository())
                .successHandler(loginSuccessHandler)
                .failureHandler(loginFailureHandler))
            // POST /auth/logout is served by AuthController
            .logout(logout -> logout.disable())
            .requestCache(cache -> cache.disable())
            .addFilterBefore(sessionPrincipalFilter, AnonymousAuthenticationFilter.class)
            .addFilterAfter(authAttemptLoggingFilter, SessionPrincipalFilter.class);

        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(allowedOrigins);
        configuration.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        configuration.setAllowedHeaders(Arrays.asList("Content-Type", "Authorization"));
        configuration.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
