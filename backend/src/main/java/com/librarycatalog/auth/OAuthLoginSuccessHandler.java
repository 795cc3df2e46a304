package com.librarycatalog.auth;

import com.librarycatalog.config.AuthProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.AuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Authenticated state: stores the session reference for the reconciled
 * user and redirects to the success destination.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OAuthLoginSuccessHandler implements AuthenticationSuccessHandler {

    private final SessionIdentityResolver sessionIdentityResolver;
    private final AuthProperties authProperties;

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request, HttpServletResponse response,
            Authentication authentication) throws IOException {
        if (!(authentication.getPrincipal() instanceof ReconciledOAuth2User principal)) {
            throw new IllegalStateException("Unexpected principal type "
                    + authentication.getPrincipal().getClass().getName());
        }

        SessionReference reference = sessionIdentityResolver.serialize(principal.getUser());
        sessionIdentityResolver.bind(request.getSession(true), reference);
        log.info("Session established for user {}", reference.userId());

        response.sendRedirect(request.getContextPath() + authProperties.getSuccessRedirect());
    }
}
