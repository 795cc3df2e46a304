package com.librarycatalog.auth;

import com.librarycatalog.config.AuthProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.authentication.AuthenticationFailureHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Failed state: no session reference is stored and the redirect carries
 * nothing about the user.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OAuthLoginFailureHandler implements AuthenticationFailureHandler {

    private final SessionIdentityResolver sessionIdentityResolver;
    private final AuthProperties authProperties;

    @Override
    public void onAuthenticationFailure(HttpServletRequest request, HttpServletResponse response,
            AuthenticationException exception) throws IOException {
        log.warn("Google login failed: {}", exception.getMessage());
        HttpSession session = request.getSession(false);
        if (session != null) {
            sessionIdentityResolver.unbind(session);
        }
        response.sendRedirect(request.getContextPath() + authProperties.getFailureRedirect());
    }
}
