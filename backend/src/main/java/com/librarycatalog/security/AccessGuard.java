package com.librarycatalog.security;

import com.librarycatalog.auth.AuthContext;
import com.librarycatalog.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Stateless request gates. Each check looks only at the context it is
 * given.
 */
@Component
@RequiredArgsConstructor
public class AccessGuard {

    private final AuthProperties authProperties;

    public GuardDecision requireAuthenticated(AuthContext context) {
        if (context == null || !context.isAuthenticated()) {
            return GuardDecision.reject(HttpStatus.UNAUTHORIZED, Map.of(
                    "success", false,
                    "error", "Authentication required",
                    "message", "You must be logged in to access this resource. Please authenticate with Google OAuth.",
                    "loginUrl", authProperties.getLoginPath()));
        }
        return GuardDecision.proceed();
    }

    public GuardDecision requireActive(AuthContext context) {
        GuardDecision authenticated = requireAuthenticated(context);
        if (!authenticated.isAllowed()) {
            return authenticated;
        }
        if (!context.user().isActive()) {
            return GuardDecision.reject(HttpStatus.FORBIDDEN, Map.of(
                    "success", false,
                    "error", "Account inactive",
                    "message", "Your account has been deactivated. Please contact support."));
        }
        return GuardDecision.proceed();
    }
}
