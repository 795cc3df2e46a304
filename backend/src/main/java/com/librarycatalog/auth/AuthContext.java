package com.librarycatalog.auth;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * The principal resolved for the current request, resolved once by
 * {@link com.librarycatalog.security.SessionPrincipalFilter}.
 */
public record AuthContext(SafeUser user) {

    public static final String REQUEST_ATTRIBUTE = AuthContext.class.getName();

    private static final AuthContext ANONYMOUS = new AuthContext(null);

    public static AuthContext anonymous() {
        return ANONYMOUS;
    }

    public static AuthContext of(SafeUser user) {
        return new AuthContext(user);
    }

    public static AuthContext from(HttpServletRequest request) {
        Object value = request.getAttribute(REQUEST_ATTRIBUTE);
        return value instanceof AuthContext context ? context : ANONYMOUS;
    }

    public boolean isAuthenticated() {
        return user != null;
    }

    public Optional<SafeUser> principal() {
        return Optional.ofNullable(user);
    }
}
