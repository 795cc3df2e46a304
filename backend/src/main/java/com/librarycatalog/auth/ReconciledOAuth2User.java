package com.librarycatalog.auth;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.core.user.OAuth2User;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Authentication principal handed from the reconcile step to the success
 * handler. Lives for the callback request only; the session keeps just the
 * {@link SessionReference}.
 */
public class ReconciledOAuth2User implements OAuth2User {

    private final UserIdentity user;
    private final Map<String, Object> attributes;

    public ReconciledOAuth2User(UserIdentity user, Map<String, Object> attributes) {
        this.user = user;
        this.attributes = Map.copyOf(attributes);
    }

    public UserIdentity getUser() {
        return user;
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of();
    }

    @Override
    public String getName() {
        return String.valueOf(user.getId());
    }
}
