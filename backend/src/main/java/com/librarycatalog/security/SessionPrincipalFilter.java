package com.librarycatalog.security;

import com.librarycatalog.auth.AuthContext;
import com.librarycatalog.auth.SafeUser;
import com.librarycatalog.auth.SessionIdentityResolver;
import com.librarycatalog.auth.SessionReference;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Rehydrates the session reference into an {@link AuthContext} request
 * attribute, once per request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionPrincipalFilter extends OncePerRequestFilter {

    private final SessionIdentityResolver sessionIdentityResolver;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        AuthContext context = AuthContext.anonymous();
        HttpSession session = request.getSession(false);
        Optional<SessionReference> reference = sessionIdentityResolver.boundReference(session);

        if (reference.isPresent()) {
            Optional<SafeUser> user = sessionIdentityResolver.deserialize(reference.get());
            if (user.isPresent()) {
                context = AuthContext.of(user.get());
            } else {
                // user removed out-of-band; drop the stale reference
                log.info("Session references unknown user {}, treating as anonymous", reference.get().userId());
                sessionIdentityResolver.unbind(session);
            }
        }

        request.setAttribute(AuthContext.REQUEST_ATTRIBUTE, context);
        filterChain.doFilter(request, response);
    }
}
