package com.librarycatalog.security;

import com.librarycatalog.auth.AuthContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Slf4j
@Component
public class AuthAttemptLoggingFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (log.isDebugEnabled()) {
            AuthContext context = AuthContext.from(request);
            if (context.isAuthenticated()) {
                log.debug("Authenticated request from user {} ({}) - IP: {} - {} {}",
                        context.user().getEmail(), context.user().getId(),
                        request.getRemoteAddr(), request.getMethod(), request.getRequestURI());
            } else {
                log.debug("Unauthenticated request - IP: {} - {} {} - User-Agent: {}",
                        request.getRemoteAddr(), request.getMethod(), request.getRequestURI(),
                        request.getHeader("User-Agent"));
            }
        }
        filterChain.doFilter(request, response);
    }
}
