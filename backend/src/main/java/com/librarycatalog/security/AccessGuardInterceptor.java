package com.librarycatalog.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.librarycatalog.auth.AuthContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;

/**
 * Applies {@link RequireAuthenticated} and {@link RequireActive} to the
 * handler method (or its controller) before it runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessGuardInterceptor implements HandlerInterceptor {

    private final AccessGuard accessGuard;
    private final ObjectMapper objectMapper;

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull Object handler) throws Exception {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }

        AuthContext context = AuthContext.from(request);
        GuardDecision decision;
        if (isAnnotated(method, RequireActive.class)) {
            decision = accessGuard.requireActive(context);
        } else if (isAnnotated(method, RequireAuthenticated.class)) {
            decision = accessGuard.requireAuthenticated(context);
        } else {
            return true;
        }

        if (decision.isAllowed()) {
            return true;
        }

        log.debug("Rejected {} {} with {}", request.getMethod(), request.getRequestURI(), decision.status());
        response.setStatus(decision.status().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), decision.body());
        return false;
    }

    private static boolean isAnnotated(HandlerMethod method,
            Class<? extends java.lang.annotation.Annotation> annotation) {
        return method.hasMethodAnnotation(annotation)
                || AnnotatedElementUtils.hasAnnotation(method.getBeanType(), annotation);
    }
}
