package com.librarycatalog.auth;

import com.librarycatalog.config.AuthProperties;
import com.librarycatalog.config.OpenApiConfig;
import com.librarycatalog.security.RequireAuthenticated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "User authentication and session management")
public class AuthController {

    private final AuthProperties authProperties;
    private final String sessionCookieName;

    public AuthController(AuthProperties authProperties,
                          @Value("${server.servlet.session.cookie.name:JSESSIONID}") String sessionCookieName) {
        this.authProperties = authProperties;
        this.sessionCookieName = sessionCookieName;
    }

    // =========================================================
    // 1) START – hand over to the provider redirect endpoint
    // =========================================================
    @GetMapping("/google")
    @Operation(summary = "Initiate Google OAuth authentication")
    public ResponseEntity<Void> login(HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(request.getContextPath() + authProperties.getAuthorizationPath()))
                .build();
    }

    // =========================================================
    // 2) CURRENT SESSION
    // =========================================================
    @GetMapping("/status")
    @Operation(summary = "Check authentication status")
    public ResponseEntity<Map<String, Object>> status(AuthContext context) {
        Map<String, Object> body = new HashMap<>();
        body.put("authenticated", context.isAuthenticated());
        body.put("user", context.user());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/login/success")
    @Operation(summary = "Get current authenticated user")
    public ResponseEntity<Map<String, Object>> loginSuccess(AuthContext context) {
        if (!context.isAuthenticated()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("success", false, "message", "User not authenticated"));
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "User authenticated successfully",
                "user", context.user()));
    }

    @GetMapping("/login/failed")
    @Operation(summary = "Authentication failure endpoint")
    public ResponseEntity<Map<String, Object>> loginFailed() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("success", false, "message", "Authentication failed"));
    }

    // =========================================================
    // 3) PROTECTED EXAMPLE
    // =========================================================
    @GetMapping("/dashboard")
    @RequireAuthenticated
    @Operation(summary = "User dashboard (protected route example)",
            security = @SecurityRequirement(name = OpenApiConfig.SESSION_AUTH))
    public ResponseEntity<Map<String, Object>> dashboard(AuthContext context) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Welcome to your dashboard",
                "user", context.user(),
                "stats", Map.of("message", "You can now access protected routes to manage books and authors")));
    }

    // =========================================================
    // 4) LOGOUT
    // =========================================================
    @PostMapping("/logout")
    @Operation(summary = "Logout user",
            security = @SecurityRequirement(name = OpenApiConfig.SESSION_AUTH))
    public ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, AuthContext context) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.invalidate();
        }
        context.principal().ifPresent(user -> log.info("User {} logged out", user.getId()));

        ResponseCookie expired = ResponseCookie.from(sessionCookieName, "")
                .path(request.getContextPath().isEmpty() ? "/" : request.getContextPath())
                .httpOnly(true)
                .maxAge(0)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, expired.toString())
                .body(Map.of("success", true, "message", "Logout successful"));
    }
}
