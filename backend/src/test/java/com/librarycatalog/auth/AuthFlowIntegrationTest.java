package com.librarycatalog.auth;

import com.librarycatalog.model.AuthProvider;
import com.librarycatalog.model.User;
import com.librarycatalog.repo.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end checks of the login routes and the session lifecycle.
 */
@SpringBootTest
@AutoConfigureMockMvc
class AuthFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private UserRepository userRepository;

    @BeforeEach
    void setUp() {
        userRepository.deleteAll();
    }

    private User storeUser(String email, boolean active) {
        return userRepository.save(User.builder()
                .googleId("g-" + email).email(email).firstName("A").lastName("B").displayName("A B")
                .provider(AuthProvider.GOOGLE).active(active)
                .build());
    }

    private static MockHttpSession sessionFor(User user) {
        MockHttpSession session = new MockHttpSession();
        session.setAttribute(SessionIdentityResolver.SESSION_ATTRIBUTE, new SessionReference(user.getId().toString()));
        return session;
    }

    // ==================== Login start and callback ====================

    @Test
    @DisplayName("GET /auth/google hands over to the authorization endpoint")
    void login_shouldRedirectToAuthorizationEndpoint() throws Exception {
        mockMvc.perform(get("/auth/google"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/oauth2/authorization/google"));
    }

    @Test
    @DisplayName("authorization endpoint redirects to Google consent with profile and email scopes")
    void authorization_shouldRedirectToGoogleConsent() throws Exception {
        mockMvc.perform(get("/oauth2/authorization/google"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", allOf(
                        startsWith("https://accounts.google.com/"),
                        containsString("client_id=test-client-id"),
                        containsString("scope=profile"),
                        containsString("email"),
                        containsString("/auth/google/callback"))));
    }

    @Test
    @DisplayName("a callback carrying a provider error ends on the failure route without a session principal")
    void callback_shouldRedirectToFailure_whenProviderReturnsError() throws Exception {
        MockHttpSession session = new MockHttpSession();

        mockMvc.perform(get("/auth/google/callback")
                        .param("error", "access_denied")
                        .param("state", "unknown")
                        .session(session))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/auth/login/failed"));

        assertThat(session.getAttribute(SessionIdentityResolver.SESSION_ATTRIBUTE)).isNull();
    }

    @Test
    @DisplayName("GET /auth/login/failed answers 401")
    void loginFailed_shouldReturn401() throws Exception {
        mockMvc.perform(get("/auth/login/failed"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Authentication failed"));
    }

    // ==================== Session rehydration ====================

    @Test
    @DisplayName("status of an anonymous request is unauthenticated with a null user")
    void status_shouldBeAnonymous_withoutSession() throws Exception {
        mockMvc.perform(get("/auth/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(false))
                .andExpect(jsonPath("$.user").value(nullValue()));
    }

    @Test
    @DisplayName("a bound session reference is resolved to the safe view of the user")
    void status_shouldResolveSessionReference() throws Exception {
        User user = storeUser("a@x.com", true);

        mockMvc.perform(get("/auth/status").session(sessionFor(user)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(true))
                .andExpect(jsonPath("$.user.id").value(user.getId().toString()))
                .andExpect(jsonPath("$.user.email").value("a@x.com"))
                .andExpect(jsonPath("$.user.provider").value("google"))
                .andExpect(jsonPath("$.user.googleId").doesNotExist())
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist());
    }

    @Test
    @DisplayName("a session pointing at a deleted user is anonymous and loses its reference")
    void status_shouldBeAnonymous_whenUserDeleted() throws Exception {
        User user = storeUser("gone@x.com", true);
        MockHttpSession session = sessionFor(user);
        userRepository.delete(user);

        mockMvc.perform(get("/auth/status").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(false));

        assertThat(session.getAttribute(SessionIdentityResolver.SESSION_ATTRIBUTE)).isNull();
    }

    @Test
    @DisplayName("login success reports the user or 401")
    void loginSuccess_shouldReflectSession() throws Exception {
        User user = storeUser("a@x.com", true);

        mockMvc.perform(get("/auth/login/success").session(sessionFor(user)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.user.email").value("a@x.com"));

        mockMvc.perform(get("/auth/login/success"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("User not authenticated"));
    }

    // ==================== Guarded routes ====================

    @Test
    @DisplayName("dashboard rejects anonymous requests with the login url")
    void dashboard_shouldReturn401_whenAnonymous() throws Exception {
        mockMvc.perform(get("/auth/dashboard"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Authentication required"))
                .andExpect(jsonPath("$.loginUrl").value("/auth/google"));
    }

    @Test
    @DisplayName("dashboard returns the safe user for a session")
    void dashboard_shouldReturnUser_whenAuthenticated() throws Exception {
        User user = storeUser("a@x.com", true);

        mockMvc.perform(get("/auth/dashboard").session(sessionFor(user)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.user.email").value("a@x.com"))
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist());
    }

    // ==================== Logout ====================

    @Test
    @DisplayName("logout invalidates the session and expires the session cookie")
    void logout_shouldInvalidateSession() throws Exception {
        User user = storeUser("a@x.com", true);
        MockHttpSession session = sessionFor(user);

        mockMvc.perform(post("/auth/logout").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(header().string("Set-Cookie", allOf(
                        containsString("LIBRARY_SESSION="),
                        containsString("Max-Age=0"))));

        assertThat(session.isInvalid()).isTrue();
    }

    @Test
    @DisplayName("logout without a session still succeeds")
    void logout_shouldSucceed_withoutSession() throws Exception {
        mockMvc.perform(post("/auth/logout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Logout successful"));
    }
}
