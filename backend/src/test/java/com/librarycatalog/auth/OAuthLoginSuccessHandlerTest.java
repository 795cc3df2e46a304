package com.librarycatalog.auth;

import com.librarycatalog.config.AuthProperties;
import com.librarycatalog.exception.SessionSerializationException;
import com.librarycatalog.model.AuthProvider;
import com.librarycatalog.repo.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Authenticated transition of the Google login.
 */
class OAuthLoginSuccessHandlerTest {

    private UserRepository userRepository;
    private OAuthLoginSuccessHandler handler;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        SessionIdentityResolver resolver = new SessionIdentityResolver(userRepository,
                new PrincipalNormalizer(new BCryptPasswordEncoder(4), Clock.systemUTC()));
        handler = new OAuthLoginSuccessHandler(resolver, new AuthProperties());
        request = new MockHttpServletRequest("GET", "/auth/google/callback");
        response = new MockHttpServletResponse();
    }

    private static OAuth2AuthenticationToken authenticationFor(UserIdentity user) {
        ReconciledOAuth2User principal = new ReconciledOAuth2User(user, Map.of("sub", "g1"));
        return new OAuth2AuthenticationToken(principal, List.of(), "google");
    }

    // ==================== Authenticated ====================

    @Test
    @DisplayName("binds exactly one session reference holding the user id and redirects to the dashboard")
    void onAuthenticationSuccess_shouldBindReferenceAndRedirect() throws Exception {
        UserIdentity user = UserIdentity.builder()
                .id(42L).googleId("g1").email("a@x.com").provider(AuthProvider.GOOGLE).active(true)
                .storeSourced(true)
                .build();

        handler.onAuthenticationSuccess(request, response, authenticationFor(user));

        MockHttpSession session = (MockHttpSession) request.getSession(false);
        assertThat(session).isNotNull();
        assertThat(session.getAttribute(SessionIdentityResolver.SESSION_ATTRIBUTE))
                .isEqualTo(new SessionReference("42"));
        assertThat(Collections.list(session.getAttributeNames()))
                .containsExactly(SessionIdentityResolver.SESSION_ATTRIBUTE);
        assertThat(response.getRedirectedUrl()).isEqualTo("/auth/dashboard");
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("a reconciled user without an id never reaches the session")
    void onAuthenticationSuccess_shouldThrow_whenUserHasNoId() {
        UserIdentity unsaved = UserIdentity.builder().email("a@x.com").build();

        assertThatThrownBy(() -> handler.onAuthenticationSuccess(request, response, authenticationFor(unsaved)))
                .isInstanceOf(SessionSerializationException.class);
        assertThat(request.getSession(false)).isNull();
        assertThat(response.getRedirectedUrl()).isNull();
    }

    @Test
    @DisplayName("an unexpected principal type is rejected before any session is created")
    void onAuthenticationSuccess_shouldThrow_whenPrincipalUnexpected() {
        TestingAuthenticationToken foreign = new TestingAuthenticationToken("someone", null);

        assertThatThrownBy(() -> handler.onAuthenticationSuccess(request, response, foreign))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("java.lang.String");
        assertThat(request.getSession(false)).isNull();
        assertThat(response.getRedirectedUrl()).isNull();
    }
}
