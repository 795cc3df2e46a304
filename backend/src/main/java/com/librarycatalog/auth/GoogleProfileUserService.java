package com.librarycatalog.auth;

import com.librarycatalog.exception.ProviderExchangeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.security.authentication.InternalAuthenticationServiceException;
import org.springframework.security.oauth2.client.userinfo.OAuth2UserRequest;
import org.springframework.security.oauth2.client.userinfo.OAuth2UserService;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.user.OAuth2User;

/**
 * Exchange and reconcile steps of the login: fetches the Google profile
 * with the access token from the code exchange, then maps it onto a stored
 * user. Any failure raises an authentication exception so the login filter
 * takes the failure route.
 */
@Slf4j
public class GoogleProfileUserService implements OAuth2UserService<OAuth2UserRequest, OAuth2User> {

    static final String INVALID_PROFILE = "invalid_user_profile";

    private final OAuth2UserService<OAuth2UserRequest, OAuth2User> profileClient;
    private final OAuthExchangeHandler exchangeHandler;

    public GoogleProfileUserService(OAuth2UserService<OAuth2UserRequest, OAuth2User> profileClient,
            OAuthExchangeHandler exchangeHandler) {
        this.profileClient = profileClient;
        this.exchangeHandler = exchangeHandler;
    }

    @Override
    public OAuth2User loadUser(OAuth2UserRequest userRequest) throws OAuth2AuthenticationException {
        OAuth2User providerUser;
        try {
            providerUser = profileClient.loadUser(userRequest);
        } catch (OAuth2AuthenticationException e) {
            throw new ProviderExchangeException("Provider profile request failed: " + e.getError().getErrorCode(), e);
        } catch (RuntimeException e) {
            // timeouts and transport errors surface as RestClientException
            throw new ProviderExchangeException("Provider profile request failed", e);
        }

        ProviderProfile profile = ProviderProfile.fromGoogleAttributes(providerUser.getAttributes());
        ReconcileResult result;
        try {
            result = exchangeHandler.reconcile(profile);
        } catch (DataAccessException e) {
            log.error("Store failure while reconciling provider id {}", profile.id(), e);
            throw new InternalAuthenticationServiceException("User could not be reconciled", e);
        }
        if (!result.isAuthenticated()) {
            throw new OAuth2AuthenticationException(new OAuth2Error(INVALID_PROFILE,
                    "User validation failed: " + String.join(", ", result.errors()), null));
        }
        return new ReconciledOAuth2User(result.user(), providerUser.getAttributes());
    }
}
