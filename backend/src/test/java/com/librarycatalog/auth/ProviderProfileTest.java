package com.librarycatalog.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ProviderProfileTest {

    @Test
    @DisplayName("primary email prefers the first verified address")
    void primaryEmail_shouldPreferVerified() {
        ProviderProfile profile = new ProviderProfile("g1",
                List.of(new ProviderProfile.Email("old@x.com", false), new ProviderProfile.Email("new@x.com", true)),
                null, null, null);

        assertThat(profile.primaryEmail()).isEqualTo("new@x.com");
    }

    @Test
    @DisplayName("primary email falls back to the first entry and is null for no entries")
    void primaryEmail_shouldFallBack() {
        ProviderProfile unverified = new ProviderProfile("g1",
                List.of(new ProviderProfile.Email("a@x.com", false), new ProviderProfile.Email("b@x.com", false)),
                null, null, null);
        ProviderProfile empty = new ProviderProfile("g1", null, null, null, null);

        assertThat(unverified.primaryEmail()).isEqualTo("a@x.com");
        assertThat(empty.primaryEmail()).isNull();
        assertThat(empty.firstPhoto()).isNull();
        assertThat(empty.name().givenName()).isNull();
    }

    @Test
    @DisplayName("google user-info attributes map onto the profile")
    void fromGoogleAttributes_shouldMapUserInfo() {
        Map<String, Object> attributes = Map.of(
                "sub", "1234567890",
                "email", "a@x.com",
                "email_verified", true,
                "given_name", "Ada",
                "family_name", "Byron",
                "name", "Ada Byron",
                "picture", "https://example.com/a.png");

        ProviderProfile profile = ProviderProfile.fromGoogleAttributes(attributes);

        assertThat(profile.id()).isEqualTo("1234567890");
        assertThat(profile.primaryEmail()).isEqualTo("a@x.com");
        assertThat(profile.name().givenName()).isEqualTo("Ada");
        assertThat(profile.name().familyName()).isEqualTo("Byron");
        assertThat(profile.displayName()).isEqualTo("Ada Byron");
        assertThat(profile.firstPhoto()).isEqualTo("https://example.com/a.png");
    }

    @Test
    @DisplayName("missing email and picture attributes give empty lists")
    void fromGoogleAttributes_shouldTolerateMissingFields() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("sub", "g2");
        attributes.put("picture", "");

        ProviderProfile profile = ProviderProfile.fromGoogleAttributes(attributes);

        assertThat(profile.emails()).isEmpty();
        assertThat(profile.photos()).isEmpty();
    }
}
