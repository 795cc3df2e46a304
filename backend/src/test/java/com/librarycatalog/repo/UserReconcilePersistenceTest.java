package com.librarycatalog.repo;

import com.librarycatalog.auth.OAuthExchangeHandler;
import com.librarycatalog.auth.PrincipalNormalizer;
import com.librarycatalog.auth.ProviderProfile;
import com.librarycatalog.auth.ReconcileResult;
import com.librarycatalog.config.IdentityConfig;
import com.librarycatalog.model.AuthProvider;
import com.librarycatalog.model.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Reconcile against a real store, including the unique email index.
 */
@DataJpaTest
@Import({OAuthExchangeHandler.class, PrincipalNormalizer.class, IdentityConfig.class})
class UserReconcilePersistenceTest {

    @Autowired
    private OAuthExchangeHandler exchangeHandler;

    @Autowired
    private UserRepository userRepository;

    private static ProviderProfile profile(String id, String email, String givenName) {
        return new ProviderProfile(id,
                List.of(new ProviderProfile.Email(email)),
                new ProviderProfile.Name(givenName, "B"),
                givenName + " B",
                List.of(new ProviderProfile.Photo("https://example.com/" + id + ".png")));
    }

    @Test
    @DisplayName("reconciling the same identity twice yields one user; the second call updates it")
    void reconcileTwice_shouldKeepOneUser() {
        ReconcileResult first = exchangeHandler.reconcile(profile("g1", "a@x.com", "A"));
        ReconcileResult second = exchangeHandler.reconcile(profile("g1", "a@x.com", "Alice"));

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(second.user().getId()).isEqualTo(first.user().getId());
        assertThat(userRepository.count()).isEqualTo(1);

        User stored = userRepository.findByEmail("a@x.com").orElseThrow();
        assertThat(stored.getFirstName()).isEqualTo("Alice");
        assertThat(stored.getGoogleId()).isEqualTo("g1");
        assertThat(stored.getProvider()).isEqualTo(AuthProvider.GOOGLE);
        assertThat(stored.getPasswordHash()).isNull();
        assertThat(stored.getLastLogin()).isNotNull();
    }

    @Test
    @DisplayName("a returning user with an over-long provider name fails and the stored record is unchanged")
    void reconcile_shouldFail_whenMergedNameTooLong() {
        ReconcileResult first = exchangeHandler.reconcile(profile("g1", "a@x.com", "A"));

        ReconcileResult second = exchangeHandler.reconcile(profile("g1", "a@x.com", "A".repeat(60)));

        assertThat(first.isAuthenticated()).isTrue();
        assertThat(second.isAuthenticated()).isFalse();
        assertThat(second.errors()).contains("First name must be at most 50 characters");
        assertThat(userRepository.findByEmail("a@x.com").orElseThrow().getFirstName()).isEqualTo("A");
    }

    @Test
    @DisplayName("a new provider id with a known email merges into the existing account")
    void reconcile_shouldMatchByEmail() {
        exchangeHandler.reconcile(profile("g1", "a@x.com", "A"));

        ReconcileResult result = exchangeHandler.reconcile(profile("g-other", "a@x.com", "A"));

        assertThat(result.created()).isFalse();
        assertThat(userRepository.count()).isEqualTo(1);
        assertThat(userRepository.findByEmail("a@x.com").orElseThrow().getGoogleId()).isEqualTo("g-other");
    }

    @Test
    @DisplayName("lookup prefers the provider id match over the email match")
    void findByGoogleIdOrEmail_shouldOrderProviderIdFirst() {
        exchangeHandler.reconcile(profile("g1", "a@x.com", "A"));
        exchangeHandler.reconcile(profile("g2", "b@x.com", "Bea"));

        List<User> matches = userRepository.findByGoogleIdOrEmail("g2", "a@x.com");

        assertThat(matches).extracting(User::getGoogleId).containsExactly("g2", "g1");
    }

    @Test
    @DisplayName("the store rejects a second user with the same email")
    void uniqueEmailIndex_shouldRejectDuplicate() {
        exchangeHandler.reconcile(profile("g1", "a@x.com", "A"));

        User duplicate = User.builder()
                .email("a@x.com").firstName("X").lastName("Y")
                .provider(AuthProvider.LOCAL).passwordHash("$2a$12$hash")
                .build();

        assertThatThrownBy(() -> userRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
