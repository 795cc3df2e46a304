package com.librarycatalog.auth;

import com.librarycatalog.exception.ValidationException;
import com.librarycatalog.model.AuthProvider;
import com.librarycatalog.model.User;
import com.librarycatalog.repo.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reconcile step of the Google login: maps an exchanged provider profile to
 * exactly one stored user, creating it on first sight.
 *
 * <p>Lookup and insert are separate store calls. Two callbacks for the same
 * identity can both miss the lookup; the unique email index rejects the
 * second insert and that caller merges into the winner's record instead.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OAuthExchangeHandler {

    private final UserRepository userRepository;
    private final PrincipalNormalizer principalNormalizer;
    private final Clock clock;

    public ReconcileResult reconcile(ProviderProfile profile) {
        Optional<User> existing = findExisting(profile);
        if (existing.isPresent()) {
            return refresh(existing.get(), profile);
        }

        UserDraft draft;
        try {
            draft = principalNormalizer.fromProviderProfile(profile);
        } catch (ValidationException e) {
            log.warn("Rejected provider profile {}: {}", profile.id(), e.getViolations());
            return ReconcileResult.failed(e.getViolations());
        }

        ValidationResult validation = principalNormalizer.validate(draft);
        if (!validation.isValid()) {
            log.warn("Rejected provider profile {}: {}", profile.id(), validation.errors());
            return ReconcileResult.failed(validation.errors());
        }

        User inserted;
        try {
            inserted = userRepository.saveAndFlush(principalNormalizer.toNewRecord(draft));
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent callback for the same identity
            log.info("Concurrent account creation for provider id {}, re-resolving", profile.id());
            return findExisting(profile)
                    .map(winner -> refresh(winner, profile))
                    .orElseGet(() -> {
                        log.error("Insert for provider id {} violated a constraint but no matching user exists",
                                profile.id(), e);
                        return ReconcileResult.failed(List.of("User could not be stored"));
                    });
        }

        log.info("Created user {} for provider {}", inserted.getId(), AuthProvider.GOOGLE.tag());
        return ReconcileResult.created(principalNormalizer.fromStoredDocument(inserted));
    }

    private Optional<User> findExisting(ProviderProfile profile) {
        return userRepository.findByGoogleIdOrEmail(profile.id(), profile.primaryEmail())
                .stream()
                .findFirst();
    }

    /**
     * Merges the login profile into a stored user. The merged state must
     * pass the same rules as a new google record before it is written.
     */
    private ReconcileResult refresh(User user, ProviderProfile profile) {
        Instant now = clock.instant();
        UserIdentity merged = principalNormalizer.fromStoredDocument(user).toBuilder()
                .googleId(profile.id())
                .firstName(profile.name().givenName())
                .lastName(profile.name().familyName())
                .displayName(profile.displayName())
                .profilePicture(profile.firstPhoto())
                .lastLogin(now)
                .updatedAt(now)
                .build();

        ValidationResult validation = principalNormalizer.validate(UserDraft.builder()
                .googleId(merged.getGoogleId())
                .email(merged.getEmail())
                .firstName(merged.getFirstName())
                .lastName(merged.getLastName())
                .displayName(merged.getDisplayName())
                .provider(AuthProvider.GOOGLE)
                .build());
        if (!validation.isValid()) {
            log.warn("Rejected profile update for user {}: {}", user.getId(), validation.errors());
            return ReconcileResult.failed(validation.errors());
        }

        User saved = userRepository.save(principalNormalizer.toRecord(merged));
        log.info("Refreshed user {} on login", saved.getId());
        return ReconcileResult.updated(principalNormalizer.fromStoredDocument(saved));
    }
}
