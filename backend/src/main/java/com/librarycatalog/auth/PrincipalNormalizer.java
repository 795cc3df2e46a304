package com.librarycatalog.auth;

import com.librarycatalog.exception.HashingException;
import com.librarycatalog.exception.ValidationException;
import com.librarycatalog.model.AuthProvider;
import com.librarycatalog.model.User;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts between provider profiles, stored records, {@link UserIdentity}
 * and the client-facing {@link SafeUser}, and owns password hashing.
 */
@Component
public class PrincipalNormalizer {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    static final int MIN_PASSWORD_LENGTH = 6;
    static final int MAX_NAME_LENGTH = 50;
    static final int MAX_DISPLAY_NAME_LENGTH = 100;

    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public PrincipalNormalizer(PasswordEncoder passwordEncoder, Clock clock) {
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    /**
     * Builds a new google user from a provider profile.
     *
     * @throws ValidationException if the profile carries no email entry
     */
    public UserDraft fromProviderProfile(ProviderProfile profile) {
        String email = profile.primaryEmail();
        if (email == null || email.isBlank()) {
            throw new ValidationException("Email is required");
        }
        Instant now = clock.instant();
        return UserDraft.builder()
                .googleId(profile.id())
                .email(email)
                .firstName(profile.name().givenName())
                .lastName(profile.name().familyName())
                .displayName(profile.displayName())
                .profilePicture(profile.firstPhoto())
                .provider(AuthProvider.GOOGLE)
                .active(true)
                .lastLogin(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public UserIdentity fromStoredDocument(User record) {
        return UserIdentity.builder()
                .id(record.getId())
                .googleId(record.getGoogleId())
                .email(record.getEmail())
                .firstName(record.getFirstName())
                .lastName(record.getLastName())
                .displayName(record.getDisplayName())
                .profilePicture(record.getProfilePicture())
                .provider(record.getProvider())
                .active(record.isActive())
                .passwordHash(record.getPasswordHash())
                .lastLogin(record.getLastLogin())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .storeSourced(true)
                .build();
    }

    public ValidationResult validate(UserDraft draft) {
        List<String> errors = new ArrayList<>();

        if (isBlank(draft.getEmail())) {
            errors.add("Email is required");
        } else if (!EMAIL.matcher(draft.getEmail()).matches()) {
            errors.add("Invalid email format");
        }

        if (isBlank(draft.getFirstName())) {
            errors.add("First name is required");
        }
        if (isBlank(draft.getLastName())) {
            errors.add("Last name is required");
        }

        if (draft.getProvider() == AuthProvider.LOCAL) {
            if (draft.getPassword() == null || draft.getPassword().length() < MIN_PASSWORD_LENGTH) {
                errors.add("Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
            }
        } else if (draft.getProvider() == AuthProvider.GOOGLE) {
            if (isBlank(draft.getGoogleId())) {
                errors.add("Google ID is required for Google authentication");
            }
        } else {
            errors.add("Provider is required");
        }

        if (draft.getFirstName() != null && draft.getFirstName().length() > MAX_NAME_LENGTH) {
            errors.add("First name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (draft.getLastName() != null && draft.getLastName().length() > MAX_NAME_LENGTH) {
            errors.add("Last name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (draft.getDisplayName() != null && draft.getDisplayName().length() > MAX_DISPLAY_NAME_LENGTH) {
            errors.add("Display name must be at most " + MAX_DISPLAY_NAME_LENGTH + " characters");
        }

        return new ValidationResult(errors);
    }

    /**
     * Record to insert for a validated draft. Local drafts get their
     * plaintext hashed here; google records never hold a hash.
     */
    public User toNewRecord(UserDraft draft) {
        Instant now = clock.instant();
        String passwordHash = null;
        if (draft.getProvider() == AuthProvider.LOCAL && draft.getPassword() != null) {
            passwordHash = hash(draft.getPassword());
        }
        return User.builder()
                .googleId(draft.getProvider() == AuthProvider.GOOGLE ? draft.getGoogleId() : null)
                .email(draft.getEmail())
                .firstName(draft.getFirstName())
                .lastName(draft.getLastName())
                .displayName(draft.getDisplayName())
                .profilePicture(draft.getProfilePicture())
                .provider(draft.getProvider())
                .active(draft.isActive())
                .passwordHash(passwordHash)
                .lastLogin(draft.getLastLogin())
                .createdAt(draft.getCreatedAt() != null ? draft.getCreatedAt() : now)
                .updatedAt(draft.getUpdatedAt() != null ? draft.getUpdatedAt() : now)
                .build();
    }

    /**
     * Record to write back for an identity read from the store, e.g. after
     * a login merge. The stored hash is copied as is.
     *
     * @throws IllegalArgumentException if the identity did not come from
     *         {@link #fromStoredDocument}; drafts go through {@link #toNewRecord}
     */
    public User toRecord(UserIdentity user) {
        if (!user.isStoreSourced()) {
            throw new IllegalArgumentException("Identity " + user.getId() + " was not read from the store");
        }
        return User.builder()
                .id(user.getId())
                .googleId(user.getGoogleId())
                .email(user.getEmail())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .displayName(user.getDisplayName())
                .profilePicture(user.getProfilePicture())
                .provider(user.getProvider())
                .active(user.isActive())
                .passwordHash(user.getPasswordHash())
                .lastLogin(user.getLastLogin())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }

    public SafeUser toSafeView(UserIdentity user) {
        return SafeUser.builder()
                .id(user.getId() == null ? null : user.getId().toString())
                .email(user.getEmail())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .displayName(user.getDisplayName())
                .profilePicture(user.getProfilePicture())
                .provider(user.getProvider())
                .active(user.isActive())
                .lastLogin(user.getLastLogin())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }

    public String hash(String plaintext) {
        try {
            return passwordEncoder.encode(plaintext);
        } catch (RuntimeException e) {
            throw new HashingException("Password hashing failed", e);
        }
    }

    /**
     * @return {@code false} on mismatch or when no hash is stored
     */
    public boolean verify(String plaintext, String passwordHash) {
        if (plaintext == null || passwordHash == null || passwordHash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, passwordHash);
        } catch (RuntimeException e) {
            throw new HashingException("Password verification failed", e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
