package com.librarycatalog.auth;

import com.librarycatalog.model.AuthProvider;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Canonical in-memory user. Instances built from a stored record carry
 * {@code storeSourced = true}: their password hash is final and must not
 * be hashed again.
 */
@Value
@Builder(toBuilder = true)
public class UserIdentity {

    Long id;
    String googleId;
    String email;
    String firstName;
    String lastName;
    String displayName;
    String profilePicture;
    AuthProvider provider;
    boolean active;

    @ToString.Exclude
    String passwordHash;

    Instant lastLogin;
    Instant createdAt;
    Instant updatedAt;
    boolean storeSourced;

    public boolean isPersisted() {
        return id != null;
    }
}
