package com.librarycatalog.auth;

import com.librarycatalog.model.AuthProvider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * A user that has not been stored yet. {@code password} is the plaintext
 * of a local registration and only lives until the record is built.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserDraft {

    private String googleId;
    private String email;
    private String firstName;
    private String lastName;
    private String displayName;
    private String profilePicture;
    private AuthProvider provider;

    @Builder.Default
    private boolean active = true;

    @ToString.Exclude
    private String password;

    private Instant lastLogin;
    private Instant createdAt;
    private Instant updatedAt;
}
