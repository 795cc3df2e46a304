package com.librarycatalog.auth;

import com.librarycatalog.model.AuthProvider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The only user representation that crosses the trust boundary: no
 * password hash, no provider id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafeUser {

    private String id;
    private String email;
    private String firstName;
    private String lastName;
    private String displayName;
    private String profilePicture;
    private AuthProvider provider;
    private boolean active;
    private Instant lastLogin;
    private Instant createdAt;
    private Instant updatedAt;
}
