package com.trellis.tenancy;

import java.io.Serializable;

/**
 * The signed-in caller, as the authentication layer left it in the session.
 *
 * @param userId unique user identifier
 * @param email user's email address
 * @param username login username
 * @param displayName optional human-readable display name
 */
public record AuthenticatedUser(String userId, String email, String username, String displayName)
        implements Serializable {

    public AuthenticatedUser {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
    }

    /** Name to greet the user with: display name, then username, then user id. */
    public String greetingName() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return username != null && !username.isBlank() ? username : userId;
    }
}
