package com.trellis.webshell.domain;

import com.trellis.tenancy.AuthenticatedUser;
import java.util.List;
import java.util.Optional;

/** Accounts the demo sign-in page offers. */
public final class DemoUsers {

    private final List<AuthenticatedUser> users;

    public DemoUsers(AuthenticatedUser... users) {
        this.users = List.of(users);
    }

    public List<AuthenticatedUser> all() {
        return users;
    }

    public Optional<AuthenticatedUser> find(String userId) {
        return users.stream().filter(user -> user.userId().equals(userId)).findFirst();
    }

    public AuthenticatedUser require(String userId) {
        return find(userId).orElseThrow(() -> new IllegalArgumentException("Unknown demo user: " + userId));
    }
}
