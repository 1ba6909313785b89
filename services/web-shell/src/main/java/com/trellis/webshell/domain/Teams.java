package com.trellis.webshell.domain;

import com.trellis.tenancy.Membership;
import com.trellis.tenancy.testing.InMemoryMembershipDirectory;
import java.text.Normalizer;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Team creation and listing on top of the membership directory. */
@Service
public class Teams {

    private static final Logger log = LoggerFactory.getLogger(Teams.class);

    static final int MAX_NAME_LENGTH = 80;

    private final InMemoryMembershipDirectory directory;
    private final Clock clock;

    @Autowired
    public Teams(InMemoryMembershipDirectory directory) {
        this(directory, Clock.systemUTC());
    }

    Teams(InMemoryMembershipDirectory directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    /** The caller's teams ordered by name. */
    public List<Membership> teamsOf(String userId) {
        return directory.listMemberships(userId).stream()
                .sorted(Comparator.comparing(Membership::tenantName, String.CASE_INSENSITIVE_ORDER))
                .toList();
    }

    /**
     * Creates a team with the caller as its first member.
     *
     * @throws IllegalArgumentException if the name is blank or too long
     */
    public synchronized Membership create(String userId, String name) {
        String trimmed = name == null ? "" : name.strip();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Team name must not be blank");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Team name must be at most %d characters".formatted(MAX_NAME_LENGTH));
        }
        var membership = new Membership(uniqueSlug(slugify(trimmed)), trimmed, Instant.now(clock));
        directory.add(userId, membership);
        log.info("Created team {} for user {}", membership.tenantId(), userId);
        return membership;
    }

    static String slugify(String name) {
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? "team" : slug;
    }

    private String uniqueSlug(String base) {
        String candidate = base;
        for (int suffix = 2; directory.knowsTenant(candidate); suffix++) {
            candidate = base + "-" + suffix;
        }
        return candidate;
    }
}
