package com.trellis.webshell.config;

import com.trellis.tenancy.AuthenticatedUser;
import com.trellis.tenancy.testing.InMemoryMembershipDirectory;
import com.trellis.webshell.domain.DemoUsers;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds the in-memory team directory. The shell owns no team persistence; a real deployment
 * replaces the {@link InMemoryMembershipDirectory} bean with one backed by its user store.
 */
@Configuration
public class DemoDataConfig {

    private static final Logger log = LoggerFactory.getLogger(DemoDataConfig.class);

    @Bean
    public InMemoryMembershipDirectory membershipDirectory(DemoUsers demoUsers) {
        var directory = new InMemoryMembershipDirectory();
        AuthenticatedUser ada = demoUsers.require("ada");
        directory.add(ada.userId(), "analytical-engines", "Analytical Engines", Instant.parse("2024-01-10T09:00:00Z"));
        directory.add(ada.userId(), "difference-crew", "Difference Crew", Instant.parse("2024-03-02T14:30:00Z"));
        log.info("Seeded demo team directory for {} user(s)", demoUsers.all().size());
        return directory;
    }

    @Bean
    public DemoUsers demoUsers() {
        return new DemoUsers(
                new AuthenticatedUser("ada", "ada@example.com", "ada", "Ada Lovelace"),
                new AuthenticatedUser("grace", "grace@example.com", "grace", "Grace Hopper"));
    }
}
