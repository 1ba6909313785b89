package com.trellis.tenancy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Membership")
class MembershipTest {

    @Test
    @DisplayName("orders by creation time, then tenant id")
    void fallbackOrder() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        var late = new Membership("A", "A", t0.plusSeconds(60));
        var earlyB = new Membership("B", "B", t0);
        var earlyC = new Membership("C", "C", t0);

        assertThat(List.of(late, earlyC, earlyB).stream().sorted(Membership.FALLBACK_ORDER).toList())
                .containsExactly(earlyB, earlyC, late);
    }

    @Test
    @DisplayName("defaults the tenant name to its id")
    void defaultsName() {
        assertThat(new Membership("T1", null, Instant.EPOCH).tenantName()).isEqualTo("T1");
    }

    @Test
    @DisplayName("requires a creation time")
    void requiresCreatedAt() {
        assertThatThrownBy(() -> new Membership("T1", "One", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("greets users by the most readable name available")
    void greetingName() {
        assertThat(new AuthenticatedUser("u-1", null, "ada", "Ada L.").greetingName()).isEqualTo("Ada L.");
        assertThat(new AuthenticatedUser("u-1", null, "ada", null).greetingName()).isEqualTo("ada");
        assertThat(new AuthenticatedUser("u-1", null, null, " ").greetingName()).isEqualTo("u-1");
    }
}
