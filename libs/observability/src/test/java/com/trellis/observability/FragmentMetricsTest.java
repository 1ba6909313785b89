package com.trellis.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FragmentMetrics")
class FragmentMetricsTest {

    private SimpleMeterRegistry registry;
    private FragmentMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FragmentMetrics(registry, "web-shell");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new FragmentMetrics(null, "app"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank app name")
        void shouldRejectBlankAppName() {
            assertThatThrownBy(() -> new FragmentMetrics(registry, " "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("appName");
        }
    }

    @Test
    @DisplayName("counts responses per kind with the app tag")
    void countsResponsesPerKind() {
        metrics.recordResponse("full");
        metrics.recordResponse("full");
        metrics.recordResponse("redirect");

        assertThat(registry.get(FragmentMetrics.RESPONSES).tag("kind", "full").tag("app", "web-shell")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get(FragmentMetrics.RESPONSES).tag("kind", "redirect").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("records secondary count and duration for a composition")
    void recordsComposition() {
        metrics.recordComposition(3, Duration.ofMillis(12));

        assertThat(registry.get(FragmentMetrics.RESPONSES).tag("kind", "fragment").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get(FragmentMetrics.SECONDARY_FRAGMENTS).summary().totalAmount()).isEqualTo(3.0);
        assertThat(registry.get(FragmentMetrics.COMPOSE_DURATION).timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(12.0);
    }

    @Test
    @DisplayName("counts protocol violations")
    void countsProtocolViolations() {
        metrics.recordProtocolViolation();

        assertThat(registry.get(FragmentMetrics.PROTOCOL_VIOLATIONS).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("counts tenant resolutions per state")
    void countsTenantResolutions() {
        metrics.recordTenantResolution("TENANT_FROM_SESSION");
        metrics.recordTenantResolution("BLOCKED");
        metrics.recordTenantResolution("BLOCKED");

        assertThat(registry.get(FragmentMetrics.TENANT_RESOLUTIONS).tag("state", "BLOCKED").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get(FragmentMetrics.TENANT_RESOLUTIONS).tag("state", "TENANT_FROM_SESSION")
                .counter().count()).isEqualTo(1.0);
    }
}
