package com.trellis.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer instruments for response composition.
 *
 * <p>Every meter carries an {@code app} tag with the application name. Meters are looked up on the
 * registry per call; Micrometer returns the already-registered instance for an identical name and
 * tag set.
 *
 * <ul>
 *   <li>{@value #RESPONSES}: counter, tag {@code kind} ({@code full}, {@code partial}, {@code fragment},
 *       {@code redirect})
 *   <li>{@value #SECONDARY_FRAGMENTS}: distribution of OOB blocks per fragment response
 *   <li>{@value #PROTOCOL_VIOLATIONS}: counter of fragment-only endpoints hit without the marker
 *   <li>{@value #TENANT_RESOLUTIONS}: counter, tag {@code state}
 *   <li>{@value #COMPOSE_DURATION}: timer around template rendering and assembly
 * </ul>
 */
public final class FragmentMetrics {

    public static final String RESPONSES = "trellis.responses";
    public static final String SECONDARY_FRAGMENTS = "trellis.fragments.secondary";
    public static final String PROTOCOL_VIOLATIONS = "trellis.protocol.violations";
    public static final String TENANT_RESOLUTIONS = "trellis.tenant.resolutions";
    public static final String COMPOSE_DURATION = "trellis.compose.duration";

    /** Tag key for the application name. */
    public static final String TAG_APP = "app";

    private final MeterRegistry registry;
    private final String appName;

    /**
     * Creates metrics bound to the given registry and application name.
     *
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param appName application name included as a default tag
     */
    public FragmentMetrics(MeterRegistry registry, String appName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (appName == null || appName.isBlank()) {
            throw new IllegalArgumentException("appName must not be null or blank");
        }
        this.registry = registry;
        this.appName = appName;
    }

    /** Counts one response of the given kind. */
    public void recordResponse(String kind) {
        Counter.builder(RESPONSES)
                .description("Rendered responses by kind")
                .tags(baseTags("kind", kind))
                .register(registry)
                .increment();
    }

    /**
     * Records a fragment response: its secondary block count and how long composition took.
     *
     * @param secondaryCount number of OOB blocks in the response (explicit and synthesized)
     * @param elapsed time spent rendering and assembling
     */
    public void recordComposition(int secondaryCount, Duration elapsed) {
        recordResponse("fragment");
        DistributionSummary.builder(SECONDARY_FRAGMENTS)
                .description("Out-of-band blocks per fragment response")
                .tags(baseTags())
                .register(registry)
                .record(secondaryCount);
        Timer.builder(COMPOSE_DURATION)
                .description("Fragment composition time")
                .tags(baseTags())
                .register(registry)
                .record(elapsed);
    }

    /** Counts a fragment-only endpoint reached without the fragment marker. */
    public void recordProtocolViolation() {
        Counter.builder(PROTOCOL_VIOLATIONS)
                .description("Fragment-only endpoints requested without the fragment marker")
                .tags(baseTags())
                .register(registry)
                .increment();
    }

    /** Counts one tenant resolution ending in the given state. */
    public void recordTenantResolution(String state) {
        Counter.builder(TENANT_RESOLUTIONS)
                .description("Tenant resolutions by final state")
                .tags(baseTags("state", state))
                .register(registry)
                .increment();
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Returns the application name used as a default tag. */
    public String appName() {
        return appName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_APP, appName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
