package com.trellis.tenancy;

import java.time.Instant;
import java.util.Comparator;

/**
 * A caller's membership in one tenant.
 *
 * @param tenantId tenant identifier
 * @param tenantName human-readable tenant name
 * @param createdAt when the membership was created; the earliest one is the fallback tenant
 */
public record Membership(String tenantId, String tenantName, Instant createdAt) {

    /** Earliest-created first, ties broken by tenant id. */
    public static final Comparator<Membership> FALLBACK_ORDER =
            Comparator.comparing(Membership::createdAt).thenComparing(Membership::tenantId);

    public Membership {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt must not be null");
        }
        if (tenantName == null || tenantName.isBlank()) {
            tenantName = tenantId;
        }
    }
}
