package com.trellis.tenancy;

/**
 * The tenant a request runs against.
 *
 * @param tenantId unique tenant identifier
 * @param tenantName human-readable tenant name
 * @param source how the tenant was resolved
 */
public record TenantContext(String tenantId, String tenantName, TenantResolutionState source) {

    public TenantContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (source == null || !source.bound()) {
            throw new IllegalArgumentException("source must be a bound state, was " + source);
        }
    }

    static TenantContext of(Membership membership, TenantResolutionState source) {
        return new TenantContext(membership.tenantId(), membership.tenantName(), source);
    }
}
