package com.trellis.tenancy;

/** Outcome of one tenant resolution. */
public enum TenantResolutionState {
    /** Nothing resolved yet. */
    NO_TENANT,
    /** The URL named a tenant the caller belongs to. */
    TENANT_FROM_URL,
    /** The session's active tenant is still one of the caller's. */
    TENANT_FROM_SESSION,
    /** Neither applied; the caller's earliest membership was picked. */
    TENANT_FROM_FALLBACK,
    /** The caller belongs to no tenant. */
    BLOCKED;

    public boolean bound() {
        return this == TENANT_FROM_URL || this == TENANT_FROM_SESSION || this == TENANT_FROM_FALLBACK;
    }
}
