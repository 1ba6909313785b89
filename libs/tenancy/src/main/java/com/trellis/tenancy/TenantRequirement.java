package com.trellis.tenancy;

/** Whether an endpoint can run without an active tenant. */
public enum TenantRequirement {
    /** Callers without a tenant are redirected to tenant creation. */
    MANDATORY,
    /** Callers without a tenant are served unbound. */
    OPTIONAL
}
