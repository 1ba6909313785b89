package com.trellis.tenancy;

import com.trellis.composition.ViewResponse;

import java.util.Optional;

/**
 * Result of {@link TenantResolver#resolve}. Handlers receive it explicitly.
 *
 * @param state final state of the resolution
 * @param tenant the active tenant, present for bound states
 * @param redirect response to send instead of running the handler, present only for a blocked
 *     caller on a mandatory endpoint
 */
public record TenantResolution(TenantResolutionState state, Optional<TenantContext> tenant,
        Optional<ViewResponse> redirect) {

    public TenantResolution {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        tenant = tenant == null ? Optional.empty() : tenant;
        redirect = redirect == null ? Optional.empty() : redirect;
        if (state.bound() != tenant.isPresent()) {
            throw new IllegalArgumentException("tenant must be present exactly for bound states, state=" + state);
        }
    }

    /** Resolution for requests that never ran the resolver (anonymous caller, tenant-free endpoint). */
    public static TenantResolution none() {
        return new TenantResolution(TenantResolutionState.NO_TENANT, Optional.empty(), Optional.empty());
    }

    static TenantResolution bound(TenantContext tenant) {
        return new TenantResolution(tenant.source(), Optional.of(tenant), Optional.empty());
    }

    static TenantResolution unbound() {
        return new TenantResolution(TenantResolutionState.BLOCKED, Optional.empty(), Optional.empty());
    }

    static TenantResolution blocked(ViewResponse redirect) {
        return new TenantResolution(TenantResolutionState.BLOCKED, Optional.empty(), Optional.of(redirect));
    }

    public boolean blocked() {
        return state == TenantResolutionState.BLOCKED;
    }

    public Optional<String> tenantId() {
        return tenant.map(TenantContext::tenantId);
    }
}
