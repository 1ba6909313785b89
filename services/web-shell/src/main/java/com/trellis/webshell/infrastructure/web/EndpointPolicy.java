package com.trellis.webshell.infrastructure.web;

import com.trellis.tenancy.TenantRequirement;

/**
 * What an endpoint needs before its handler runs.
 *
 * @param fragmentOnly only the htmx client may call it; other requests are a protocol violation
 * @param requiresCaller anonymous callers are sent to the login page
 * @param tenantRequirement how the active team is resolved for a signed-in caller; {@code null}
 *     skips resolution
 */
public record EndpointPolicy(boolean fragmentOnly, boolean requiresCaller, TenantRequirement tenantRequirement) {

    /** Full or partial page open to everyone; a signed-in caller's team is resolved if there is one. */
    public static EndpointPolicy publicPage() {
        return new EndpointPolicy(false, false, TenantRequirement.OPTIONAL);
    }

    /** Fragment open to everyone, no team resolution. */
    public static EndpointPolicy publicFragment() {
        return new EndpointPolicy(true, false, null);
    }

    public static EndpointPolicy page(TenantRequirement tenantRequirement) {
        return new EndpointPolicy(false, true, tenantRequirement);
    }

    public static EndpointPolicy fragment(TenantRequirement tenantRequirement) {
        return new EndpointPolicy(true, true, tenantRequirement);
    }
}
