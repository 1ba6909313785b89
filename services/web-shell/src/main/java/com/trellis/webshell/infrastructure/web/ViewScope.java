package com.trellis.webshell.infrastructure.web;

import com.trellis.composition.FragmentSet;
import com.trellis.composition.InboundRequest;
import com.trellis.composition.NotificationQueue;
import com.trellis.composition.RenderContext;
import com.trellis.composition.TemplateRef;
import com.trellis.composition.ViewResponse;
import com.trellis.tenancy.AuthenticatedUser;
import com.trellis.tenancy.TenantContext;
import com.trellis.tenancy.TenantResolution;
import java.util.Optional;

/** Everything a handler gets once {@link ViewSupport} has let the request through. */
public final class ViewScope {

    private final ViewSupport support;
    private final EndpointPolicy policy;
    private final InboundRequest request;
    private final RenderContext context;
    private final AuthenticatedUser caller;
    private final TenantResolution tenancy;

    ViewScope(ViewSupport support, EndpointPolicy policy, InboundRequest request, RenderContext context,
            AuthenticatedUser caller, TenantResolution tenancy) {
        this.support = support;
        this.policy = policy;
        this.request = request;
        this.context = context;
        this.caller = caller;
        this.tenancy = tenancy;
    }

    public InboundRequest request() {
        return request;
    }

    public RenderContext context() {
        return context;
    }

    public Optional<AuthenticatedUser> caller() {
        return Optional.ofNullable(caller);
    }

    /** The signed-in caller; only valid on endpoints that require one. */
    public AuthenticatedUser requireCaller() {
        if (caller == null) {
            throw new IllegalStateException("Endpoint " + request.fullPath() + " has no signed-in caller");
        }
        return caller;
    }

    public TenantResolution tenancy() {
        return tenancy;
    }

    /** The active team; only valid on endpoints with a mandatory team. */
    public TenantContext requireTenant() {
        return tenancy.tenant().orElseThrow(() ->
                new IllegalStateException("Endpoint " + request.fullPath() + " has no active team"));
    }

    public NotificationQueue notifications() {
        return request.notifications();
    }

    /** Renders one template; on fragment-only endpoints pending notifications are folded in. */
    public ViewResponse render(TemplateRef template) {
        return support.render(policy, request, context, template);
    }

    /** Composes a fragment response; fragment-only endpoints only. */
    public ViewResponse compose(FragmentSet fragments) {
        return support.compose(request, context, fragments);
    }

    public ViewResponse redirect(String location) {
        return ViewResponse.redirect(location);
    }
}
