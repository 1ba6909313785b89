package com.trellis.webshell.infrastructure.web;

import com.trellis.composition.FragmentComposer;
import com.trellis.composition.FragmentProtocolViolationException;
import com.trellis.composition.FragmentSet;
import com.trellis.composition.InboundRequest;
import com.trellis.composition.RenderContext;
import com.trellis.composition.TemplateRef;
import com.trellis.composition.ViewDispatcher;
import com.trellis.composition.ViewResponse;
import com.trellis.observability.CompositionTracer;
import com.trellis.observability.FragmentMetrics;
import com.trellis.observability.RequestLogContextHolder;
import com.trellis.tenancy.AuthenticatedUser;
import com.trellis.tenancy.TenantResolution;
import com.trellis.tenancy.TenantResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Runs one HTML endpoint: protocol check, caller, render context, team resolution, handler, then
 * the buffered response.
 *
 * <p>The fragment marker is checked before anything else, so fragment-only endpoints never run
 * handler code for a plain browser request. Redirects produced along the way (login, team setup)
 * are returned without calling the handler.
 */
@Component
public class ViewSupport {

    /** Render variable holding the signed-in caller. */
    public static final String CALLER_VARIABLE = "user";

    private final ViewDispatcher dispatcher;
    private final FragmentComposer composer;
    private final TenantResolver tenants;
    private final Callers callers;
    private final FragmentMetrics metrics;
    private final CompositionTracer tracer;

    public ViewSupport(@Qualifier("viewDispatcher") ViewDispatcher dispatcher, FragmentComposer composer,
            TenantResolver tenants, Callers callers, FragmentMetrics metrics, CompositionTracer tracer) {
        this.dispatcher = dispatcher;
        this.composer = composer;
        this.tenants = tenants;
        this.callers = callers;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    /**
     * Handles an endpoint.
     *
     * @param http the servlet request
     * @param policy what the endpoint needs
     * @param urlTenantId team id taken from the URL, or {@code null}
     * @param handler builds the response from the prepared scope
     * @throws FragmentProtocolViolationException if a fragment-only endpoint gets a plain request
     */
    public ResponseEntity<String> handle(HttpServletRequest http, EndpointPolicy policy, String urlTenantId,
            Function<ViewScope, ViewResponse> handler) {
        InboundRequest request = InboundRequests.from(http);
        if (policy.fragmentOnly() && !request.fragmentRequest()) {
            throw new FragmentProtocolViolationException(request.fullPath());
        }

        Optional<AuthenticatedUser> caller = callers.current(http);
        if (caller.isEmpty() && policy.requiresCaller()) {
            return send(callers.loginRedirect(request));
        }
        caller.ifPresent(user -> RequestLogContextHolder.update(ctx -> ctx.withUser(user.userId())));

        RenderContext context = policy.fragmentOnly() ? composer.dispatch(request) : dispatcher.dispatch(request);
        caller.ifPresent(user -> context.put(CALLER_VARIABLE, user));

        TenantResolution tenancy = TenantResolution.none();
        if (caller.isPresent() && policy.tenantRequirement() != null) {
            tenancy = tenants.resolve(request, caller.get(), urlTenantId, policy.tenantRequirement());
            metrics.recordTenantResolution(tenancy.state().name());
            tenancy.tenantId().ifPresent(id -> RequestLogContextHolder.update(ctx -> ctx.withTenant(id)));
            if (tenancy.redirect().isPresent()) {
                return send(tenancy.redirect().get());
            }
            TenantResolver.expose(tenancy, context);
        }

        ViewResponse response = handler.apply(
                new ViewScope(this, policy, request, context, caller.orElse(null), tenancy));
        return send(response);
    }

    /**
     * Redirect sent without opening a render context, so one-shot session flags stay unread for the
     * page the browser lands on.
     */
    public ResponseEntity<String> redirect(String location) {
        return send(ViewResponse.redirect(location));
    }

    ViewResponse render(EndpointPolicy policy, InboundRequest request, RenderContext context, TemplateRef template) {
        if (policy.fragmentOnly()) {
            return compose(request, context, FragmentSet.of(template));
        }
        ViewResponse response = tracer.trace("trellis.render.page", Map.of("trellis.template", template.name()),
                () -> dispatcher.render(request, context, template));
        metrics.recordResponse(request.fragmentRequest() ? "partial" : "full");
        return response;
    }

    ViewResponse compose(InboundRequest request, RenderContext context, FragmentSet fragments) {
        long started = System.nanoTime();
        String primary = fragments.primary().map(p -> p.templateRef().name()).orElse("-");
        ViewResponse response = tracer.trace("trellis.render.fragments", Map.of("trellis.template", primary),
                () -> composer.render(request, context, fragments));
        metrics.recordComposition(response.oobTargets().size(), Duration.ofNanos(System.nanoTime() - started));
        return response;
    }

    private ResponseEntity<String> send(ViewResponse response) {
        if (response.isRedirect()) {
            metrics.recordResponse("redirect");
        }
        return toResponseEntity(response);
    }

    /** Writes a buffered {@link ViewResponse} as one Spring response. */
    public static ResponseEntity<String> toResponseEntity(ViewResponse response) {
        HttpHeaders headers = new HttpHeaders();
        response.headers().forEach(headers::set);
        headers.set(HttpHeaders.CONTENT_TYPE, response.contentType());
        return ResponseEntity.status(response.status()).headers(headers).body(response.body());
    }
}
