package com.trellis.tenancy;

import com.trellis.composition.InboundRequest;
import com.trellis.composition.RenderContext;
import com.trellis.composition.SessionStore;
import com.trellis.composition.ViewResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Decides which tenant a request runs against and keeps the session's active tenant in step.
 *
 * <p>Resolution order:
 *
 * <ol>
 *   <li>a tenant id taken from the URL, if the caller is a member ({@code TENANT_FROM_URL})
 *   <li>the session's active tenant, if the caller is still a member ({@code TENANT_FROM_SESSION})
 *   <li>the caller's earliest membership, ties broken by tenant id ({@code TENANT_FROM_FALLBACK})
 *   <li>otherwise {@code BLOCKED}
 * </ol>
 *
 * <p>A URL or session id naming a tenant the caller does not belong to is treated as absent. The
 * active tenant is written to the session only when it changes, and removed when the caller has
 * no membership left. This class is the only writer of {@value #ACTIVE_TENANT_KEY}.
 */
public class TenantResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    /** Session key holding the active tenant id. */
    public static final String ACTIVE_TENANT_KEY = "team_id";

    /** Render variable the resolved tenant is exposed as. */
    public static final String TENANT_VARIABLE = "team";

    static final String SETUP_MESSAGE = "Let's set up your team first.";

    private final MembershipDirectory directory;
    private final SessionStore sessions;
    private final String tenantCreationPath;

    public TenantResolver(MembershipDirectory directory, SessionStore sessions, String tenantCreationPath) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        if (sessions == null) {
            throw new IllegalArgumentException("sessions must not be null");
        }
        if (tenantCreationPath == null || tenantCreationPath.isBlank()) {
            throw new IllegalArgumentException("tenantCreationPath must not be null or blank");
        }
        this.directory = directory;
        this.sessions = sessions;
        this.tenantCreationPath = tenantCreationPath;
    }

    /**
     * Resolves the active tenant for an authenticated caller.
     *
     * @param request the inbound request; a blocked caller on a mandatory endpoint gets an info
     *     notification queued on it
     * @param caller the signed-in user
     * @param urlTenantId tenant id taken from the URL, or {@code null}
     * @param requirement whether the endpoint needs a tenant
     */
    public TenantResolution resolve(
            InboundRequest request, AuthenticatedUser caller, String urlTenantId, TenantRequirement requirement) {
        String sessionId = request.sessionId();
        List<Membership> memberships = directory.listMemberships(caller.userId());

        Optional<Membership> fromUrl = membership(memberships, urlTenantId);
        if (fromUrl.isPresent()) {
            return bind(sessionId, TenantContext.of(fromUrl.get(), TenantResolutionState.TENANT_FROM_URL));
        }
        if (urlTenantId != null && !urlTenantId.isBlank()) {
            log.debug("Ignoring tenant {} from URL: user {} is not a member", urlTenantId, caller.userId());
        }

        Optional<String> stored = sessions.get(sessionId, ACTIVE_TENANT_KEY).map(String::valueOf);
        Optional<Membership> fromSession = stored.flatMap(id -> membership(memberships, id));
        if (fromSession.isPresent()) {
            return bind(sessionId, TenantContext.of(fromSession.get(), TenantResolutionState.TENANT_FROM_SESSION));
        }

        Optional<Membership> fallback = memberships.stream().min(Membership.FALLBACK_ORDER);
        if (fallback.isPresent()) {
            return bind(sessionId, TenantContext.of(fallback.get(), TenantResolutionState.TENANT_FROM_FALLBACK));
        }

        if (stored.isPresent()) {
            sessions.remove(sessionId, ACTIVE_TENANT_KEY);
            log.info("Cleared stale active tenant {} for user {} without memberships", stored.get(), caller.userId());
        }
        if (requirement == TenantRequirement.MANDATORY) {
            request.notifications().info(SETUP_MESSAGE);
            log.info("User {} has no tenant; redirecting to {}", caller.userId(), tenantCreationPath);
            return TenantResolution.blocked(ViewResponse.redirect(tenantCreationPath));
        }
        return TenantResolution.unbound();
    }

    /** Exposes the resolved tenant to templates as {@value #TENANT_VARIABLE}. */
    public static RenderContext expose(TenantResolution resolution, RenderContext context) {
        resolution.tenant().ifPresent(tenant -> context.put(TENANT_VARIABLE, tenant));
        return context;
    }

    private TenantResolution bind(String sessionId, TenantContext tenant) {
        persist(sessionId, tenant.tenantId());
        log.debug("Resolved tenant {} ({})", tenant.tenantId(), tenant.source());
        return TenantResolution.bound(tenant);
    }

    private void persist(String sessionId, String tenantId) {
        if (sessionId == null) {
            return;
        }
        boolean unchanged = sessions.get(sessionId, ACTIVE_TENANT_KEY)
                .map(String::valueOf)
                .filter(tenantId::equals)
                .isPresent();
        if (!unchanged) {
            sessions.set(sessionId, ACTIVE_TENANT_KEY, tenantId);
        }
    }

    private static Optional<Membership> membership(List<Membership> memberships, String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return Optional.empty();
        }
        return memberships.stream().filter(m -> m.tenantId().equals(tenantId)).findFirst();
    }
}
