package com.trellis.webshell.web;

import com.trellis.composition.FragmentSet;
import com.trellis.composition.TemplateCatalog;
import com.trellis.composition.TemplateRef;
import com.trellis.composition.ViewResponse;
import com.trellis.tenancy.Membership;
import com.trellis.tenancy.TenantContext;
import com.trellis.tenancy.TenantRequirement;
import com.trellis.webshell.domain.Teams;
import com.trellis.webshell.infrastructure.web.EndpointPolicy;
import com.trellis.webshell.infrastructure.web.ViewScope;
import com.trellis.webshell.infrastructure.web.ViewSupport;
import jakarta.servlet.http.HttpServletRequest;
import java.time.ZoneOffset;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Team pages: the dashboard (whole page, or its panel as a fragment when switching teams) and team
 * creation.
 */
@Controller
public class TeamController {

    static final String STATS_TARGET = "team-stats";
    static final String SECTION = "teams";

    private final ViewSupport views;
    private final Teams teams;
    private final TemplateRef dashboard;
    private final TemplateRef panel;
    private final TemplateRef stats;
    private final TemplateRef form;

    public TeamController(ViewSupport views, Teams teams, TemplateCatalog catalog) {
        this.views = views;
        this.teams = teams;
        this.dashboard = catalog.ref(ViewTemplates.TEAM_DASHBOARD);
        this.panel = catalog.ref(ViewTemplates.TEAM_PANEL);
        this.stats = catalog.ref(ViewTemplates.TEAM_STATS);
        this.form = catalog.ref(ViewTemplates.TEAM_FORM);
    }

    /** Dashboard of the active team; {@code team_id} switches to another of the caller's teams. */
    @GetMapping("/teams/")
    public ResponseEntity<String> dashboard(HttpServletRequest request,
            @RequestParam(name = "team_id", required = false) String teamId) {
        return views.handle(request, EndpointPolicy.page(TenantRequirement.MANDATORY), teamId, this::renderDashboard);
    }

    /** Bookmarkable dashboard of one team; also where the panel fragment points the address bar. */
    @GetMapping("/teams/{teamId}/")
    public ResponseEntity<String> teamDashboard(HttpServletRequest request, @PathVariable String teamId) {
        return views.handle(request, EndpointPolicy.page(TenantRequirement.MANDATORY), teamId, this::renderDashboard);
    }

    /** Swaps the dashboard panel and the stats sidebar to another team. Fragment requests only. */
    @GetMapping("/teams/{teamId}/panel")
    public ResponseEntity<String> panel(HttpServletRequest request, @PathVariable String teamId) {
        return views.handle(request, EndpointPolicy.fragment(TenantRequirement.MANDATORY), teamId, scope -> {
            TenantContext team = describe(scope);
            return scope.compose(FragmentSet.builder()
                    .primary(panel)
                    .secondary(STATS_TARGET, stats)
                    .pushUrl("/teams/" + team.tenantId() + "/")
                    .activeSection(SECTION)
                    .build());
        });
    }

    @GetMapping("/teams/new")
    public ResponseEntity<String> newTeam(HttpServletRequest request) {
        return views.handle(request, EndpointPolicy.page(TenantRequirement.OPTIONAL), null, scope -> {
            if (!teams.teamsOf(scope.requireCaller().userId()).isEmpty()) {
                scope.notifications().info("You are already a member of a team.");
                return scope.redirect("/teams/");
            }
            return renderForm(scope);
        });
    }

    @PostMapping("/teams/new")
    public ResponseEntity<String> createTeam(HttpServletRequest request,
            @RequestParam(name = "name", required = false) String name) {
        return views.handle(request, EndpointPolicy.page(TenantRequirement.OPTIONAL), null, scope -> {
            if (name == null || name.isBlank()) {
                scope.notifications().error("Please give your team a name.");
                return renderForm(scope);
            }
            Membership created;
            try {
                created = teams.create(scope.requireCaller().userId(), name);
            } catch (IllegalArgumentException e) {
                scope.notifications().error(e.getMessage());
                scope.context().put("name", name);
                return renderForm(scope);
            }
            scope.notifications().success("Team \"%s\" created successfully!".formatted(created.tenantName()));
            return scope.redirect("/teams/" + created.tenantId() + "/");
        });
    }

    private ViewResponse renderDashboard(ViewScope scope) {
        describe(scope);
        scope.context().put("pageTitle", "Team dashboard").put("activeSection", SECTION);
        return scope.render(dashboard);
    }

    private ViewResponse renderForm(ViewScope scope) {
        scope.context()
                .put("pageTitle", "Create Team")
                .put("title", "Create Team")
                .put("submitText", "Create Team");
        return scope.render(form);
    }

    private TenantContext describe(ViewScope scope) {
        TenantContext team = scope.requireTenant();
        List<Membership> memberships = teams.teamsOf(scope.requireCaller().userId());
        Membership active = memberships.stream()
                .filter(m -> m.tenantId().equals(team.tenantId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Active team " + team.tenantId() + " vanished"));
        scope.context()
                .put("memberships", memberships)
                .put("membershipCount", memberships.size())
                .put("memberSince", active.createdAt().atZone(ZoneOffset.UTC).toLocalDate());
        return team;
    }
}
