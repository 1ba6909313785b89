package com.trellis.webshell.web;

import java.util.List;

/** Names of every template the shell renders. All of them are verified at startup. */
public final class ViewTemplates {

    public static final String HOME = "pages/home";
    public static final String LOGIN = "pages/login";
    public static final String TEAM_DASHBOARD = "teams/dashboard";
    public static final String TEAM_PANEL = "teams/panel";
    public static final String TEAM_STATS = "teams/team_stats";
    public static final String TEAM_FORM = "teams/team_form";
    public static final String OOB_EXAMPLES = "components/oob/examples";
    public static final String OOB_NAV_UPDATED = "components/oob/nav_updated";
    public static final String OOB_COMBINED = "components/oob/combined";
    public static final String ALERT = "layout/alerts/alert";
    public static final String MODAL_EXAMPLES = "components/modals/examples";
    public static final String ERROR_PAGE = "layout/errors/error";
    public static final String FRAGMENT_ERROR = "layout/errors/fragment_error";

    public static final List<String> ALL = List.of(
            HOME, LOGIN, TEAM_DASHBOARD, TEAM_PANEL, TEAM_STATS, TEAM_FORM, OOB_EXAMPLES, OOB_NAV_UPDATED,
            OOB_COMBINED, ALERT, MODAL_EXAMPLES, ERROR_PAGE, FRAGMENT_ERROR);

    private ViewTemplates() {
        // constants
    }
}
