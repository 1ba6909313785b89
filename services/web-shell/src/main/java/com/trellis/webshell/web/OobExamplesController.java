package com.trellis.webshell.web;

import com.trellis.composition.FragmentSet;
import com.trellis.composition.NotificationLevel;
import com.trellis.composition.TemplateCatalog;
import com.trellis.composition.TemplateRef;
import com.trellis.webshell.infrastructure.web.EndpointPolicy;
import com.trellis.webshell.infrastructure.web.ViewSupport;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

/** Demonstrates out-of-band updates: toasts, alerts, modals, navigation state, and all at once. */
@Controller
@RequestMapping("/examples/oob")
public class OobExamplesController {

    private static final Map<String, String> TOAST_TEXT = Map.of(
            "success", "Operation was successful!",
            "info", "Here's some information for you.",
            "warning", "Warning: This is a cautionary message.",
            "error", "Error: Something went wrong.");

    private static final Map<String, String> ALERT_TEXT = Map.of(
            "success", "Your changes have been saved successfully.",
            "info", "Here's some information about this feature.",
            "warning", "Please note this will affect your account settings.",
            "error", "We couldn't complete the requested action.");

    private static final Map<String, String> MODAL_TITLES = Map.of(
            "basic", "Basic Modal Example",
            "form", "Form Modal Example",
            "confirm", "Confirmation Modal Example",
            "large", "Large Content Modal Example");

    private static final List<Map<String, String>> FORM_FIELDS = List.of(
            Map.of("name", "name", "label", "Your Name", "type", "text"),
            Map.of("name", "email", "label", "Email Address", "type", "email"),
            Map.of("name", "message", "label", "Message", "type", "textarea"));

    private final ViewSupport views;
    private final TemplateRef examples;
    private final TemplateRef alert;
    private final TemplateRef modal;
    private final TemplateRef navUpdated;
    private final TemplateRef combined;

    public OobExamplesController(ViewSupport views, TemplateCatalog catalog) {
        this.views = views;
        this.examples = catalog.ref(ViewTemplates.OOB_EXAMPLES);
        this.alert = catalog.ref(ViewTemplates.ALERT);
        this.modal = catalog.ref(ViewTemplates.MODAL_EXAMPLES);
        this.navUpdated = catalog.ref(ViewTemplates.OOB_NAV_UPDATED);
        this.combined = catalog.ref(ViewTemplates.OOB_COMBINED);
    }

    @GetMapping
    public ResponseEntity<String> page(HttpServletRequest request) {
        return views.handle(request, EndpointPolicy.publicPage(), null, scope -> {
            scope.context()
                    .put("pageTitle", "OOB Examples")
                    .put("pageDescription", "Examples of HTMX Out-of-Band (OOB) swaps");
            return scope.render(examples);
        });
    }

    /** Answers with nothing but a toast. */
    @GetMapping("/toast")
    public ResponseEntity<String> toast(HttpServletRequest request,
            @RequestParam(name = "type", defaultValue = "success") String type) {
        return views.handle(request, EndpointPolicy.publicFragment(), null, scope -> {
            NotificationLevel level = switch (type) {
                case "info" -> NotificationLevel.INFO;
                case "warning" -> NotificationLevel.WARNING;
                case "error" -> NotificationLevel.ERROR;
                default -> NotificationLevel.SUCCESS;
            };
            scope.notifications().enqueue(level, TOAST_TEXT.getOrDefault(type, "This is a notification."));
            return scope.compose(FragmentSet.builder().build());
        });
    }

    @GetMapping("/alert")
    public ResponseEntity<String> alert(HttpServletRequest request,
            @RequestParam(name = "type", defaultValue = "info") String type) {
        return views.handle(request, EndpointPolicy.publicFragment(), null, scope -> {
            scope.context()
                    .put("alertType", type)
                    .put("alertMessage", ALERT_TEXT.getOrDefault(type, "This is an important notice."))
                    .put("dismissible", true);
            return scope.render(alert);
        });
    }

    @GetMapping("/modal")
    public ResponseEntity<String> modal(HttpServletRequest request,
            @RequestParam(name = "type", defaultValue = "basic") String type) {
        return views.handle(request, EndpointPolicy.publicFragment(), null, scope -> {
            scope.context()
                    .put("modalType", type)
                    .put("modalTitle", MODAL_TITLES.getOrDefault(type, "Modal Example"))
                    .put("formFields", "form".equals(type) ? FORM_FIELDS : List.of());
            return scope.compose(FragmentSet.builder().primary(modal).includeModals().build());
        });
    }

    @GetMapping("/nav")
    public ResponseEntity<String> nav(HttpServletRequest request,
            @RequestParam(name = "section", defaultValue = "home") String section) {
        return views.handle(request, EndpointPolicy.publicFragment(), null, scope -> {
            scope.context().put("section", section);
            return scope.compose(FragmentSet.builder().primary(navUpdated).activeSection(section).build());
        });
    }

    @GetMapping("/combined")
    public ResponseEntity<String> combined(HttpServletRequest request) {
        return views.handle(request, EndpointPolicy.publicFragment(), null, scope -> {
            scope.notifications().success("Multiple OOB updates successfully demonstrated!");
            return scope.compose(FragmentSet.builder()
                    .primary(combined)
                    .activeSection("home")
                    .includeModals()
                    .build());
        });
    }
}
