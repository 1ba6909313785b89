package com.trellis.webshell.web;

import com.trellis.composition.TemplateCatalog;
import com.trellis.composition.TemplateRef;
import com.trellis.tenancy.AuthenticatedUser;
import com.trellis.webshell.domain.DemoUsers;
import com.trellis.webshell.infrastructure.web.Callers;
import com.trellis.webshell.infrastructure.web.EndpointPolicy;
import com.trellis.webshell.infrastructure.web.ViewSupport;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Demo sign-in: pick one of the {@link DemoUsers}. Stands in for the real authentication flow,
 * which only has to leave an {@link AuthenticatedUser} in the session.
 */
@Controller
public class LoginController {

    private final ViewSupport views;
    private final Callers callers;
    private final DemoUsers demoUsers;
    private final TemplateRef login;

    public LoginController(ViewSupport views, Callers callers, DemoUsers demoUsers, TemplateCatalog catalog) {
        this.views = views;
        this.callers = callers;
        this.demoUsers = demoUsers;
        this.login = catalog.ref(ViewTemplates.LOGIN);
    }

    @GetMapping("/login")
    public ResponseEntity<String> loginPage(HttpServletRequest request,
            @RequestParam(name = "next", defaultValue = "/") String next) {
        return views.handle(request, EndpointPolicy.publicPage(), null, scope -> {
            scope.context()
                    .put("pageTitle", "Sign in")
                    .put("users", demoUsers.all())
                    .put("next", safeNext(next));
            return scope.render(login);
        });
    }

    @PostMapping("/login")
    public ResponseEntity<String> signIn(HttpServletRequest request,
            @RequestParam(name = "user") String userId,
            @RequestParam(name = "next", defaultValue = "/") String next) {
        Optional<AuthenticatedUser> user = demoUsers.find(userId);
        if (user.isEmpty()) {
            throw new IllegalArgumentException("Unknown user: " + userId);
        }
        callers.signIn(request, user.get());
        return views.redirect(safeNext(next));
    }

    @PostMapping("/logout")
    public ResponseEntity<String> signOut(HttpServletRequest request) {
        callers.signOut(request);
        return views.redirect("/");
    }

    /** Only same-site paths are followed after sign-in. */
    static String safeNext(String next) {
        if (next == null || !next.startsWith("/") || next.startsWith("//") || next.contains("\\")) {
            return "/";
        }
        return next;
    }
}
