package com.trellis.webshell.web;

import com.trellis.composition.TemplateCatalog;
import com.trellis.composition.TemplateRef;
import com.trellis.webshell.config.WebShellProperties;
import com.trellis.webshell.infrastructure.web.EndpointPolicy;
import com.trellis.webshell.infrastructure.web.ViewSupport;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/** Landing page. Open to everyone; shows the active team to signed-in callers who have one. */
@Controller
public class HomeController {

    private final ViewSupport views;
    private final WebShellProperties properties;
    private final TemplateRef home;

    public HomeController(ViewSupport views, TemplateCatalog catalog, WebShellProperties properties) {
        this.views = views;
        this.properties = properties;
        this.home = catalog.ref(ViewTemplates.HOME);
    }

    @GetMapping("/")
    public ResponseEntity<String> home(HttpServletRequest request) {
        return views.handle(request, EndpointPolicy.publicPage(), null, scope -> {
            scope.context()
                    .put("pageTitle", "Home")
                    .put("environment", properties.environment())
                    .put("loginPath", properties.loginPath());
            return scope.render(home);
        });
    }
}
