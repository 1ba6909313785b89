package com.trellis.webshell.config;

import com.trellis.composition.FragmentComposer;
import com.trellis.composition.NotificationFlash;
import com.trellis.composition.SessionStore;
import com.trellis.composition.TemplateCatalog;
import com.trellis.composition.TemplateRenderer;
import com.trellis.composition.ViewDispatcher;
import com.trellis.observability.CompositionTracer;
import com.trellis.observability.FragmentMetrics;
import com.trellis.tenancy.MembershipDirectory;
import com.trellis.tenancy.TenantResolver;
import com.trellis.webshell.infrastructure.thymeleaf.ThymeleafTemplateRenderer;
import com.trellis.webshell.infrastructure.web.ServletSessionStore;
import com.trellis.webshell.web.ViewTemplates;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import jakarta.servlet.http.HttpSessionListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.thymeleaf.ThymeleafProperties;
import org.springframework.boot.web.servlet.ServletListenerRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.thymeleaf.ITemplateEngine;

/** Wires the composition engine, tenant resolution and their observability into the context. */
@Configuration
public class CompositionConfig {

    @Bean
    public TemplateRenderer templateRenderer(
            ITemplateEngine templateEngine, ResourceLoader resourceLoader, ThymeleafProperties thymeleaf) {
        return new ThymeleafTemplateRenderer(
                templateEngine, resourceLoader, thymeleaf.getPrefix(), thymeleaf.getSuffix());
    }

    /** Fails startup when any template an endpoint uses is missing. */
    @Bean
    public TemplateCatalog templateCatalog(TemplateRenderer templateRenderer) {
        return TemplateCatalog.builder(templateRenderer)
                .register(ViewTemplates.ALL.toArray(String[]::new))
                .build();
    }

    @Bean
    public ServletSessionStore sessionStore() {
        return new ServletSessionStore();
    }

    @Bean
    public ServletListenerRegistrationBean<HttpSessionListener> sessionStoreListener(ServletSessionStore sessionStore) {
        return new ServletListenerRegistrationBean<>(sessionStore);
    }

    @Bean
    public NotificationFlash notificationFlash(SessionStore sessionStore) {
        return new NotificationFlash(sessionStore);
    }

    @Bean
    public ViewDispatcher viewDispatcher(TemplateCatalog templateCatalog, SessionStore sessionStore) {
        return new ViewDispatcher(templateCatalog, sessionStore);
    }

    @Bean
    public FragmentComposer fragmentComposer(
            TemplateCatalog templateCatalog, SessionStore sessionStore, WebShellProperties properties) {
        return new FragmentComposer(templateCatalog, sessionStore, properties.duplicateTargetPolicy());
    }

    @Bean
    public TenantResolver tenantResolver(
            MembershipDirectory membershipDirectory, SessionStore sessionStore, WebShellProperties properties) {
        return new TenantResolver(membershipDirectory, sessionStore, properties.tenantCreationPath());
    }

    @Bean
    public FragmentMetrics fragmentMetrics(MeterRegistry meterRegistry, WebShellProperties properties) {
        return new FragmentMetrics(meterRegistry, properties.name());
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }

    @Bean
    public CompositionTracer compositionTracer(OpenTelemetry openTelemetry, WebShellProperties properties) {
        return new CompositionTracer(openTelemetry.getTracer(properties.name()));
    }
}
