package com.trellis.webshell.infrastructure.thymeleaf;

import com.trellis.composition.TemplateRef;
import com.trellis.composition.TemplateRenderException;
import com.trellis.composition.TemplateRenderer;
import java.util.Locale;
import java.util.Map;
import org.springframework.core.io.ResourceLoader;
import org.thymeleaf.ITemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;

/**
 * {@link TemplateRenderer} backed by the Thymeleaf engine Spring Boot configures.
 *
 * <p>Template names resolve under the engine's prefix and suffix ({@code classpath:/templates/},
 * {@code .html} by default). Rendering runs outside the servlet view machinery, so templates use
 * plain {@code href}s rather than context-relative link expressions.
 */
public class ThymeleafTemplateRenderer implements TemplateRenderer {

    private final ITemplateEngine engine;
    private final ResourceLoader resourceLoader;
    private final String prefix;
    private final String suffix;

    public ThymeleafTemplateRenderer(ITemplateEngine engine, ResourceLoader resourceLoader, String prefix,
            String suffix) {
        this.engine = engine;
        this.resourceLoader = resourceLoader;
        this.prefix = prefix;
        this.suffix = suffix;
    }

    @Override
    public String render(TemplateRef template, Map<String, Object> model) {
        try {
            return engine.process(template.name(), new Context(Locale.ENGLISH, model));
        } catch (TemplateEngineException e) {
            throw new TemplateRenderException(template, e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(TemplateRef template) {
        return resourceLoader.getResource(prefix + template.name() + suffix).exists();
    }
}
