package com.example.routines.docgen.service;

import com.example.routines.docgen.exception.TemplateLoadingException;
import com.example.routines.docgen.expression.ExpressionResolver;
import com.example.routines.docgen.model.TemplateConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Loads the configured templates at startup and compiles every expression
 * they contain, so the first render of each does not pay for parsing.
 *
 * <pre>
 * docgen:
 *   templates:
 *     preload-ids: routine-weekly,routine-basic
 * </pre>
 */
@Slf4j
@Component
public class TemplatePrewarmer {

    private final TemplateLoader templateLoader;
    private final ExpressionResolver expressionResolver;
    private final DefaultTemplates defaultTemplates;

    @Value("${docgen.templates.preload-ids:}")
    private List<String> preloadTemplateIds = Collections.emptyList();

    @Value("${docgen.templates.cache-enabled:true}")
    private boolean cacheEnabled = true;

    @Value("${docgen.templates.preload-defaults:true}")
    private boolean preloadDefaults = true;

    public TemplatePrewarmer(TemplateLoader templateLoader, ExpressionResolver expressionResolver,
                             DefaultTemplates defaultTemplates) {
        this.templateLoader = templateLoader;
        this.expressionResolver = expressionResolver;
        this.defaultTemplates = defaultTemplates;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmOnStartup() {
        if (!cacheEnabled) {
            log.info("Template prewarming skipped (caching disabled)");
            return;
        }
        int compiled = warm(preloadTemplateIds);
        if (preloadDefaults) {
            compiled += warmDefaults();
        }
        log.info("Template prewarming finished, {} expressions compiled", compiled);
    }

    /**
     * @return number of expressions compiled
     */
    public int warm(List<String> templateIds) {
        int compiled = 0;
        for (String id : templateIds) {
            if (id == null || id.trim().isEmpty()) {
                continue;
            }
            try {
                TemplateConfig template = templateLoader.loadTemplate(id.trim());
                int count = precompile(template.getSource());
                compiled += count;
                log.info("Prewarmed template '{}' ({} expressions)", id.trim(), count);
            } catch (TemplateLoadingException e) {
                log.warn("Failed to prewarm template '{}': {}", id, e.getMessage());
            }
        }
        return compiled;
    }

    /**
     * Compiles the expressions of the built-in routine templates.
     */
    public int warmDefaults() {
        int compiled = 0;
        for (Map<String, Object> template : defaultTemplates.all().values()) {
            compiled += precompile(template);
        }
        return compiled;
    }

    private int precompile(Object node) {
        int count = 0;
        if (node instanceof String) {
            String text = (String) node;
            if (text.contains("{{") && expressionResolver.precompile(text)) {
                count++;
            }
        } else if (node instanceof Map) {
            for (Object value : ((Map<?, ?>) node).values()) {
                count += precompile(value);
            }
        } else if (node instanceof List) {
            for (Object value : (List<?>) node) {
                count += precompile(value);
            }
        }
        return count;
    }
}
