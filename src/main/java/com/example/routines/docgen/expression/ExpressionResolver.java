package com.example.routines.docgen.expression;

import com.example.routines.docgen.config.EngineProperties;
import com.example.routines.docgen.util.BoundedCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * Resolves {@code {{ expr }}} placeholders in template strings against a data
 * context.
 *
 * Compiled templates are kept in a bounded, insertion-ordered cache shared by
 * every render. Resolution is best effort: any compile or evaluation failure
 * yields the source string unchanged.
 */
@Slf4j
@Component
public class ExpressionResolver {
    private final BoundedCache<String, CompiledTemplate> compiled;

    public ExpressionResolver(EngineProperties properties) {
        this.compiled = new BoundedCache<>(Math.max(1, properties.getMaxCompiledTemplates()), false);
    }

    public String resolve(String source, Map<String, Object> data) {
        if (source == null) {
            return "";
        }
        if (!source.contains(CompiledTemplate.OPEN)) {
            return source;
        }
        try {
            return compile(source).render(data == null ? Collections.emptyMap() : data);
        } catch (ExpressionException e) {
            log.debug("Leaving expression unresolved '{}': {}", source, e.getMessage());
            return source;
        }
    }

    /**
     * Resolves strings; any other value is returned as is.
     */
    public Object resolveValue(Object value, Map<String, Object> data) {
        if (value instanceof String) {
            return resolve((String) value, data);
        }
        return value;
    }

    /**
     * Compiles {@code source} into the cache without evaluating it.
     *
     * @return false when the source does not compile
     */
    public boolean precompile(String source) {
        if (source == null || !source.contains(CompiledTemplate.OPEN)) {
            return true;
        }
        try {
            compile(source);
            return true;
        } catch (ExpressionException e) {
            log.warn("Template expression does not compile '{}': {}", source, e.getMessage());
            return false;
        }
    }

    public BoundedCache<String, CompiledTemplate> getCompiledCache() {
        return compiled;
    }

    private CompiledTemplate compile(String source) throws ExpressionException {
        CompiledTemplate template = compiled.get(source);
        if (template == null) {
            template = CompiledTemplate.compile(source);
            compiled.put(source, template);
        }
        return template;
    }
}
