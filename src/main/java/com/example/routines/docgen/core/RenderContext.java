package com.example.routines.docgen.core;

import com.example.routines.docgen.expression.ExpressionResolver;
import com.example.routines.docgen.layout.Colors;
import com.example.routines.docgen.layout.PageGeometry;
import com.example.routines.docgen.layout.SpacerElement;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.TemplateConfig;
import com.example.routines.docgen.util.UnitConverter;
import com.example.routines.docgen.util.Values;
import lombok.Getter;
import lombok.Setter;

import java.awt.Color;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a section renderer may read while one document is composed:
 * the template, the resolved data context and the page geometry.
 */
@Getter
public class RenderContext {
    private final TemplateConfig template;
    private final Map<String, Object> data;
    private final PageGeometry geometry;
    private final ExpressionResolver expressionResolver;
    private final Color headingColor;

    @Setter
    private int currentPageIndex;
    @Setter
    private int currentSectionIndex;

    public RenderContext(TemplateConfig template, Map<String, Object> data, PageGeometry geometry,
                         ExpressionResolver expressionResolver) {
        this.template = template;
        this.data = data;
        this.geometry = geometry;
        this.expressionResolver = expressionResolver;
        this.headingColor = Colors.parseHex(template.getPrimaryColor());
    }

    /**
     * String form of a template value with its {@code {{ }}} expressions resolved.
     */
    public String resolve(Object raw) {
        return expressionResolver.resolve(Values.asString(raw), data);
    }

    /**
     * Trailing gap of a section: its {@code spacing_after}, or the renderer's
     * default. Empty when the gap is zero.
     */
    public Optional<SpacerElement> spacingAfter(Section section, double defaultMm) {
        double points = UnitConverter.toPoints(section.get("spacing_after"), defaultMm);
        return points > 0 ? Optional.of(new SpacerElement((float) points)) : Optional.empty();
    }
}
