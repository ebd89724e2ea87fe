package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Fallback for section types the engine does not know: renders nothing.
 */
@Slf4j
@Component
public class UnknownSectionRenderer implements SectionRenderer {

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        log.warn("Skipping section of unknown type '{}' (page {}, section {})", section.getRawType(),
                context.getCurrentPageIndex() + 1, context.getCurrentSectionIndex() + 1);
        return Collections.emptyList();
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.UNKNOWN;
    }
}
