package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.layout.PageBreakElement;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

@Component
public class PageBreakSectionRenderer implements SectionRenderer {

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        return Collections.singletonList(PageBreakElement.INSTANCE);
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.PAGE_BREAK;
    }
}
