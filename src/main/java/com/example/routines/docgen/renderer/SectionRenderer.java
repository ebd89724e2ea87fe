package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;

import java.util.List;

/**
 * Turns one section into layout primitives. Implementations never throw for
 * bad content: they emit less (or nothing) instead.
 */
public interface SectionRenderer {

    List<LayoutElement> render(Section section, RenderContext context);

    boolean supports(SectionType type);
}
