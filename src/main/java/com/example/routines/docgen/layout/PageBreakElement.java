package com.example.routines.docgen.layout;

/**
 * Ends the current page; following content starts on a new one.
 */
public final class PageBreakElement implements LayoutElement {
    public static final PageBreakElement INSTANCE = new PageBreakElement();

    private PageBreakElement() {
    }

    @Override
    public String toString() {
        return "PageBreak";
    }
}
