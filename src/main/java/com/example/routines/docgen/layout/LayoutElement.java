package com.example.routines.docgen.layout;

/**
 * One primitive of the content flow handed to {@link PdfLayoutWriter}.
 */
public interface LayoutElement {
}
