package com.example.routines.docgen.layout;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;

import java.io.IOException;

/**
 * Draws on top of every finished page, after the content flow is laid out.
 */
public interface PageDecorator {
    void decorate(PDDocument document, PDPage page, int pageIndex, PageGeometry geometry) throws IOException;
}
