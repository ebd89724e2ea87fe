package com.example.routines.docgen.preview;

import com.example.routines.docgen.aspect.LogExecutionTime;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Renders one PDF page to PNG.
 */
@Component
public class PdfRasterizer {
    static final float MIN_SCALE = 0.5f;
    static final float MAX_SCALE = 4.0f;

    /**
     * @param pageNumber 1-based, clamped to the document's pages
     * @param dpi        resolution; the scale factor dpi/72 is clamped to [0.5, 4]
     */
    @LogExecutionTime("PDF Rasterization")
    public byte[] toPng(byte[] pdf, int pageNumber, int dpi) throws IOException {
        try (PDDocument document = PDDocument.load(pdf)) {
            int pageIndex = pageIndex(document.getNumberOfPages(), pageNumber);
            BufferedImage image = new PDFRenderer(document).renderImage(pageIndex, scale(dpi), ImageType.RGB);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(image, "png", out)) {
                throw new IOException("No PNG writer available");
            }
            return out.toByteArray();
        }
    }

    static int pageIndex(int pageCount, int pageNumber) {
        return Math.max(0, Math.min(pageCount - 1, pageNumber - 1));
    }

    static float scale(int dpi) {
        return Math.max(MIN_SCALE, Math.min(MAX_SCALE, dpi / 72f));
    }
}
