package com.example.routines.docgen.qr;

import com.example.routines.docgen.layout.PageDecorator;
import com.example.routines.docgen.layout.PageGeometry;
import com.example.routines.docgen.model.QrPosition;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Stamps the QR code into the top-right or bottom-right margin corner of
 * every page. The image object is created once and shared by all pages.
 */
public class QrOverlayDecorator implements PageDecorator {
    private final BufferedImage image;
    private final QrPosition position;
    private final float width;
    private final float height;

    private PDImageXObject xObject;
    private int drawCount;

    public QrOverlayDecorator(BufferedImage image, QrPosition position, float width, float height) {
        if (!position.isOverlay()) {
            throw new IllegalArgumentException("Not an overlay position: " + position);
        }
        this.image = image;
        this.position = position;
        this.width = width;
        this.height = height;
    }

    @Override
    public void decorate(PDDocument document, PDPage page, int pageIndex, PageGeometry geometry) throws IOException {
        if (xObject == null) {
            xObject = LosslessFactory.createFromImage(document, image);
        }
        float x = geometry.getPageWidth() - geometry.getMarginRight() - width;
        float y;
        if (position == QrPosition.HEADER) {
            float top = geometry.getMarginTop();
            y = geometry.getPageHeight() - top + Math.max(0f, (top - height) / 2);
        } else {
            y = Math.max(0f, (geometry.getMarginBottom() - height) / 2);
        }
        try (PDPageContentStream stream = new PDPageContentStream(
                document, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
            stream.drawImage(xObject, x, y, width, height);
        }
        drawCount++;
    }

    public int getDrawCount() {
        return drawCount;
    }

    public QrPosition getPosition() {
        return position;
    }
}
