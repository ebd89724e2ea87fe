package com.example.routines.docgen.layout;

import com.example.routines.docgen.model.PageLayout;
import com.example.routines.docgen.util.UnitConverter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

/**
 * Page size and margins of one render, all in points.
 */
@Slf4j
@Value
public class PageGeometry {
    private static final double DEFAULT_MARGIN_MM = 20;

    float pageWidth;
    float pageHeight;
    float marginTop;
    float marginBottom;
    float marginLeft;
    float marginRight;

    public static PageGeometry from(PageLayout layout) {
        PageFormat format = PageFormat.resolve(layout.getPageSize());
        float width = format.getWidth();
        float height = format.getHeight();
        if (layout.isLandscape()) {
            width = format.getHeight();
            height = format.getWidth();
        }
        float top = margin(layout, "top");
        float bottom = margin(layout, "bottom");
        float left = margin(layout, "left");
        float right = margin(layout, "right");
        if (left + right >= width || top + bottom >= height) {
            log.warn("Margins leave no printable area on {}, using defaults", format.getDisplayName());
            float fallback = (float) UnitConverter.mm(DEFAULT_MARGIN_MM);
            top = bottom = left = right = fallback;
        }
        return new PageGeometry(width, height, top, bottom, left, right);
    }

    private static float margin(PageLayout layout, String side) {
        return (float) Math.max(0d, UnitConverter.toPoints(layout.margin(side), DEFAULT_MARGIN_MM));
    }

    public float getFrameWidth() {
        return pageWidth - marginLeft - marginRight;
    }

    public float getFrameHeight() {
        return pageHeight - marginTop - marginBottom;
    }

    public PDRectangle toMediaBox() {
        return new PDRectangle(pageWidth, pageHeight);
    }
}
