package com.example.routines.docgen.layout;

import com.example.routines.docgen.model.PageLayout;
import com.example.routines.docgen.util.UnitConverter;
import org.junit.jupiter.api.Test;

import static com.example.routines.docgen.TestTemplates.map;
import static org.junit.jupiter.api.Assertions.*;

public class PageGeometryTest {

    @Test
    public void testLetterLandscape() {
        PageGeometry geometry = PageGeometry.from(PageLayout.from(map("page_size", "letter", "orientation", "landscape",
                "margins", map("top", "1in", "bottom", "1in", "left", 10, "right", 10))));

        assertEquals(792f, geometry.getPageWidth());
        assertEquals(612f, geometry.getPageHeight());
        assertEquals(72f, geometry.getMarginTop(), 0.01);
        assertEquals(792f - 2 * (float) UnitConverter.mm(10), geometry.getFrameWidth(), 0.01);
    }

    @Test
    public void testUnknownSizeFallsBackToA4() {
        PageGeometry geometry = PageGeometry.from(PageLayout.from(map("page_size", "A5")));
        assertEquals(PageFormat.A4.getWidth(), geometry.getPageWidth());
        assertEquals(UnitConverter.mm(20), geometry.getMarginLeft(), 0.01);
    }

    @Test
    public void testNegativeMarginsClampToZero() {
        PageGeometry geometry = PageGeometry.from(PageLayout.from(map("margins", map("left", -10))));
        assertEquals(0f, geometry.getMarginLeft());
    }

    @Test
    public void testMarginsWithoutPrintableAreaUseDefaults() {
        PageGeometry geometry = PageGeometry.from(PageLayout.from(map("margins", map("left", 150, "right", 150))));
        assertEquals(UnitConverter.mm(20), geometry.getMarginLeft(), 0.01);
        assertTrue(geometry.getFrameWidth() > 0);
    }
}
