package com.example.routines.docgen.model;

import com.example.routines.docgen.TestTemplates;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.example.routines.docgen.TestTemplates.list;
import static com.example.routines.docgen.TestTemplates.map;
import static org.junit.jupiter.api.Assertions.*;

public class TemplateConfigTest {

    @Test
    public void testParsesTypedView() {
        Map<String, Object> raw = TestTemplates.headerTemplate();
        raw.put("qr_code", map("enabled", true, "position", "separate_sheet", "size", 30));

        TemplateConfig template = TemplateConfig.from(raw);

        assertSame(raw, template.getSource());
        assertEquals("Test", template.getMetadata().getName());
        assertEquals(SectionType.HEADER, template.getPages().get(0).getSections().get(0).getType());
        VariableDefinition name = template.getVariables().get("name");
        assertTrue(name.isHasDefault());
        assertEquals("Gym", name.getDefaultValue());
        assertEquals(QrPosition.SEPARATE, template.getQrCode().getPosition());
        assertTrue(template.getQrCode().isActive());
        assertNull(template.getPrimaryColor());
    }

    @Test
    public void testToleratesMissingAndMalformedParts() {
        TemplateConfig template = TemplateConfig.from(map("pages", list("not-a-page", map("sections", "x"))));

        assertEquals(1, template.getPages().size());
        assertTrue(template.getPages().get(0).getSections().isEmpty());
        assertEquals("A4", template.getLayout().getPageSize());
        assertFalse(template.getLayout().isLandscape());
        assertEquals(20, template.getLayout().margin("top"));
        assertFalse(template.getQrCode().isActive());
        assertTrue(template.getVariables().isEmpty());
    }

    @Test
    public void testExplicitNullDefaultIsStillADefault() {
        VariableDefinition definition = VariableDefinition.from("x", map("default", null));
        assertTrue(definition.isHasDefault());
        assertEquals("string", definition.getType());
        assertFalse(VariableDefinition.from("y", map()).isHasDefault());
    }

    @Test
    public void testDiasSemanaLookup() {
        assertEquals(Integer.valueOf(5), TemplateConfig.from(map("dias_semana", "5")).getDiasSemana());
        assertEquals(Integer.valueOf(2),
                TemplateConfig.from(map("metadata", map("dias_semana", 2))).getDiasSemana());
    }

    @Test
    public void testSectionAndPositionNames() {
        assertEquals(SectionType.SPACING, SectionType.fromValue("Spacer"));
        assertEquals(SectionType.UNKNOWN, SectionType.fromValue("carousel"));
        assertEquals(SectionType.UNKNOWN, SectionType.fromValue(null));
        assertEquals(QrPosition.INLINE, QrPosition.fromValue(null));
        assertEquals(QrPosition.HEADER, QrPosition.fromValue(" Header "));
        assertEquals(QrPosition.NONE, QrPosition.fromValue("sidebar"));
    }

    @Test
    public void testSectionSettingsFallBackToSectionLevel() {
        Section section = Section.from(map("type", "text", "content", map("text", "a"), "spacing_after", 3));
        assertEquals("a", section.get("text"));
        assertEquals(3, section.get("spacing_after"));
        assertEquals("d", section.get("missing", "d"));
    }
}
