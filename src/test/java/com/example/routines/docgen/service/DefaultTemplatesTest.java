package com.example.routines.docgen.service;

import com.example.routines.docgen.EngineFixture;
import com.example.routines.docgen.model.QrPosition;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.model.TemplateConfig;
import com.example.routines.docgen.preview.SampleDataGenerator;
import com.example.routines.docgen.validation.TemplateValidator;
import com.example.routines.docgen.validation.ValidationResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultTemplatesTest {
    private final DefaultTemplates defaults = new DefaultTemplates();

    @Test
    public void testExcelEquivalentStructure() {
        TemplateConfig template = defaults.excelEquivalentConfig(4);

        assertEquals("Plantilla Excel 4 días", template.getMetadata().getName());
        assertEquals(Integer.valueOf(4), template.getDiasSemana());
        assertEquals(QrPosition.INLINE, template.getQrCode().getPosition());
        assertEquals(5, template.getPages().get(0).getSections().size());
        assertEquals(SectionType.EXERCISE_TABLE, template.getPages().get(0).getSections().get(2).getType());
        assertEquals("#111827", template.getPrimaryColor());
    }

    @Test
    public void testOnlyTwoToFiveDays() {
        assertThrows(IllegalArgumentException.class, () -> defaults.excelEquivalent(1));
        assertThrows(IllegalArgumentException.class, () -> defaults.excelEquivalent(6));
        assertEquals(4, defaults.all().size());
        assertTrue(defaults.all().containsKey("excel-3-dias"));
    }

    @Test
    public void testEveryDefaultTemplateValidates() {
        TemplateValidator validator = new TemplateValidator();
        for (Map.Entry<String, Map<String, Object>> entry : defaults.all().entrySet()) {
            ValidationResult result = validator.validate(entry.getValue());
            assertTrue(result.isValid(), entry.getKey() + ": " + result.errorMessages());
            assertTrue(result.getWarnings().isEmpty(), entry.getKey() + ": " + result.warningMessages());
        }
    }

    @Test
    public void testRendersWithSampleData() throws IOException {
        Map<String, Object> raw = defaults.excelEquivalent(3);
        Map<String, Object> data = new SampleDataGenerator().generate(raw);

        byte[] pdf = new EngineFixture().composer().render(raw, data);

        try (PDDocument document = PDDocument.load(pdf)) {
            String text = new PDFTextStripper().getText(document);
            assertTrue(text.contains("Gimnasio"), text);
            assertTrue(text.contains("Día 3"), text);
            assertTrue(text.contains("Sentadilla"), text);
        }
    }
}
