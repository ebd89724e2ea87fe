package com.example.routines.docgen.service;

import com.example.routines.docgen.exception.TemplateLoadingException;
import com.example.routines.docgen.model.TemplateConfig;
import com.example.routines.docgen.validation.TemplateValidator;
import com.example.routines.docgen.validation.ValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateLoaderTest {
    private final TemplateLoader loader = new TemplateLoader();

    @Test
    public void testLoadYamlFromClasspathWithoutExtension() {
        TemplateConfig template = loader.loadTemplate("test-routine");

        assertEquals("Test Routine", template.getMetadata().getName());
        assertEquals(1, template.getPages().size());
        assertEquals(2, template.getPages().get(0).getSections().size());
        assertTrue(template.getQrCode().isActive());
    }

    @Test
    public void testLoadJsonByFileName() {
        TemplateConfig template = loader.loadTemplate("test-routine.json");

        assertEquals("Test Routine JSON", template.getMetadata().getName());
        assertTrue(template.getLayout().isLandscape());
    }

    @Test
    public void testLoadFromFilesystemPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.yaml");
        Files.write(file, ("metadata: {name: Disk, version: '1', description: d}\n"
                + "layout: {page_size: A4, orientation: portrait, margins: {top: 20, bottom: 20, left: 20, right: 20}}\n"
                + "pages: []\nvariables: {}\n").getBytes(StandardCharsets.UTF_8));

        Map<String, Object> raw = loader.loadRawTemplate(file.toString());

        assertEquals("Disk", ((Map<?, ?>) raw.get("metadata")).get("name"));
    }

    @Test
    public void testMissingTemplate() {
        TemplateLoadingException e = assertThrows(TemplateLoadingException.class,
                () -> loader.loadTemplate("does-not-exist"));
        assertEquals(TemplateLoadingException.TEMPLATE_NOT_FOUND, e.getCode());

        e = assertThrows(TemplateLoadingException.class, () -> loader.loadTemplate(" "));
        assertEquals(TemplateLoadingException.TEMPLATE_NOT_FOUND, e.getCode());
    }

    @Test
    public void testMalformedTemplate() {
        TemplateLoadingException e = assertThrows(TemplateLoadingException.class,
                () -> loader.loadTemplate("broken"));
        assertEquals(TemplateLoadingException.TEMPLATE_PARSE_ERROR, e.getCode());
    }

    @Test
    public void testBundledTemplateIsValid() {
        ValidationResult result = new TemplateValidator().validate(loader.loadRawTemplate("routine-weekly"));
        assertTrue(result.isValid(), String.valueOf(result.errorMessages()));
    }
}
