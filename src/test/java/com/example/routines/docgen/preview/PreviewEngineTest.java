package com.example.routines.docgen.preview;

import com.example.routines.docgen.EngineFixture;
import com.example.routines.docgen.TestTemplates;
import com.example.routines.docgen.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static com.example.routines.docgen.TestTemplates.map;
import static org.junit.jupiter.api.Assertions.*;

public class PreviewEngineTest {
    private EngineFixture fixture;
    private PreviewEngine engine;

    @BeforeEach
    public void setUp() {
        fixture = new EngineFixture();
        engine = fixture.previewEngine();
    }

    @Test
    public void testPdfPreviewIsCached() {
        Map<String, Object> template = TestTemplates.headerTemplate();
        PreviewConfig config = PreviewConfig.defaults();

        PreviewResult first = engine.generatePreview(template, config);
        PreviewResult second = engine.generatePreview(template, config);

        assertTrue(first.isSuccess());
        assertFalse(first.isCacheHit());
        assertEquals(PreviewFormat.PDF, first.getFormat());
        assertEquals("%PDF", new String(first.getBytes(), 0, 4, StandardCharsets.US_ASCII));
        assertEquals(first.getBytes().length, first.getSizeBytes());

        assertTrue(second.isCacheHit());
        assertArrayEquals(first.getBytes(), second.getBytes());
        assertEquals(first.getSizeBytes(), second.getSizeBytes());
        assertEquals(1, fixture.previewCache.size());
    }

    @Test
    public void testCachedBytesAreNotShared() {
        Map<String, Object> template = TestTemplates.headerTemplate();
        PreviewResult first = engine.generatePreview(template, PreviewConfig.defaults());
        first.getBytes()[0] = 'X';

        PreviewResult second = engine.generatePreview(template, PreviewConfig.defaults());
        second.getBytes()[1] = 'X';
        PreviewResult third = engine.generatePreview(template, PreviewConfig.defaults());

        assertEquals('%', third.getBytes()[0]);
        assertEquals('P', third.getBytes()[1]);
    }

    @Test
    public void testDifferentDataIsADifferentEntry() {
        Map<String, Object> template = TestTemplates.headerTemplate();

        engine.generatePreview(template, PreviewConfig.defaults(), map("name", "A"));
        PreviewResult other = engine.generatePreview(template, PreviewConfig.defaults(), map("name", "B"));

        assertFalse(other.isCacheHit());
        assertEquals(2, fixture.previewCache.size());
    }

    @Test
    public void testEntriesExpireAfterTtl() {
        Map<String, Object> template = TestTemplates.headerTemplate();
        PreviewConfig config = PreviewConfig.builder().cacheTtlSeconds(10L).build();

        engine.generatePreview(template, config);
        fixture.clock.advance(Duration.ofSeconds(5));
        assertTrue(engine.generatePreview(template, config).isCacheHit());

        fixture.clock.advance(Duration.ofSeconds(6));
        PreviewResult expired = engine.generatePreview(template, config);
        assertTrue(expired.isSuccess());
        assertFalse(expired.isCacheHit());
        assertEquals(1L, fixture.previewCache.stats().get("expiredCount"));
    }

    @Test
    public void testCacheIsBounded() {
        EngineProperties properties = new EngineProperties();
        properties.setPreviewCacheMaxEntries(3);
        EngineFixture small = new EngineFixture(properties);
        PreviewEngine bounded = small.previewEngine();
        PreviewConfig json = PreviewConfig.builder().format("json").build();

        for (int i = 0; i < 5; i++) {
            assertTrue(bounded.generatePreview(TestTemplates.headerTemplate(), json, map("i", i)).isSuccess());
        }

        assertEquals(3, small.previewCache.size());
        assertEquals(2L, small.previewCache.stats().get("evictionCount"));
        assertFalse(bounded.generatePreview(TestTemplates.headerTemplate(), json, map("i", 0)).isCacheHit());
        assertTrue(bounded.generatePreview(TestTemplates.headerTemplate(), json, map("i", 4)).isCacheHit());
    }

    @Test
    public void testCacheCanBeBypassed() {
        PreviewConfig config = PreviewConfig.builder().useCache(false).build();

        engine.generatePreview(TestTemplates.headerTemplate(), config);
        PreviewResult second = engine.generatePreview(TestTemplates.headerTemplate(), config);

        assertFalse(second.isCacheHit());
        assertEquals(0, fixture.previewCache.size());
    }

    @Test
    public void testImagePreviewIsPng() {
        PreviewConfig config = PreviewConfig.builder().format("image").pageNumber(99).dpi(72).build();

        PreviewResult result = engine.generatePreview(TestTemplates.headerTemplate(), config);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        byte[] png = result.getBytes();
        assertEquals((byte) 0x89, png[0]);
        assertEquals('P', png[1]);
        assertEquals('N', png[2]);
        assertEquals('G', png[3]);
        assertEquals(PreviewFormat.IMAGE.getMimeType(), "image/png");
    }

    @Test
    public void testThumbnailPreview() {
        PreviewResult result = engine.generatePreview(TestTemplates.headerTemplate(),
                PreviewConfig.builder().format("thumbnail").dpi(36).build());
        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertEquals(PreviewFormat.THUMBNAIL, result.getFormat());
    }

    @Test
    public void testHtmlPlaceholder() {
        PreviewResult result = engine.generatePreview(TestTemplates.headerTemplate(),
                PreviewConfig.builder().format("HTML").build());

        assertTrue(result.isSuccess());
        assertEquals(PreviewEngine.HTML_PLACEHOLDER, result.getData());
        assertEquals(PreviewEngine.HTML_PLACEHOLDER.length(), result.getSizeBytes());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testJsonPreviewEchoesTemplateAndSampleData() {
        Map<String, Object> template = TestTemplates.headerTemplate();
        template.put("dias_semana", 4);

        PreviewResult result = engine.generatePreview(template, PreviewConfig.builder().format("json").build());

        Map<String, Object> payload = (Map<String, Object>) result.getData();
        assertEquals(template, payload.get("template"));
        Map<String, Object> data = (Map<String, Object>) payload.get("data");
        assertEquals(4, ((List<?>) data.get("dias")).size());
        assertEquals("demo-uuid", ((Map<?, ?>) data.get("routine")).get("uuid"));
        assertTrue(result.getSizeBytes() > 0);
    }

    @Test
    public void testSampleDataCanBeDisabled() {
        PreviewConfig config = PreviewConfig.builder().format("json").generateSampleData(false).build();

        PreviewResult result = engine.generatePreview(TestTemplates.headerTemplate(), config);

        assertEquals(map(), ((Map<?, ?>) result.getData()).get("data"));
    }

    @Test
    public void testUnsupportedFormatAndQuality() {
        PreviewResult format = engine.generatePreview(TestTemplates.headerTemplate(),
                PreviewConfig.builder().format("docx").build());
        assertFalse(format.isSuccess());
        assertEquals("Unsupported format: docx", format.getErrorMessage());
        assertNull(format.getFormat());

        PreviewResult quality = engine.generatePreview(TestTemplates.headerTemplate(),
                PreviewConfig.builder().quality("extreme").build());
        assertFalse(quality.isSuccess());
        assertEquals("Unsupported quality: extreme", quality.getErrorMessage());
        assertEquals(0, fixture.previewCache.size());
    }

    @Test
    public void testInvalidTemplateIsReportedAndNotCached() {
        Map<String, Object> template = TestTemplates.headerTemplate();
        template.remove("variables");
        template.remove("layout");

        PreviewResult result = engine.generatePreview(template, PreviewConfig.defaults());

        assertFalse(result.isSuccess());
        assertEquals("Missing required field: layout; Missing required field: variables", result.getErrorMessage());
        assertEquals(0, result.getSizeBytes());
        assertEquals(0, fixture.previewCache.size());
    }

    @Test
    public void testDataUri() {
        PreviewResult pdf = engine.generatePreview(TestTemplates.headerTemplate(), PreviewConfig.defaults());
        String uri = engine.buildDataUri(pdf).orElseThrow();
        assertTrue(uri.startsWith("data:application/pdf;base64,"));
        byte[] decoded = Base64.getDecoder().decode(uri.substring("data:application/pdf;base64,".length()));
        assertArrayEquals(pdf.getBytes(), decoded);

        PreviewResult html = engine.generatePreview(TestTemplates.headerTemplate(),
                PreviewConfig.builder().format("html").build());
        assertTrue(engine.buildDataUri(html).orElseThrow().startsWith("data:text/html;base64,"));

        PreviewResult json = engine.generatePreview(TestTemplates.headerTemplate(),
                PreviewConfig.builder().format("json").build());
        assertTrue(engine.buildDataUri(json).orElseThrow().startsWith("data:application/json;base64,"));

        PreviewResult failed = engine.generatePreview(TestTemplates.headerTemplate(),
                PreviewConfig.builder().format("docx").build());
        assertFalse(engine.buildDataUri(failed).isPresent());
    }

    @Test
    public void testInvalidateClearsCache() {
        engine.generatePreview(TestTemplates.headerTemplate(), PreviewConfig.defaults());
        engine.invalidate();

        assertEquals(0, fixture.previewCache.size());
        assertFalse(engine.generatePreview(TestTemplates.headerTemplate(), PreviewConfig.defaults()).isCacheHit());
    }
}
