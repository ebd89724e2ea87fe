package com.example.routines.docgen.preview;

import com.example.routines.docgen.aspect.LogExecutionTime;
import com.example.routines.docgen.model.TemplateConfig;
import com.example.routines.docgen.service.DocumentComposer;
import com.example.routines.docgen.util.ContentHashing;
import com.example.routines.docgen.validation.TemplateValidator;
import com.example.routines.docgen.validation.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Produces editor previews of a template: the PDF itself, a rasterized page,
 * a placeholder HTML page or the raw template/data pair.
 *
 * Successful results are cached by a hash of template, options and data.
 * Failures of any kind come back as unsuccessful results and are never
 * cached.
 */
@Slf4j
@Service
public class PreviewEngine {
    static final String HTML_PLACEHOLDER = "<html><body>Preview not implemented</body></html>";

    private final DocumentComposer composer;
    private final TemplateValidator validator;
    private final PreviewCache cache;
    private final PdfRasterizer rasterizer;
    private final SampleDataGenerator sampleDataGenerator;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PreviewEngine(DocumentComposer composer, TemplateValidator validator, PreviewCache cache,
                         PdfRasterizer rasterizer, SampleDataGenerator sampleDataGenerator) {
        this.composer = composer;
        this.validator = validator;
        this.cache = cache;
        this.rasterizer = rasterizer;
        this.sampleDataGenerator = sampleDataGenerator;
    }

    /**
     * Generate a preview.
     *
     * @param template raw template definition
     * @param config   preview options
     * @param data     caller data; sample data is used when empty and enabled
     * @return the preview, successful or not
     */
    @LogExecutionTime("Preview Generation")
    public PreviewResult generatePreview(Map<String, Object> template, PreviewConfig config, Map<String, Object> data) {
        long start = System.nanoTime();
        PreviewFormat format = PreviewFormat.fromValue(config.getFormat()).orElse(null);
        if (format == null) {
            return failure(null, "Unsupported format: " + config.getFormat(), start);
        }
        if (!PreviewQuality.fromValue(config.getQuality()).isPresent()) {
            return failure(format, "Unsupported quality: " + config.getQuality(), start);
        }

        Map<String, Object> effectiveData = data;
        if ((data == null || data.isEmpty()) && config.isGenerateSampleData()) {
            effectiveData = sampleDataGenerator.generate(template);
        }
        if (effectiveData == null) {
            effectiveData = Collections.emptyMap();
        }

        long ttl = config.getCacheTtlSeconds() != null ? config.getCacheTtlSeconds() : cache.getDefaultTtlSeconds();
        String cacheKey = null;
        try {
            if (config.isUseCache()) {
                cacheKey = cacheKey(template, config, ttl, effectiveData);
                Optional<PreviewCacheEntry> cached = cache.get(cacheKey);
                if (cached.isPresent()) {
                    log.debug("Preview cache hit {}", cacheKey);
                    return PreviewResult.builder()
                            .success(true)
                            .data(cached.get().copyOfData())
                            .format(format)
                            .sizeBytes(cached.get().getSizeBytes())
                            .generationTimeMillis(elapsedMillis(start))
                            .cacheHit(true)
                            .build();
                }
            }

            ValidationResult validation = validator.validate(template);
            if (!validation.isValid()) {
                return failure(format, String.join("; ", validation.errorMessages()), start);
            }

            Object payload = render(format, template, config, effectiveData);
            long size = sizeOf(payload);
            if (cacheKey != null) {
                cache.put(cacheKey, payload, size, ttl);
            }
            return PreviewResult.builder()
                    .success(true)
                    .data(payload)
                    .format(format)
                    .sizeBytes(size)
                    .generationTimeMillis(elapsedMillis(start))
                    .cacheHit(false)
                    .build();
        } catch (Exception e) {
            log.warn("Preview generation failed: {}", e.getMessage());
            return failure(format, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), start);
        }
    }

    public PreviewResult generatePreview(Map<String, Object> template, PreviewConfig config) {
        return generatePreview(template, config, null);
    }

    /**
     * Encodes a successful result as {@code data:<mime>;base64,<payload>}.
     */
    public Optional<String> buildDataUri(PreviewResult result) {
        if (result == null || !result.isSuccess() || result.getFormat() == null) {
            return Optional.empty();
        }
        PreviewFormat format = result.getFormat();
        Object data = result.getData();
        byte[] raw;
        if ((format == PreviewFormat.PDF || format.isRaster()) && data instanceof byte[]) {
            raw = (byte[]) data;
        } else if (format == PreviewFormat.HTML && data instanceof String) {
            raw = ((String) data).getBytes(StandardCharsets.UTF_8);
        } else if (format == PreviewFormat.JSON && !(data instanceof byte[]) && !(data instanceof String)) {
            try {
                raw = objectMapper.writeValueAsBytes(data);
            } catch (JsonProcessingException e) {
                log.warn("Cannot serialize JSON preview: {}", e.getOriginalMessage());
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Optional.of("data:" + format.getMimeType() + ";base64," + Base64.getEncoder().encodeToString(raw));
    }

    public void invalidate() {
        cache.clear();
    }

    private Object render(PreviewFormat format, Map<String, Object> template, PreviewConfig config,
                          Map<String, Object> data) throws Exception {
        switch (format) {
            case PDF:
                return composer.render(TemplateConfig.from(template), data);
            case IMAGE:
            case THUMBNAIL:
                byte[] pdf = composer.render(TemplateConfig.from(template), data);
                return rasterizer.toPng(pdf, config.getPageNumber(), config.getDpi());
            case HTML:
                return HTML_PLACEHOLDER;
            case JSON:
                Map<String, Object> echo = new LinkedHashMap<>();
                echo.put("template", template);
                echo.put("data", data);
                return PreviewCacheEntry.copy(echo);
            default:
                throw new IllegalStateException("Unsupported format: " + format.getValue());
        }
    }

    private long sizeOf(Object payload) throws JsonProcessingException {
        if (payload instanceof byte[]) {
            return ((byte[]) payload).length;
        }
        if (payload instanceof String) {
            return ((String) payload).getBytes(StandardCharsets.UTF_8).length;
        }
        return objectMapper.writeValueAsBytes(payload).length;
    }

    private static String cacheKey(Map<String, Object> template, PreviewConfig config, long ttl,
                                   Map<String, Object> data) {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("template", template);
        key.put("cfg", config.toKeyMap(ttl));
        key.put("data", data);
        return ContentHashing.hash(key);
    }

    private static PreviewResult failure(PreviewFormat format, String message, long start) {
        return PreviewResult.builder()
                .success(false)
                .data("")
                .format(format)
                .sizeBytes(0)
                .generationTimeMillis(elapsedMillis(start))
                .cacheHit(false)
                .errorMessage(message)
                .build();
    }

    private static long elapsedMillis(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
