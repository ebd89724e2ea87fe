package com.example.routines.docgen.renderer;

import com.example.routines.docgen.config.EngineProperties;
import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.ImageElement;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Inline images given as {@code data:image/...;base64,} URIs. Other schemes,
 * undecodable payloads and payloads over the byte budget are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageSectionRenderer implements SectionRenderer {
    static final String DATA_IMAGE_PREFIX = "data:image/";
    private static final String BASE64_MARKER = ";base64,";
    private static final double DEFAULT_WIDTH_MM = 100;
    private static final double DEFAULT_HEIGHT_MM = 60;
    private static final double SPACING_AFTER_MM = 4;

    private final EngineProperties properties;

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        Object src = section.get("src");
        if (src == null) {
            src = section.get("path");
        }
        List<LayoutElement> elements = new ArrayList<>();
        Optional<BufferedImage> image = decode(context.resolve(src).trim());
        if (!image.isPresent()) {
            return elements;
        }
        float width = (float) UnitConverter.toPoints(section.get("width"), DEFAULT_WIDTH_MM);
        float height = (float) UnitConverter.toPoints(section.get("height"), DEFAULT_HEIGHT_MM);
        if (width <= 0 || height <= 0) {
            return elements;
        }
        elements.add(new ImageElement(image.get(), width, height, false));
        context.spacingAfter(section, SPACING_AFTER_MM).ifPresent(elements::add);
        return elements;
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.IMAGE;
    }

    Optional<BufferedImage> decode(String src) {
        if (!src.startsWith(DATA_IMAGE_PREFIX)) {
            if (!src.isEmpty()) {
                log.debug("Dropping image with unsupported source scheme");
            }
            return Optional.empty();
        }
        int marker = src.indexOf(BASE64_MARKER);
        if (marker < 0) {
            log.debug("Dropping data URI image that is not base64 encoded");
            return Optional.empty();
        }
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(src.substring(marker + BASE64_MARKER.length()));
        } catch (IllegalArgumentException e) {
            log.warn("Dropping image with invalid base64 payload: {}", e.getMessage());
            return Optional.empty();
        }
        if (bytes.length > properties.getMaxImageBytes()) {
            log.warn("Dropping image of {} bytes, limit is {}", bytes.length, properties.getMaxImageBytes());
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(ImageIO.read(new ByteArrayInputStream(bytes)));
        } catch (IOException e) {
            log.warn("Dropping unreadable image: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
