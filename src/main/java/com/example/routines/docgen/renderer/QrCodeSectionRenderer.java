package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.ImageElement;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.qr.QrCodeGenerator;
import com.example.routines.docgen.qr.QrPayloadResolver;
import com.example.routines.docgen.util.UnitConverter;
import com.example.routines.docgen.util.Values;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * QR code placed in the content flow by its own section, independent of the
 * template-level QR directive.
 */
@Component
@RequiredArgsConstructor
public class QrCodeSectionRenderer implements SectionRenderer {
    private static final double DEFAULT_SIZE_MM = 60;
    private static final double SPACING_AFTER_MM = 4;

    private final QrPayloadResolver payloadResolver;
    private final QrCodeGenerator generator;

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        List<LayoutElement> elements = new ArrayList<>();
        Object source = section.get("data_source");
        Object custom = section.get("custom_data");
        Optional<BufferedImage> image = payloadResolver
                .resolve(source == null ? null : Values.asString(source),
                        custom == null ? null : Values.asString(custom),
                        context.getData())
                .flatMap(generator::generate);
        if (!image.isPresent()) {
            return elements;
        }
        float size = (float) UnitConverter.toPoints(section.get("size"), DEFAULT_SIZE_MM);
        if (size <= 0) {
            return elements;
        }
        elements.add(new ImageElement(image.get(), size, size, true));
        context.spacingAfter(section, SPACING_AFTER_MM).ifPresent(elements::add);
        return elements;
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.QR_CODE;
    }
}
