package com.example.routines.docgen.service;

import com.example.routines.docgen.aspect.LogExecutionTime;
import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.exception.RenderException;
import com.example.routines.docgen.expression.ExpressionResolver;
import com.example.routines.docgen.layout.ImageElement;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.layout.PageBreakElement;
import com.example.routines.docgen.layout.PageDecorator;
import com.example.routines.docgen.layout.PageGeometry;
import com.example.routines.docgen.layout.ParagraphElement;
import com.example.routines.docgen.layout.PdfLayoutWriter;
import com.example.routines.docgen.layout.SpacerElement;
import com.example.routines.docgen.layout.TextStyle;
import com.example.routines.docgen.model.Page;
import com.example.routines.docgen.model.QrCodeConfig;
import com.example.routines.docgen.model.QrPosition;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.model.TemplateConfig;
import com.example.routines.docgen.qr.QrCodeGenerator;
import com.example.routines.docgen.qr.QrOverlayDecorator;
import com.example.routines.docgen.qr.QrPayloadResolver;
import com.example.routines.docgen.renderer.SectionRenderer;
import com.example.routines.docgen.util.ContentHashing;
import com.example.routines.docgen.util.UnitConverter;
import com.example.routines.docgen.util.Values;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main orchestrator for document rendering.
 *
 * Resolves variables, lays out every page's sections through the section
 * renderers, applies the template's QR directive and encodes the flow as a
 * PDF. Bad content degrades silently inside the renderers; only unexpected
 * failures surface, as {@link RenderException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentComposer {
    static final double OVERLAY_QR_SIZE_MM = 40;
    static final double INLINE_QR_SIZE_MM = 40;
    static final double SEPARATE_QR_SIZE_MM = 60;
    static final String SEPARATE_QR_HEADING = "QR";
    private static final float INLINE_QR_GAP = 6f;
    private static final float SEPARATE_QR_GAP = 12f;
    private static final byte[] FALLBACK_DOCUMENT_ID = "routine-docgen-id".getBytes(StandardCharsets.US_ASCII);

    private final List<SectionRenderer> renderers;
    private final ExpressionResolver expressionResolver;
    private final VariableResolver variableResolver;
    private final QrPayloadResolver qrPayloadResolver;
    private final QrCodeGenerator qrCodeGenerator;

    /** Layout flow and page decorators of one render. */
    @Value
    static class Composition {
        PageGeometry geometry;
        Map<String, Object> data;
        List<LayoutElement> flow;
        List<PageDecorator> decorators;
    }

    /**
     * Render a template to PDF bytes.
     *
     * @param template parsed template
     * @param data     caller data; may be null
     * @return the PDF document
     */
    @LogExecutionTime("Document Rendering")
    public byte[] render(TemplateConfig template, Map<String, Object> data) {
        log.info("Rendering template '{}' ({} pages)", template.getMetadata().getName(), template.getPages().size());
        try {
            Composition composition = compose(template, data);
            byte[] id = documentId(template, composition.getData());
            return new PdfLayoutWriter(composition.getGeometry())
                    .write(composition.getFlow(), composition.getDecorators(), id);
        } catch (RenderException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("Rendering template '{}' failed", template.getMetadata().getName(), e);
            throw new RenderException(RenderException.RENDER_FAILED, "Failed to render document: " + e.getMessage(), e);
        }
    }

    public byte[] render(Map<String, Object> rawTemplate, Map<String, Object> data) {
        return render(TemplateConfig.from(rawTemplate), data);
    }

    /**
     * Render and write the document to {@code output}, creating parent
     * directories as needed.
     */
    public Path render(TemplateConfig template, Map<String, Object> data, Path output) {
        byte[] pdf = render(template, data);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(output, pdf);
            return output;
        } catch (IOException e) {
            throw new RenderException(RenderException.OUTPUT_WRITE_FAILED, "Cannot write " + output, e);
        }
    }

    public void render(TemplateConfig template, Map<String, Object> data, OutputStream output) {
        byte[] pdf = render(template, data);
        try {
            output.write(pdf);
        } catch (IOException e) {
            throw new RenderException(RenderException.OUTPUT_WRITE_FAILED, "Cannot write document to stream", e);
        }
    }

    /**
     * The layout primitives a render would paginate, QR elements included.
     */
    public List<LayoutElement> buildContentFlow(TemplateConfig template, Map<String, Object> data) {
        return compose(template, data).getFlow();
    }

    Composition compose(TemplateConfig template, Map<String, Object> data) {
        Map<String, Object> resolved = variableResolver.resolve(template, data);
        PageGeometry geometry = PageGeometry.from(template.getLayout());
        RenderContext context = new RenderContext(template, resolved, geometry, expressionResolver);

        List<LayoutElement> flow = new ArrayList<>();
        List<Page> pages = template.getPages();
        for (int p = 0; p < pages.size(); p++) {
            context.setCurrentPageIndex(p);
            List<Section> sections = pages.get(p).getSections();
            for (int s = 0; s < sections.size(); s++) {
                Section section = sections.get(s);
                context.setCurrentSectionIndex(s);
                flow.addAll(findRenderer(section.getType()).render(section, context));
            }
            if (p < pages.size() - 1) {
                flow.add(PageBreakElement.INSTANCE);
            }
        }

        List<PageDecorator> decorators = new ArrayList<>();
        applyQrDirective(template.getQrCode(), resolved, flow, decorators);
        return new Composition(geometry, resolved, flow, decorators);
    }

    private void applyQrDirective(QrCodeConfig qr, Map<String, Object> data,
                                  List<LayoutElement> flow, List<PageDecorator> decorators) {
        if (!qr.isActive()) {
            return;
        }
        Optional<BufferedImage> image = qrPayloadResolver
                .resolve(qr.getDataSource(), qr.getCustomData(), data)
                .flatMap(qrCodeGenerator::generate);
        if (!image.isPresent()) {
            log.debug("QR code disabled for this render: no payload for source '{}'", qr.getDataSource());
            return;
        }
        QrPosition position = qr.getPosition();
        switch (position) {
            case HEADER:
            case FOOTER: {
                float[] size = qrSize(qr.getSize(), OVERLAY_QR_SIZE_MM);
                decorators.add(new QrOverlayDecorator(image.get(), position, size[0], size[1]));
                break;
            }
            case INLINE: {
                float[] size = qrSize(qr.getSize(), INLINE_QR_SIZE_MM);
                flow.add(new SpacerElement(INLINE_QR_GAP));
                flow.add(new ImageElement(image.get(), size[0], size[1], true));
                break;
            }
            case SEPARATE: {
                float[] size = qrSize(qr.getSize(), SEPARATE_QR_SIZE_MM);
                flow.add(PageBreakElement.INSTANCE);
                flow.add(new ParagraphElement(SEPARATE_QR_HEADING, TextStyle.SECTION_HEADER));
                flow.add(new SpacerElement(SEPARATE_QR_GAP));
                flow.add(new ImageElement(image.get(), size[0], size[1], true));
                break;
            }
            default:
                break;
        }
    }

    /**
     * Width and height in points from a single length or a
     * {@code {width, height}} map.
     */
    static float[] qrSize(Object size, double defaultMm) {
        if (size instanceof Map) {
            Map<String, Object> map = Values.asMap(size);
            return new float[]{
                    (float) UnitConverter.toPoints(map.get("width"), defaultMm),
                    (float) UnitConverter.toPoints(map.get("height"), defaultMm)};
        }
        float side = (float) UnitConverter.toPoints(size, defaultMm);
        if (side <= 0) {
            side = (float) UnitConverter.mm(defaultMm);
        }
        return new float[]{side, side};
    }

    /**
     * Trailer id derived from the render inputs, so identical inputs give
     * identical bytes.
     */
    private static byte[] documentId(TemplateConfig template, Map<String, Object> data) {
        try {
            String canonical = ContentHashing.canonicalJson(Arrays.asList(template.getSource(), data));
            return Arrays.copyOf(ContentHashing.sha256(canonical.getBytes(StandardCharsets.UTF_8)), 16);
        } catch (IllegalArgumentException e) {
            log.debug("Render inputs are not serializable, using the fixed document id: {}", e.getMessage());
            return FALLBACK_DOCUMENT_ID.clone();
        }
    }

    private SectionRenderer findRenderer(SectionType type) {
        return renderers.stream()
                .filter(r -> r.supports(type))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOperationException(
                        "No renderer found for section type: " + type));
    }
}
