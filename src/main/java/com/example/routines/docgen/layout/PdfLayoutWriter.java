package com.example.routines.docgen.layout;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Paginates a flow of layout primitives onto PDF pages.
 *
 * The cursor runs top-down inside the margin frame; an element that does not
 * fit moves to a new page. Page decorators run once per finished page. Output
 * is deterministic: no dates are written and the trailer id comes from the
 * caller.
 */
@Slf4j
public class PdfLayoutWriter {
    private static final PDFont REGULAR = PDType1Font.HELVETICA;
    private static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;
    private static final float CELL_PADDING = 3f;
    private static final float GRID_LINE_WIDTH = 0.5f;

    private final PageGeometry geometry;
    private final PDDocument document;
    private final Map<BufferedImage, PDImageXObject> imageObjects = new IdentityHashMap<>();

    private PDPageContentStream stream;
    private float cursorY;
    private boolean pageHasContent;
    private boolean breakPending;

    public PdfLayoutWriter(PageGeometry geometry) {
        this.geometry = geometry;
        this.document = new PDDocument();
    }

    /**
     * Lays out {@code elements}, applies the decorators and serialises the
     * document.
     *
     * @param documentId 16 bytes written as both halves of the trailer id
     */
    public byte[] write(List<LayoutElement> elements, List<PageDecorator> decorators, byte[] documentId)
            throws IOException {
        try {
            for (LayoutElement element : elements) {
                place(element);
            }
            if (document.getNumberOfPages() == 0) {
                startPage();
            }
            closeStream();

            for (int i = 0; i < document.getNumberOfPages(); i++) {
                PDPage page = document.getPage(i);
                for (PageDecorator decorator : decorators) {
                    decorator.decorate(document, page, i, geometry);
                }
            }

            COSArray id = new COSArray();
            id.add(new COSString(documentId));
            id.add(new COSString(documentId));
            document.getDocument().getTrailer().setItem(COSName.ID, id);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        } finally {
            closeStream();
            document.close();
        }
    }

    private void place(LayoutElement element) throws IOException {
        if (element instanceof ParagraphElement) {
            drawParagraph((ParagraphElement) element);
        } else if (element instanceof TableElement) {
            drawTable((TableElement) element);
        } else if (element instanceof ImageElement) {
            drawImage((ImageElement) element);
        } else if (element instanceof SpacerElement) {
            addSpace(((SpacerElement) element).getHeight());
        } else if (element instanceof PageBreakElement) {
            // consecutive breaks collapse into one
            if (breakPending) {
                return;
            }
            if (stream == null) {
                startPage();
            }
            breakPending = true;
        } else {
            log.debug("Ignoring unsupported layout element {}", element);
        }
    }

    // ---- pagination ----

    private void startPage() throws IOException {
        closeStream();
        PDPage page = new PDPage(geometry.toMediaBox());
        document.addPage(page);
        stream = new PDPageContentStream(document, page);
        cursorY = geometry.getPageHeight() - geometry.getMarginTop();
        pageHasContent = false;
        breakPending = false;
    }

    private void closeStream() throws IOException {
        if (stream != null) {
            stream.close();
            stream = null;
        }
    }

    /**
     * Makes sure {@code height} points are available, starting a new page when
     * they are not. A fresh page always accepts the element.
     */
    private void ensureRoom(float height) throws IOException {
        if (stream == null || breakPending) {
            startPage();
        } else if (pageHasContent && cursorY - height < geometry.getMarginBottom()) {
            startPage();
        }
        pageHasContent = true;
    }

    private void addSpace(float height) {
        if (stream == null || breakPending || !pageHasContent) {
            return;
        }
        cursorY = Math.max(geometry.getMarginBottom(), cursorY - height);
    }

    // ---- paragraphs ----

    private void drawParagraph(ParagraphElement paragraph) throws IOException {
        TextStyle style = paragraph.getStyle();
        PDFont font = style.isBold() ? BOLD : REGULAR;
        float size = style.getFontSize();
        List<String> lines = new ArrayList<>();
        for (String raw : paragraph.getText().split("\r?\n", -1)) {
            lines.addAll(wrap(sanitize(raw, font), font, size, geometry.getFrameWidth()));
        }
        if (pageHasContent) {
            addSpace(style.getSpaceBefore());
        }
        for (String line : lines) {
            ensureRoom(style.getLeading());
            cursorY -= style.getLeading();
            float width = textWidth(line, font, size);
            float x = style.isCentered()
                    ? geometry.getMarginLeft() + (geometry.getFrameWidth() - width) / 2
                    : geometry.getMarginLeft();
            showText(line, font, size, paragraph.effectiveColor(), x, cursorY + style.getLeading() * 0.25f);
        }
        addSpace(style.getSpaceAfter());
    }

    private void showText(String text, PDFont font, float size, Color color, float x, float y) throws IOException {
        if (text.isEmpty()) {
            return;
        }
        stream.beginText();
        stream.setNonStrokingColor(color);
        stream.setFont(font, size);
        stream.newLineAtOffset(x, y);
        stream.showText(text);
        stream.endText();
    }

    // ---- tables ----

    private void drawTable(TableElement table) throws IOException {
        int columns = table.getColumnCount();
        if (columns == 0) {
            return;
        }
        TableStyle style = table.getStyle();
        float columnWidth = geometry.getFrameWidth() / columns;
        float leading = style.getFontSize() * 1.2f;

        List<List<List<String>>> wrapped = new ArrayList<>();
        List<Float> heights = new ArrayList<>();
        for (int r = 0; r < table.getRows().size(); r++) {
            List<String> row = table.getRows().get(r);
            List<List<String>> cells = new ArrayList<>();
            int maxLines = 1;
            for (int c = 0; c < columns; c++) {
                PDFont font = cellFont(style, r, c);
                String text = c < row.size() && row.get(c) != null ? row.get(c) : "";
                List<String> lines = wrap(sanitize(text, font), font, style.getFontSize(),
                        columnWidth - 2 * CELL_PADDING);
                cells.add(lines);
                maxLines = Math.max(maxLines, lines.size());
            }
            wrapped.add(cells);
            heights.add(maxLines * leading + 2 * CELL_PADDING);
        }

        int headerRows = Math.min(style.getHeaderRows(), wrapped.size());
        for (int r = 0; r < wrapped.size(); r++) {
            int pagesBefore = document.getNumberOfPages();
            ensureRoom(heights.get(r));
            boolean continued = r > 0 && document.getNumberOfPages() != pagesBefore;
            if (continued && r >= headerRows && headerRows > 0 && style.isRepeatHeader()) {
                for (int h = 0; h < headerRows; h++) {
                    drawRow(wrapped.get(h), heights.get(h), h, style, columnWidth, leading);
                }
            }
            drawRow(wrapped.get(r), heights.get(r), r, style, columnWidth, leading);
        }
    }

    private void drawRow(List<List<String>> cells, float height, int rowIndex, TableStyle style,
                         float columnWidth, float leading) throws IOException {
        float top = cursorY;
        float bottom = top - height;
        boolean header = rowIndex < style.getHeaderRows();
        for (int c = 0; c < cells.size(); c++) {
            float x = geometry.getMarginLeft() + c * columnWidth;
            Color background = null;
            if (header) {
                background = TableStyle.HEADER_BACKGROUND;
            } else if (c == style.getHighlightColumn()) {
                background = TableStyle.HIGHLIGHT_BACKGROUND;
            }
            if (background != null) {
                stream.setNonStrokingColor(background);
                stream.addRect(x, bottom, columnWidth, height);
                stream.fill();
            }
            stream.setStrokingColor(TableStyle.GRID_COLOR);
            stream.setLineWidth(GRID_LINE_WIDTH);
            stream.addRect(x, bottom, columnWidth, height);
            stream.stroke();

            PDFont font = cellFont(style, rowIndex, c);
            float baseline = top - CELL_PADDING - style.getFontSize();
            for (String line : cells.get(c)) {
                showText(line, font, style.getFontSize(), Color.BLACK, x + CELL_PADDING, baseline);
                baseline -= leading;
            }
        }
        cursorY = bottom;
    }

    private static PDFont cellFont(TableStyle style, int row, int column) {
        boolean bold = row < style.getHeaderRows() || (column == 0 && style.isBoldFirstColumn());
        return bold ? BOLD : REGULAR;
    }

    // ---- images ----

    private void drawImage(ImageElement element) throws IOException {
        float width = element.getWidth();
        float height = element.getHeight();
        float scale = Math.min(1f, Math.min(geometry.getFrameWidth() / width, geometry.getFrameHeight() / height));
        width *= scale;
        height *= scale;
        ensureRoom(height);
        cursorY -= height;
        PDImageXObject xObject = imageObjects.get(element.getImage());
        if (xObject == null) {
            xObject = LosslessFactory.createFromImage(document, element.getImage());
            imageObjects.put(element.getImage(), xObject);
        }
        float x = geometry.getMarginLeft() + (geometry.getFrameWidth() - width) / 2;
        stream.drawImage(xObject, x, cursorY, width, height);
    }

    // ---- text helpers ----

    /**
     * Replaces characters the standard fonts cannot encode with '?'.
     */
    static String sanitize(String text, PDFont font) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t') {
                sb.append(' ');
                continue;
            }
            if (Character.isISOControl(c)) {
                continue;
            }
            try {
                font.encode(String.valueOf(c));
                sb.append(c);
            } catch (IllegalArgumentException | IOException e) {
                sb.append('?');
            }
        }
        return sb.toString();
    }

    static float textWidth(String text, PDFont font, float size) throws IOException {
        return font.getStringWidth(text) / 1000f * size;
    }

    /**
     * Greedy word wrap; words wider than the line are split by character.
     */
    static List<String> wrap(String text, PDFont font, float size, float maxWidth) throws IOException {
        if (text.isEmpty()) {
            return Collections.singletonList("");
        }
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : Arrays.asList(text.split(" ", -1))) {
            String candidate = line.length() == 0 ? word : line + " " + word;
            if (textWidth(candidate, font, size) <= maxWidth) {
                line.setLength(0);
                line.append(candidate);
                continue;
            }
            if (line.length() > 0) {
                lines.add(line.toString());
                line.setLength(0);
            }
            for (char c : word.toCharArray()) {
                if (line.length() > 0 && textWidth(line.toString() + c, font, size) > maxWidth) {
                    lines.add(line.toString());
                    line.setLength(0);
                }
                line.append(c);
            }
        }
        lines.add(line.toString());
        return lines;
    }
}
