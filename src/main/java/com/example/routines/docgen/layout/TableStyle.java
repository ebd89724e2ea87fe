package com.example.routines.docgen.layout;

import lombok.Builder;
import lombok.Value;

import java.awt.Color;

/**
 * Presentation of a {@link TableElement}.
 */
@Value
@Builder
public class TableStyle {
    public static final Color HEADER_BACKGROUND = new Color(211, 211, 211);
    public static final Color HIGHLIGHT_BACKGROUND = new Color(255, 242, 204);
    public static final Color GRID_COLOR = Color.GRAY;

    /** Leading rows drawn bold on a grey background. */
    @Builder.Default
    int headerRows = 0;
    /** Redraw the header rows at the top of every continuation page. */
    @Builder.Default
    boolean repeatHeader = false;
    @Builder.Default
    float fontSize = 9f;
    /** Zero-based column drawn on a highlight background, -1 for none. */
    @Builder.Default
    int highlightColumn = -1;
    /** First column drawn bold (key/value blocks). */
    @Builder.Default
    boolean boldFirstColumn = false;

    public static TableStyle plain() {
        return TableStyle.builder().build();
    }

    public static TableStyle withHeader() {
        return TableStyle.builder().headerRows(1).repeatHeader(true).build();
    }
}
