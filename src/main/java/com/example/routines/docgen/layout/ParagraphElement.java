package com.example.routines.docgen.layout;

import lombok.Value;

import java.awt.Color;

@Value
public class ParagraphElement implements LayoutElement {
    String text;
    TextStyle style;
    /** Overrides the style colour when set. */
    Color color;

    public ParagraphElement(String text, TextStyle style) {
        this(text, style, null);
    }

    public ParagraphElement(String text, TextStyle style, Color color) {
        this.text = text;
        this.style = style;
        this.color = color;
    }

    public Color effectiveColor() {
        return color != null ? color : style.getColor();
    }
}
