package com.example.routines.docgen.layout;

import lombok.Value;

import java.awt.image.BufferedImage;

/**
 * Bitmap placed centred in the frame. Width and height are in points.
 */
@Value
public class ImageElement implements LayoutElement {
    BufferedImage image;
    float width;
    float height;
    boolean qrCode;
}
