package com.example.routines.docgen.qr;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Encodes payloads as QR bitmaps. The bitmap is scaled to its final size
 * when placed on the page.
 */
@Slf4j
@Component
public class QrCodeGenerator {
    static final int PIXEL_SIZE = 300;

    private final QRCodeWriter writer = new QRCodeWriter();

    public Optional<BufferedImage> generate(String payload) {
        if (payload == null || payload.isEmpty()) {
            return Optional.empty();
        }
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.CHARACTER_SET, "UTF-8");
        hints.put(EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.M);
        hints.put(EncodeHintType.MARGIN, 1);
        try {
            BitMatrix matrix = writer.encode(payload, BarcodeFormat.QR_CODE, PIXEL_SIZE, PIXEL_SIZE, hints);
            return Optional.of(MatrixToImageWriter.toBufferedImage(matrix));
        } catch (WriterException | IllegalArgumentException e) {
            log.warn("QR code could not be encoded, skipping it: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
