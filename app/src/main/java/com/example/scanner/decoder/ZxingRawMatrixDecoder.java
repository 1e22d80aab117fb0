package com.example.scanner.decoder;

import com.example.scanner.models.DecodedPayload;
import com.example.scanner.models.SourceMethod;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.ChecksumException;
import com.google.zxing.DecodeHintType;
import com.google.zxing.FormatException;
import com.google.zxing.LuminanceSource;
import com.google.zxing.NotFoundException;
import com.google.zxing.RGBLuminanceSource;
import com.google.zxing.Result;
import com.google.zxing.common.GlobalHistogramBinarizer;
import com.google.zxing.qrcode.QRCodeReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes a QR code from the raw ARGB pixel matrix with a global
 * threshold, trying the inverted image when the normal one fails
 * (white-on-black stickers).
 */
public class ZxingRawMatrixDecoder implements RawMatrixDecoder {
    private static final Logger log = LoggerFactory.getLogger(ZxingRawMatrixDecoder.class);

    private static final Map<DecodeHintType, Object> HINTS = new EnumMap<>(DecodeHintType.class);
    static {
        HINTS.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
    }

    @Override
    public Optional<DecodedPayload> decode(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        LuminanceSource source = new RGBLuminanceSource(width, height, pixels);

        Optional<String> text = tryDecode(source);
        if (text.isEmpty()) {
            text = tryDecode(source.invert());
        }
        text.ifPresent(t -> log.debug("🔲 Raw matrix QR: {}", t));
        return text.map(t -> new DecodedPayload(t, SourceMethod.RAW_MATRIX));
    }

    private Optional<String> tryDecode(LuminanceSource source) {
        QRCodeReader reader = new QRCodeReader();
        try {
            Result result = reader.decode(new BinaryBitmap(new GlobalHistogramBinarizer(source)), HINTS);
            return Optional.ofNullable(result.getText()).filter(t -> !t.isBlank());
        } catch (NotFoundException | ChecksumException | FormatException e) {
            log.trace("Raw matrix decode miss: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }
}
