package com.example.scanner.decoder;

import com.example.scanner.models.DecodedPayload;
import com.example.scanner.models.SourceMethod;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.ResultPoint;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.GenericMultipleBarcodeReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ZXing multi-format decoder. Phone boxes usually carry several barcodes
 * (IMEI1, IMEI2, serial, EAN), so every barcode found is returned.
 */
public class ZxingBarcodeDecoder implements BarcodeDecoder {
    private static final Logger log = LoggerFactory.getLogger(ZxingBarcodeDecoder.class);

    private static final Set<BarcodeFormat> MATRIX_FORMATS = EnumSet.of(
            BarcodeFormat.QR_CODE,
            BarcodeFormat.DATA_MATRIX,
            BarcodeFormat.PDF_417,
            BarcodeFormat.AZTEC,
            BarcodeFormat.MAXICODE);

    private static final Map<DecodeHintType, Object> HINTS = new EnumMap<>(DecodeHintType.class);
    static {
        HINTS.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
    }

    @Override
    public List<DecodedPayload> decode(BufferedImage image) {
        LuminanceSource source = new BufferedImageLuminanceSource(image);
        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(source));
        MultiFormatReader baseReader = new MultiFormatReader();
        GenericMultipleBarcodeReader multiReader = new GenericMultipleBarcodeReader(baseReader);

        Result[] results;
        try {
            results = multiReader.decodeMultiple(bitmap, HINTS);
        } catch (NotFoundException e) {
            log.trace("No barcode in {}x{} image", image.getWidth(), image.getHeight());
            return List.of();
        } finally {
            baseReader.reset();
        }

        List<Result> ordered = new ArrayList<>(Arrays.asList(results));
        ordered.sort(Comparator.comparingDouble(ZxingBarcodeDecoder::topOf)
                .thenComparingDouble(ZxingBarcodeDecoder::leftOf));

        List<DecodedPayload> payloads = new ArrayList<>();
        for (Result result : ordered) {
            String text = result.getText();
            if (text == null || text.isBlank()) {
                continue;
            }
            SourceMethod method = MATRIX_FORMATS.contains(result.getBarcodeFormat())
                    ? SourceMethod.BARCODE_2D : SourceMethod.BARCODE_1D;
            log.debug("📦 {} barcode: {}", result.getBarcodeFormat(), text);
            payloads.add(new DecodedPayload(text, method));
        }
        return payloads;
    }

    private static double topOf(Result result) {
        ResultPoint[] points = result.getResultPoints();
        if (points == null) return Double.MAX_VALUE;
        double top = Double.MAX_VALUE;
        for (ResultPoint p : points) {
            if (p != null) top = Math.min(top, p.getY());
        }
        return top;
    }

    private static double leftOf(Result result) {
        ResultPoint[] points = result.getResultPoints();
        if (points == null) return Double.MAX_VALUE;
        double left = Double.MAX_VALUE;
        for (ResultPoint p : points) {
            if (p != null) left = Math.min(left, p.getX());
        }
        return left;
    }
}
