package com.example.scanner.decoder;

import com.example.scanner.models.DecodedPayload;
import com.example.scanner.models.SourceMethod;
import com.example.scanner.ocr.OcrTextProcessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * Boundary around the three decode capabilities. A capability that throws
 * is logged and treated as "no result"; nothing is retried here.
 */
public class DecoderAdapter {
    private static final Logger log = LoggerFactory.getLogger(DecoderAdapter.class);

    private final BarcodeDecoder barcodeDecoder;
    private final RawMatrixDecoder rawMatrixDecoder;
    private final TextRecognizer textRecognizer;
    private final OcrTextProcessor ocrTextProcessor;

    public DecoderAdapter(BarcodeDecoder barcodeDecoder,
                          RawMatrixDecoder rawMatrixDecoder,
                          TextRecognizer textRecognizer,
                          OcrTextProcessor ocrTextProcessor) {
        this.barcodeDecoder = barcodeDecoder;
        this.rawMatrixDecoder = rawMatrixDecoder;
        this.textRecognizer = textRecognizer;
        this.ocrTextProcessor = ocrTextProcessor;
    }

    public List<DecodedPayload> decodeBarcodes(BufferedImage image) {
        try {
            List<DecodedPayload> payloads = barcodeDecoder.decode(image);
            return payloads != null ? payloads : List.of();
        } catch (Exception e) {
            log.warn("⚠️ Barcode decoder failed, treating as no result: {}", e.toString());
            return List.of();
        }
    }

    public Optional<DecodedPayload> decodeRawMatrix(BufferedImage image) {
        try {
            Optional<DecodedPayload> payload = rawMatrixDecoder.decode(image);
            return payload != null ? payload : Optional.empty();
        } catch (Exception e) {
            log.warn("⚠️ Raw matrix decoder failed, treating as no result: {}", e.toString());
            return Optional.empty();
        }
    }

    public Optional<DecodedPayload> recognizeText(BufferedImage image) {
        String text;
        try {
            text = textRecognizer.recognize(image);
        } catch (Exception | LinkageError e) {
            // LinkageError: native OCR library missing on this host
            log.warn("⚠️ Text recognizer failed, treating as no result: {}", e.toString());
            return Optional.empty();
        }
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new DecodedPayload(ocrTextProcessor.clean(text), SourceMethod.OCR));
    }
}
