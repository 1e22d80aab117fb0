package com.example.scanner.decoder;

import com.example.scanner.Configuration;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Tesseract OCR through Tess4J. The engine instance is not thread-safe;
 * calls are serialized.
 */
public class TesseractTextRecognizer implements TextRecognizer {
    private static final Logger log = LoggerFactory.getLogger(TesseractTextRecognizer.class);

    private final ITesseract tesseract;

    public TesseractTextRecognizer(Configuration config) {
        Tesseract engine = new Tesseract();
        if (config.tessDataPath != null) {
            engine.setDatapath(config.tessDataPath);
        }
        engine.setLanguage(config.ocrLanguage);
        engine.setPageSegMode(config.ocrPageSegMode);
        this.tesseract = engine;
        log.debug("✅ Tesseract configured: lang={}, psm={}, datapath={}",
                config.ocrLanguage, config.ocrPageSegMode, config.tessDataPath);
    }

    @Override
    public synchronized String recognize(BufferedImage image) throws TesseractException {
        long start = System.currentTimeMillis();
        String text = tesseract.doOCR(image);
        log.debug("📝 OCR finished in {} ms, {} chars", System.currentTimeMillis() - start,
                text != null ? text.length() : 0);
        return text != null ? text : "";
    }
}
