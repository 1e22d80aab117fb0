package com.example.scanner.decoder;

import java.awt.image.BufferedImage;

/**
 * OCR capability.
 */
public interface TextRecognizer {

    /**
     * @return recognized text, or an empty string when nothing was read
     */
    String recognize(BufferedImage image) throws Exception;
}
