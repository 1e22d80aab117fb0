package com.example.scanner.detection;

import java.awt.image.BufferedImage;

/**
 * Derives the alternative images the pipeline retries on. Implementations
 * never modify the input.
 */
public interface ImagePreprocessor {

    /**
     * Per-pixel linear gain, clamped to 255.
     */
    BufferedImage enhanceContrast(BufferedImage image);

    /**
     * Copy scaled to the configured fixed size.
     */
    BufferedImage resize(BufferedImage image);

    /**
     * Grayscale, locally equalised and sharpened copy for the final OCR pass.
     */
    BufferedImage prepareForOcr(BufferedImage image);
}
