package com.example.scanner.detection;

import static org.junit.Assert.assertEquals;

import com.example.scanner.Configuration;
import com.example.scanner.utils.OpenCvLoader;

import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;

import java.awt.image.BufferedImage;

public class OpenCvImagePreprocessorTest {

    private OpenCvImagePreprocessor preprocessor;

    @Before
    public void setUp() {
        Assume.assumeTrue("OpenCV native library not available", OpenCvLoader.tryLoad());
        preprocessor = new OpenCvImagePreprocessor(new Configuration.Builder().build());
    }

    @Test
    public void enhanceContrast_scalesAndSaturates() {
        BufferedImage image = gray(20, 10, 100);
        image.setRGB(0, 0, 0xC8C8C8);

        BufferedImage result = preprocessor.enhanceContrast(image);

        assertEquals(150, result.getRGB(5, 5) & 0xFF);
        assertEquals(255, result.getRGB(0, 0) & 0xFF);
        assertEquals(20, result.getWidth());
    }

    @Test
    public void resize_toConfiguredDimensions() {
        BufferedImage result = preprocessor.resize(gray(800, 600, 128));

        assertEquals(400, result.getWidth());
        assertEquals(400, result.getHeight());
    }

    @Test
    public void prepareForOcr_grayscaleSameSize() {
        BufferedImage result = preprocessor.prepareForOcr(gray(120, 80, 90));

        assertEquals(BufferedImage.TYPE_BYTE_GRAY, result.getType());
        assertEquals(120, result.getWidth());
        assertEquals(80, result.getHeight());
    }

    private static BufferedImage gray(int width, int height, int level) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        int rgb = (level << 16) | (level << 8) | level;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }
}
