package com.example.scanner.detection;

import com.example.scanner.Configuration;
import com.example.scanner.utils.ImageUtils;
import com.example.scanner.utils.OpenCvLoader;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

public class OpenCvImagePreprocessor implements ImagePreprocessor {
    private static final Logger log = LoggerFactory.getLogger(OpenCvImagePreprocessor.class);

    private final Configuration config;

    public OpenCvImagePreprocessor(Configuration config) {
        this.config = config;
    }

    @Override
    public BufferedImage enhanceContrast(BufferedImage image) {
        OpenCvLoader.ensureLoaded();
        Mat src = ImageUtils.bufferedImageToMat(image);
        Mat enhanced = new Mat();
        try {
            // convertTo saturates, so values above 255 are clamped
            src.convertTo(enhanced, -1, config.contrastGain, 0);
            log.debug("🌗 Contrast x{} applied to {}x{}", config.contrastGain, image.getWidth(), image.getHeight());
            return ImageUtils.matToBufferedImage(enhanced);
        } finally {
            src.release();
            enhanced.release();
        }
    }

    @Override
    public BufferedImage resize(BufferedImage image) {
        OpenCvLoader.ensureLoaded();
        Mat src = ImageUtils.bufferedImageToMat(image);
        Mat resized = new Mat();
        try {
            Imgproc.resize(src, resized, new Size(config.resizeWidth, config.resizeHeight),
                    0, 0, Imgproc.INTER_AREA);
            log.debug("📐 Resized {}x{} -> {}x{}", image.getWidth(), image.getHeight(),
                    config.resizeWidth, config.resizeHeight);
            return ImageUtils.matToBufferedImage(resized);
        } finally {
            src.release();
            resized.release();
        }
    }

    @Override
    public BufferedImage prepareForOcr(BufferedImage image) {
        OpenCvLoader.ensureLoaded();
        Mat src = ImageUtils.bufferedImageToMat(image);
        Mat gray = new Mat();
        Mat enhanced = new Mat();
        Mat blurred = new Mat();
        Mat sharpened = new Mat();
        try {
            Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGR2GRAY);

            CLAHE clahe = Imgproc.createCLAHE(config.claheClipLimit,
                    new Size(config.claheTileSize, config.claheTileSize));
            clahe.apply(gray, enhanced);

            Imgproc.GaussianBlur(enhanced, blurred, new Size(0, 0), 3);
            Core.addWeighted(enhanced, 1.5, blurred, -0.5, 0, sharpened);

            return ImageUtils.matToBufferedImage(sharpened);
        } finally {
            src.release();
            gray.release();
            enhanced.release();
            blurred.release();
            sharpened.release();
        }
    }
}
