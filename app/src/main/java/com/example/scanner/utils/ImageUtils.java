package com.example.scanner.utils;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.File;
import java.io.IOException;

/**
 * Utility class for image operations including:
 * - Loading uploaded image files
 * - Converting between BufferedImage and OpenCV Mat
 */
public class ImageUtils {
    private static final Logger log = LoggerFactory.getLogger(ImageUtils.class);

    private ImageUtils() {}

    /**
     * Reads an uploaded image file.
     *
     * @throws IOException if the file cannot be read or is not a supported image format
     */
    public static BufferedImage loadImage(File file) throws IOException {
        if (file == null || !file.isFile()) {
            throw new IOException("Image file not found: " + file);
        }
        BufferedImage image = ImageIO.read(file);
        if (image == null) {
            throw new IOException("Unsupported image format: " + file.getName());
        }
        log.debug("🖼️ Loaded {}: {}x{}", file.getName(), image.getWidth(), image.getHeight());
        return image;
    }

    /**
     * Returns the image itself if it already has the requested type,
     * otherwise a converted copy.
     */
    public static BufferedImage convert(BufferedImage image, int type) {
        if (image.getType() == type) {
            return image;
        }
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), type);
        Graphics2D g = converted.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return converted;
    }

    /**
     * Converts to an 8-bit, 3-channel BGR Mat. The caller releases it.
     */
    public static Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage bgr = convert(image, BufferedImage.TYPE_3BYTE_BGR);
        byte[] data = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(bgr.getHeight(), bgr.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    /**
     * Converts a continuous 8-bit gray or BGR Mat back to a BufferedImage.
     */
    public static BufferedImage matToBufferedImage(Mat mat) {
        int type;
        if (mat.channels() == 1) {
            type = BufferedImage.TYPE_BYTE_GRAY;
        } else if (mat.channels() == 3) {
            type = BufferedImage.TYPE_3BYTE_BGR;
        } else {
            throw new IllegalArgumentException("Unsupported channel count: " + mat.channels());
        }
        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), type);
        byte[] data = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, data);
        return image;
    }
}
