package com.example.scanner.decoder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.example.scanner.models.DecodedPayload;
import com.example.scanner.models.SourceMethod;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.MultiFormatWriter;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;

import org.junit.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ZxingDecodersTest {

    @Test
    public void barcodeDecoder_qrCode_reportedAs2d() throws WriterException {
        BufferedImage image = qr("IMEI1: 354626223546262", 300);

        List<DecodedPayload> payloads = new ZxingBarcodeDecoder().decode(image);

        assertEquals(1, payloads.size());
        assertEquals("IMEI1: 354626223546262", payloads.get(0).text);
        assertEquals(SourceMethod.BARCODE_2D, payloads.get(0).sourceMethod);
    }

    @Test
    public void barcodeDecoder_code128_reportedAs1d() throws WriterException {
        BitMatrix matrix = new MultiFormatWriter().encode("354626223546262", BarcodeFormat.CODE_128, 600, 150);
        BufferedImage image = MatrixToImageWriter.toBufferedImage(matrix);

        List<DecodedPayload> payloads = new ZxingBarcodeDecoder().decode(image);

        assertEquals(1, payloads.size());
        assertEquals("354626223546262", payloads.get(0).text);
        assertEquals(SourceMethod.BARCODE_1D, payloads.get(0).sourceMethod);
    }

    @Test
    public void barcodeDecoder_blankImage_empty() {
        assertTrue(new ZxingBarcodeDecoder().decode(blank(200, 200)).isEmpty());
    }

    @Test
    public void rawMatrixDecoder_qrCode_decoded() throws WriterException {
        Optional<DecodedPayload> payload = new ZxingRawMatrixDecoder().decode(qr("861234567890127", 250));

        assertTrue(payload.isPresent());
        assertEquals("861234567890127", payload.get().text);
        assertEquals(SourceMethod.RAW_MATRIX, payload.get().sourceMethod);
    }

    @Test
    public void rawMatrixDecoder_invertedQrCode_decoded() throws WriterException {
        BufferedImage image = qr("861234567890127", 250);
        BufferedImage inverted = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                inverted.setRGB(x, y, ~image.getRGB(x, y) & 0xFFFFFF);
            }
        }

        Optional<DecodedPayload> payload = new ZxingRawMatrixDecoder().decode(inverted);

        assertTrue(payload.isPresent());
        assertEquals("861234567890127", payload.get().text);
    }

    @Test
    public void rawMatrixDecoder_blankImage_empty() {
        assertFalse(new ZxingRawMatrixDecoder().decode(blank(120, 120)).isPresent());
    }

    private static BufferedImage qr(String text, int size) throws WriterException {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.MARGIN, 4);
        BitMatrix matrix = new QRCodeWriter().encode(text, BarcodeFormat.QR_CODE, size, size, hints);
        return MatrixToImageWriter.toBufferedImage(matrix);
    }

    private static BufferedImage blank(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }
}
