package com.example.scanner.decoder;

import com.example.scanner.models.DecodedPayload;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * 1D/2D barcode decode capability.
 */
public interface BarcodeDecoder {

    /**
     * Decode every barcode visible in the image.
     *
     * @return payloads in reading order, empty when nothing was found
     */
    List<DecodedPayload> decode(BufferedImage image) throws Exception;
}
