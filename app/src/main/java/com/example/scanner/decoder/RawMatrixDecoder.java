package com.example.scanner.decoder;

import com.example.scanner.models.DecodedPayload;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * QR-only decode straight from the raw pixel matrix, without the
 * multi-format reader's localisation heuristics.
 */
public interface RawMatrixDecoder {

    Optional<DecodedPayload> decode(BufferedImage image) throws Exception;
}
