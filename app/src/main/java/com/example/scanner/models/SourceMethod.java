package com.example.scanner.models;

/**
 * Which capability produced a piece of decoded text.
 */
public enum SourceMethod {
    BARCODE_1D,
    BARCODE_2D,
    RAW_MATRIX,
    OCR,
    MANUAL
}
