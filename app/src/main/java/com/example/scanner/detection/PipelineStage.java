package com.example.scanner.detection;

/**
 * Escalating decode attempts, in the order the pipeline runs them.
 */
public enum PipelineStage {
    BARCODE_ORIGINAL(ImageVariant.ORIGINAL, Capability.BARCODE),
    OCR_ORIGINAL(ImageVariant.ORIGINAL, Capability.OCR),
    RAW_MATRIX_ORIGINAL(ImageVariant.ORIGINAL, Capability.RAW_MATRIX),
    BARCODE_ENHANCED(ImageVariant.CONTRAST_ENHANCED, Capability.BARCODE),
    RAW_MATRIX_ENHANCED(ImageVariant.CONTRAST_ENHANCED, Capability.RAW_MATRIX),
    BARCODE_RESIZED(ImageVariant.RESIZED, Capability.BARCODE),
    RAW_MATRIX_RESIZED(ImageVariant.RESIZED, Capability.RAW_MATRIX),
    OCR_COMPREHENSIVE(ImageVariant.OCR_OPTIMIZED, Capability.OCR);

    public enum ImageVariant {
        ORIGINAL,
        CONTRAST_ENHANCED,
        RESIZED,
        OCR_OPTIMIZED
    }

    public enum Capability {
        BARCODE,
        RAW_MATRIX,
        OCR
    }

    public final ImageVariant variant;
    public final Capability capability;

    PipelineStage(ImageVariant variant, Capability capability) {
        this.variant = variant;
        this.capability = capability;
    }
}
