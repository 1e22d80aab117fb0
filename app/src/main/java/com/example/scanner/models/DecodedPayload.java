package com.example.scanner.models;

/**
 * Text produced by one decoder call. Consumed immediately by the extractor.
 */
public class DecodedPayload {
    public final String text;
    public final SourceMethod sourceMethod;

    public DecodedPayload(String text, SourceMethod sourceMethod) {
        this.text = text;
        this.sourceMethod = sourceMethod;
    }

    @Override
    public String toString() {
        return sourceMethod + "[" + text + "]";
    }
}
