package com.example.scanner.models;

/**
 * The single identifier reported to the caller, or an explicit failure.
 */
public class ScanResult {

    public enum Status {
        /** Luhn-valid, non-denylisted IMEI. */
        IMEI_VALIDATED,
        /** Lenient fallback: IMEI-shaped but failed validation. */
        IMEI_UNVERIFIED,
        MOBILE_NUMBER,
        /** Operator-typed value, not validated. */
        MANUAL_ENTRY,
        NOT_FOUND
    }

    public final Status status;
    public final String value;
    public final IdentifierKind kind;
    public final SourceMethod sourceMethod;
    public final ScanErrorType errorType;

    private ScanResult(Status status, String value, IdentifierKind kind,
                       SourceMethod sourceMethod, ScanErrorType errorType) {
        this.status = status;
        this.value = value;
        this.kind = kind;
        this.sourceMethod = sourceMethod;
        this.errorType = errorType;
    }

    public static ScanResult validatedImei(IdentifierCandidate candidate) {
        return new ScanResult(Status.IMEI_VALIDATED, candidate.value, IdentifierKind.IMEI,
                candidate.sourceMethod, null);
    }

    public static ScanResult unverifiedImei(IdentifierCandidate candidate) {
        return new ScanResult(Status.IMEI_UNVERIFIED, candidate.value, IdentifierKind.IMEI,
                candidate.sourceMethod, ScanErrorType.VALIDATION_FAILED);
    }

    public static ScanResult mobile(IdentifierCandidate candidate) {
        return new ScanResult(Status.MOBILE_NUMBER, candidate.value, IdentifierKind.MOBILE,
                candidate.sourceMethod, null);
    }

    public static ScanResult manualEntry(String value) {
        return new ScanResult(Status.MANUAL_ENTRY, value, null, SourceMethod.MANUAL, null);
    }

    public static ScanResult notFound() {
        return new ScanResult(Status.NOT_FOUND, null, null, null, ScanErrorType.NO_IDENTIFIER_FOUND);
    }

    public boolean isFound() {
        return status != Status.NOT_FOUND;
    }

    public boolean isValidatedImei() {
        return status == Status.IMEI_VALIDATED;
    }

    @Override
    public String toString() {
        return "ScanResult{" + status + (value != null ? ", " + value : "")
                + (sourceMethod != null ? ", " + sourceMethod : "") + "}";
    }
}
