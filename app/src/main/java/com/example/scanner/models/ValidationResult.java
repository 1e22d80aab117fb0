package com.example.scanner.models;

public class ValidationResult {
    public final IdentifierCandidate candidate;
    public final boolean isValid;
    public final RejectReason rejectReason;

    private ValidationResult(IdentifierCandidate candidate, boolean isValid, RejectReason rejectReason) {
        this.candidate = candidate;
        this.isValid = isValid;
        this.rejectReason = rejectReason;
    }

    public static ValidationResult accepted(IdentifierCandidate candidate) {
        return new ValidationResult(candidate, true, RejectReason.NONE);
    }

    public static ValidationResult rejected(IdentifierCandidate candidate, RejectReason reason) {
        return new ValidationResult(candidate, false, reason);
    }

    @Override
    public String toString() {
        return isValid ? "ACCEPTED " + candidate : "REJECTED(" + rejectReason + ") " + candidate;
    }
}
