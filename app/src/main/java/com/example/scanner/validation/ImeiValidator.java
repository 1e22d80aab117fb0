package com.example.scanner.validation;

import com.example.scanner.models.IdentifierCandidate;
import com.example.scanner.models.IdentifierKind;
import com.example.scanner.models.RejectReason;
import com.example.scanner.models.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an IMEI candidate is accepted: not denylisted, exactly
 * 15 ASCII digits, and Luhn-valid.
 */
public class ImeiValidator {

    private static final Logger log = LoggerFactory.getLogger(ImeiValidator.class);

    public static final int IMEI_LENGTH = 15;

    private final LuhnCheckDigitValidator luhn;

    public ImeiValidator() {
        this(new LuhnCheckDigitValidator());
    }

    public ImeiValidator(LuhnCheckDigitValidator luhn) {
        this.luhn = luhn;
    }

    public ValidationResult validate(IdentifierCandidate candidate) {
        RejectReason reason = check(candidate.value);
        if (reason == RejectReason.NONE) {
            return ValidationResult.accepted(candidate);
        }
        log.debug("❌ Rejected {}: {}", candidate.value, reason);
        return ValidationResult.rejected(candidate, reason);
    }

    /**
     * Mobile candidates are never checksum-validated.
     */
    public boolean isAccepted(IdentifierCandidate candidate) {
        return candidate.kind == IdentifierKind.IMEI && check(candidate.value) == RejectReason.NONE;
    }

    public static boolean isStructurallyValid(String value) {
        if (value == null || value.length() != IMEI_LENGTH) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private RejectReason check(String value) {
        if (ProductBarcodeDenylist.isDenylisted(value)) {
            return RejectReason.DENYLISTED;
        }
        if (!isStructurallyValid(value)) {
            return RejectReason.BAD_LENGTH;
        }
        if (!luhn.isValid(value)) {
            return RejectReason.BAD_CHECKSUM;
        }
        return RejectReason.NONE;
    }
}
