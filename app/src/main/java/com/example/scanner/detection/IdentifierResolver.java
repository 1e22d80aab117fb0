package com.example.scanner.detection;

import com.example.scanner.models.IdentifierCandidate;
import com.example.scanner.models.ScanResult;
import com.example.scanner.models.ValidationResult;
import com.example.scanner.validation.ImeiValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Picks the one identifier to report from the accumulated candidates.
 *
 * <ol>
 *   <li>first accepted IMEI in document order</li>
 *   <li>otherwise the first IMEI candidate, reported as unverified</li>
 *   <li>otherwise the first mobile candidate</li>
 *   <li>otherwise not found</li>
 * </ol>
 */
public class IdentifierResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentifierResolver.class);

    private final ImeiValidator validator;

    public IdentifierResolver(ImeiValidator validator) {
        this.validator = validator;
    }

    public Optional<IdentifierCandidate> firstAccepted(List<IdentifierCandidate> imeiCandidates) {
        for (IdentifierCandidate candidate : imeiCandidates) {
            ValidationResult validation = validator.validate(candidate);
            if (validation.isValid) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public ScanResult resolve(List<IdentifierCandidate> imeiCandidates,
                              List<IdentifierCandidate> mobileCandidates) {
        Optional<IdentifierCandidate> accepted = firstAccepted(imeiCandidates);
        if (accepted.isPresent()) {
            log.debug("✅ Resolved validated IMEI {}", accepted.get().value);
            return ScanResult.validatedImei(accepted.get());
        }

        if (!imeiCandidates.isEmpty()) {
            // TODO: confirm with product owners whether unverified IMEIs should be reported at all
            IdentifierCandidate fallback = imeiCandidates.get(0);
            log.debug("⚠️ No IMEI passed validation, falling back to {}", fallback.value);
            return ScanResult.unverifiedImei(fallback);
        }

        if (!mobileCandidates.isEmpty()) {
            IdentifierCandidate mobile = mobileCandidates.get(0);
            log.debug("📱 Resolved mobile number {}", mobile.value);
            return ScanResult.mobile(mobile);
        }

        log.debug("🚫 No identifier candidates");
        return ScanResult.notFound();
    }
}
