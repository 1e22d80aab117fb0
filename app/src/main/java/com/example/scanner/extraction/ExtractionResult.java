package com.example.scanner.extraction;

import com.example.scanner.models.IdentifierCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, value-deduplicated IMEI and mobile candidate lists. The first
 * occurrence of a value wins; later duplicates are dropped.
 */
public class ExtractionResult {

    private final Map<String, IdentifierCandidate> imeiCandidates = new LinkedHashMap<>();
    private final Map<String, IdentifierCandidate> mobileCandidates = new LinkedHashMap<>();

    public boolean addImei(IdentifierCandidate candidate) {
        return imeiCandidates.putIfAbsent(candidate.value, candidate) == null;
    }

    public boolean addMobile(IdentifierCandidate candidate) {
        return mobileCandidates.putIfAbsent(candidate.value, candidate) == null;
    }

    public boolean containsImei(String value) {
        return imeiCandidates.containsKey(value);
    }

    /**
     * Appends every candidate of {@code other} that is not already present.
     */
    public void merge(ExtractionResult other) {
        other.imeiCandidates.values().forEach(this::addImei);
        other.mobileCandidates.values().forEach(this::addMobile);
    }

    public List<IdentifierCandidate> getImeiCandidates() {
        return Collections.unmodifiableList(new ArrayList<>(imeiCandidates.values()));
    }

    public List<IdentifierCandidate> getMobileCandidates() {
        return Collections.unmodifiableList(new ArrayList<>(mobileCandidates.values()));
    }

    public boolean isEmpty() {
        return imeiCandidates.isEmpty() && mobileCandidates.isEmpty();
    }

    @Override
    public String toString() {
        return "imei=" + imeiCandidates.keySet() + ", mobile=" + mobileCandidates.keySet();
    }
}
