package com.example.scanner.extraction;

import com.example.scanner.models.CandidateOrigin;
import com.example.scanner.models.DecodedPayload;
import com.example.scanner.models.IdentifierCandidate;
import com.example.scanner.models.IdentifierKind;
import com.example.scanner.models.SourceMethod;
import com.example.scanner.validation.ProductBarcodeDenylist;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns decoded text into ordered IMEI and mobile-number candidates.
 * Stateless; safe to share.
 */
public class CandidateExtractor {
    private static final Logger log = LoggerFactory.getLogger(CandidateExtractor.class);

    private static final Pattern EXACT_IMEI = Pattern.compile("[83]\\d{14}");

    // Priority order: the primary SIM identifier must be collected first
    private static final List<Pattern> LABELED_PATTERNS = List.of(
            Pattern.compile("IMEI1\\s*:?\\s*(\\d{15})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("IMEI\\s*2?\\s*:?\\s*(\\d{15})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("IMEI/MEID\\s*:?\\s*(\\d{15})", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern BARE_IMEI = Pattern.compile("(?<!\\d)(\\d{15})(?!\\d)");
    private static final Pattern MOBILE = Pattern.compile("(?<!\\d)(\\d{10,15})(?!\\d)");

    public ExtractionResult extract(DecodedPayload payload) {
        return extract(payload.text, payload.sourceMethod);
    }

    public ExtractionResult extract(String text, SourceMethod sourceMethod) {
        ExtractionResult result = new ExtractionResult();
        if (text == null || text.isBlank()) {
            return result;
        }

        String trimmed = text.trim();
        if (EXACT_IMEI.matcher(trimmed).matches()) {
            log.debug("🎯 Direct IMEI payload: {}", trimmed);
            result.addImei(candidate(trimmed, IdentifierKind.IMEI, CandidateOrigin.UNLABELED, sourceMethod));
            return result;
        }

        JsonElement json = looksLikeJson(trimmed) ? parseJson(trimmed) : null;
        if (json != null) {
            // Structured payloads are read leaf by leaf only
            walk(json, sourceMethod, result);
        } else {
            collectLabeled(text, sourceMethod, result);
            collectUnlabeled(text, sourceMethod, result);
            collectMobile(text, sourceMethod, result);
        }

        log.debug("🔍 Extracted from {}: {}", sourceMethod, result);
        return result;
    }

    private void collectLabeled(String text, SourceMethod sourceMethod, ExtractionResult result) {
        for (Pattern pattern : LABELED_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                result.addImei(candidate(matcher.group(1), IdentifierKind.IMEI,
                        CandidateOrigin.LABELED, sourceMethod));
            }
        }
    }

    private void collectUnlabeled(String text, SourceMethod sourceMethod, ExtractionResult result) {
        Matcher matcher = BARE_IMEI.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(1);
            if (result.containsImei(value) || ProductBarcodeDenylist.isDenylisted(value)) {
                continue;
            }
            char first = value.charAt(0);
            if (first == '8' || first == '3') {
                result.addImei(candidate(value, IdentifierKind.IMEI, CandidateOrigin.UNLABELED, sourceMethod));
            }
        }
    }

    private void collectMobile(String text, SourceMethod sourceMethod, ExtractionResult result) {
        Matcher matcher = MOBILE.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(1);
            if (ProductBarcodeDenylist.isProductCode(value)) {
                continue;
            }
            result.addMobile(candidate(value, IdentifierKind.MOBILE, CandidateOrigin.UNLABELED, sourceMethod));
        }
    }

    private static boolean looksLikeJson(String text) {
        return text.startsWith("{") || text.startsWith("[");
    }

    private static JsonElement parseJson(String text) {
        try {
            return JsonParser.parseString(text);
        } catch (JsonParseException e) {
            log.trace("Payload is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private void walk(JsonElement element, SourceMethod sourceMethod, ExtractionResult result) {
        if (element == null || element.isJsonNull()) {
            return;
        }
        if (element.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                walk(entry.getValue(), sourceMethod, result);
            }
        } else if (element.isJsonArray()) {
            for (JsonElement child : element.getAsJsonArray()) {
                walk(child, sourceMethod, result);
            }
        } else if (!element.getAsJsonPrimitive().isBoolean()) {
            ExtractionResult leaf = extract(element.getAsString(), sourceMethod);
            leaf.getImeiCandidates().forEach(c -> result.addImei(c.withOrigin(CandidateOrigin.JSON_WALK)));
            leaf.getMobileCandidates().forEach(c -> result.addMobile(c.withOrigin(CandidateOrigin.JSON_WALK)));
        }
    }

    private static IdentifierCandidate candidate(String value, IdentifierKind kind,
                                                 CandidateOrigin origin, SourceMethod sourceMethod) {
        return new IdentifierCandidate(value, kind, origin, sourceMethod);
    }
}
