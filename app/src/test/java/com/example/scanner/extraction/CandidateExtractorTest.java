package com.example.scanner.extraction;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.example.scanner.models.CandidateOrigin;
import com.example.scanner.models.IdentifierCandidate;
import com.example.scanner.models.SourceMethod;

import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

public class CandidateExtractorTest {

    private final CandidateExtractor extractor = new CandidateExtractor();

    @Test
    public void extract_exactImeiPayload_singleCandidate() {
        ExtractionResult result = extractor.extract("  354626223546262 \n", SourceMethod.BARCODE_1D);

        assertEquals(List.of("354626223546262"), values(result.getImeiCandidates()));
        assertEquals(CandidateOrigin.UNLABELED, result.getImeiCandidates().get(0).origin);
        assertTrue(result.getMobileCandidates().isEmpty());
    }

    @Test
    public void extract_labelOnPreviousLine_labeledCandidate() {
        ExtractionResult result = extractor.extract(
                "IMEI(MEID) and S/N\nIMEI1\n354626223546262 / 19", SourceMethod.OCR);

        List<IdentifierCandidate> imeis = result.getImeiCandidates();
        assertEquals(List.of("354626223546262"), values(imeis));
        assertEquals(CandidateOrigin.LABELED, imeis.get(0).origin);
        assertEquals(SourceMethod.OCR, imeis.get(0).sourceMethod);
    }

    @Test
    public void extract_imei1CollectedBeforeImei2() {
        ExtractionResult result = extractor.extract(
                "IMEI2: 861234567890127\nIMEI1: 354626223546262", SourceMethod.OCR);

        assertEquals(List.of("354626223546262", "861234567890127"), values(result.getImeiCandidates()));
    }

    @Test
    public void extract_imeiMeidLabel() {
        ExtractionResult result = extractor.extract("imei/meid: 490154203237518", SourceMethod.OCR);

        assertEquals(List.of("490154203237518"), values(result.getImeiCandidates()));
        assertEquals(CandidateOrigin.LABELED, result.getImeiCandidates().get(0).origin);
    }

    @Test
    public void extract_unlabeledOnlyWhenStartingWith8Or3() {
        ExtractionResult result = extractor.extract(
                "S/N 123456789012345 code 861234567890127", SourceMethod.OCR);

        assertEquals(List.of("861234567890127"), values(result.getImeiCandidates()));
        assertEquals(List.of("123456789012345", "861234567890127"), values(result.getMobileCandidates()));
    }

    @Test
    public void extract_duplicateValues_keptOnce() {
        ExtractionResult result = extractor.extract(
                "IMEI1: 354626223546262\nIMEI1: 354626223546262", SourceMethod.OCR);

        assertEquals(1, result.getImeiCandidates().size());
        assertEquals(1, result.getMobileCandidates().size());
    }

    @Test
    public void extract_nineteenDigitLabeledValue_takesFirstFifteenDigits() {
        // The 19-digit value is not a 15-digit IMEI. The label pattern has no
        // trailing digit boundary, so only its first 15 digits are captured;
        // the full value is never reported as an identifier.
        ExtractionResult result = extractor.extract(
                "IMEI: 3251600990000013254 2\nSERIAL: 5AAS58133XDYT95", SourceMethod.OCR);

        assertEquals(List.of("325160099000001"), values(result.getImeiCandidates()));
        assertTrue(result.getMobileCandidates().isEmpty());
    }

    @Test
    public void extract_productBarcode_nothing() {
        ExtractionResult result = extractor.extract("6932204509475", SourceMethod.BARCODE_1D);

        assertTrue(result.isEmpty());
    }

    @Test
    public void extract_mobileNumbers_tenToFifteenDigits() {
        ExtractionResult result = extractor.extract("Tel 0912345678 / 123456789", SourceMethod.OCR);

        assertEquals(List.of("0912345678"), values(result.getMobileCandidates()));
        assertTrue(result.getImeiCandidates().isEmpty());
    }

    @Test
    public void extract_jsonPayload_walksStringLeaves() {
        ExtractionResult result = extractor.extract(
                "{\"device\":{\"label\":\"IMEI1\\n490154203237518\"}}", SourceMethod.BARCODE_2D);

        List<IdentifierCandidate> imeis = result.getImeiCandidates();
        assertEquals(List.of("490154203237518"), values(imeis));
        assertEquals(CandidateOrigin.JSON_WALK, imeis.get(0).origin);
        assertEquals(SourceMethod.BARCODE_2D, imeis.get(0).sourceMethod);
    }

    @Test
    public void extract_jsonLeafWithInlineLabel_taggedAsJsonWalk() {
        ExtractionResult result = extractor.extract(
                "{\"imei\":\"IMEI1: 354626223546262\",\"phone\":\"9812345678\"}", SourceMethod.BARCODE_2D);

        assertEquals(List.of("354626223546262"), values(result.getImeiCandidates()));
        assertEquals(CandidateOrigin.JSON_WALK, result.getImeiCandidates().get(0).origin);
        assertEquals(List.of("354626223546262", "9812345678"), values(result.getMobileCandidates()));
        result.getMobileCandidates().forEach(c -> assertEquals(CandidateOrigin.JSON_WALK, c.origin));
    }

    @Test
    public void extract_jsonNumericLeaf_extracted() {
        ExtractionResult result = extractor.extract("{\"imei\":861234567890127}", SourceMethod.BARCODE_2D);

        assertEquals(List.of("861234567890127"), values(result.getImeiCandidates()));
        assertEquals(CandidateOrigin.JSON_WALK, result.getImeiCandidates().get(0).origin);
    }

    @Test
    public void extract_mobileWithProductPrefix_kept() {
        ExtractionResult result = extractor.extract("Customer mobile: 6912345678", SourceMethod.OCR);

        assertEquals(List.of("6912345678"), values(result.getMobileCandidates()));
        assertTrue(result.getImeiCandidates().isEmpty());
    }

    @Test
    public void extract_twelveDigitProductCode_notAMobile() {
        ExtractionResult result = extractor.extract("EAN 690123456789 box", SourceMethod.OCR);

        assertTrue(result.isEmpty());
    }

    @Test
    public void extract_jsonArray_walksEveryElement() {
        ExtractionResult result = extractor.extract(
                "[\"IMEI1\\n354626223546262\", {\"b\": [\"IMEI2\\n490154203237518\"]}, 42, null]",
                SourceMethod.BARCODE_2D);

        assertEquals(List.of("354626223546262", "490154203237518"), values(result.getImeiCandidates()));
    }

    @Test
    public void extract_malformedJson_fallsBackToText() {
        ExtractionResult result = extractor.extract("{not json 354626223546262", SourceMethod.BARCODE_2D);

        assertEquals(List.of("354626223546262"), values(result.getImeiCandidates()));
    }

    @Test
    public void extract_blankOrNull_empty() {
        assertTrue(extractor.extract(null, SourceMethod.OCR).isEmpty());
        assertTrue(extractor.extract("   ", SourceMethod.OCR).isEmpty());
    }

    @Test
    public void merge_keepsFirstOccurrence() {
        ExtractionResult first = extractor.extract("354626223546262", SourceMethod.BARCODE_1D);
        ExtractionResult second = extractor.extract("IMEI1: 354626223546262", SourceMethod.OCR);

        first.merge(second);

        assertEquals(1, first.getImeiCandidates().size());
        assertEquals(SourceMethod.BARCODE_1D, first.getImeiCandidates().get(0).sourceMethod);
    }

    private static List<String> values(List<IdentifierCandidate> candidates) {
        return candidates.stream().map(c -> c.value).collect(Collectors.toList());
    }
}
