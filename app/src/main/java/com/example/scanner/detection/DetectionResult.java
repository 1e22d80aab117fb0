package com.example.scanner.detection;

import com.example.scanner.models.IdentifierCandidate;
import com.example.scanner.models.ScanResult;

import java.util.List;

/**
 * Outcome of one pipeline run over a single image.
 */
public class DetectionResult {
    public final ScanResult scanResult;
    /** Stage that produced the accepted IMEI, null when the pipeline ran to the end. */
    public final PipelineStage acceptedAt;
    public final List<IdentifierCandidate> imeiCandidates;
    public final List<IdentifierCandidate> mobileCandidates;
    public final int stagesRun;

    DetectionResult(ScanResult scanResult, PipelineStage acceptedAt,
                    List<IdentifierCandidate> imeiCandidates,
                    List<IdentifierCandidate> mobileCandidates, int stagesRun) {
        this.scanResult = scanResult;
        this.acceptedAt = acceptedAt;
        this.imeiCandidates = imeiCandidates;
        this.mobileCandidates = mobileCandidates;
        this.stagesRun = stagesRun;
    }

    public boolean isAccepted() {
        return scanResult.isValidatedImei();
    }

    @Override
    public String toString() {
        return "DetectionResult{" + scanResult + ", acceptedAt=" + acceptedAt
                + ", stagesRun=" + stagesRun + "}";
    }
}
