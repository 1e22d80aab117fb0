package com.example.scanner.detection;

import com.example.scanner.decoder.DecoderAdapter;
import com.example.scanner.extraction.CandidateExtractor;
import com.example.scanner.extraction.ExtractionResult;
import com.example.scanner.models.DecodedPayload;
import com.example.scanner.models.IdentifierCandidate;
import com.example.scanner.models.ScanResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the escalating decode stages over one image and stops at the first
 * stage that yields an accepted IMEI. Candidates from every stage that ran
 * are accumulated and resolved together when no stage succeeds.
 */
public class DetectionPipeline {
    private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);

    private final DecoderAdapter decoderAdapter;
    private final ImagePreprocessor preprocessor;
    private final CandidateExtractor extractor;
    private final IdentifierResolver resolver;

    public DetectionPipeline(DecoderAdapter decoderAdapter,
                             ImagePreprocessor preprocessor,
                             CandidateExtractor extractor,
                             IdentifierResolver resolver) {
        this.decoderAdapter = decoderAdapter;
        this.preprocessor = preprocessor;
        this.extractor = extractor;
        this.resolver = resolver;
    }

    public DetectionResult detect(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        log.debug("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.debug("🔎 Detection started on {}x{} image", image.getWidth(), image.getHeight());

        ExtractionResult accumulated = new ExtractionResult();
        Map<PipelineStage.ImageVariant, BufferedImage> variants = new EnumMap<>(PipelineStage.ImageVariant.class);
        Set<PipelineStage.ImageVariant> failedVariants = EnumSet.noneOf(PipelineStage.ImageVariant.class);
        variants.put(PipelineStage.ImageVariant.ORIGINAL, image);
        int stagesRun = 0;

        for (PipelineStage stage : PipelineStage.values()) {
            BufferedImage input = variantFor(stage.variant, image, variants, failedVariants);
            if (input == null) {
                log.debug("⏭️ {} skipped, no {} image", stage, stage.variant);
                continue;
            }

            stagesRun++;
            List<DecodedPayload> payloads = runStage(stage, input);
            for (DecodedPayload payload : payloads) {
                accumulated.merge(extractor.extract(payload));
            }

            Optional<IdentifierCandidate> accepted = resolver.firstAccepted(accumulated.getImeiCandidates());
            if (accepted.isPresent()) {
                log.debug("🎯 {} accepted {} after {} stage(s)", stage, accepted.get().value, stagesRun);
                return new DetectionResult(ScanResult.validatedImei(accepted.get()), stage,
                        accumulated.getImeiCandidates(), accumulated.getMobileCandidates(), stagesRun);
            }
            log.debug("   ├─ {}: {} payload(s), candidates so far {}", stage, payloads.size(), accumulated);
        }

        ScanResult result = resolver.resolve(accumulated.getImeiCandidates(), accumulated.getMobileCandidates());
        log.debug("   └─ Pipeline exhausted: {}", result);
        return new DetectionResult(result, null,
                accumulated.getImeiCandidates(), accumulated.getMobileCandidates(), stagesRun);
    }

    private List<DecodedPayload> runStage(PipelineStage stage, BufferedImage input) {
        switch (stage.capability) {
            case BARCODE:
                return decoderAdapter.decodeBarcodes(input);
            case RAW_MATRIX:
                return asList(decoderAdapter.decodeRawMatrix(input));
            case OCR:
                return asList(decoderAdapter.recognizeText(input));
            default:
                throw new IllegalStateException("Unknown capability " + stage.capability);
        }
    }

    private BufferedImage variantFor(PipelineStage.ImageVariant variant, BufferedImage original,
                                     Map<PipelineStage.ImageVariant, BufferedImage> variants,
                                     Set<PipelineStage.ImageVariant> failedVariants) {
        BufferedImage cached = variants.get(variant);
        if (cached != null || failedVariants.contains(variant)) {
            return cached;
        }
        try {
            BufferedImage derived = derive(variant, original);
            variants.put(variant, derived);
            return derived;
        } catch (RuntimeException | LinkageError e) {
            log.warn("⚠️ Could not prepare {} image, skipping its stages: {}", variant, e.toString());
            failedVariants.add(variant);
            return null;
        }
    }

    private BufferedImage derive(PipelineStage.ImageVariant variant, BufferedImage original) {
        switch (variant) {
            case CONTRAST_ENHANCED:
                return preprocessor.enhanceContrast(original);
            case RESIZED:
                return preprocessor.resize(original);
            case OCR_OPTIMIZED:
                return preprocessor.prepareForOcr(original);
            case ORIGINAL:
            default:
                return original;
        }
    }

    private static List<DecodedPayload> asList(Optional<DecodedPayload> payload) {
        List<DecodedPayload> list = new ArrayList<>(1);
        payload.ifPresent(list::add);
        return list;
    }
}
