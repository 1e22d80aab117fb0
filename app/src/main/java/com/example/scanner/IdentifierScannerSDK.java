package com.example.scanner;

import com.example.scanner.camera.CameraConstraints;
import com.example.scanner.camera.CameraDevice;
import com.example.scanner.camera.CameraHandle;
import com.example.scanner.camera.CameraManager;
import com.example.scanner.camera.CameraProvider;
import com.example.scanner.camera.PermissionState;
import com.example.scanner.decoder.BarcodeDecoder;
import com.example.scanner.decoder.DecoderAdapter;
import com.example.scanner.decoder.RawMatrixDecoder;
import com.example.scanner.decoder.TesseractTextRecognizer;
import com.example.scanner.decoder.TextRecognizer;
import com.example.scanner.decoder.ZxingBarcodeDecoder;
import com.example.scanner.decoder.ZxingRawMatrixDecoder;
import com.example.scanner.detection.DetectionPipeline;
import com.example.scanner.detection.IdentifierResolver;
import com.example.scanner.detection.ImagePreprocessor;
import com.example.scanner.detection.OpenCvImagePreprocessor;
import com.example.scanner.extraction.CandidateExtractor;
import com.example.scanner.models.ScanResult;
import com.example.scanner.ocr.OcrTextProcessor;
import com.example.scanner.session.DecodeSurface;
import com.example.scanner.session.ExecutorScanScheduler;
import com.example.scanner.session.ScanSession;
import com.example.scanner.session.ScanSessionListener;
import com.example.scanner.utils.ImageUtils;
import com.example.scanner.validation.ImeiValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point. Wires the default decoders (ZXing, Tesseract, OpenCV) into a
 * detection pipeline and hands out scan sessions.
 *
 * <pre>
 * IdentifierScannerSDK sdk = new IdentifierScannerSDK.Builder()
 *         .setCameraProvider(provider)
 *         .build();
 * ScanResult result = sdk.scanFile(new File("label.png"));
 * </pre>
 */
public class IdentifierScannerSDK {
    private static final Logger log = LoggerFactory.getLogger(IdentifierScannerSDK.class);

    private final Configuration configuration;
    private final DetectionPipeline pipeline;
    private final CameraProvider cameraProvider;
    private final DecodeSurface decodeSurface;

    private IdentifierScannerSDK(Builder builder) {
        this.configuration = builder.configuration;
        this.cameraProvider = builder.cameraProvider;
        this.decodeSurface = builder.decodeSurface;

        BarcodeDecoder barcodeDecoder = builder.barcodeDecoder != null
                ? builder.barcodeDecoder : new ZxingBarcodeDecoder();
        RawMatrixDecoder rawMatrixDecoder = builder.rawMatrixDecoder != null
                ? builder.rawMatrixDecoder : new ZxingRawMatrixDecoder();
        TextRecognizer textRecognizer = builder.textRecognizer != null
                ? builder.textRecognizer : new TesseractTextRecognizer(configuration);
        ImagePreprocessor preprocessor = builder.preprocessor != null
                ? builder.preprocessor : new OpenCvImagePreprocessor(configuration);

        DecoderAdapter adapter = new DecoderAdapter(barcodeDecoder, rawMatrixDecoder, textRecognizer,
                new OcrTextProcessor(configuration.ocrDigitCorrection));
        this.pipeline = new DetectionPipeline(adapter, preprocessor, new CandidateExtractor(),
                new IdentifierResolver(new ImeiValidator()));
        log.debug("✅ IdentifierScannerSDK initialized");
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    public DetectionPipeline getPipeline() {
        return pipeline;
    }

    /**
     * Creates a session with its own session thread and decode thread. The
     * caller closes it.
     */
    public ScanSession newSession(ScanSessionListener listener) {
        CameraManager cameraManager = new CameraManager(cameraProvider, configuration.preferredCameraKeywords);
        ExecutorService decodeExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "scan-decode");
            thread.setDaemon(true);
            return thread;
        });
        return new ScanSession(configuration, cameraManager, pipeline,
                new ExecutorScanScheduler("scan-session"), decodeExecutor, decodeSurface, listener);
    }

    public ScanResult scanImage(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("image is null");
        }
        return pipeline.detect(image).scanResult;
    }

    /**
     * @throws IOException if the file is missing or not a readable image
     */
    public ScanResult scanFile(File file) throws IOException {
        log.debug("📁 Scanning file {}", file);
        return scanImage(ImageUtils.loadImage(file));
    }

    // ==================== BUILDER ====================

    public static class Builder {
        private Configuration configuration = new Configuration();
        private CameraProvider cameraProvider = NO_CAMERA;
        private DecodeSurface decodeSurface = DecodeSurface.NONE;
        private BarcodeDecoder barcodeDecoder;
        private RawMatrixDecoder rawMatrixDecoder;
        private TextRecognizer textRecognizer;
        private ImagePreprocessor preprocessor;

        public Builder setConfiguration(Configuration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder setCameraProvider(CameraProvider cameraProvider) {
            this.cameraProvider = cameraProvider;
            return this;
        }

        public Builder setDecodeSurface(DecodeSurface decodeSurface) {
            this.decodeSurface = decodeSurface;
            return this;
        }

        public Builder setBarcodeDecoder(BarcodeDecoder barcodeDecoder) {
            this.barcodeDecoder = barcodeDecoder;
            return this;
        }

        public Builder setRawMatrixDecoder(RawMatrixDecoder rawMatrixDecoder) {
            this.rawMatrixDecoder = rawMatrixDecoder;
            return this;
        }

        public Builder setTextRecognizer(TextRecognizer textRecognizer) {
            this.textRecognizer = textRecognizer;
            return this;
        }

        public Builder setImagePreprocessor(ImagePreprocessor preprocessor) {
            this.preprocessor = preprocessor;
            return this;
        }

        public IdentifierScannerSDK build() {
            if (configuration == null) {
                throw new IllegalArgumentException("configuration is required");
            }
            if (cameraProvider == null) {
                throw new IllegalArgumentException("cameraProvider is required");
            }
            return new IdentifierScannerSDK(this);
        }
    }

    // Headless default: permission is moot and there is nothing to open.
    private static final CameraProvider NO_CAMERA = new CameraProvider() {
        @Override
        public PermissionState checkPermission() {
            return PermissionState.GRANTED;
        }

        @Override
        public void requestPermission() {
        }

        @Override
        public List<CameraDevice> listDevices() {
            return List.of();
        }

        @Override
        public CameraHandle open(CameraDevice device, CameraConstraints constraints) {
            throw new UnsupportedOperationException("No camera provider configured");
        }
    };
}
