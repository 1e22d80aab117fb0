package com.example.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class Configuration {

    // Live scan loop settings
    public long scanIntervalMs = 2000;
    public long errorRetryIntervalMs = 3000;
    public long scanTimeoutMs = 30000;
    public boolean acceptFallbackInLiveMode = false;

    // Image preprocessing settings
    public double contrastGain = 1.5;
    public int resizeWidth = 400;
    public int resizeHeight = 400;
    public double claheClipLimit = 2.0;
    public int claheTileSize = 8;

    // Camera selection
    public List<String> preferredCameraKeywords = List.of("front", "facing", "user");

    // OCR settings
    public boolean ocrDigitCorrection = true;
    public String tessDataPath = null;
    public String ocrLanguage = "eng";
    public int ocrPageSegMode = 6;

    public Configuration() {}

    // Static Builder class
    public static class Builder {
        private final Configuration config = new Configuration();

        public Builder setScanIntervalMs(long ms) {
            config.scanIntervalMs = ms;
            return this;
        }

        public Builder setErrorRetryIntervalMs(long ms) {
            config.errorRetryIntervalMs = ms;
            return this;
        }

        public Builder setScanTimeoutMs(long ms) {
            config.scanTimeoutMs = ms;
            return this;
        }

        public Builder setAcceptFallbackInLiveMode(boolean accept) {
            config.acceptFallbackInLiveMode = accept;
            return this;
        }

        public Builder setContrastGain(double gain) {
            config.contrastGain = gain;
            return this;
        }

        public Builder setResizeDimensions(int width, int height) {
            config.resizeWidth = width;
            config.resizeHeight = height;
            return this;
        }

        public Builder setClaheClipLimit(double clipLimit) {
            config.claheClipLimit = clipLimit;
            return this;
        }

        public Builder setClaheTileSize(int tileSize) {
            config.claheTileSize = tileSize;
            return this;
        }

        public Builder setPreferredCameraKeywords(List<String> keywords) {
            config.preferredCameraKeywords = List.copyOf(keywords);
            return this;
        }

        public Builder setOcrDigitCorrection(boolean enabled) {
            config.ocrDigitCorrection = enabled;
            return this;
        }

        public Builder setTessDataPath(String path) {
            config.tessDataPath = path;
            return this;
        }

        public Builder setOcrLanguage(String language) {
            config.ocrLanguage = language;
            return this;
        }

        public Builder setOcrPageSegMode(int mode) {
            config.ocrPageSegMode = mode;
            return this;
        }

        public Configuration build() {
            if (config.scanIntervalMs <= 0 || config.errorRetryIntervalMs <= 0 || config.scanTimeoutMs <= 0) {
                throw new IllegalArgumentException("Scan intervals and timeout must be positive");
            }
            if (config.resizeWidth <= 0 || config.resizeHeight <= 0) {
                throw new IllegalArgumentException("Resize dimensions must be positive");
            }
            Logger log = LoggerFactory.getLogger(Configuration.class);
            log.debug("Building Configuration:");
            log.debug("  scanIntervalMs: {}", config.scanIntervalMs);
            log.debug("  errorRetryIntervalMs: {}", config.errorRetryIntervalMs);
            log.debug("  scanTimeoutMs: {}", config.scanTimeoutMs);
            log.debug("  acceptFallbackInLiveMode: {}", config.acceptFallbackInLiveMode);
            log.debug("  contrastGain: {}", config.contrastGain);
            log.debug("  resize: {}x{}", config.resizeWidth, config.resizeHeight);
            log.debug("  clahe: clip={}, tile={}", config.claheClipLimit, config.claheTileSize);
            log.debug("  preferredCameraKeywords: {}", config.preferredCameraKeywords);
            log.debug("  ocrDigitCorrection: {}", config.ocrDigitCorrection);
            log.debug("  ocr: lang={}, psm={}, datapath={}",
                    config.ocrLanguage, config.ocrPageSegMode, config.tessDataPath);

            return config;
        }
    }
}
