package com.example.scanner.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact once
 * per JVM.
 */
public final class OpenCvLoader {
    private static final Logger log = LoggerFactory.getLogger(OpenCvLoader.class);

    private static volatile Boolean loaded;

    private OpenCvLoader() {}

    /**
     * @return true if the native library is available
     */
    public static boolean tryLoad() {
        Boolean state = loaded;
        if (state != null) {
            return state;
        }
        synchronized (OpenCvLoader.class) {
            if (loaded == null) {
                try {
                    nu.pattern.OpenCV.loadLocally();
                    loaded = Boolean.TRUE;
                    log.debug("✅ OpenCV native library loaded");
                } catch (RuntimeException | LinkageError e) {
                    loaded = Boolean.FALSE;
                    log.error("❌ OpenCV native library could not be loaded", e);
                }
            }
            return loaded;
        }
    }

    public static void ensureLoaded() {
        if (!tryLoad()) {
            throw new IllegalStateException("OpenCV native library is not available");
        }
    }
}
