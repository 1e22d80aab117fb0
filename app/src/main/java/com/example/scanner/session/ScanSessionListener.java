package com.example.scanner.session;

import com.example.scanner.models.ScanErrorType;
import com.example.scanner.models.ScanResult;

/**
 * Session notifications, delivered on the session thread.
 */
public interface ScanSessionListener {

    default void onStateChanged(SessionState previous, SessionState current) {
    }

    default void onModeChanged(ScanMode mode) {
    }

    /**
     * A resolved identifier. The live scanner has already stopped itself.
     */
    default void onResult(ScanResult result) {
    }

    /**
     * Camera errors and timeouts end the attempt. {@link ScanErrorType#TRANSIENT_DECODER_ERROR}
     * is informational; the loop keeps running.
     */
    default void onError(ScanErrorType type, String message) {
    }
}
