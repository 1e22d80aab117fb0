package com.example.scanner.camera;

import com.example.scanner.models.ScanErrorType;

/**
 * Camera acquisition failure, classified by the camera capability.
 */
public class CameraAccessException extends Exception {

    public enum Reason {
        PERMISSION_DENIED(ScanErrorType.PERMISSION_DENIED),
        DEVICE_NOT_FOUND(ScanErrorType.DEVICE_NOT_FOUND),
        DEVICE_BUSY(ScanErrorType.DEVICE_BUSY),
        UNSUPPORTED_CONSTRAINTS(ScanErrorType.UNSUPPORTED_CONSTRAINTS),
        UNKNOWN(ScanErrorType.CAMERA_FAILURE);

        public final ScanErrorType errorType;

        Reason(ScanErrorType errorType) {
            this.errorType = errorType;
        }
    }

    private final Reason reason;

    public CameraAccessException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CameraAccessException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public ScanErrorType toErrorType() {
        return reason.errorType;
    }
}
