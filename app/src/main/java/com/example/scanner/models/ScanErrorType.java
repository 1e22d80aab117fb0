package com.example.scanner.models;

/**
 * Failure taxonomy reported to the caller. Each type carries the message
 * shown to the operator.
 */
public enum ScanErrorType {
    PERMISSION_DENIED("Camera permission denied. Please allow camera access and try again."),
    DEVICE_NOT_FOUND("No camera found. Please connect a camera and try again."),
    DEVICE_BUSY("Camera is already in use by another application. Please close other camera applications and try again."),
    UNSUPPORTED_CONSTRAINTS("Camera constraints not supported. Please try a different camera."),
    CAMERA_FAILURE("Failed to access camera. Please check your camera settings."),
    NO_IDENTIFIER_FOUND("No IMEI or mobile number could be found."),
    VALIDATION_FAILED("An IMEI-like number was found but it did not pass validation."),
    TRANSIENT_DECODER_ERROR("Decoding failed, retrying.");

    private final String userMessage;

    ScanErrorType(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
