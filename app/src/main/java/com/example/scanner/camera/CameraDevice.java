package com.example.scanner.camera;

/**
 * A camera the platform reports as available.
 */
public class CameraDevice {
    public final String id;
    public final String label;

    public CameraDevice(String id, String label) {
        this.id = id;
        this.label = label != null ? label : "";
    }

    @Override
    public String toString() {
        return label.isEmpty() ? id : label + " (" + id + ")";
    }
}
