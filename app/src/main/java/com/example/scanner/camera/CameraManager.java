package com.example.scanner.camera;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Permission handling, device selection and stream acquisition on top of a
 * {@link CameraProvider}. Holds no open stream itself; the caller owns the
 * returned handle.
 */
public class CameraManager {
    private static final Logger log = LoggerFactory.getLogger(CameraManager.class);

    private final CameraProvider provider;
    private final List<String> preferredKeywords;
    private final List<CameraConstraints> constraintOrder;

    public CameraManager(CameraProvider provider, List<String> preferredKeywords) {
        this(provider, preferredKeywords, CameraConstraints.FALLBACK_ORDER);
    }

    public CameraManager(CameraProvider provider, List<String> preferredKeywords,
                         List<CameraConstraints> constraintOrder) {
        if (constraintOrder.isEmpty()) {
            throw new IllegalArgumentException("At least one constraint profile is required");
        }
        this.provider = provider;
        this.preferredKeywords = preferredKeywords;
        this.constraintOrder = constraintOrder;
    }

    /**
     * Makes sure camera access is granted, prompting if the state is not known.
     */
    public void ensurePermission() throws CameraAccessException {
        PermissionState state = provider.checkPermission();
        log.debug("🔐 Camera permission state: {}", state);

        if (state == PermissionState.GRANTED) {
            return;
        }
        if (state == PermissionState.DENIED) {
            throw new CameraAccessException(CameraAccessException.Reason.PERMISSION_DENIED,
                    "Camera permission denied");
        }

        log.debug("🔐 Requesting camera permission...");
        provider.requestPermission();
        log.debug("✅ Camera permission granted");
    }

    /**
     * Picks the camera to open: the explicitly requested id, else the first
     * device whose label matches a preferred keyword, else the first device.
     */
    public CameraDevice selectDevice(String requestedId) throws CameraAccessException {
        List<CameraDevice> devices = provider.listDevices();
        log.debug("📷 Available cameras: {}", devices);

        if (devices == null || devices.isEmpty()) {
            throw new CameraAccessException(CameraAccessException.Reason.DEVICE_NOT_FOUND, "No camera found");
        }

        if (requestedId != null) {
            for (CameraDevice device : devices) {
                if (device.id.equals(requestedId)) {
                    return device;
                }
            }
            throw new CameraAccessException(CameraAccessException.Reason.DEVICE_NOT_FOUND,
                    "Camera " + requestedId + " is not available");
        }

        for (CameraDevice device : devices) {
            String label = device.label.toLowerCase(Locale.ROOT);
            for (String keyword : preferredKeywords) {
                if (label.contains(keyword.toLowerCase(Locale.ROOT))) {
                    log.debug("Using preferred camera: {}", device);
                    return device;
                }
            }
        }

        log.debug("Using first available camera: {}", devices.get(0));
        return devices.get(0);
    }

    /**
     * Opens the device, relaxing constraints while the device rejects them.
     * Any other failure is reported immediately.
     */
    public CameraHandle open(CameraDevice device) throws CameraAccessException {
        CameraAccessException lastError = null;

        for (CameraConstraints constraints : constraintOrder) {
            try {
                log.debug("🎥 Opening {} with '{}' constraints", device, constraints);
                CameraHandle handle = provider.open(device, constraints);
                log.debug("✅ Camera started with '{}' constraints", constraints);
                return handle;
            } catch (CameraAccessException e) {
                if (e.getReason() != CameraAccessException.Reason.UNSUPPORTED_CONSTRAINTS) {
                    throw e;
                }
                log.debug("Constraint profile '{}' rejected: {}", constraints, e.getMessage());
                lastError = e;
            }
        }

        throw lastError;
    }
}
