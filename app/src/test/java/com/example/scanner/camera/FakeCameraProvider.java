package com.example.scanner.camera;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory camera platform that counts open streams.
 */
public class FakeCameraProvider implements CameraProvider {

    public PermissionState permission = PermissionState.GRANTED;
    public CameraAccessException requestPermissionError;
    public List<CameraDevice> devices = new ArrayList<>(List.of(
            new CameraDevice("cam-0", "Integrated Camera"),
            new CameraDevice("cam-1", "USB Camera facing front")));
    public Set<String> unsupportedProfiles = new HashSet<>();
    public CameraAccessException.Reason openFailure;
    public BufferedImage frame = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
    public boolean failCapture = false;

    public int permissionRequests = 0;
    public final List<String> openAttempts = new ArrayList<>();
    public final List<FakeHandle> handles = new ArrayList<>();
    public int openHandles = 0;
    public int maxOpenHandles = 0;

    @Override
    public PermissionState checkPermission() {
        return permission;
    }

    @Override
    public void requestPermission() throws CameraAccessException {
        permissionRequests++;
        if (requestPermissionError != null) {
            throw requestPermissionError;
        }
        permission = PermissionState.GRANTED;
    }

    @Override
    public List<CameraDevice> listDevices() {
        return devices;
    }

    @Override
    public CameraHandle open(CameraDevice device, CameraConstraints constraints) throws CameraAccessException {
        openAttempts.add(device.id + "/" + constraints.name);
        if (openFailure != null) {
            throw new CameraAccessException(openFailure, "open failed: " + openFailure);
        }
        if (unsupportedProfiles.contains(constraints.name)) {
            throw new CameraAccessException(CameraAccessException.Reason.UNSUPPORTED_CONSTRAINTS,
                    constraints.name + " not supported");
        }
        FakeHandle handle = new FakeHandle(device, constraints);
        handles.add(handle);
        openHandles++;
        maxOpenHandles = Math.max(maxOpenHandles, openHandles);
        return handle;
    }

    public FakeHandle lastHandle() {
        return handles.isEmpty() ? null : handles.get(handles.size() - 1);
    }

    public class FakeHandle implements CameraHandle {
        public final CameraDevice device;
        public final CameraConstraints constraints;
        public int captures = 0;
        private boolean open = true;

        FakeHandle(CameraDevice device, CameraConstraints constraints) {
            this.device = device;
            this.constraints = constraints;
        }

        @Override
        public CameraDevice getDevice() {
            return device;
        }

        @Override
        public BufferedImage captureFrame() throws IOException {
            captures++;
            if (failCapture) {
                throw new IOException("frame grab failed");
            }
            return frame;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            if (open) {
                open = false;
                openHandles--;
            }
        }
    }
}
