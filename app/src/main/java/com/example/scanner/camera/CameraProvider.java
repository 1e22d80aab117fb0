package com.example.scanner.camera;

import java.util.List;

/**
 * Platform camera capability.
 */
public interface CameraProvider {

    PermissionState checkPermission();

    /**
     * Prompts for camera access.
     *
     * @throws CameraAccessException if access is refused or no camera can be reached
     */
    void requestPermission() throws CameraAccessException;

    List<CameraDevice> listDevices() throws CameraAccessException;

    CameraHandle open(CameraDevice device, CameraConstraints constraints) throws CameraAccessException;
}
