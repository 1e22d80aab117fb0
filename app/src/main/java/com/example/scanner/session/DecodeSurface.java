package com.example.scanner.session;

import com.example.scanner.camera.CameraHandle;

/**
 * The preview/decode surface a UI mounts for a live stream. The session is
 * its only owner: it attaches after acquiring a camera and detaches during
 * teardown, nobody else does either.
 */
public interface DecodeSurface {

    void attach(CameraHandle handle);

    void detach();

    /** For headless use. */
    DecodeSurface NONE = new DecodeSurface() {
        @Override
        public void attach(CameraHandle handle) {
        }

        @Override
        public void detach() {
        }
    };
}
