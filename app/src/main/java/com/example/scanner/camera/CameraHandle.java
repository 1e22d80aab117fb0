package com.example.scanner.camera;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * One open camera stream. Owned by exactly one scan session.
 */
public interface CameraHandle extends AutoCloseable {

    CameraDevice getDevice();

    /**
     * Snapshot of the current frame.
     */
    BufferedImage captureFrame() throws IOException;

    boolean isOpen();

    /**
     * Stops every track of the stream. Calling it again is a no-op.
     */
    @Override
    void close();
}
