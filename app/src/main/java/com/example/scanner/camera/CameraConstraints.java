package com.example.scanner.camera;

import java.util.List;

/**
 * Requested stream properties. Zero means "no preference".
 */
public class CameraConstraints {

    public enum Facing {
        ENVIRONMENT,
        USER,
        ANY
    }

    public final String name;
    public final int idealWidth;
    public final int idealHeight;
    public final int minWidth;
    public final int minHeight;
    public final Facing facing;
    public final int idealFrameRate;

    public CameraConstraints(String name, int idealWidth, int idealHeight, int minWidth, int minHeight,
                             Facing facing, int idealFrameRate) {
        this.name = name;
        this.idealWidth = idealWidth;
        this.idealHeight = idealHeight;
        this.minWidth = minWidth;
        this.minHeight = minHeight;
        this.facing = facing;
        this.idealFrameRate = idealFrameRate;
    }

    public static final CameraConstraints FULL =
            new CameraConstraints("full", 1280, 720, 640, 480, Facing.ENVIRONMENT, 30);
    public static final CameraConstraints SIMPLIFIED =
            new CameraConstraints("simplified", 1280, 720, 0, 0, Facing.ENVIRONMENT, 0);
    public static final CameraConstraints BASIC =
            new CameraConstraints("basic", 1280, 720, 0, 0, Facing.ANY, 0);
    public static final CameraConstraints MINIMAL =
            new CameraConstraints("minimal", 0, 0, 0, 0, Facing.ANY, 0);

    /**
     * Tried in order until the device accepts one.
     */
    public static final List<CameraConstraints> FALLBACK_ORDER = List.of(FULL, SIMPLIFIED, BASIC, MINIMAL);

    @Override
    public String toString() {
        return name;
    }
}
