package com.example.scanner.session;

import com.example.scanner.Configuration;
import com.example.scanner.camera.CameraAccessException;
import com.example.scanner.camera.CameraDevice;
import com.example.scanner.camera.CameraHandle;
import com.example.scanner.camera.CameraManager;
import com.example.scanner.detection.DetectionPipeline;
import com.example.scanner.detection.DetectionResult;
import com.example.scanner.models.ScanErrorType;
import com.example.scanner.models.ScanResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scanner session state machine.
 *
 * <pre>
 * IDLE → REQUESTING_PERMISSION → INITIALIZING → ACTIVE → {SWITCHING_CAMERA, ERROR, EMERGENCY_STOPPED} → IDLE
 * </pre>
 *
 * All public operations except {@link #scanUpload(BufferedImage)} are posted
 * to the session's {@link ScanScheduler} and return immediately. State, the
 * camera handle and all timers are only touched on that thread. Work that was
 * scheduled for an earlier attempt carries that attempt's generation and is
 * dropped once a teardown has bumped it.
 *
 * The session owns the scheduler and the decode executor it is given and
 * shuts both down on {@link #close()}.
 */
public class ScanSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScanSession.class);

    private final Configuration config;
    private final CameraManager cameraManager;
    private final DetectionPipeline pipeline;
    private final ScanScheduler scheduler;
    private final Executor decodeExecutor;
    private final DecodeSurface surface;
    private final ScanSessionListener listener;
    private final LiveScanLoop loop;

    // Written on the session thread only, volatile for readers elsewhere
    private volatile ScanMode mode = ScanMode.CAMERA;
    // Last mode a caller asked for; set on the caller thread before the switch is queued
    private volatile ScanMode requestedMode = ScanMode.CAMERA;
    private volatile SessionState state = SessionState.IDLE;
    private volatile int errorCount = 0;
    private volatile ScanErrorType lastError;
    private volatile TeardownReport lastTeardown;
    private volatile CameraHandle cameraHandle;

    // Session thread only
    private int generation = 0;
    private boolean surfaceAttached = false;
    private ScanScheduler.ScheduledTask timeoutTask;
    private String selectedCameraId;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean uploadInFlight = new AtomicBoolean(false);

    public ScanSession(Configuration config,
                       CameraManager cameraManager,
                       DetectionPipeline pipeline,
                       ScanScheduler scheduler,
                       Executor decodeExecutor,
                       DecodeSurface surface,
                       ScanSessionListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.cameraManager = Objects.requireNonNull(cameraManager, "cameraManager");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.decodeExecutor = Objects.requireNonNull(decodeExecutor, "decodeExecutor");
        this.surface = surface != null ? surface : DecodeSurface.NONE;
        this.listener = listener != null ? listener : new ScanSessionListener() { };
        this.loop = new LiveScanLoop(scheduler, decodeExecutor, pipeline, config, new LoopHost());
        log.debug("✅ ScanSession created");
    }

    // ==================== Public operations ====================

    /**
     * Starts camera acquisition. Only meaningful in camera mode from IDLE.
     */
    public void start() {
        scheduler.execute(this::doStart);
    }

    public void stop() {
        scheduler.execute(() -> {
            log.debug("⏹️ Stop requested in {}", state);
            teardown();
            if (state != SessionState.EMERGENCY_STOPPED) {
                setState(SessionState.IDLE);
            }
        });
    }

    /**
     * Stops the camera and enters upload mode. {@link #scanUpload} accepts
     * images as soon as this returns; the camera teardown completes on the
     * session thread.
     */
    public void switchToUploadMode() {
        requestedMode = ScanMode.UPLOAD;
        scheduler.execute(() -> switchMode(ScanMode.UPLOAD));
    }

    public void switchToCameraMode() {
        requestedMode = ScanMode.CAMERA;
        scheduler.execute(() -> switchMode(ScanMode.CAMERA));
    }

    /**
     * Replaces the active camera. The old stream is fully released before the
     * new one is opened.
     */
    public void switchCamera(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        scheduler.execute(() -> doSwitchCamera(deviceId));
    }

    /**
     * Stops everything from any state. The session stays stopped until
     * {@link #resetEmergencyStop()}.
     */
    public void emergencyStop() {
        scheduler.execute(() -> {
            log.warn("🛑 EMERGENCY STOP in {}", state);
            teardown();
            setState(SessionState.EMERGENCY_STOPPED);
        });
    }

    public void resetEmergencyStop() {
        scheduler.execute(() -> {
            if (state != SessionState.EMERGENCY_STOPPED) {
                log.debug("Reset ignored, not emergency stopped ({})", state);
                return;
            }
            log.debug("🔓 Emergency stop reset by operator");
            setState(SessionState.IDLE);
        });
    }

    /**
     * Operator retry after an error.
     */
    public void retry() {
        scheduler.execute(() -> {
            if (state != SessionState.ERROR && state != SessionState.IDLE) {
                log.debug("Retry ignored in {}", state);
                return;
            }
            log.debug("🔄 Retrying scan");
            teardown();
            setState(SessionState.IDLE);
            doStart();
        });
    }

    /**
     * Runs the full pipeline on an uploaded image on the calling thread.
     *
     * @throws IllegalStateException outside upload mode, while emergency
     *                               stopped, after close or while another upload is running
     */
    public ScanResult scanUpload(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("image is null");
        }
        if (closed.get()) {
            throw new IllegalStateException("Session is closed");
        }
        ScanMode current = requestedMode;
        if (current != ScanMode.UPLOAD) {
            throw new IllegalStateException("Image upload requires upload mode, current mode is " + current);
        }
        if (state == SessionState.EMERGENCY_STOPPED) {
            throw new IllegalStateException("Session is emergency stopped");
        }
        if (!uploadInFlight.compareAndSet(false, true)) {
            throw new IllegalStateException("An upload is already being processed");
        }

        try {
            log.debug("📁 Processing uploaded image {}x{}", image.getWidth(), image.getHeight());
            DetectionResult detection = pipeline.detect(image);
            ScanResult result = detection.scanResult;
            scheduler.execute(() -> {
                if (mode != ScanMode.UPLOAD) {
                    log.debug("Mode changed during upload, result not delivered");
                    return;
                }
                if (result.isFound()) {
                    notifyResult(result);
                } else {
                    notifyError(ScanErrorType.NO_IDENTIFIER_FOUND,
                            ScanErrorType.NO_IDENTIFIER_FOUND.getUserMessage());
                }
            });
            return result;
        } finally {
            uploadInFlight.set(false);
        }
    }

    /**
     * Accepts an operator-typed identifier as is. Stops any live scan.
     *
     * @throws IllegalArgumentException for blank input
     */
    public ScanResult submitManualEntry(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Manual entry is empty");
        }
        ScanResult result = ScanResult.manualEntry(text.trim());
        scheduler.execute(() -> {
            log.debug("⌨️ Manual entry submitted");
            teardown();
            if (state != SessionState.EMERGENCY_STOPPED) {
                setState(SessionState.IDLE);
            }
            notifyResult(result);
        });
        return result;
    }

    /**
     * Tears the session down and shuts its executors down. Safe to call more
     * than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.debug("🧹 Closing ScanSession");
        scheduler.execute(() -> {
            teardown();
            if (state != SessionState.EMERGENCY_STOPPED) {
                setState(SessionState.IDLE);
            }
        });
        scheduler.shutdown();
        if (decodeExecutor instanceof ExecutorService) {
            ((ExecutorService) decodeExecutor).shutdown();
        }
    }

    // ==================== Getters ====================

    public SessionState getState() {
        return state;
    }

    public ScanMode getMode() {
        return mode;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public ScanErrorType getLastError() {
        return lastError;
    }

    public TeardownReport getLastTeardownReport() {
        return lastTeardown;
    }

    public boolean isCameraActive() {
        return cameraHandle != null;
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ==================== Acquisition ====================

    private void doStart() {
        if (closed.get()) {
            return;
        }
        if (mode != ScanMode.CAMERA) {
            log.debug("Start ignored in {} mode", mode);
            return;
        }
        if (state != SessionState.IDLE) {
            log.debug("Scanner already started ({}), skipping", state);
            return;
        }

        errorCount = 0;
        lastError = null;
        int attempt = generation;
        setState(SessionState.REQUESTING_PERMISSION);
        scheduler.execute(() -> permissionPhase(attempt));
    }

    private void permissionPhase(int attempt) {
        if (!isCurrent(attempt, SessionState.REQUESTING_PERMISSION)) {
            return;
        }
        try {
            cameraManager.ensurePermission();
        } catch (CameraAccessException e) {
            fail(e);
            return;
        }
        setState(SessionState.INITIALIZING);
        scheduler.execute(() -> initializePhase(attempt, SessionState.INITIALIZING));
    }

    private void initializePhase(int attempt, SessionState expected) {
        if (!isCurrent(attempt, expected)) {
            return;
        }
        try {
            acquireCamera();
        } catch (CameraAccessException e) {
            fail(e);
            return;
        } catch (RuntimeException e) {
            fail(new CameraAccessException(CameraAccessException.Reason.UNKNOWN, e.getMessage(), e));
            return;
        }
        activate(attempt);
    }

    private void acquireCamera() throws CameraAccessException {
        if (cameraHandle != null) {
            throw new IllegalStateException("Camera handle already held by this session");
        }
        CameraDevice device = cameraManager.selectDevice(selectedCameraId);
        CameraHandle handle = cameraManager.open(device);
        cameraHandle = handle;
        selectedCameraId = device.id;
        surface.attach(handle);
        surfaceAttached = true;
        log.debug("📷 Camera {} attached", device);
    }

    private void activate(int attempt) {
        setState(SessionState.ACTIVE);
        timeoutTask = scheduler.schedule(() -> onScanTimeout(attempt), config.scanTimeoutMs);
        loop.start(attempt);
    }

    private void doSwitchCamera(String deviceId) {
        if (state != SessionState.ACTIVE) {
            log.debug("Camera switch ignored in {}", state);
            return;
        }
        log.debug("🔀 Switching camera to {}", deviceId);
        String previous = selectedCameraId;
        setState(SessionState.SWITCHING_CAMERA);
        teardown();
        selectedCameraId = deviceId;
        int attempt = generation;
        scheduler.execute(() -> {
            if (!isCurrent(attempt, SessionState.SWITCHING_CAMERA)) {
                return;
            }
            try {
                acquireCamera();
            } catch (CameraAccessException e) {
                selectedCameraId = previous;
                fail(e);
                return;
            } catch (RuntimeException e) {
                selectedCameraId = previous;
                fail(new CameraAccessException(CameraAccessException.Reason.UNKNOWN, e.getMessage(), e));
                return;
            }
            activate(attempt);
        });
    }

    private void switchMode(ScanMode target) {
        if (state == SessionState.EMERGENCY_STOPPED) {
            log.warn("⚠️ Mode switch to {} refused while emergency stopped", target);
            if (requestedMode == target) {
                requestedMode = mode;
            }
            return;
        }
        teardown();
        setState(SessionState.IDLE);
        if (mode != target) {
            mode = target;
            log.debug("🔁 Mode switched to {}", target);
            safely(() -> listener.onModeChanged(target));
        }
        if (target == ScanMode.CAMERA) {
            doStart();
        }
    }

    // ==================== Outcomes ====================

    private void onScanTimeout(int attempt) {
        if (!isCurrent(attempt, SessionState.ACTIVE)) {
            return;
        }
        timeoutTask = null;
        log.warn("⏰ No identifier detected within {} ms", config.scanTimeoutMs);
        teardown();
        lastError = ScanErrorType.NO_IDENTIFIER_FOUND;
        setState(SessionState.ERROR);
        notifyError(ScanErrorType.NO_IDENTIFIER_FOUND,
                "Scan timeout. No identifier detected within " + (config.scanTimeoutMs / 1000) + " seconds.");
    }

    private void fail(CameraAccessException e) {
        ScanErrorType type = e.toErrorType();
        log.error("❌ Camera error [{}]: {}", type, e.getMessage(), e);
        teardown();
        lastError = type;
        setState(SessionState.ERROR);
        notifyError(type, type.getUserMessage());
    }

    private void deliver(ScanResult result) {
        log.debug("✅ Identifier found: {}", result);
        teardown();
        setState(SessionState.IDLE);
        notifyResult(result);
    }

    // ==================== Teardown ====================

    /**
     * Releases timers, the decode surface and the camera, in that order.
     * Idempotent. Invalidates everything scheduled for the current attempt.
     */
    private TeardownReport teardown() {
        generation++;
        TeardownReport report = new TeardownReport();

        boolean timersHeld = loop.stop();
        if (timeoutTask != null) {
            timersHeld |= timeoutTask.cancel();
            timeoutTask = null;
        }
        report.released(TeardownReport.Resource.TIMERS, timersHeld);

        if (surfaceAttached) {
            try {
                surface.detach();
                report.released(TeardownReport.Resource.DECODE_SURFACE, true);
            } catch (RuntimeException e) {
                log.warn("⚠️ Failed to detach decode surface: {}", e.toString());
                report.failed(TeardownReport.Resource.DECODE_SURFACE, e);
            } finally {
                surfaceAttached = false;
            }
        } else {
            report.released(TeardownReport.Resource.DECODE_SURFACE, false);
        }

        CameraHandle handle = cameraHandle;
        cameraHandle = null;
        if (handle != null) {
            try {
                handle.close();
                report.released(TeardownReport.Resource.CAMERA, true);
            } catch (RuntimeException e) {
                log.warn("⚠️ Failed to stop camera stream: {}", e.toString());
                report.failed(TeardownReport.Resource.CAMERA, e);
            }
        } else {
            report.released(TeardownReport.Resource.CAMERA, false);
        }

        if (report.releasedAnything() || report.hasFailures()) {
            log.debug("🧹 Teardown: {}", report);
        }
        lastTeardown = report;
        return report;
    }

    // ==================== Helpers ====================

    private boolean isCurrent(int attempt, SessionState expected) {
        if (attempt != generation || state != expected || closed.get()) {
            log.debug("Dropping stale step for attempt {} (now {} in {})", attempt, generation, state);
            return false;
        }
        return true;
    }

    private void setState(SessionState next) {
        SessionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.debug("State: {} → {}", previous, next);
        safely(() -> listener.onStateChanged(previous, next));
    }

    private void notifyResult(ScanResult result) {
        safely(() -> listener.onResult(result));
    }

    private void notifyError(ScanErrorType type, String message) {
        safely(() -> listener.onError(type, message));
    }

    private void safely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("❌ Session listener threw", e);
        }
    }

    private class LoopHost implements LiveScanLoop.Host {

        @Override
        public boolean isCurrent(int attempt) {
            return attempt == generation && state == SessionState.ACTIVE && !closed.get();
        }

        @Override
        public BufferedImage captureFrame(int attempt) throws Exception {
            CameraHandle handle = cameraHandle;
            if (handle == null || !handle.isOpen()) {
                throw new IllegalStateException("Camera stream is not open");
            }
            return handle.captureFrame();
        }

        @Override
        public void onDetection(int attempt, DetectionResult result) {
            ScanResult scanResult = result.scanResult;
            if (result.isAccepted()
                    || (config.acceptFallbackInLiveMode && scanResult.isFound())) {
                deliver(scanResult);
            } else {
                log.debug("🔍 No accepted identifier in frame ({}), continuing", scanResult.status);
            }
        }

        @Override
        public void onTransientError(int attempt, Throwable error) {
            errorCount++;
            log.warn("⚠️ Transient decode error #{}: {}", errorCount, error.toString());
            notifyError(ScanErrorType.TRANSIENT_DECODER_ERROR, ScanErrorType.TRANSIENT_DECODER_ERROR.getUserMessage());
        }
    }
}
