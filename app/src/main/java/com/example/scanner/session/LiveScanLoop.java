package com.example.scanner.session;

import com.example.scanner.Configuration;
import com.example.scanner.detection.DetectionPipeline;
import com.example.scanner.detection.DetectionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Periodic frame capture and decode while a session is ACTIVE.
 *
 * Ticks run on the session thread; the pipeline runs on the decode executor
 * and its completion is posted back to the session thread. Only one pipeline
 * run is in flight at a time. A tick that finds one in flight is skipped.
 */
class LiveScanLoop {
    private static final Logger log = LoggerFactory.getLogger(LiveScanLoop.class);

    interface Host {
        /** True while the loop started for {@code generation} may keep going. */
        boolean isCurrent(int generation);

        BufferedImage captureFrame(int generation) throws Exception;

        void onDetection(int generation, DetectionResult result);

        void onTransientError(int generation, Throwable error);
    }

    private final ScanScheduler scheduler;
    private final Executor decodeExecutor;
    private final DetectionPipeline pipeline;
    private final Configuration config;
    private final Host host;

    // Session thread only
    private ScanScheduler.ScheduledTask loopTask;
    private boolean stopProcessing = true;
    private boolean pipelineInFlight = false;

    LiveScanLoop(ScanScheduler scheduler, Executor decodeExecutor, DetectionPipeline pipeline,
                 Configuration config, Host host) {
        this.scheduler = scheduler;
        this.decodeExecutor = decodeExecutor;
        this.pipeline = pipeline;
        this.config = config;
        this.host = host;
    }

    void start(int generation) {
        stop();
        stopProcessing = false;
        log.debug("🔁 Scan loop started (generation {}, every {} ms)", generation, config.scanIntervalMs);
        loopTask = scheduler.schedule(() -> tick(generation), config.scanIntervalMs);
    }

    /**
     * @return true if a pending tick was cancelled
     */
    boolean stop() {
        stopProcessing = true;
        if (loopTask == null) {
            return false;
        }
        boolean cancelled = loopTask.cancel();
        loopTask = null;
        return cancelled;
    }

    private void tick(int generation) {
        loopTask = null;
        if (stopProcessing || !host.isCurrent(generation)) {
            log.debug("Scan loop ended (generation {})", generation);
            return;
        }

        boolean failed = false;
        if (pipelineInFlight) {
            log.debug("⏭️ Pipeline still running, skipping this frame");
        } else {
            failed = !submit(generation);
        }

        if (!stopProcessing && host.isCurrent(generation)) {
            scheduleNext(generation, failed ? config.errorRetryIntervalMs : config.scanIntervalMs);
        }
    }

    private void scheduleNext(int generation, long delayMs) {
        if (loopTask != null) {
            loopTask.cancel();
        }
        loopTask = scheduler.schedule(() -> tick(generation), delayMs);
    }

    /**
     * @return false if the frame could not be handed to the pipeline
     */
    private boolean submit(int generation) {
        BufferedImage frame;
        try {
            frame = host.captureFrame(generation);
        } catch (Exception e) {
            log.warn("⚠️ Frame capture failed: {}", e.toString());
            host.onTransientError(generation, e);
            return false;
        }

        pipelineInFlight = true;
        try {
            CompletableFuture
                    .supplyAsync(() -> pipeline.detect(frame), decodeExecutor)
                    .whenComplete((result, error) ->
                            scheduler.execute(() -> complete(generation, result, error)));
        } catch (RejectedExecutionException e) {
            pipelineInFlight = false;
            log.warn("⚠️ Decode executor rejected the frame: {}", e.toString());
            host.onTransientError(generation, e);
            return false;
        }
        return true;
    }

    private void complete(int generation, DetectionResult result, Throwable error) {
        pipelineInFlight = false;

        if (stopProcessing || !host.isCurrent(generation)) {
            log.debug("🗑️ Discarding late pipeline result (generation {})", generation);
            return;
        }

        if (error != null) {
            log.warn("⚠️ Pipeline run failed: {}", error.toString());
            host.onTransientError(generation, error);
            // Back off: the next frame comes after the retry interval
            if (!stopProcessing && host.isCurrent(generation)) {
                scheduleNext(generation, config.errorRetryIntervalMs);
            }
            return;
        }

        host.onDetection(generation, result);
    }
}
