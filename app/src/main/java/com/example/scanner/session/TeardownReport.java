package com.example.scanner.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What one teardown released. Failures are recorded, not thrown, so every
 * resource still gets its release attempt.
 */
public class TeardownReport {

    public enum Resource {
        TIMERS,
        DECODE_SURFACE,
        CAMERA
    }

    public enum Outcome {
        RELEASED,
        NOTHING_HELD,
        FAILED
    }

    public static class Step {
        public final Resource resource;
        public final Outcome outcome;
        public final Throwable cause;

        Step(Resource resource, Outcome outcome, Throwable cause) {
            this.resource = resource;
            this.outcome = outcome;
            this.cause = cause;
        }

        @Override
        public String toString() {
            return resource + "=" + outcome + (cause != null ? "(" + cause + ")" : "");
        }
    }

    private final List<Step> steps = new ArrayList<>();

    void released(Resource resource, boolean wasHeld) {
        steps.add(new Step(resource, wasHeld ? Outcome.RELEASED : Outcome.NOTHING_HELD, null));
    }

    void failed(Resource resource, Throwable cause) {
        steps.add(new Step(resource, Outcome.FAILED, cause));
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public Outcome outcomeOf(Resource resource) {
        for (Step step : steps) {
            if (step.resource == resource) {
                return step.outcome;
            }
        }
        return Outcome.NOTHING_HELD;
    }

    public boolean hasFailures() {
        return steps.stream().anyMatch(s -> s.outcome == Outcome.FAILED);
    }

    public boolean releasedAnything() {
        return steps.stream().anyMatch(s -> s.outcome == Outcome.RELEASED);
    }

    @Override
    public String toString() {
        return steps.toString();
    }
}
