package com.astrobg.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Terminal outcome of one extraction run. Immutable: list and buffer accessors hand out copies.
 */
public class ExtractionResult {

    public enum Status { SUCCESS, FAILED, CANCELLED }

    public enum ErrorKind { NONE, CONFIGURATION, SAMPLING, FITTING, RUNTIME, CANCELLED }

    public final Status status;
    public final ErrorKind errorKind;
    public final String errorMessage;

    public final int samplesUsed;
    public final int samplesRejected;
    public final double rmsError;
    public final double meanDeviation;
    public final double maxDeviation;
    public final boolean withinErrorTolerance;
    public final double processingTimeSeconds;

    private final List<Sample> samples;
    private final BackgroundModel background;
    private final float[] corrected;

    private ExtractionResult(Builder b) {
        this.status = b.status;
        this.errorKind = b.errorKind;
        this.errorMessage = b.errorMessage;
        this.samples = copySamples(b.samples);
        this.background = b.background;
        this.corrected = b.corrected;
        this.rmsError = b.rmsError;
        this.meanDeviation = b.meanDeviation;
        this.maxDeviation = b.maxDeviation;
        this.withinErrorTolerance = b.withinErrorTolerance;
        this.processingTimeSeconds = b.processingTimeSeconds;

        int rejected = 0;
        for (Sample s : samples) if (s.isRejected()) rejected++;
        this.samplesRejected = rejected;
        this.samplesUsed = samples.size() - rejected;
    }

    public static ExtractionResult empty() {
        return new Builder(Status.FAILED).errorKind(ErrorKind.NONE).build();
    }

    public static ExtractionResult failed(ErrorKind kind, String message) {
        return failed(kind, message, Collections.emptyList(), 0);
    }

    public static ExtractionResult failed(ErrorKind kind, String message, List<Sample> samples, double seconds) {
        return new Builder(Status.FAILED).errorKind(kind).errorMessage(message)
                .samples(samples).processingTimeSeconds(seconds).build();
    }

    public static ExtractionResult cancelled(List<Sample> samples, double seconds) {
        return new Builder(Status.CANCELLED).errorKind(ErrorKind.CANCELLED)
                .errorMessage("Extraction cancelled").samples(samples).processingTimeSeconds(seconds).build();
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }

    /** Successful and carrying at least one output buffer. */
    public boolean isValid() {
        return isSuccess() && (background != null || corrected != null);
    }

    public List<Sample> samples() {
        return copySamples(samples);
    }

    public int sampleCount() {
        return samples.size();
    }

    public boolean hasBackground() {
        return background != null;
    }

    public BackgroundModel background() {
        return background == null ? null : background.copy();
    }

    public boolean hasCorrected() {
        return corrected != null;
    }

    public float[] corrected() {
        return corrected == null ? null : corrected.clone();
    }

    private static List<Sample> copySamples(List<Sample> source) {
        List<Sample> out = new ArrayList<>(source.size());
        for (Sample s : source) out.add(s.copy());
        return Collections.unmodifiableList(out);
    }

    public static class Builder {
        private final Status status;
        private ErrorKind errorKind = ErrorKind.NONE;
        private String errorMessage = "";
        private List<Sample> samples = Collections.emptyList();
        private BackgroundModel background;
        private float[] corrected;
        private double rmsError;
        private double meanDeviation;
        private double maxDeviation;
        private boolean withinErrorTolerance;
        private double processingTimeSeconds;

        public Builder(Status status) {
            this.status = status;
        }

        public Builder errorKind(ErrorKind v) { this.errorKind = v; return this; }
        public Builder errorMessage(String v) { this.errorMessage = v == null ? "" : v; return this; }
        public Builder samples(List<Sample> v) { this.samples = v; return this; }
        public Builder background(BackgroundModel v) { this.background = v; return this; }
        public Builder corrected(float[] v) { this.corrected = v; return this; }
        public Builder rmsError(double v) { this.rmsError = v; return this; }
        public Builder meanDeviation(double v) { this.meanDeviation = v; return this; }
        public Builder maxDeviation(double v) { this.maxDeviation = v; return this; }
        public Builder withinErrorTolerance(boolean v) { this.withinErrorTolerance = v; return this; }
        public Builder processingTimeSeconds(double v) { this.processingTimeSeconds = v; return this; }

        public ExtractionResult build() {
            return new ExtractionResult(this);
        }
    }
}
