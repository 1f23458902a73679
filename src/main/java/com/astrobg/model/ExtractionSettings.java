package com.astrobg.model;

/**
 * Tunables for one extraction run. The facade hands each worker a {@link #copy()},
 * so changes made while a run is in flight only affect the next run.
 */
public class ExtractionSettings {

    public enum Model {
        LINEAR(1, "Linear"),
        POLYNOMIAL2(2, "Polynomial (2nd order)"),
        POLYNOMIAL3(3, "Polynomial (3rd order)");

        public final int order;
        public final String displayName;

        Model(int order, String displayName) {
            this.order = order;
            this.displayName = displayName;
        }

        /** Number of polynomial terms of total degree up to {@link #order}. */
        public int termCount() {
            return (order + 1) * (order + 2) / 2;
        }
    }

    public enum SampleGeneration {
        AUTOMATIC("Automatic"),
        MANUAL("Manual"),
        GRID("Regular Grid");

        public final String displayName;

        SampleGeneration(String displayName) {
            this.displayName = displayName;
        }
    }

    public Model model = Model.POLYNOMIAL2;
    public SampleGeneration sampleGeneration = SampleGeneration.AUTOMATIC;

    public double tolerance = 1.0;
    public double deviation = 0.8;
    public int minSamples = 50;
    public int maxSamples = 2000;

    public boolean useOutlierRejection = true;
    public double rejectionLow = 2.0;   // sigma units below the median
    public double rejectionHigh = 2.5;  // sigma units above the median
    public int rejectionIterations = 3;

    public int gridRows = 16;
    public int gridColumns = 16;

    public boolean discardModel = true;
    public boolean applyCorrection = false;
    public boolean normalizeOutput = true;

    public double maxError = 0.1;

    public static ExtractionSettings defaults() {
        return new ExtractionSettings();
    }

    public static ExtractionSettings conservative() {
        ExtractionSettings s = defaults();
        s.model = Model.LINEAR;
        s.sampleGeneration = SampleGeneration.GRID;
        s.tolerance = 1.5;
        s.deviation = 1.2;
        s.minSamples = 100;
        s.maxSamples = 2000;
        s.rejectionLow = 3.0;
        s.rejectionHigh = 3.5;
        return s;
    }

    public static ExtractionSettings aggressive() {
        ExtractionSettings s = defaults();
        s.model = Model.POLYNOMIAL3;
        s.sampleGeneration = SampleGeneration.AUTOMATIC;
        s.tolerance = 0.5;
        s.deviation = 0.5;
        s.maxSamples = 5000;
        s.rejectionLow = 1.5;
        s.rejectionHigh = 2.0;
        s.rejectionIterations = 5;
        return s;
    }

    public ExtractionSettings copy() {
        ExtractionSettings s = new ExtractionSettings();
        s.model = model;
        s.sampleGeneration = sampleGeneration;
        s.tolerance = tolerance;
        s.deviation = deviation;
        s.minSamples = minSamples;
        s.maxSamples = maxSamples;
        s.useOutlierRejection = useOutlierRejection;
        s.rejectionLow = rejectionLow;
        s.rejectionHigh = rejectionHigh;
        s.rejectionIterations = rejectionIterations;
        s.gridRows = gridRows;
        s.gridColumns = gridColumns;
        s.discardModel = discardModel;
        s.applyCorrection = applyCorrection;
        s.normalizeOutput = normalizeOutput;
        s.maxError = maxError;
        return s;
    }

    /**
     * @throws IllegalArgumentException naming the first offending field
     */
    public void validate() {
        if (model == null) throw new IllegalArgumentException("No background model selected");
        if (sampleGeneration == null) throw new IllegalArgumentException("No sample generation mode selected");
        if (minSamples < 1) throw new IllegalArgumentException("minSamples must be positive: " + minSamples);
        if (maxSamples < minSamples) {
            throw new IllegalArgumentException(String.format("maxSamples (%d) below minSamples (%d)", maxSamples, minSamples));
        }
        if (gridRows < 1 || gridColumns < 1) {
            throw new IllegalArgumentException(String.format("Invalid grid %dx%d", gridRows, gridColumns));
        }
        if (rejectionLow <= 0 || rejectionHigh <= 0) {
            throw new IllegalArgumentException("Rejection thresholds must be positive");
        }
        if (rejectionIterations < 0) throw new IllegalArgumentException("rejectionIterations must not be negative");
        if (maxError <= 0) throw new IllegalArgumentException("maxError must be positive");
    }

    @Override
    public String toString() {
        return String.format("Model: %s, Sampling: %s, Samples: %d-%d, Rejection: %s (%.1f/%.1f x%d)",
                model.displayName, sampleGeneration.displayName, minSamples, maxSamples,
                useOutlierRejection ? "on" : "off", rejectionLow, rejectionHigh, rejectionIterations);
    }
}
