package com.astrobg.model;

import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Persists {@link ExtractionSettings} in a preferences node. Missing or unreadable keys
 * fall back to {@link ExtractionSettings#defaults()}.
 */
public class ExtractionPreferences {

    private static final String KEY_MODEL = "model";
    private static final String KEY_SAMPLING = "sample_generation";
    private static final String KEY_TOLERANCE = "tolerance";
    private static final String KEY_DEVIATION = "deviation";
    private static final String KEY_MIN_SAMPLES = "min_samples";
    private static final String KEY_MAX_SAMPLES = "max_samples";
    private static final String KEY_REJECTION = "use_outlier_rejection";
    private static final String KEY_REJECT_LOW = "rejection_low";
    private static final String KEY_REJECT_HIGH = "rejection_high";
    private static final String KEY_REJECT_ITER = "rejection_iterations";
    private static final String KEY_GRID_ROWS = "grid_rows";
    private static final String KEY_GRID_COLS = "grid_columns";
    private static final String KEY_DISCARD = "discard_model";
    private static final String KEY_APPLY = "apply_correction";
    private static final String KEY_NORMALIZE = "normalize_output";
    private static final String KEY_MAX_ERROR = "max_error";

    private final Preferences prefs;

    public ExtractionPreferences() {
        this(Preferences.userNodeForPackage(ExtractionPreferences.class));
    }

    public ExtractionPreferences(Preferences prefs) {
        this.prefs = prefs;
    }

    public ExtractionSettings load() {
        ExtractionSettings d = ExtractionSettings.defaults();
        ExtractionSettings s = new ExtractionSettings();
        s.model = enumValue(ExtractionSettings.Model.class, prefs.get(KEY_MODEL, d.model.name()), d.model);
        s.sampleGeneration = enumValue(ExtractionSettings.SampleGeneration.class,
                prefs.get(KEY_SAMPLING, d.sampleGeneration.name()), d.sampleGeneration);
        s.tolerance = prefs.getDouble(KEY_TOLERANCE, d.tolerance);
        s.deviation = prefs.getDouble(KEY_DEVIATION, d.deviation);
        s.minSamples = prefs.getInt(KEY_MIN_SAMPLES, d.minSamples);
        s.maxSamples = prefs.getInt(KEY_MAX_SAMPLES, d.maxSamples);
        s.useOutlierRejection = prefs.getBoolean(KEY_REJECTION, d.useOutlierRejection);
        s.rejectionLow = prefs.getDouble(KEY_REJECT_LOW, d.rejectionLow);
        s.rejectionHigh = prefs.getDouble(KEY_REJECT_HIGH, d.rejectionHigh);
        s.rejectionIterations = prefs.getInt(KEY_REJECT_ITER, d.rejectionIterations);
        s.gridRows = prefs.getInt(KEY_GRID_ROWS, d.gridRows);
        s.gridColumns = prefs.getInt(KEY_GRID_COLS, d.gridColumns);
        s.discardModel = prefs.getBoolean(KEY_DISCARD, d.discardModel);
        s.applyCorrection = prefs.getBoolean(KEY_APPLY, d.applyCorrection);
        s.normalizeOutput = prefs.getBoolean(KEY_NORMALIZE, d.normalizeOutput);
        s.maxError = prefs.getDouble(KEY_MAX_ERROR, d.maxError);
        return s;
    }

    public void save(ExtractionSettings s) throws BackingStoreException {
        prefs.put(KEY_MODEL, s.model.name());
        prefs.put(KEY_SAMPLING, s.sampleGeneration.name());
        prefs.putDouble(KEY_TOLERANCE, s.tolerance);
        prefs.putDouble(KEY_DEVIATION, s.deviation);
        prefs.putInt(KEY_MIN_SAMPLES, s.minSamples);
        prefs.putInt(KEY_MAX_SAMPLES, s.maxSamples);
        prefs.putBoolean(KEY_REJECTION, s.useOutlierRejection);
        prefs.putDouble(KEY_REJECT_LOW, s.rejectionLow);
        prefs.putDouble(KEY_REJECT_HIGH, s.rejectionHigh);
        prefs.putInt(KEY_REJECT_ITER, s.rejectionIterations);
        prefs.putInt(KEY_GRID_ROWS, s.gridRows);
        prefs.putInt(KEY_GRID_COLS, s.gridColumns);
        prefs.putBoolean(KEY_DISCARD, s.discardModel);
        prefs.putBoolean(KEY_APPLY, s.applyCorrection);
        prefs.putBoolean(KEY_NORMALIZE, s.normalizeOutput);
        prefs.putDouble(KEY_MAX_ERROR, s.maxError);
        prefs.flush();
    }

    public void reset() throws BackingStoreException {
        prefs.clear();
        prefs.flush();
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name, E fallback) {
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
