package com.astrobg.service;

import com.astrobg.model.BackgroundModel;
import com.astrobg.model.ImageData;

/**
 * Subtracts a background model from its source image.
 */
public class Corrector {

    private static final double MIN_RANGE = 1e-12;

    /** Returns a new buffer {@code image - model}; cancellation mid-loop discards it. */
    public float[] apply(ImageData image, BackgroundModel model, CancellationToken token) {
        float[] background = model.toArray();
        if (background.length != image.pixels.length) {
            throw new IllegalArgumentException(String.format(
                    "Model holds %d values, image holds %d", background.length, image.pixels.length));
        }

        float[] corrected = new float[background.length];
        for (int i = 0; i < corrected.length; i++) {
            token.throwIfCancelled();
            corrected[i] = image.pixels[i] - background[i];
        }
        return corrected;
    }

    /** Rescales a buffer in place to [0,1]; a flat buffer becomes all zeros. */
    public void normalize(float[] buffer) {
        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for (float v : buffer) {
            if (!Float.isFinite(v)) continue;
            if (v < min) min = v;
            if (v > max) max = v;
        }
        if (min > max) return;

        double range = max - min;
        for (int i = 0; i < buffer.length; i++) {
            buffer[i] = range < MIN_RANGE ? 0f : (float) ((buffer[i] - min) / range);
        }
    }
}
