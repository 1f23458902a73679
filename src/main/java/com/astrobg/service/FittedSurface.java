package com.astrobg.service;

/**
 * A fitted background surface over the normalised domain [0,1] x [0,1].
 */
public interface FittedSurface {

    double valueAt(double nx, double ny);

    /** Evaluates the surface at every pixel of a {@code width x height} plane, row-major. */
    default float[] evaluate(int width, int height) {
        float[] plane = new float[width * height];
        for (int y = 0; y < height; y++) {
            double ny = (double) y / height;
            int row = y * width;
            for (int x = 0; x < width; x++) {
                plane[row + x] = (float) valueAt((double) x / width, ny);
            }
        }
        return plane;
    }
}
