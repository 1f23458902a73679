package com.astrobg.service;

/**
 * Dense Gaussian elimination with partial pivoting.
 */
public final class LinearSolver {

    static final double SINGULAR_PIVOT = 1e-12;

    private LinearSolver() {
    }

    /**
     * Solves {@code a * x = b} for a square {@code a}. Inputs are not modified.
     *
     * @throws FittingException if a pivot smaller than 1e-12 in magnitude is met
     */
    public static double[] solve(double[][] a, double[] b) throws FittingException {
        int n = b.length;
        if (a.length != n) {
            throw new IllegalArgumentException(String.format("Matrix has %d rows, vector has %d", a.length, n));
        }
        double[][] m = new double[n][];
        for (int i = 0; i < n; i++) {
            if (a[i].length != n) throw new IllegalArgumentException("Matrix is not square");
            m[i] = a[i].clone();
        }
        double[] rhs = b.clone();

        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(m[row][col]) > Math.abs(m[pivot][col])) pivot = row;
            }
            if (Math.abs(m[pivot][col]) < SINGULAR_PIVOT) {
                throw new FittingException("Singular system at column " + col);
            }
            if (pivot != col) {
                double[] tmp = m[pivot]; m[pivot] = m[col]; m[col] = tmp;
                double t = rhs[pivot]; rhs[pivot] = rhs[col]; rhs[col] = t;
            }

            for (int row = col + 1; row < n; row++) {
                double factor = m[row][col] / m[col][col];
                if (factor == 0) continue;
                for (int k = col; k < n; k++) m[row][k] -= factor * m[col][k];
                rhs[row] -= factor * rhs[col];
            }
        }

        double[] x = new double[n];
        for (int row = n - 1; row >= 0; row--) {
            double sum = rhs[row];
            for (int k = row + 1; k < n; k++) sum -= m[row][k] * x[k];
            x[row] = sum / m[row][row];
        }
        return x;
    }
}
