package com.astrobg.service;

import com.astrobg.model.ExtractionSettings;
import com.astrobg.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;

/**
 * Least-squares fit of a 2-D polynomial of total degree 1, 2 or 3. Terms are ordered
 * by degree: {1, x, y, x^2, xy, y^2, x^3, x^2y, xy^2, y^3}.
 */
public class PolynomialSurfaceFitter implements SurfaceFitter {

    private static final Logger log = LoggerFactory.getLogger(PolynomialSurfaceFitter.class);

    private final ExtractionSettings.Model model;

    public PolynomialSurfaceFitter(ExtractionSettings.Model model) {
        this.model = model;
    }

    public ExtractionSettings.Model getModel() {
        return model;
    }

    @Override
    public PolynomialSurface fit(List<Sample> samples, int width, int height) throws FittingException {
        List<Sample> valid = new ArrayList<>();
        for (Sample s : samples) if (!s.isRejected()) valid.add(s);

        int terms = model.termCount();
        if (valid.size() < terms) {
            throw new FittingException(String.format("%s needs at least %d samples, %d valid",
                    model.displayName, terms, valid.size()));
        }

        // Normal equations (A^T A) c = A^T b, accumulated row by row without storing A.
        double[][] ata = new double[terms][terms];
        double[] atb = new double[terms];
        double[] row = new double[terms];
        for (Sample s : valid) {
            terms(model.order, (double) s.x / width, (double) s.y / height, row);
            for (int i = 0; i < terms; i++) {
                atb[i] += row[i] * s.value;
                for (int j = i; j < terms; j++) ata[i][j] += row[i] * row[j];
            }
        }
        for (int i = 0; i < terms; i++) {
            for (int j = 0; j < i; j++) ata[i][j] = ata[j][i];
        }

        double[] coefficients = LinearSolver.solve(ata, atb);
        log.debug("{} fitted to {} samples", model.displayName, valid.size());
        return new PolynomialSurface(model.order, coefficients);
    }

    static void terms(int order, double nx, double ny, double[] out) {
        int t = 0;
        for (int degree = 0; degree <= order; degree++) {
            for (int yPower = 0; yPower <= degree; yPower++) {
                out[t++] = Math.pow(nx, degree - yPower) * Math.pow(ny, yPower);
            }
        }
    }

    public static class PolynomialSurface implements FittedSurface {
        private final int order;
        private final double[] coefficients;

        PolynomialSurface(int order, double[] coefficients) {
            this.order = order;
            this.coefficients = coefficients;
        }

        public double[] getCoefficients() {
            return coefficients.clone();
        }

        @Override
        public double valueAt(double nx, double ny) {
            double[] row = new double[coefficients.length];
            terms(order, nx, ny, row);
            double sum = 0;
            for (int i = 0; i < row.length; i++) sum += coefficients[i] * row[i];
            return sum;
        }
    }
}
