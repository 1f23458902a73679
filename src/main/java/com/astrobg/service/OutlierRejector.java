package com.astrobg.service;

import com.astrobg.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Iterative median/MAD sigma clipping over the rejection flags of a sample list.
 */
public class OutlierRejector {

    private static final Logger log = LoggerFactory.getLogger(OutlierRejector.class);

    /** Scales the MAD of a normal distribution to its standard deviation. */
    public static final double MAD_TO_SIGMA = 1.4826;
    static final int MIN_VALID_SAMPLES = 10;
    private static final double MIN_SIGMA = 1e-12;

    public int reject(List<Sample> samples, double lowSigma, double highSigma, int maxIterations) {
        return reject(samples, lowSigma, highSigma, maxIterations, CancellationToken.none());
    }

    /** Returns the number of samples newly flagged by this call. */
    public int reject(List<Sample> samples, double lowSigma, double highSigma, int maxIterations,
                      CancellationToken token) {
        int total = 0;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            token.throwIfCancelled();

            List<Double> values = new ArrayList<>();
            for (Sample s : samples) if (!s.isRejected()) values.add((double) s.value);
            if (values.size() < MIN_VALID_SAMPLES) break;

            double median = median(values);
            List<Double> deviations = new ArrayList<>(values.size());
            for (double v : values) deviations.add(Math.abs(v - median));
            double sigma = MAD_TO_SIGMA * median(deviations);
            if (sigma < MIN_SIGMA) break;

            double low = median - lowSigma * sigma;
            double high = median + highSigma * sigma;
            int rejected = 0;
            for (Sample s : samples) {
                if (!s.isRejected() && (s.value < low || s.value > high)) {
                    s.reject();
                    rejected++;
                }
            }
            log.debug("Rejection pass {}: median {}, sigma {}, rejected {}", iteration + 1, median, sigma, rejected);
            total += rejected;
            if (rejected == 0) break;
        }
        return total;
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 0) return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
        return sorted.get(mid);
    }
}
