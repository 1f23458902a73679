package com.astrobg.service;

import com.astrobg.model.ExtractionSettings;
import com.astrobg.model.Sample;
import java.util.List;

/**
 * Fits a smooth surface to background samples. Implementations ignore rejected samples.
 */
public interface SurfaceFitter {

    FittedSurface fit(List<Sample> samples, int width, int height) throws FittingException;

    static SurfaceFitter forModel(ExtractionSettings.Model model) {
        return new PolynomialSurfaceFitter(model);
    }
}
