package com.astrobg.service;

import com.astrobg.model.ExtractionSettings;
import com.astrobg.model.ImageData;
import com.astrobg.model.Sample;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolynomialSurfaceFitterTest {

    private static List<Sample> gridOf(int width, int height, int n, java.util.function.DoubleBinaryOperator f) {
        List<Sample> samples = new ArrayList<>();
        for (int row = 1; row <= n; row++) {
            for (int col = 1; col <= n; col++) {
                int x = col * width / (n + 1);
                int y = row * height / (n + 1);
                samples.add(new Sample(x, y, 0, (float) f.applyAsDouble((double) x / width, (double) y / height)));
            }
        }
        return samples;
    }

    @Test
    void recoversALinearRamp() throws Exception {
        ImageData image = TestImages.linearRamp(512, 512);
        ExtractionSettings s = ExtractionSettings.defaults();
        s.sampleGeneration = ExtractionSettings.SampleGeneration.GRID;
        s.gridRows = 8;
        s.gridColumns = 8;
        s.minSamples = 10;
        List<Sample> samples = new SampleGenerator().generate(image, 0, s, Collections.emptyList(), CancellationToken.none());

        FittedSurface surface = new PolynomialSurfaceFitter(ExtractionSettings.Model.LINEAR).fit(samples, 512, 512);
        float[] plane = surface.evaluate(512, 512);

        double sumSq = 0;
        for (int i = 0; i < plane.length; i++) {
            double d = plane[i] - image.pixels[i];
            sumSq += d * d;
        }
        assertTrue(Math.sqrt(sumSq / plane.length) < 1e-3);
    }

    @Test
    void recoversQuadraticCoefficients() throws Exception {
        List<Sample> samples = gridOf(400, 300, 6,
                (x, y) -> 0.2 + 0.1 * x - 0.05 * y + 0.3 * x * x + 0.1 * x * y - 0.2 * y * y);

        PolynomialSurfaceFitter.PolynomialSurface surface =
                new PolynomialSurfaceFitter(ExtractionSettings.Model.POLYNOMIAL2).fit(samples, 400, 300);

        assertArrayEquals(new double[] {0.2, 0.1, -0.05, 0.3, 0.1, -0.2}, surface.getCoefficients(), 1e-4);
        assertEquals(0.2 + 0.1 * 0.5 - 0.05 * 0.5 + 0.3 * 0.25 + 0.1 * 0.25 - 0.2 * 0.25,
                surface.valueAt(0.5, 0.5), 1e-4);
    }

    @Test
    void cubicFitsACubicSurface() throws Exception {
        List<Sample> samples = gridOf(256, 256, 8, (x, y) -> 0.1 + 0.4 * x * x * x - 0.2 * x * y * y);

        FittedSurface surface = new PolynomialSurfaceFitter(ExtractionSettings.Model.POLYNOMIAL3).fit(samples, 256, 256);

        assertEquals(0.1 + 0.4 * 0.125 - 0.2 * 0.5 * 0.25, surface.valueAt(0.5, 0.5), 1e-4);
    }

    @Test
    void ignoresRejectedSamples() throws Exception {
        List<Sample> samples = gridOf(100, 100, 5, (x, y) -> 0.3);
        samples.add(new Sample(50, 50, 0, 100f, true));

        FittedSurface surface = new PolynomialSurfaceFitter(ExtractionSettings.Model.LINEAR).fit(samples, 100, 100);

        assertEquals(0.3, surface.valueAt(0.5, 0.5), 1e-5);
    }

    @Test
    void tooFewValidSamplesFail() {
        assertTooFew(ExtractionSettings.Model.LINEAR, 2);
        assertTooFew(ExtractionSettings.Model.POLYNOMIAL2, 5);
        assertTooFew(ExtractionSettings.Model.POLYNOMIAL3, 9);
    }

    private static void assertTooFew(ExtractionSettings.Model model, int valid) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < valid; i++) samples.add(new Sample(i * 7, i * 3, 0, 0.1f));
        for (int i = 0; i < 20; i++) samples.add(new Sample(i, 40 - i, 0, 0.1f, true));

        FittingException e = assertThrows(FittingException.class,
                () -> new PolynomialSurfaceFitter(model).fit(samples, 64, 64));
        assertTrue(e.getMessage().contains(valid + " valid"), e.getMessage());
    }

    @Test
    void coincidentSamplesAreSingular() {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < 10; i++) samples.add(new Sample(5, 5, 0, 0.1f + i * 0.001f));

        assertThrows(FittingException.class,
                () -> new PolynomialSurfaceFitter(ExtractionSettings.Model.LINEAR).fit(samples, 100, 100));
    }

    @Test
    void termsAreOrderedByDegree() {
        double[] out = new double[10];
        PolynomialSurfaceFitter.terms(3, 2.0, 3.0, out);

        assertArrayEquals(new double[] {1, 2, 3, 4, 6, 9, 8, 12, 18, 27}, out, 1e-12);
    }

    @Test
    void forModelKeepsTheRequestedModel() {
        SurfaceFitter fitter = SurfaceFitter.forModel(ExtractionSettings.Model.POLYNOMIAL3);

        assertEquals(ExtractionSettings.Model.POLYNOMIAL3, ((PolynomialSurfaceFitter) fitter).getModel());
    }
}
