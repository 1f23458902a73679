package com.astrobg.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionSettingsTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        ExtractionSettings s = ExtractionSettings.defaults();

        assertEquals(ExtractionSettings.Model.POLYNOMIAL2, s.model);
        assertEquals(ExtractionSettings.SampleGeneration.AUTOMATIC, s.sampleGeneration);
        assertEquals(50, s.minSamples);
        assertEquals(2000, s.maxSamples);
        assertEquals(2.0, s.rejectionLow);
        assertEquals(2.5, s.rejectionHigh);
        assertEquals(3, s.rejectionIterations);
        assertTrue(s.discardModel);
        assertFalse(s.applyCorrection);
        assertTrue(s.normalizeOutput);
        assertDoesNotThrow(s::validate);
    }

    @Test
    void presetsAreValid() {
        ExtractionSettings conservative = ExtractionSettings.conservative();
        ExtractionSettings aggressive = ExtractionSettings.aggressive();

        assertEquals(ExtractionSettings.Model.LINEAR, conservative.model);
        assertEquals(ExtractionSettings.SampleGeneration.GRID, conservative.sampleGeneration);
        assertEquals(ExtractionSettings.Model.POLYNOMIAL3, aggressive.model);
        assertEquals(5, aggressive.rejectionIterations);
        assertDoesNotThrow(conservative::validate);
        assertDoesNotThrow(aggressive::validate);
    }

    @Test
    void termCountFollowsTheOrder() {
        assertEquals(3, ExtractionSettings.Model.LINEAR.termCount());
        assertEquals(6, ExtractionSettings.Model.POLYNOMIAL2.termCount());
        assertEquals(10, ExtractionSettings.Model.POLYNOMIAL3.termCount());
    }

    @Test
    void validateRejectsInconsistentBounds() {
        ExtractionSettings s = ExtractionSettings.defaults();
        s.maxSamples = 10;
        assertThrows(IllegalArgumentException.class, s::validate);

        ExtractionSettings grid = ExtractionSettings.defaults();
        grid.gridColumns = 0;
        assertThrows(IllegalArgumentException.class, grid::validate);

        ExtractionSettings sigma = ExtractionSettings.defaults();
        sigma.rejectionHigh = 0;
        assertThrows(IllegalArgumentException.class, sigma::validate);
    }

    @Test
    void copyIsIndependent() {
        ExtractionSettings s = ExtractionSettings.defaults();
        ExtractionSettings copy = s.copy();
        copy.minSamples = 7;
        copy.model = ExtractionSettings.Model.LINEAR;

        assertEquals(50, s.minSamples);
        assertEquals(ExtractionSettings.Model.POLYNOMIAL2, s.model);
    }
}
