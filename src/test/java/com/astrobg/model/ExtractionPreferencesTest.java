package com.astrobg.model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.prefs.Preferences;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionPreferencesTest {

    private Preferences node;
    private ExtractionPreferences preferences;

    @BeforeEach
    void setUp() {
        node = Preferences.userRoot().node("astrobg-test-" + System.nanoTime());
        preferences = new ExtractionPreferences(node);
    }

    @AfterEach
    void tearDown() throws Exception {
        node.removeNode();
    }

    @Test
    void emptyNodeLoadsDefaults() {
        ExtractionSettings s = preferences.load();

        assertEquals(ExtractionSettings.defaults().toString(), s.toString());
    }

    @Test
    void savedSettingsAreLoadedBack() throws Exception {
        ExtractionSettings s = ExtractionSettings.aggressive();
        s.gridRows = 12;
        s.applyCorrection = true;

        preferences.save(s);
        ExtractionSettings loaded = preferences.load();

        assertEquals(ExtractionSettings.Model.POLYNOMIAL3, loaded.model);
        assertEquals(12, loaded.gridRows);
        assertTrue(loaded.applyCorrection);
        assertEquals(1.5, loaded.rejectionLow);
    }

    @Test
    void unknownEnumNameFallsBackToDefault() {
        node.put("model", "SPLINE");

        assertEquals(ExtractionSettings.Model.POLYNOMIAL2, preferences.load().model);
    }

    @Test
    void resetClearsStoredValues() throws Exception {
        preferences.save(ExtractionSettings.conservative());

        preferences.reset();

        assertEquals(ExtractionSettings.Model.POLYNOMIAL2, preferences.load().model);
    }
}
