package com.astrobg.service;

import com.astrobg.model.ExtractionResult;
import com.astrobg.model.Sample;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text views of an {@link ExtractionResult} for display and export.
 */
public class ExtractionReport {

    public static final String CSV_HEADER = "x,y,channel,value,status";

    private final ExtractionResult result;

    public ExtractionReport(ExtractionResult result) {
        this.result = result;
    }

    public String summary() {
        switch (result.status) {
            case CANCELLED:
                return "Extraction cancelled";
            case FAILED:
                return result.errorMessage.isEmpty() ? "Extraction failed" : "Extraction failed: " + result.errorMessage;
            default:
                break;
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.US, "Samples: %d (rejected: %d)\n", result.samplesUsed, result.samplesRejected));
        sb.append(String.format(Locale.US, "RMS Error: %.6f\n", result.rmsError));
        sb.append(String.format(Locale.US, "Mean Dev: %.6f\n", result.meanDeviation));
        sb.append(String.format(Locale.US, "Max Dev: %.6f\n", result.maxDeviation));
        sb.append(String.format(Locale.US, "Time: %.2fs", result.processingTimeSeconds));
        if (!result.withinErrorTolerance) sb.append("\n[WARNING] RMS error above configured maximum");
        return sb.toString();
    }

    /** One row per sample, in generation order: x, y, channel, value, Valid/Rejected. */
    public List<String[]> sampleTable() {
        List<String[]> rows = new ArrayList<>();
        for (Sample s : result.samples()) {
            rows.add(new String[] {
                    Integer.toString(s.x),
                    Integer.toString(s.y),
                    Integer.toString(s.channel),
                    String.format(Locale.US, "%.6f", s.value),
                    s.isRejected() ? "Rejected" : "Valid"
            });
        }
        return rows;
    }

    public void writeSampleCsv(Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write(CSV_HEADER);
            out.newLine();
            for (String[] row : sampleTable()) {
                out.write(String.join(",", row));
                out.newLine();
            }
        }
    }
}
