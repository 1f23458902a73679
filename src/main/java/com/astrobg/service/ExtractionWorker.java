package com.astrobg.service;

import com.astrobg.model.BackgroundModel;
import com.astrobg.model.ExtractionResult;
import com.astrobg.model.ExtractionSettings;
import com.astrobg.model.ImageData;
import com.astrobg.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * One extraction run: sampling, outlier rejection, surface fitting and optional correction.
 * Channels are processed independently inside each stage. A worker is single use.
 */
public class ExtractionWorker implements Callable<ExtractionResult> {

    private static final Logger log = LoggerFactory.getLogger(ExtractionWorker.class);

    public enum State { IDLE, SAMPLING, FITTING, CORRECTING, DONE, FAILED, CANCELLED }

    private final ImageData image;
    private final ExtractionSettings settings;
    private final List<Sample> manualSamples;
    private final CancellationToken token;
    private final ExtractionListener listener;

    private final SampleGenerator sampler = new SampleGenerator();
    private final OutlierRejector rejector = new OutlierRejector();
    private final Corrector corrector = new Corrector();
    private final SurfaceFitter fitter;

    private volatile State state = State.IDLE;

    public ExtractionWorker(ImageData image, ExtractionSettings settings) {
        this(image, settings, Collections.emptyList(), CancellationToken.none(), new ExtractionListener() {});
    }

    public ExtractionWorker(ImageData image, ExtractionSettings settings, List<Sample> manualSamples,
                            CancellationToken token, ExtractionListener listener) {
        this.image = image;
        this.settings = settings.copy();
        this.manualSamples = new ArrayList<>(manualSamples);
        this.token = token;
        this.listener = listener;
        this.fitter = SurfaceFitter.forModel(this.settings.model);
    }

    public State getState() {
        return state;
    }

    @Override
    public ExtractionResult call() {
        long start = System.nanoTime();
        List<Sample> samples = new ArrayList<>();
        try {
            ExtractionResult result = process(samples, start);
            state = State.DONE;
            log.info("Background extraction finished in {}s: {} samples, {} rejected, RMS {}",
                    String.format("%.2f", result.processingTimeSeconds), result.samplesUsed,
                    result.samplesRejected, result.rmsError);
            return result;
        } catch (CancellationException e) {
            state = State.CANCELLED;
            log.info("Background extraction cancelled");
            return ExtractionResult.cancelled(samples, elapsed(start));
        } catch (SamplingException e) {
            state = State.FAILED;
            log.error("Background sampling failed: {}", e.getMessage());
            return ExtractionResult.failed(ExtractionResult.ErrorKind.SAMPLING,
                    "Insufficient samples: " + e.getMessage(), samples, elapsed(start));
        } catch (FittingException e) {
            state = State.FAILED;
            log.error("Background fitting failed: {}", e.getMessage());
            return ExtractionResult.failed(ExtractionResult.ErrorKind.FITTING,
                    "Fitting failed: " + e.getMessage(), samples, elapsed(start));
        } catch (RuntimeException e) {
            state = State.FAILED;
            log.error("Background extraction error", e);
            return ExtractionResult.failed(ExtractionResult.ErrorKind.RUNTIME,
                    "Extraction error: " + e, samples, elapsed(start));
        }
    }

    private ExtractionResult process(List<Sample> samples, long start) throws SamplingException, FittingException {
        progress(0, "Starting background extraction");

        // --- SAMPLING ---
        state = State.SAMPLING;
        token.throwIfCancelled();
        progress(10, "Generating background samples...");
        progress(15, String.format("Sampling %d channel(s) (%s)", image.channels, settings.sampleGeneration.displayName));
        List<List<Sample>> perChannel = new ArrayList<>();
        for (int c = 0; c < image.channels; c++) {
            token.throwIfCancelled();
            List<Sample> channelSamples = sampleChannel(c);
            perChannel.add(channelSamples);
            samples.addAll(channelSamples);
        }
        progress(55, String.format("Generated %d background samples", samples.size()));

        // --- FITTING ---
        state = State.FITTING;
        token.throwIfCancelled();
        if (settings.useOutlierRejection) {
            progress(65, "Rejecting outliers...");
            for (List<Sample> channelSamples : perChannel) {
                rejector.reject(channelSamples, settings.rejectionLow, settings.rejectionHigh,
                        settings.rejectionIterations, token);
            }
        }

        progress(75, "Fitting background model...");
        List<FittedSurface> surfaces = new ArrayList<>();
        for (List<Sample> channelSamples : perChannel) {
            token.throwIfCancelled();
            surfaces.add(fitter.fit(channelSamples, image.width, image.height));
        }

        progress(85, "Evaluating background model...");
        BackgroundModel model = new BackgroundModel(image.width, image.height, image.channels);
        for (int c = 0; c < image.channels; c++) {
            token.throwIfCancelled();
            model.setPlane(c, surfaces.get(c).evaluate(image.width, image.height));
        }
        ErrorStats stats = errorStats(perChannel, surfaces);
        boolean withinTolerance = stats.rms <= settings.maxError;
        if (!withinTolerance) {
            log.warn("Fit RMS error {} exceeds the configured maximum {}", stats.rms, settings.maxError);
        }

        // --- CORRECTION ---
        float[] corrected = null;
        if (settings.applyCorrection) {
            state = State.CORRECTING;
            token.throwIfCancelled();
            progress(90, "Applying background correction...");
            corrected = corrector.apply(image, model, token);
            if (settings.normalizeOutput) corrector.normalize(corrected);
        }

        progress(100, "Background extraction complete");
        return new ExtractionResult.Builder(ExtractionResult.Status.SUCCESS)
                .samples(samples)
                .background(settings.discardModel && corrected != null ? null : model)
                .corrected(corrected)
                .rmsError(stats.rms)
                .meanDeviation(stats.mean)
                .maxDeviation(stats.max)
                .withinErrorTolerance(withinTolerance)
                .processingTimeSeconds(elapsed(start))
                .build();
    }

    // Manual sampling that comes up short is retried once on the regular grid. Automatic
    // sampling already ends on the grid inside the generator.
    private List<Sample> sampleChannel(int channel) throws SamplingException {
        try {
            return sampler.generate(image, channel, settings, manualSamples, token);
        } catch (SamplingException e) {
            if (settings.sampleGeneration != ExtractionSettings.SampleGeneration.MANUAL) throw e;
            log.warn("{} sampling failed on channel {} ({}), retrying with grid",
                    settings.sampleGeneration.displayName, channel, e.getMessage());
            ExtractionSettings gridSettings = settings.copy();
            gridSettings.sampleGeneration = ExtractionSettings.SampleGeneration.GRID;
            return sampler.generate(image, channel, gridSettings, manualSamples, token);
        }
    }

    private ErrorStats errorStats(List<List<Sample>> perChannel, List<FittedSurface> surfaces) {
        double sumSq = 0, sumAbs = 0, max = 0;
        int count = 0;
        for (int c = 0; c < perChannel.size(); c++) {
            FittedSurface surface = surfaces.get(c);
            for (Sample s : perChannel.get(c)) {
                if (s.isRejected()) continue;
                double residual = Math.abs(s.value - surface.valueAt((double) s.x / image.width, (double) s.y / image.height));
                sumSq += residual * residual;
                sumAbs += residual;
                max = Math.max(max, residual);
                count++;
            }
        }
        if (count == 0) return new ErrorStats(0, 0, 0);
        return new ErrorStats(Math.sqrt(sumSq / count), sumAbs / count, max);
    }

    private void progress(int percentage, String stage) {
        log.debug("[{}%] {}", percentage, stage);
        listener.onProgress(percentage, stage);
    }

    private static double elapsed(long start) {
        return (System.nanoTime() - start) / 1e9;
    }

    private static class ErrorStats {
        final double rms, mean, max;

        ErrorStats(double rms, double mean, double max) {
            this.rms = rms;
            this.mean = mean;
            this.max = max;
        }
    }
}
