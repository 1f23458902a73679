package com.astrobg.service;

import com.astrobg.model.ExtractionResult;
import com.astrobg.model.ExtractionSettings;
import com.astrobg.model.ImageData;
import com.astrobg.model.Sample;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point for background extraction. Owns the settings, the manual sample list and the
 * last results, and allows at most one run in flight. The internal lock only guards those
 * snapshots; it is never held while a worker computes.
 */
public class BackgroundExtractor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundExtractor.class);

    public static final int DEFAULT_PREVIEW_SIZE = 256;
    static final int MIN_PREVIEW_SIDE = 32;
    private static final long SHUTDOWN_WAIT_MS = 5000;

    private final Object lock = new Object();
    private final List<ExtractionListener> listeners = new CopyOnWriteArrayList<>();
    private final ExtractionListener dispatcher = new Dispatcher();

    private ExtractionSettings settings = ExtractionSettings.defaults();
    private ExtractionResult result = ExtractionResult.empty();
    private ExtractionResult previewResult = ExtractionResult.empty();
    private final List<Sample> manualSamples = new ArrayList<>();
    private Run activeRun;
    private CompletableFuture<ExtractionResult> completion = CompletableFuture.completedFuture(ExtractionResult.empty());

    // --- SETTINGS ---

    public void setSettings(ExtractionSettings settings) {
        synchronized (lock) {
            this.settings = settings.copy();
        }
    }

    public ExtractionSettings getSettings() {
        synchronized (lock) {
            return settings.copy();
        }
    }

    public void addListener(ExtractionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ExtractionListener listener) {
        listeners.remove(listener);
    }

    // --- EXTRACTION ---

    /**
     * Runs the full pipeline on the calling thread.
     *
     * @return false if another run is in flight, the input is rejected, or the run did not succeed
     */
    public boolean extract(ImageData image) {
        Run run = prepare(image, false, false);
        return run != null && execute(run).isSuccess();
    }

    /**
     * Starts the pipeline on a dedicated thread and returns immediately.
     * Follow the run through {@link #completion()} or a listener.
     *
     * @return false if another run is in flight or the input is rejected
     */
    public boolean extractAsync(ImageData image) {
        Run run = prepare(image, false, true);
        if (run == null) return false;

        Thread thread = new Thread(() -> execute(run), "background-extraction");
        thread.setDaemon(true);
        run.thread = thread;
        thread.start();
        return true;
    }

    /**
     * Runs the pipeline on a nearest-neighbour downsampled copy whose longer side is at most
     * {@code maxSize}. The outcome is kept apart from {@link #result()}.
     */
    public boolean generatePreview(ImageData image, int maxSize) {
        if (isExtracting()) {
            log.warn("Background extraction already in progress, preview skipped");
            return false;
        }
        if (maxSize <= 0) {
            rejectInput("Invalid preview size: " + maxSize, true);
            return false;
        }
        ImageData previewImage = image;
        if (image != null && image.isValid()) {
            previewImage = downsample(image, maxSize);
            if (previewImage == null) {
                log.warn("Image {}x{} too small for a {}px preview", image.width, image.height, maxSize);
                return false;
            }
        }
        Run run = prepare(previewImage, true, false);
        return run != null && execute(run).isSuccess();
    }

    public boolean generatePreview(ImageData image) {
        return generatePreview(image, DEFAULT_PREVIEW_SIZE);
    }

    /** Signals the active run to stop at its next checkpoint. No effect when idle. */
    public void cancel() {
        synchronized (lock) {
            if (activeRun == null) return;
            activeRun.token.cancel();
        }
        log.info("Background extraction cancel requested");
    }

    public boolean isExtracting() {
        synchronized (lock) {
            return activeRun != null;
        }
    }

    /** Future of the current run, or of the last one when idle. */
    public CompletableFuture<ExtractionResult> completion() {
        synchronized (lock) {
            return completion;
        }
    }

    // --- RESULTS ---

    public ExtractionResult result() {
        synchronized (lock) {
            return result;
        }
    }

    public boolean hasResult() {
        synchronized (lock) {
            return result.isValid();
        }
    }

    public void clearResult() {
        synchronized (lock) {
            result = ExtractionResult.empty();
        }
    }

    public ExtractionResult previewResult() {
        synchronized (lock) {
            return previewResult;
        }
    }

    // --- MANUAL SAMPLES ---

    public void addManualSample(int x, int y, float value) {
        synchronized (lock) {
            manualSamples.add(new Sample(x, y, 0, value));
        }
    }

    /** Removes the most recently added sample at (x, y), if any. */
    public boolean removeManualSample(int x, int y) {
        synchronized (lock) {
            for (int i = manualSamples.size() - 1; i >= 0; i--) {
                Sample s = manualSamples.get(i);
                if (s.x == x && s.y == y) {
                    manualSamples.remove(i);
                    return true;
                }
            }
            return false;
        }
    }

    public void clearManualSamples() {
        synchronized (lock) {
            manualSamples.clear();
        }
    }

    public List<Sample> getManualSamples() {
        synchronized (lock) {
            List<Sample> copy = new ArrayList<>();
            for (Sample s : manualSamples) copy.add(s.copy());
            return copy;
        }
    }

    /** Cancels the active run and waits briefly for its thread to finish. */
    @Override
    public void close() {
        Thread thread;
        synchronized (lock) {
            if (activeRun == null) return;
            activeRun.token.cancel();
            thread = activeRun.thread;
        }
        if (thread == null || thread == Thread.currentThread()) return;
        try {
            thread.join(SHUTDOWN_WAIT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- INTERNALS ---

    // The image is copied only once it has been validated.
    private Run prepare(ImageData image, boolean preview, boolean copyImage) {
        String problem;
        synchronized (lock) {
            if (activeRun != null) {
                log.warn("Background extraction already in progress");
                return null;
            }
            ExtractionSettings snapshot = settings.copy();
            try {
                checkInputs(image, snapshot);
                activeRun = new Run(copyImage ? image.copy() : image, snapshot, getManualSamples(), preview);
                completion = activeRun.future;
                return activeRun;
            } catch (InvalidImageException e) {
                problem = e.getMessage();
            }
        }
        rejectInput(problem, preview);
        return null;
    }

    private void rejectInput(String message, boolean preview) {
        ExtractionResult rejection = ExtractionResult.failed(ExtractionResult.ErrorKind.CONFIGURATION, message);
        synchronized (lock) {
            if (preview) previewResult = rejection;
            else result = rejection;
            if (activeRun == null) completion = CompletableFuture.completedFuture(rejection);
        }
        log.error("Background extraction rejected: {}", message);
        dispatcher.onFinished(rejection);
    }

    private static void checkInputs(ImageData image, ExtractionSettings settings) throws InvalidImageException {
        if (image == null) throw new InvalidImageException("No image supplied");
        image.validate();
        try {
            settings.validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidImageException("Invalid settings: " + e.getMessage());
        }
    }

    private ExtractionResult execute(Run run) {
        ExtractionResult outcome = null;
        try {
            log.info("Background extraction started on {}x{}x{} image{}: {}", run.image.width, run.image.height,
                    run.image.channels, run.preview ? " (preview)" : "", run.settings);
            dispatcher.onStarted();
            ExtractionWorker worker = new ExtractionWorker(run.image, run.settings, run.manualSamples, run.token, dispatcher);
            outcome = worker.call();
            return outcome;
        } finally {
            if (outcome == null) {
                outcome = ExtractionResult.failed(ExtractionResult.ErrorKind.RUNTIME, "Extraction aborted");
            }
            synchronized (lock) {
                if (run.preview) previewResult = outcome;
                else result = outcome;
                activeRun = null;
            }
            dispatcher.onFinished(outcome);
            run.future.complete(outcome);
        }
    }

    static ImageData downsample(ImageData image, int maxSize) {
        int longer = Math.max(image.width, image.height);
        int scale = Math.max(1, (longer + maxSize - 1) / maxSize);
        if (scale == 1) return image;

        int w = image.width / scale;
        int h = image.height / scale;
        if (w < MIN_PREVIEW_SIDE || h < MIN_PREVIEW_SIDE) return null;

        float[] out = new float[w * h * image.channels];
        for (int c = 0; c < image.channels; c++) {
            FloatProcessor ip = new FloatProcessor(image.width, image.height, image.plane(c));
            ip.setInterpolationMethod(ImageProcessor.NONE);
            float[] small = (float[]) ip.resize(w, h).getPixels();
            System.arraycopy(small, 0, out, c * w * h, w * h);
        }
        return new ImageData(w, h, image.channels, out);
    }

    private static class Run {
        final ImageData image;
        final ExtractionSettings settings;
        final List<Sample> manualSamples;
        final boolean preview;
        final CancellationToken token = new CancellationToken();
        final CompletableFuture<ExtractionResult> future = new CompletableFuture<>();
        volatile Thread thread;

        Run(ImageData image, ExtractionSettings settings, List<Sample> manualSamples, boolean preview) {
            this.image = image;
            this.settings = settings;
            this.manualSamples = manualSamples;
            this.preview = preview;
        }
    }

    // Fans worker callbacks out to the registered listeners; a failing listener does not abort the run.
    private class Dispatcher implements ExtractionListener {
        @Override
        public void onStarted() {
            for (ExtractionListener l : listeners) {
                try {
                    l.onStarted();
                } catch (RuntimeException e) {
                    log.warn("Extraction listener failed on start", e);
                }
            }
        }

        @Override
        public void onProgress(int percentage, String stage) {
            for (ExtractionListener l : listeners) {
                try {
                    l.onProgress(percentage, stage);
                } catch (RuntimeException e) {
                    log.warn("Extraction listener failed on progress {}%", percentage, e);
                }
            }
        }

        @Override
        public void onFinished(ExtractionResult outcome) {
            for (ExtractionListener l : listeners) {
                try {
                    l.onFinished(outcome);
                } catch (RuntimeException e) {
                    log.warn("Extraction listener failed on finish", e);
                }
            }
        }
    }
}
