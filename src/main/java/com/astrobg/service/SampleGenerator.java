package com.astrobg.service;

import com.astrobg.model.ExtractionSettings;
import com.astrobg.model.ImageData;
import com.astrobg.model.Sample;
import ij.measure.Measurements;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Produces candidate background samples for one channel of an image.
 */
public class SampleGenerator {

    private static final Logger log = LoggerFactory.getLogger(SampleGenerator.class);

    static final int MIN_BLOCK_PIXELS = 10;
    private static final int MIN_BLOCK_SIZE = 8;
    private static final int BLOCKS_PER_SHORT_SIDE = 32;

    /** {@code manualSamples} are only read in MANUAL mode. */
    public List<Sample> generate(ImageData image, int channel, ExtractionSettings settings,
                                 List<Sample> manualSamples, CancellationToken token) throws SamplingException {
        List<Sample> samples;
        switch (settings.sampleGeneration) {
            case GRID:
                samples = grid(image, channel, settings, token);
                break;
            case MANUAL:
                samples = manual(image, channel, settings, manualSamples);
                break;
            case AUTOMATIC:
            default:
                samples = automatic(image, channel, settings, token);
                break;
        }

        if (samples.size() < settings.minSamples) {
            throw new SamplingException(samples.size(), settings.minSamples);
        }
        log.debug("Generated {} {} samples on channel {}", samples.size(), settings.sampleGeneration, channel);
        return samples;
    }

    public static int blockSize(int width, int height) {
        return Math.max(MIN_BLOCK_SIZE, Math.min(width, height) / BLOCKS_PER_SHORT_SIDE);
    }

    List<Sample> grid(ImageData image, int channel, ExtractionSettings settings, CancellationToken token) {
        List<Sample> samples = new ArrayList<>();
        int stepX = image.width / (settings.gridColumns + 1);
        int stepY = image.height / (settings.gridRows + 1);

        for (int row = 1; row <= settings.gridRows; row++) {
            token.throwIfCancelled();
            for (int col = 1; col <= settings.gridColumns; col++) {
                if (samples.size() >= settings.maxSamples) return samples;
                int x = col * stepX;
                int y = row * stepY;
                if (x >= image.width || y >= image.height) continue;

                float v = image.pixel(x, y, channel);
                if (Float.isFinite(v)) samples.add(new Sample(x, y, channel, v));
            }
        }
        return samples;
    }

    List<Sample> automatic(ImageData image, int channel, ExtractionSettings settings, CancellationToken token) {
        try {
            List<Sample> accepted = lowVarianceBlocks(image, channel, settings, token);
            if (accepted.size() >= settings.minSamples) return accepted;
            log.warn("Automatic sampling kept {} samples on channel {} (minimum {}), falling back to grid",
                    accepted.size(), channel, settings.minSamples);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Automatic sampling failed on channel {}, falling back to grid", channel, e);
        }
        return grid(image, channel, settings, token);
    }

    private List<Sample> lowVarianceBlocks(ImageData image, int channel, ExtractionSettings settings,
                                           CancellationToken token) {
        int blockSize = blockSize(image.width, image.height);
        int step = Math.max(1, blockSize / 2);
        FloatProcessor ip = new FloatProcessor(image.width, image.height, image.plane(channel));
        int measurements = Measurements.MEAN | Measurements.STD_DEV | Measurements.MEDIAN;

        List<Block> blocks = new ArrayList<>();
        for (int by = 0; by + blockSize <= image.height; by += step) {
            for (int bx = 0; bx + blockSize <= image.width; bx += step) {
                token.throwIfCancelled();
                ip.setRoi(bx, by, blockSize, blockSize);
                ImageStatistics stats = ImageStatistics.getStatistics(ip, measurements, null);
                if (stats.pixelCount < MIN_BLOCK_PIXELS) continue;
                blocks.add(new Block(bx + blockSize / 2, by + blockSize / 2, stats.mean, stats.median, stats.stdDev));
            }
        }
        if (blocks.isEmpty()) return Collections.emptyList();

        List<Block> candidates = structureFree(blocks, settings);
        candidates.sort(Comparator.comparingDouble(b -> b.variance()));

        double minDistance = blockSize / 2.0;
        double minDistanceSq = minDistance * minDistance;
        List<Sample> accepted = new ArrayList<>();
        for (Block b : candidates) {
            if (accepted.size() >= settings.maxSamples) break;
            token.throwIfCancelled();

            boolean tooClose = false;
            for (Sample s : accepted) {
                if (s.distanceSquared(b.cx, b.cy) < minDistanceSq) {
                    tooClose = true;
                    break;
                }
            }
            if (!tooClose) accepted.add(new Sample(b.cx, b.cy, channel, (float) b.mean));
        }
        log.debug("Channel {}: {} blocks of {}px, {} candidates, {} accepted",
                channel, blocks.size(), blockSize, candidates.size(), accepted.size());
        return accepted;
    }

    // Drops blocks whose noise is well above the typical block noise (tolerance) or whose
    // mean is pulled above the median by bright pixels (deviation, in block sigma units).
    private List<Block> structureFree(List<Block> blocks, ExtractionSettings settings) {
        List<Double> noise = new ArrayList<>();
        for (Block b : blocks) noise.add(b.stdDev);
        Collections.sort(noise);
        double typicalNoise = noise.get(noise.size() / 2);
        double noiseLimit = typicalNoise * (1.0 + settings.tolerance);

        List<Block> kept = new ArrayList<>();
        for (Block b : blocks) {
            if (typicalNoise > 0 && b.stdDev > noiseLimit) continue;
            if (b.stdDev > 0 && (b.mean - b.median) > settings.deviation * b.stdDev) continue;
            kept.add(b);
        }
        return kept;
    }

    List<Sample> manual(ImageData image, int channel, ExtractionSettings settings, List<Sample> registered) {
        List<Sample> samples = new ArrayList<>();
        for (Sample m : registered) {
            if (samples.size() >= settings.maxSamples) break;
            if (m.x < 0 || m.y < 0 || m.x >= image.width || m.y >= image.height) {
                log.debug("Ignoring manual sample outside the image: {}", m);
                continue;
            }
            // Registered values describe a single plane; colour images are read per channel.
            float v = image.channels == 1 ? m.value : image.pixel(m.x, m.y, channel);
            if (Float.isFinite(v)) samples.add(new Sample(m.x, m.y, channel, v));
        }
        return samples;
    }

    private static class Block {
        final int cx, cy;
        final double mean, median, stdDev;

        Block(int cx, int cy, double mean, double median, double stdDev) {
            this.cx = cx;
            this.cy = cy;
            this.mean = mean;
            this.median = median;
            this.stdDev = stdDev;
        }

        double variance() {
            return stdDev * stdDev;
        }
    }
}
