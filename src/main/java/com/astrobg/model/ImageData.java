package com.astrobg.model;

import com.astrobg.service.InvalidImageException;
import java.util.Arrays;

/**
 * Dense planar pixel buffer. Pixel (x, y) of channel c lives at {@code c*w*h + y*w + x}.
 */
public class ImageData {
    public final int width;
    public final int height;
    public final int channels;
    public final float[] pixels;

    public ImageData(int width, int height, int channels, float[] pixels) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.pixels = pixels;
    }

    public static ImageData singleChannel(int width, int height, float[] pixels) {
        return new ImageData(width, height, 1, pixels);
    }

    public boolean isValid() {
        return width > 0 && height > 0 && channels > 0
                && pixels != null && pixels.length > 0
                && (long) width * height * channels == pixels.length;
    }

    public void validate() throws InvalidImageException {
        if (pixels == null || pixels.length == 0) throw new InvalidImageException("Image buffer is empty");
        if (width <= 0 || height <= 0) {
            throw new InvalidImageException(String.format("Invalid image dimensions %dx%d", width, height));
        }
        if (channels <= 0) throw new InvalidImageException("Invalid channel count " + channels);
        long expected = (long) width * height * channels;
        if (expected != pixels.length) {
            throw new InvalidImageException(String.format(
                    "Buffer holds %d values, expected %d (%dx%dx%d)", pixels.length, expected, width, height, channels));
        }
    }

    public int planeSize() {
        return width * height;
    }

    public float pixel(int x, int y, int channel) {
        return pixels[channel * planeSize() + y * width + x];
    }

    /** Copy of one channel, row-major. */
    public float[] plane(int channel) {
        int offset = channel * planeSize();
        return Arrays.copyOfRange(pixels, offset, offset + planeSize());
    }

    public ImageData copy() {
        return new ImageData(width, height, channels, pixels.clone());
    }
}
