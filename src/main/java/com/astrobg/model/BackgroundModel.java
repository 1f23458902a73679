package com.astrobg.model;

/**
 * Fitted background surface evaluated at every pixel, same planar layout as {@link ImageData}.
 */
public class BackgroundModel {
    public final int width;
    public final int height;
    public final int channels;
    private final float[] data;

    public BackgroundModel(int width, int height, int channels) {
        this(width, height, channels, new float[width * height * channels]);
    }

    public BackgroundModel(int width, int height, int channels, float[] data) {
        if (data.length != width * height * channels) {
            throw new IllegalArgumentException(String.format(
                    "Model buffer holds %d values, expected %d", data.length, width * height * channels));
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    public float valueAt(int x, int y, int channel) {
        return data[channel * width * height + y * width + x];
    }

    public void setPlane(int channel, float[] plane) {
        System.arraycopy(plane, 0, data, channel * width * height, width * height);
    }

    public int size() {
        return data.length;
    }

    /** Copy of the backing buffer. */
    public float[] toArray() {
        return data.clone();
    }

    public BackgroundModel copy() {
        return new BackgroundModel(width, height, channels, data.clone());
    }
}
