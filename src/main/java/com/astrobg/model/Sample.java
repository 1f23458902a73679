package com.astrobg.model;

public class Sample {
    public final int x;
    public final int y;
    public final int channel;
    public final float value;

    private boolean rejected;

    public Sample(int x, int y, int channel, float value) {
        this(x, y, channel, value, false);
    }

    public Sample(int x, int y, int channel, float value, boolean rejected) {
        this.x = x;
        this.y = y;
        this.channel = channel;
        this.value = value;
        this.rejected = rejected;
    }

    public boolean isRejected() {
        return rejected;
    }

    // Rejection is one-way: a sample is never restored once flagged.
    public void reject() {
        rejected = true;
    }

    public Sample copy() {
        return new Sample(x, y, channel, value, rejected);
    }

    public double distanceSquared(int px, int py) {
        double dx = x - px;
        double dy = y - py;
        return dx * dx + dy * dy;
    }

    @Override
    public String toString() {
        return String.format("Sample[(%d,%d) c=%d v=%.6f%s]", x, y, channel, value, rejected ? " rejected" : "");
    }
}
