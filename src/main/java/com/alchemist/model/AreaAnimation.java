package com.alchemist.model;

/**
 * Cosmetic three-phase whirlwind shown after an area attack: expanding ring,
 * rotating spiral, fade. Carries no gameplay effect.
 */
public final class AreaAnimation {

    public enum Phase { RING, SPIRAL, FADE }

    private final double centerX;
    private final double centerY;
    private final double radius;
    private final long startTime;
    private final long durationMillis;

    public AreaAnimation(double centerX, double centerY, double radius, long startTime, long durationMillis) {
        this.centerX = centerX;
        this.centerY = centerY;
        this.radius = radius;
        this.startTime = startTime;
        this.durationMillis = durationMillis;
    }

    public double progress(long now) {
        if (durationMillis <= 0) return 1.0;
        return Math.max(0.0, Math.min(1.0, (double) (now - startTime) / durationMillis));
    }

    public Phase phase(long now) {
        double progress = progress(now);
        if (progress < 0.3) return Phase.RING;
        if (progress < 0.7) return Phase.SPIRAL;
        return Phase.FADE;
    }

    public boolean isFinished(long now) {
        return now - startTime >= durationMillis;
    }

    public double getCenterX() { return centerX; }
    public double getCenterY() { return centerY; }
    public double getRadius() { return radius; }
    public long getStartTime() { return startTime; }
    public long getDurationMillis() { return durationMillis; }
}
