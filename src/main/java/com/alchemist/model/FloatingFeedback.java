package com.alchemist.model;

/**
 * Transient damage or heal number that follows its target. Read by rendering only.
 */
public final class FloatingFeedback {
    private static final double RISE_PER_SECOND = 20.0;

    private final int value;
    private final CombatEntity target;
    private final long startTime;
    private final long durationMillis;
    private final FeedbackColor color;

    public FloatingFeedback(int value, CombatEntity target, long startTime, long durationMillis, FeedbackColor color) {
        this.value = value;
        this.target = target;
        this.startTime = startTime;
        this.durationMillis = durationMillis;
        this.color = color;
    }

    public boolean isExpired(long now) {
        return now - startTime >= durationMillis;
    }

    /** Fully opaque for the first half, then fades linearly. */
    public int alpha(long now) {
        double progress = (double) (now - startTime) / durationMillis;
        if (progress <= 0.5) return 255;
        return (int) Math.max(0, Math.round(255 * (1.0 - (progress - 0.5) / 0.5)));
    }

    public double riseOffset(long now) {
        return Math.max(0, now - startTime) / 1000.0 * RISE_PER_SECOND;
    }

    public String label() {
        return (color == FeedbackColor.HEAL ? "+" : "-") + value;
    }

    public int getValue() { return value; }
    public CombatEntity getTarget() { return target; }
    public long getStartTime() { return startTime; }
    public long getDurationMillis() { return durationMillis; }
    public FeedbackColor getColor() { return color; }
}
