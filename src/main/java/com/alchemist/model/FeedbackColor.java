package com.alchemist.model;

/**
 * Colour tag for floating numbers, derived from the damage source.
 */
public enum FeedbackColor {
    DAMAGE(255, 100, 100),
    FIRE(255, 150, 50),
    WATER(100, 150, 255),
    AREA(255, 200, 100),
    HEAL(100, 255, 100);

    private final int red;
    private final int green;
    private final int blue;

    FeedbackColor(int red, int green, int blue) {
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    public int getRed() { return red; }
    public int getGreen() { return green; }
    public int getBlue() { return blue; }

    public String toHex() {
        return String.format("#%02x%02x%02x", red, green, blue);
    }

    public static FeedbackColor forDamageType(DamageType type) {
        if (type == DamageType.FIRE) return FIRE;
        if (type == DamageType.WATER) return WATER;
        return DAMAGE;
    }
}
