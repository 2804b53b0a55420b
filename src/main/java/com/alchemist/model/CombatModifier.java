package com.alchemist.model;

/**
 * Buff or debuff applied to damage an entity deals or receives.
 * A duration of zero means permanent.
 */
public class CombatModifier {
    private final String name;
    private final double damageMultiplier;
    private final double damageReduction;
    private final long durationMillis;
    private long registeredAt = 0;

    public CombatModifier(String name, double damageMultiplier, double damageReduction, long durationMillis) {
        if (damageReduction < 0.0 || damageReduction > 1.0) {
            throw new IllegalArgumentException("damageReduction must be within [0, 1]: " + damageReduction);
        }
        if (durationMillis < 0) {
            throw new IllegalArgumentException("durationMillis must not be negative: " + durationMillis);
        }
        this.name = name;
        this.damageMultiplier = damageMultiplier;
        this.damageReduction = damageReduction;
        this.durationMillis = durationMillis;
    }

    public static CombatModifier multiplier(String name, double multiplier, long durationMillis) {
        return new CombatModifier(name, multiplier, 0.0, durationMillis);
    }

    public static CombatModifier reduction(String name, double reduction, long durationMillis) {
        return new CombatModifier(name, 1.0, reduction, durationMillis);
    }

    public int apply(int damage) {
        double modified = damage * damageMultiplier;
        modified *= (1.0 - damageReduction);
        return Math.max(0, (int) modified);
    }

    public boolean isPermanent() { return durationMillis == 0; }

    public boolean isExpired(long now) {
        return !isPermanent() && now - registeredAt >= durationMillis;
    }

    public void markRegistered(long now) { this.registeredAt = now; }

    public String getName() { return name; }
    public double getDamageMultiplier() { return damageMultiplier; }
    public double getDamageReduction() { return damageReduction; }
    public long getDurationMillis() { return durationMillis; }
    public long getRegisteredAt() { return registeredAt; }
}
