package com.alchemist.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable description of what an element combination does.
 * Durations and cooldowns are in simulation milliseconds, radius in world units.
 */
public final class EffectDescriptor {
    private final String id;
    private final String name;
    private final String description;
    private final EffectKind kind;
    private final List<Element> elements;
    private final int damage;
    private final int healing;
    private final long durationMillis;
    private final double radius;
    private final long cooldownMillis;

    private EffectDescriptor(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.description = builder.description;
        this.kind = builder.kind;
        this.elements = Collections.unmodifiableList(Arrays.asList(builder.first, builder.second));
        this.damage = builder.damage;
        this.healing = builder.healing;
        this.durationMillis = builder.durationMillis;
        this.radius = builder.radius;
        this.cooldownMillis = builder.cooldownMillis;
    }

    public static Builder builder(String id, EffectKind kind, Element first, Element second) {
        return new Builder(id, kind, first, second);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public EffectKind getKind() { return kind; }
    public List<Element> getElements() { return elements; }
    public int getDamage() { return damage; }
    public int getHealing() { return healing; }
    public long getDurationMillis() { return durationMillis; }
    public double getRadius() { return radius; }
    public long getCooldownMillis() { return cooldownMillis; }

    @Override
    public String toString() {
        return name + " (" + kind + ")";
    }

    public static final class Builder {
        private final String id;
        private final EffectKind kind;
        private final Element first;
        private final Element second;
        private String name;
        private String description = "";
        private int damage;
        private int healing;
        private long durationMillis;
        private double radius;
        private long cooldownMillis;

        private Builder(String id, EffectKind kind, Element first, Element second) {
            if (id == null || kind == null || first == null || second == null) {
                throw new IllegalArgumentException("id, kind and both elements are required");
            }
            this.id = id;
            this.name = id;
            this.kind = kind;
            this.first = first;
            this.second = second;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder damage(int damage) { this.damage = damage; return this; }
        public Builder healing(int healing) { this.healing = healing; return this; }
        public Builder durationMillis(long durationMillis) { this.durationMillis = durationMillis; return this; }
        public Builder radius(double radius) { this.radius = radius; return this; }
        public Builder cooldownMillis(long cooldownMillis) { this.cooldownMillis = cooldownMillis; return this; }

        public EffectDescriptor build() {
            if (damage < 0 || healing < 0 || durationMillis < 0 || radius < 0 || cooldownMillis < 0) {
                throw new IllegalArgumentException("Effect parameters must not be negative: " + id);
            }
            return new EffectDescriptor(this);
        }
    }
}
