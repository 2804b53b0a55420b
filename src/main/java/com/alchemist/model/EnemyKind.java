package com.alchemist.model;

/**
 * Stat block for each enemy variant. The AI runs one state machine for every kind and
 * branches on {@link #isRanged()} and {@link #isProvokedOnly()}.
 */
public enum EnemyKind {
    //          type name     hp   speed detect leash  range  cooldown dmg  ranged provoked  hitbox
    DEMON(      "Demon",      200, 100,  512,   614,   96,    2000,    25,  false, false,    48, 56),
    FIRE_WORM(  "FireWorm",   200, 80,   768,   768,   512,   3000,    30,  true,  false,    56, 40),
    DRAGON_LORD("DragonLord", 20,  60,   150,   450,   100,   1500,    35,  false, true,     64, 64);

    private final String typeName;
    private final int maxHealth;
    private final double speed;
    private final double detectionRange;
    private final double leashRange;
    private final double attackRange;
    private final long attackCooldownMillis;
    private final int attackDamage;
    private final boolean ranged;
    private final boolean provokedOnly;
    private final double hitboxWidth;
    private final double hitboxHeight;

    EnemyKind(String typeName, int maxHealth, double speed, double detectionRange, double leashRange,
              double attackRange, long attackCooldownMillis, int attackDamage, boolean ranged,
              boolean provokedOnly, double hitboxWidth, double hitboxHeight) {
        this.typeName = typeName;
        this.maxHealth = maxHealth;
        this.speed = speed;
        this.detectionRange = detectionRange;
        this.leashRange = leashRange;
        this.attackRange = attackRange;
        this.attackCooldownMillis = attackCooldownMillis;
        this.attackDamage = attackDamage;
        this.ranged = ranged;
        this.provokedOnly = provokedOnly;
        this.hitboxWidth = hitboxWidth;
        this.hitboxHeight = hitboxHeight;
    }

    public String getTypeName() { return typeName; }
    public int getMaxHealth() { return maxHealth; }
    public double getSpeed() { return speed; }
    public double getDetectionRange() { return detectionRange; }
    public double getLeashRange() { return leashRange; }
    public double getAttackRange() { return attackRange; }
    public long getAttackCooldownMillis() { return attackCooldownMillis; }
    public int getAttackDamage() { return attackDamage; }
    public boolean isRanged() { return ranged; }
    public boolean isProvokedOnly() { return provokedOnly; }
    public double getHitboxWidth() { return hitboxWidth; }
    public double getHitboxHeight() { return hitboxHeight; }

    public static EnemyKind fromName(String name) {
        for (EnemyKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name) || kind.typeName.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown enemy kind: " + name);
    }
}
