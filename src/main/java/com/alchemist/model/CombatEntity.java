package com.alchemist.model;

/**
 * Capability contract shared by every actor that can deal or receive damage.
 * <p>
 * Health is an integer in {@code [0, maxHealth]}. Once it reaches zero the entity is
 * terminal: later calls to {@link #takeDamage} must leave its health untouched.
 */
public interface CombatEntity {

    String getId();

    /** Kind name used by element-conditioned damage rules, e.g. "FireWorm". */
    String getTypeName();

    double getX();

    double getY();

    Rect getHitbox();

    int getHealth();

    int getMaxHealth();

    int getAttackDamage();

    long getAttackCooldownMillis();

    long getLastAttackTime();

    boolean isAlive();

    /** True when alive and the attack cooldown has elapsed at simulation time {@code now}. */
    boolean canAttack(long now);

    void recordAttack(long now);

    /**
     * Applies damage, or healing when {@code amount} is negative (clamped at max health).
     *
     * @return true if the entity is still alive afterwards
     */
    boolean takeDamage(int amount, DamageType type, CombatEntity source);
}
