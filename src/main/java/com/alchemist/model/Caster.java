package com.alchemist.model;

/**
 * A combat entity that can select elements and cast the resulting spell.
 */
public interface Caster extends CombatEntity {

    /** Last horizontal facing; projectiles travel along it. */
    boolean isFacingRight();

    int getMana();

    /** Deducts {@code cost} mana if enough is available; returns false otherwise. */
    boolean spendMana(int cost);

    SelectionBuffer getSelection();
}
