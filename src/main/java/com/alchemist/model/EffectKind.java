package com.alchemist.model;

public enum EffectKind {
    PROJECTILE,
    HEALING,
    SHIELD,
    AREA_ATTACK,
    INVISIBILITY
}
