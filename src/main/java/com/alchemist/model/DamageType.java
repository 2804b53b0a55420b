package com.alchemist.model;

public enum DamageType {
    PHYSICAL,
    MAGICAL,
    FIRE,
    WATER,
    EARTH
}
