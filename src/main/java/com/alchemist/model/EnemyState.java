package com.alchemist.model;

public enum EnemyState {
    IDLE,
    PURSUING,
    ATTACKING,
    DEAD
}
