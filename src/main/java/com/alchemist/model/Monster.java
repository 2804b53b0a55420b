package com.alchemist.model;

public class Monster extends CombatActor {
    private final EnemyKind kind;

    // AI State
    private EnemyState state = EnemyState.IDLE;
    private long stateChangedAt = 0;
    private boolean facingRight = true;

    // Flag: provoked-only kinds stay passive until hit
    private boolean provoked = false;
    private CombatEntity aggroSource;

    private long deathTime = NEVER;

    public Monster(String id, EnemyKind kind, double x, double y) {
        super(id, kind.getTypeName(), x, y, kind.getMaxHealth(), kind.getAttackDamage(),
                kind.getAttackCooldownMillis(), kind.getHitboxWidth(), kind.getHitboxHeight());
        this.kind = kind;
    }

    @Override
    protected void onHurt(CombatEntity source) {
        provoked = true;
        if (source != null) aggroSource = source;
    }

    @Override
    protected void onDeath(CombatEntity source) {
        if (source != null) aggroSource = source;
    }

    public void enterState(EnemyState next, long now) {
        if (next == EnemyState.DEAD && state != EnemyState.DEAD) {
            deathTime = now;
        }
        this.state = next;
        this.stateChangedAt = now;
    }

    /**
     * Opacity while dead: solid for the death animation, then a linear fade to zero.
     */
    public int fadeAlpha(long now, long deathAnimationMillis, long fadeOutMillis) {
        if (state != EnemyState.DEAD) return 255;
        long elapsed = now - deathTime;
        if (elapsed <= deathAnimationMillis) return 255;
        if (fadeOutMillis <= 0) return 0;
        double progress = (double) (elapsed - deathAnimationMillis) / fadeOutMillis;
        return (int) Math.max(0, Math.round(255 * (1.0 - progress)));
    }

    public boolean isFadedOut(long now, long deathAnimationMillis, long fadeOutMillis) {
        return state == EnemyState.DEAD && now - deathTime >= deathAnimationMillis + fadeOutMillis;
    }

    public EnemyKind getKind() { return kind; }
    public EnemyState getState() { return state; }
    public long getStateChangedAt() { return stateChangedAt; }
    public long getDeathTime() { return deathTime; }

    public boolean isFacingRight() { return facingRight; }
    public void setFacingRight(boolean facingRight) { this.facingRight = facingRight; }

    public boolean isProvoked() { return provoked; }
    public void provoke(CombatEntity source) {
        this.provoked = true;
        if (source != null) this.aggroSource = source;
    }

    public CombatEntity getAggroSource() { return aggroSource; }

    public double getSpeed() { return kind.getSpeed(); }
    public double getDetectionRange() { return kind.getDetectionRange(); }
    public double getLeashRange() { return kind.getLeashRange(); }
    public double getAttackRange() { return kind.getAttackRange(); }
}
