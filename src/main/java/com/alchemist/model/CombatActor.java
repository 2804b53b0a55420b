package com.alchemist.model;

/**
 * Shared health, position and attack-timer state for players and monsters.
 */
public abstract class CombatActor implements CombatEntity {
    public static final long NEVER = Long.MIN_VALUE;

    protected final String id;
    protected final String type;
    protected double x;
    protected double y;
    protected int hp;
    protected int maxHp;
    protected int attackDamage;
    protected long attackCooldownMillis;
    protected long lastAttackTime = NEVER;
    protected boolean alive = true;

    private final double hitboxWidth;
    private final double hitboxHeight;

    protected CombatActor(String id, String type, double x, double y, int maxHp,
                          int attackDamage, long attackCooldownMillis,
                          double hitboxWidth, double hitboxHeight) {
        if (maxHp <= 0) {
            throw new IllegalArgumentException("maxHp must be positive, got " + maxHp);
        }
        this.id = id;
        this.type = type;
        this.x = x;
        this.y = y;
        this.maxHp = maxHp;
        this.hp = maxHp;
        this.attackDamage = attackDamage;
        this.attackCooldownMillis = attackCooldownMillis;
        this.hitboxWidth = hitboxWidth;
        this.hitboxHeight = hitboxHeight;
    }

    // --- HP Logic ---
    @Override
    public boolean takeDamage(int amount, DamageType damageType, CombatEntity source) {
        if (!alive) return false;

        if (amount < 0) {
            hp = (int) Math.min(maxHp, (long) hp - amount);
        } else {
            hp = (int) Math.max(0, (long) hp - amount);
        }

        if (hp <= 0) {
            alive = false;
            onDeath(source);
        } else if (amount > 0) {
            onHurt(source);
        }
        return alive;
    }

    protected void onHurt(CombatEntity source) {
    }

    protected void onDeath(CombatEntity source) {
    }

    @Override
    public boolean canAttack(long now) {
        return alive && (lastAttackTime == NEVER || now - lastAttackTime >= attackCooldownMillis);
    }

    @Override
    public void recordAttack(long now) { this.lastAttackTime = now; }

    @Override
    public Rect getHitbox() {
        return Rect.centeredOn(x, y, hitboxWidth, hitboxHeight);
    }

    public Rect getHitboxAt(double atX, double atY) {
        return Rect.centeredOn(atX, atY, hitboxWidth, hitboxHeight);
    }

    public double distanceTo(CombatEntity other) {
        return Math.hypot(other.getX() - x, other.getY() - y);
    }

    @Override public String getId() { return id; }
    @Override public String getTypeName() { return type; }
    @Override public double getX() { return x; }
    @Override public double getY() { return y; }
    @Override public int getHealth() { return hp; }
    @Override public int getMaxHealth() { return maxHp; }
    @Override public int getAttackDamage() { return attackDamage; }
    @Override public long getAttackCooldownMillis() { return attackCooldownMillis; }
    @Override public long getLastAttackTime() { return lastAttackTime; }
    @Override public boolean isAlive() { return alive; }

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setAttackDamage(int attackDamage) { this.attackDamage = attackDamage; }

    @Override
    public String toString() {
        return type + "[" + id + " hp=" + hp + "/" + maxHp + " at " + Math.round(x) + "," + Math.round(y) + "]";
    }
}
