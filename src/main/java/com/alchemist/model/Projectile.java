package com.alchemist.model;

public class Projectile {
    private final String id;
    private final CombatEntity owner;
    private final ProjectileElement element;
    private final boolean hostile;
    private final int damage;
    private final double speed;
    private final double size;

    private double x;
    private double y;
    private final double dirX;
    private final double dirY;
    private boolean alive = true;

    public Projectile(String id, CombatEntity owner, ProjectileElement element, boolean hostile,
                      double startX, double startY, double targetX, double targetY,
                      double speed, int damage, double size) {
        this.id = id;
        this.owner = owner;
        this.element = element;
        this.hostile = hostile;
        this.x = startX;
        this.y = startY;
        this.speed = speed;
        this.damage = damage;
        this.size = size;

        double dx = targetX - startX;
        double dy = targetY - startY;
        double length = Math.sqrt(dx * dx + dy * dy);
        if (length > 0) {
            this.dirX = dx / length;
            this.dirY = dy / length;
        } else {
            this.dirX = 0;
            this.dirY = 0;
        }
    }

    public void advance(double dtSeconds) {
        x += dirX * speed * dtSeconds;
        y += dirY * speed * dtSeconds;
    }

    public boolean isOutside(double worldBound) {
        return Math.abs(x) > worldBound || Math.abs(y) > worldBound;
    }

    public Rect getHitbox() {
        return Rect.centeredOn(x, y, size, size);
    }

    public void kill() { this.alive = false; }

    public String getId() { return id; }
    public CombatEntity getOwner() { return owner; }
    public ProjectileElement getElement() { return element; }
    public boolean isHostile() { return hostile; }
    public int getDamage() { return damage; }
    public double getSpeed() { return speed; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getDirX() { return dirX; }
    public double getDirY() { return dirY; }
    public boolean isAlive() { return alive; }
}
