package com.alchemist.model;

/**
 * A time-boxed boon bound to one target, such as a shield or invisibility.
 */
public final class ActiveEffect {
    private final String name;
    private final CombatEntity target;
    private final long startTime;
    private final long durationMillis;

    public ActiveEffect(String name, CombatEntity target, long startTime, long durationMillis) {
        this.name = name;
        this.target = target;
        this.startTime = startTime;
        this.durationMillis = durationMillis;
    }

    public boolean isExpired(long now) {
        return now - startTime >= durationMillis;
    }

    public long remainingMillis(long now) {
        return Math.max(0, startTime + durationMillis - now);
    }

    public boolean isBoundTo(CombatEntity entity) {
        return target == entity;
    }

    public String getName() { return name; }
    public CombatEntity getTarget() { return target; }
    public long getStartTime() { return startTime; }
    public long getDurationMillis() { return durationMillis; }
}
