package com.alchemist.model;

public final class DamageRecord {
    private final CombatEntity attacker;
    private final CombatEntity target;
    private final int amount;
    private final DamageType type;
    private final long timestamp;
    private final boolean targetSurvived;

    public DamageRecord(CombatEntity attacker, CombatEntity target, int amount, DamageType type,
                        long timestamp, boolean targetSurvived) {
        this.attacker = attacker;
        this.target = target;
        this.amount = amount;
        this.type = type;
        this.timestamp = timestamp;
        this.targetSurvived = targetSurvived;
    }

    public CombatEntity getAttacker() { return attacker; }
    public CombatEntity getTarget() { return target; }
    public int getAmount() { return amount; }
    public DamageType getType() { return type; }
    public long getTimestamp() { return timestamp; }
    public boolean isTargetSurvived() { return targetSurvived; }
}
