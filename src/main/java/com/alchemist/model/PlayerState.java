package com.alchemist.model;

public class PlayerState extends CombatActor implements Caster {
    public static final String TYPE = "Player";

    private static final int DEFAULT_MAX_HP = 100;
    private static final int ATTACK_DAMAGE = 30;
    private static final long ATTACK_COOLDOWN = 1000;

    // --- MANA ---
    private int mana;
    private int maxMana;
    private double manaRegenPerSecond;
    private double manaRemainder = 0;

    private boolean facingRight = true;
    private final SelectionBuffer selection = new SelectionBuffer();

    public PlayerState(String playerId, double x, double y) {
        this(playerId, x, y, DEFAULT_MAX_HP, 100, 3.0);
    }

    public PlayerState(String playerId, double x, double y, int maxHp, int maxMana, double manaRegenPerSecond) {
        super(playerId, TYPE, x, y, maxHp, ATTACK_DAMAGE, ATTACK_COOLDOWN, 40, 48);
        this.maxMana = maxMana;
        this.mana = maxMana;
        this.manaRegenPerSecond = manaRegenPerSecond;
    }

    // --- Mana Logic ---
    @Override
    public boolean spendMana(int cost) {
        if (cost < 0) throw new IllegalArgumentException("Mana cost must not be negative: " + cost);
        if (mana < cost) return false;
        mana -= cost;
        return true;
    }

    public void regenerateMana(double dtSeconds) {
        if (!alive || mana >= maxMana) {
            manaRemainder = 0;
            return;
        }
        manaRemainder += manaRegenPerSecond * dtSeconds;
        int whole = (int) manaRemainder;
        if (whole > 0) {
            mana = Math.min(maxMana, mana + whole);
            manaRemainder -= whole;
        }
    }

    @Override public int getMana() { return mana; }
    public int getMaxMana() { return maxMana; }
    public void setMana(int mana) { this.mana = Math.max(0, Math.min(maxMana, mana)); }

    @Override public boolean isFacingRight() { return facingRight; }
    public void setFacingRight(boolean facingRight) { this.facingRight = facingRight; }

    @Override public SelectionBuffer getSelection() { return selection; }

    public String getPlayerId() { return id; }
}
