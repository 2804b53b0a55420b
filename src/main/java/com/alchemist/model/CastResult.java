package com.alchemist.model;

import java.util.Optional;

public final class CastResult {

    public enum Status {
        CAST,
        NOTHING_SELECTED,
        INVALID_COMBO,
        ON_COOLDOWN,
        INSUFFICIENT_MANA
    }

    private final Status status;
    private final EffectDescriptor effect;

    private CastResult(Status status, EffectDescriptor effect) {
        this.status = status;
        this.effect = effect;
    }

    public static CastResult cast(EffectDescriptor effect) {
        return new CastResult(Status.CAST, effect);
    }

    public static CastResult failed(Status status, EffectDescriptor effect) {
        return new CastResult(status, effect);
    }

    public boolean isSuccess() { return status == Status.CAST; }
    public Status getStatus() { return status; }

    /** The applied effect; empty unless the cast succeeded. */
    public Optional<EffectDescriptor> getEffect() {
        return isSuccess() ? Optional.of(effect) : Optional.empty();
    }

    /** The resolved effect, even when the cast was refused for mana or cooldown. */
    public Optional<EffectDescriptor> getAttempted() { return Optional.ofNullable(effect); }
}
