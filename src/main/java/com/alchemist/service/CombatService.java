package com.alchemist.service;

import com.alchemist.model.CombatEntity;
import com.alchemist.model.DamageType;
import com.alchemist.model.FeedbackColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Gameplay-facing entry point for hurting and healing. Checks the target's shield
 * before handing the request to the {@link DamagePipeline}.
 */
@Service
public class CombatService {
    private static final Logger log = LoggerFactory.getLogger(CombatService.class);

    private final DamagePipeline pipeline;
    private final ActiveEffectTracker effects;

    public CombatService(DamagePipeline pipeline, ActiveEffectTracker effects) {
        this.pipeline = pipeline;
        this.effects = effects;
    }

    public boolean processAttack(CombatEntity attacker, CombatEntity target, DamageType type, long now) {
        if (effects.isShielded(target, now)) {
            log.debug("Shield on {} absorbed attack from {}", target.getId(), attacker.getId());
            return false;
        }
        return pipeline.processAttack(attacker, target, type, now);
    }

    public boolean dealDamage(CombatEntity source, CombatEntity target, int amount, DamageType type,
                              FeedbackColor color, long now) {
        if (effects.isShielded(target, now)) {
            log.debug("Shield on {} absorbed {} damage", target.getId(), amount);
            return false;
        }
        return pipeline.applyDamage(source, target, amount, type, color, now);
    }

    public int healEntity(CombatEntity target, int amount, long now) {
        return pipeline.healEntity(target, amount, now);
    }

    public boolean isShielded(CombatEntity target, long now) {
        return effects.isShielded(target, now);
    }

    public DamagePipeline getPipeline() { return pipeline; }
}
