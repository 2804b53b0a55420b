package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.AreaAnimation;
import com.alchemist.model.CombatEntity;
import com.alchemist.model.DamageType;
import com.alchemist.model.EffectDescriptor;
import com.alchemist.model.FeedbackColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Radius damage around a caster. The damage is instantaneous; the animation left
 * behind is cosmetic.
 */
@Service
public class AreaResolver {
    private static final Logger log = LoggerFactory.getLogger(AreaResolver.class);

    private final CombatService combatService;
    private final long animationMillis;
    private final List<AreaAnimation> animations = new CopyOnWriteArrayList<>();

    public AreaResolver(CombatProperties properties, CombatService combatService) {
        this.combatService = combatService;
        this.animationMillis = properties.getArea().getAnimationMillis();
    }

    /**
     * Damages every live candidate whose centre lies within the descriptor's radius of the caster.
     * The caster gets no special treatment: callers pass the entities that may be hit.
     *
     * @return the candidates that were in range
     */
    public List<CombatEntity> resolve(CombatEntity caster, EffectDescriptor descriptor,
                                      Collection<? extends CombatEntity> candidates, long now) {
        double radius = descriptor.getRadius();
        List<CombatEntity> hit = new ArrayList<>();
        for (CombatEntity candidate : candidates) {
            if (!candidate.isAlive()) continue;
            double distance = Math.hypot(candidate.getX() - caster.getX(), candidate.getY() - caster.getY());
            if (distance <= radius) {
                combatService.dealDamage(caster, candidate, descriptor.getDamage(), DamageType.MAGICAL,
                        FeedbackColor.AREA, now);
                hit.add(candidate);
            }
        }
        animations.add(new AreaAnimation(caster.getX(), caster.getY(), radius, now, animationMillis));
        log.debug("{} caught {} of {} candidates", descriptor.getName(), hit.size(), candidates.size());
        return hit;
    }

    public void expire(long now) {
        animations.removeIf(a -> a.isFinished(now));
    }

    public List<AreaAnimation> getAnimations() {
        return Collections.unmodifiableList(new ArrayList<>(animations));
    }

    public void clear() { animations.clear(); }
}
