package com.alchemist.service;

import com.alchemist.model.ActiveEffect;
import com.alchemist.model.CombatEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Time-boxed boons keyed by effect name. Only one record per name exists at a time:
 * applying a name again rebinds the slot to the new target and restarts its timer.
 */
@Service
public class ActiveEffectTracker {
    private static final Logger log = LoggerFactory.getLogger(ActiveEffectTracker.class);

    public static final String SHIELD = "shield";
    public static final String INVISIBILITY = "invisibility";

    private final Map<String, ActiveEffect> effects = new ConcurrentHashMap<>();
    private final SimulationClock clock;

    public ActiveEffectTracker(SimulationClock clock) {
        this.clock = clock;
    }

    public ActiveEffect apply(String name, CombatEntity target, long now, long durationMillis) {
        ActiveEffect effect = new ActiveEffect(name, target, now, durationMillis);
        ActiveEffect previous = effects.put(name, effect);
        if (previous != null && previous.getTarget() != target) {
            log.debug("Effect '{}' moved from {} to {}", name, previous.getTarget().getId(), target.getId());
        }
        return effect;
    }

    /** Drops every record whose duration has elapsed at {@code now}. */
    public List<ActiveEffect> expire(long now) {
        List<ActiveEffect> expired = new ArrayList<>();
        Iterator<ActiveEffect> it = effects.values().iterator();
        while (it.hasNext()) {
            ActiveEffect effect = it.next();
            if (effect.isExpired(now)) {
                it.remove();
                expired.add(effect);
                log.debug("Effect '{}' on {} expired", effect.getName(), effect.getTarget().getId());
            }
        }
        return expired;
    }

    public boolean isActive(String name, CombatEntity entity, long now) {
        ActiveEffect effect = effects.get(name);
        return effect != null && effect.isBoundTo(entity) && !effect.isExpired(now);
    }

    public boolean isShielded(CombatEntity entity, long now) { return isActive(SHIELD, entity, now); }
    public boolean isInvisible(CombatEntity entity, long now) { return isActive(INVISIBILITY, entity, now); }

    public boolean isShielded(CombatEntity entity) { return isShielded(entity, clock.now()); }
    public boolean isInvisible(CombatEntity entity) { return isInvisible(entity, clock.now()); }

    public Optional<ActiveEffect> get(String name) {
        return Optional.ofNullable(effects.get(name));
    }

    public List<ActiveEffect> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(effects.values()));
    }

    public int size() { return effects.size(); }

    public void clear() { effects.clear(); }
}
