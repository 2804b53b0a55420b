package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.CombatEntity;
import com.alchemist.model.CombatModifier;
import com.alchemist.model.DamageRecord;
import com.alchemist.model.DamageType;
import com.alchemist.model.FeedbackColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The one place where health changes. Attacks, flat damage and heals all pass
 * through here so that modifiers, history and feedback stay consistent.
 * <p>
 * Shield status is not checked here; see {@link CombatService}.
 */
@Service
public class DamagePipeline {
    private static final Logger log = LoggerFactory.getLogger(DamagePipeline.class);

    private final FeedbackEmitter feedback;
    private final int historyCapacity;

    private final Map<CombatEntity, List<CombatModifier>> modifiers = new ConcurrentHashMap<>();
    private final Deque<DamageRecord> history = new ArrayDeque<>();

    public DamagePipeline(CombatProperties properties, FeedbackEmitter feedback) {
        this.feedback = feedback;
        this.historyCapacity = Math.max(1, properties.getHistoryCapacity());
    }

    // --- ATTACKS ---

    /**
     * Resolves a standard attack using the attacker's own damage and both sides' modifiers.
     *
     * @return true if the attack was dispatched; says nothing about whether the target survived
     */
    public boolean processAttack(CombatEntity attacker, CombatEntity target, DamageType type, long now) {
        if (!attacker.canAttack(now) || !target.isAlive()) {
            return false;
        }
        int amount = computeDamage(attacker, target);
        boolean survived = target.takeDamage(amount, type, attacker);
        attacker.recordAttack(now);

        record(new DamageRecord(attacker, target, amount, type, now, survived));
        feedback.emit(amount, target, FeedbackColor.forDamageType(type), now);
        log.debug("{} hit {} for {} ({})", attacker.getId(), target.getId(), amount, type);
        return true;
    }

    /**
     * Applies a fixed amount of damage with no modifiers, as used by spells and projectiles.
     */
    public boolean applyDamage(CombatEntity source, CombatEntity target, int amount, DamageType type,
                               FeedbackColor color, long now) {
        if (!target.isAlive()) return false;
        int clamped = Math.max(0, amount);
        boolean survived = target.takeDamage(clamped, type, source);

        record(new DamageRecord(source, target, clamped, type, now, survived));
        feedback.emit(clamped, target, color, now);
        log.debug("{} took {} {} damage from {}", target.getId(), clamped, type,
                source != null ? source.getId() : "world");
        return true;
    }

    /**
     * Heals through {@code takeDamage(-amount)}.
     *
     * @return the health actually gained, after clamping at max health
     */
    public int healEntity(CombatEntity target, int amount, long now) {
        if (amount < 0) {
            throw new IllegalArgumentException("Heal amount must not be negative: " + amount);
        }
        int before = target.getHealth();
        target.takeDamage(-amount, DamageType.MAGICAL, null);
        int applied = target.getHealth() - before;
        if (target.isAlive()) {
            feedback.emit(applied, target, FeedbackColor.HEAL, now);
        }
        return applied;
    }

    int computeDamage(CombatEntity attacker, CombatEntity target) {
        int damage = attacker.getAttackDamage();
        for (CombatModifier modifier : getModifiers(attacker)) {
            damage = modifier.apply(damage);
        }
        for (CombatModifier modifier : getModifiers(target)) {
            damage = modifier.apply(damage);
        }
        return Math.max(0, damage);
    }

    // --- MODIFIERS ---

    public void addModifier(CombatEntity entity, CombatModifier modifier, long now) {
        modifier.markRegistered(now);
        modifiers.computeIfAbsent(entity, e -> new CopyOnWriteArrayList<>()).add(modifier);
    }

    public boolean removeModifier(CombatEntity entity, String name) {
        List<CombatModifier> list = modifiers.get(entity);
        return list != null && list.removeIf(m -> m.getName().equals(name));
    }

    public List<CombatModifier> getModifiers(CombatEntity entity) {
        List<CombatModifier> list = modifiers.get(entity);
        if (list == null) return Collections.emptyList();
        return Collections.unmodifiableList(list);
    }

    public void purgeExpiredModifiers(long now) {
        Iterator<Map.Entry<CombatEntity, List<CombatModifier>>> it = modifiers.entrySet().iterator();
        while (it.hasNext()) {
            List<CombatModifier> list = it.next().getValue();
            list.removeIf(m -> m.isExpired(now));
            if (list.isEmpty()) {
                it.remove();
            }
        }
    }

    public void forget(CombatEntity entity) {
        modifiers.remove(entity);
    }

    // --- HISTORY ---

    private synchronized void record(DamageRecord entry) {
        if (history.size() >= historyCapacity) {
            history.removeFirst();
        }
        history.addLast(entry);
    }

    /** Most recent entries last; at most {@code limit} of them. */
    public synchronized List<DamageRecord> getDamageHistory(int limit) {
        List<DamageRecord> all = new ArrayList<>(history);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return Collections.unmodifiableList(new ArrayList<>(all.subList(from, all.size())));
    }

    public synchronized int getHistorySize() { return history.size(); }

    public synchronized void clearDamageHistory() { history.clear(); }
}
