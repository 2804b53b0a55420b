package com.alchemist.handler;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.ActiveEffect;
import com.alchemist.model.AreaAnimation;
import com.alchemist.model.DamageRecord;
import com.alchemist.model.EffectDescriptor;
import com.alchemist.model.FloatingFeedback;
import com.alchemist.model.Monster;
import com.alchemist.model.PlayerState;
import com.alchemist.model.Projectile;
import com.alchemist.service.ActiveEffectTracker;
import com.alchemist.service.AreaResolver;
import com.alchemist.service.DamagePipeline;
import com.alchemist.service.EffectRegistry;
import com.alchemist.service.EnemyService;
import com.alchemist.service.FeedbackEmitter;
import com.alchemist.service.ProjectileSimulator;
import com.alchemist.service.SpellCooldownTracker;
import com.alchemist.service.VisualCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the JSON views of the simulation pushed over the socket and served by the debug API.
 */
@Component
public class WorldSnapshotWriter {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final EnemyService enemyService;
    private final ProjectileSimulator projectiles;
    private final ActiveEffectTracker effects;
    private final FeedbackEmitter feedback;
    private final AreaResolver areaResolver;
    private final DamagePipeline pipeline;
    private final EffectRegistry registry;
    private final SpellCooldownTracker cooldowns;
    private final VisualCatalog visuals;
    private final CombatProperties properties;

    public WorldSnapshotWriter(EnemyService enemyService, ProjectileSimulator projectiles, ActiveEffectTracker effects,
                               FeedbackEmitter feedback, AreaResolver areaResolver, DamagePipeline pipeline,
                               EffectRegistry registry, SpellCooldownTracker cooldowns, VisualCatalog visuals,
                               CombatProperties properties) {
        this.enemyService = enemyService;
        this.projectiles = projectiles;
        this.effects = effects;
        this.feedback = feedback;
        this.areaResolver = areaResolver;
        this.pipeline = pipeline;
        this.registry = registry;
        this.cooldowns = cooldowns;
        this.visuals = visuals;
        this.properties = properties;
    }

    public ObjectMapper getObjectMapper() { return objectMapper; }

    public ObjectNode worldUpdate(PlayerState player, long now) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "world_update");
        msg.put("time", now);

        ObjectNode p = msg.putObject("player");
        p.put("x", player.getX());
        p.put("y", player.getY());
        p.put("hp", player.getHealth());
        p.put("maxHp", player.getMaxHealth());
        p.put("mana", player.getMana());
        p.put("maxMana", player.getMaxMana());
        p.put("facingRight", player.isFacingRight());
        p.put("selection", player.getSelection().describe());
        p.put("shielded", effects.isShielded(player, now));
        p.put("invisible", effects.isInvisible(player, now));

        msg.set("enemies", enemies(now));
        msg.set("projectiles", projectiles());
        msg.set("effects", effects(now));
        msg.set("feedback", feedback(now));
        msg.set("areas", areas(now));
        msg.set("cooldowns", cooldowns(now));
        return msg;
    }

    public ArrayNode enemies(long now) {
        ArrayNode arr = objectMapper.createArrayNode();
        for (Monster m : enemyService.getMonsters()) {
            ObjectNode n = arr.addObject();
            n.put("id", m.getId());
            n.put("type", m.getTypeName());
            n.put("x", m.getX());
            n.put("y", m.getY());
            n.put("hp", m.getHealth());
            n.put("maxHp", m.getMaxHealth());
            n.put("state", m.getState().toString());
            n.put("facingRight", m.isFacingRight());
            n.put("provoked", m.isProvoked());
            n.put("alpha", m.fadeAlpha(now, properties.getEnemy().getDeathAnimationMillis(),
                    properties.getEnemy().getFadeOutMillis()));
        }
        return arr;
    }

    public ArrayNode projectiles() {
        ArrayNode arr = objectMapper.createArrayNode();
        for (Projectile pr : projectiles.getProjectiles()) {
            ObjectNode n = arr.addObject();
            n.put("id", pr.getId());
            n.put("element", pr.getElement().toString());
            n.put("sprite", visuals.spriteFor(pr));
            n.put("hostile", pr.isHostile());
            n.put("x", pr.getX());
            n.put("y", pr.getY());
            n.put("dirX", pr.getDirX());
            n.put("dirY", pr.getDirY());
        }
        return arr;
    }

    public ArrayNode effects(long now) {
        ArrayNode arr = objectMapper.createArrayNode();
        for (ActiveEffect effect : effects.snapshot()) {
            ObjectNode n = arr.addObject();
            n.put("name", effect.getName());
            n.put("target", effect.getTarget().getId());
            n.put("remainingMillis", effect.remainingMillis(now));
        }
        return arr;
    }

    public ArrayNode feedback(long now) {
        ArrayNode arr = objectMapper.createArrayNode();
        for (FloatingFeedback f : feedback.getActive()) {
            ObjectNode n = arr.addObject();
            n.put("label", f.label());
            n.put("target", f.getTarget().getId());
            n.put("x", f.getTarget().getX());
            n.put("y", f.getTarget().getY() - f.riseOffset(now));
            n.put("color", f.getColor().toHex());
            n.put("alpha", f.alpha(now));
        }
        return arr;
    }

    public ArrayNode areas(long now) {
        ArrayNode arr = objectMapper.createArrayNode();
        for (AreaAnimation a : areaResolver.getAnimations()) {
            ObjectNode n = arr.addObject();
            n.put("x", a.getCenterX());
            n.put("y", a.getCenterY());
            n.put("radius", a.getRadius());
            n.put("phase", a.phase(now).toString());
            n.put("progress", a.progress(now));
        }
        return arr;
    }

    public ObjectNode cooldowns(long now) {
        ObjectNode n = objectMapper.createObjectNode();
        for (Map.Entry<String, Long> entry : cooldowns.snapshot(now).entrySet()) {
            n.put(entry.getKey(), entry.getValue());
        }
        return n;
    }

    public ArrayNode history(int limit) {
        ArrayNode arr = objectMapper.createArrayNode();
        for (DamageRecord r : pipeline.getDamageHistory(limit)) {
            ObjectNode n = arr.addObject();
            n.put("attacker", r.getAttacker() != null ? r.getAttacker().getId() : null);
            n.put("target", r.getTarget().getId());
            n.put("amount", r.getAmount());
            n.put("type", r.getType().toString());
            n.put("time", r.getTimestamp());
            n.put("survived", r.isTargetSurvived());
        }
        return arr;
    }

    public ArrayNode combos() {
        ArrayNode arr = objectMapper.createArrayNode();
        for (EffectDescriptor d : registry.getAll()) {
            ObjectNode n = arr.addObject();
            n.put("id", d.getId());
            n.put("name", d.getName());
            n.put("kind", d.getKind().toString());
            n.put("icon", visuals.iconFor(d));
            ArrayNode elements = n.putArray("elements");
            d.getElements().forEach(e -> elements.add(e.getLabel()));
            n.put("cooldownMillis", d.getCooldownMillis());
        }
        return arr;
    }
}
