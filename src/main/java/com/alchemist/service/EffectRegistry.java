package com.alchemist.service;

import com.alchemist.model.EffectDescriptor;
import com.alchemist.model.EffectKind;
import com.alchemist.model.Element;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed table of element combinations. Both orderings of every pair are stored,
 * so lookups never have to normalise their arguments.
 */
@Service
public class EffectRegistry {

    private static final long DEFAULT_COOLDOWN = 3000;

    private final Map<String, EffectDescriptor> combos = new HashMap<>();
    private final Map<String, EffectDescriptor> byId = new LinkedHashMap<>();

    public EffectRegistry() {
        registerDefaults();
    }

    private void registerDefaults() {
        // Projectiles
        register(EffectDescriptor.builder("fireball", EffectKind.PROJECTILE, Element.FIRE, Element.FIRE)
                .name("Fireball").description("Hurls a ball of fire along the caster's facing")
                .damage(25).cooldownMillis(DEFAULT_COOLDOWN).build());
        register(EffectDescriptor.builder("water_orb", EffectKind.PROJECTILE, Element.WATER, Element.WATER)
                .name("Water Orb").description("Launches a sphere of water")
                .damage(25).cooldownMillis(DEFAULT_COOLDOWN).build());

        // Self buffs
        register(EffectDescriptor.builder("stone_shield", EffectKind.SHIELD, Element.STONE, Element.STONE)
                .name("Stone Shield").description("Blocks all incoming damage for a short time")
                .durationMillis(2000).cooldownMillis(DEFAULT_COOLDOWN).build());
        register(EffectDescriptor.builder("healing_potion", EffectKind.HEALING, Element.FIRE, Element.WATER)
                .name("Healing Potion").description("Restores health")
                .healing(50).cooldownMillis(DEFAULT_COOLDOWN).build());
        register(EffectDescriptor.builder("invisibility", EffectKind.INVISIBILITY, Element.WATER, Element.STONE)
                .name("Invisibility").description("Enemies lose track of the caster")
                .durationMillis(5000).cooldownMillis(DEFAULT_COOLDOWN).build());

        // Area
        register(EffectDescriptor.builder("whirlwind", EffectKind.AREA_ATTACK, Element.FIRE, Element.STONE)
                .name("Whirlwind").description("Damages every enemy around the caster")
                .damage(10).radius(128).cooldownMillis(DEFAULT_COOLDOWN).build());
    }

    public void register(EffectDescriptor descriptor) {
        Element first = descriptor.getElements().get(0);
        Element second = descriptor.getElements().get(1);
        EffectDescriptor existing = combos.get(key(first, second));
        if (existing != null && !existing.getId().equals(descriptor.getId())) {
            throw new IllegalStateException("Combination " + first.getLabel() + " + " + second.getLabel()
                    + " is already bound to " + existing.getId());
        }
        combos.put(key(first, second), descriptor);
        combos.put(key(second, first), descriptor);
        byId.put(descriptor.getId(), descriptor);
    }

    public Optional<EffectDescriptor> resolve(Element first, Element second) {
        if (first == null || second == null) return Optional.empty();
        return Optional.ofNullable(combos.get(key(first, second)));
    }

    public Optional<EffectDescriptor> getEffect(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Collection<EffectDescriptor> getAll() {
        return Collections.unmodifiableCollection(byId.values());
    }

    /** Lines such as "fire + fire = Fireball", one per registered effect. */
    public List<String> availableCombinations() {
        List<String> lines = new ArrayList<>();
        for (EffectDescriptor descriptor : byId.values()) {
            lines.add(descriptor.getElements().get(0).getLabel() + " + "
                    + descriptor.getElements().get(1).getLabel() + " = " + descriptor.getName());
        }
        return lines;
    }

    private static String key(Element first, Element second) {
        return first.name() + "_" + second.name();
    }
}
