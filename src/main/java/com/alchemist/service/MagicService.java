package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.Caster;
import com.alchemist.model.CastResult;
import com.alchemist.model.CombatEntity;
import com.alchemist.model.EffectDescriptor;
import com.alchemist.model.Element;
import com.alchemist.model.SelectionBuffer;
import com.alchemist.model.SelectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

/**
 * Turns element selections into spells: resolution, mana and cooldown gating,
 * and dispatch to the executor for each effect kind.
 */
@Service
public class MagicService {
    private static final Logger log = LoggerFactory.getLogger(MagicService.class);

    private final EffectRegistry registry;
    private final ActiveEffectTracker effects;
    private final CombatService combatService;
    private final ProjectileSimulator projectiles;
    private final AreaResolver areaResolver;
    private final SpellCooldownTracker cooldowns;
    private final CombatProperties properties;

    public MagicService(EffectRegistry registry, ActiveEffectTracker effects, CombatService combatService,
                        ProjectileSimulator projectiles, AreaResolver areaResolver,
                        SpellCooldownTracker cooldowns, CombatProperties properties) {
        this.registry = registry;
        this.effects = effects;
        this.combatService = combatService;
        this.projectiles = projectiles;
        this.areaResolver = areaResolver;
        this.cooldowns = cooldowns;
        this.properties = properties;
    }

    // --- SELECTION ---

    public SelectionResult selectElement(Caster caster, Element element, long now) {
        SelectionBuffer selection = caster.getSelection();
        if (!selection.push(element, now, properties.getSelectionDebounceMillis())) {
            log.debug("Ignored repeated {} from {}", element.getLabel(), caster.getId());
            return SelectionResult.IGNORED;
        }
        if (!selection.isFull()) {
            return SelectionResult.PENDING;
        }

        Optional<EffectDescriptor> resolved = registry.resolve(selection.get(0), selection.get(1));
        if (resolved.isEmpty()) {
            log.debug("No effect for {}", selection.describe());
            selection.clear();
            return SelectionResult.INVALID_COMBO;
        }
        selection.setReady(resolved.get());
        return SelectionResult.READY;
    }

    public void clearSelection(Caster caster) {
        caster.getSelection().clear();
    }

    // --- CASTING ---

    /**
     * Casts whatever the caster has selected. The selection is cleared whatever the outcome.
     *
     * @param candidates targets considered by area effects
     * @return the applied effect, or empty if nothing was cast
     */
    public Optional<EffectDescriptor> castMagic(Caster caster, Collection<? extends CombatEntity> candidates, long now) {
        return cast(caster, candidates, now).getEffect();
    }

    public CastResult cast(Caster caster, Collection<? extends CombatEntity> candidates, long now) {
        SelectionBuffer selection = caster.getSelection();
        try {
            if (!selection.isFull()) {
                return CastResult.failed(CastResult.Status.NOTHING_SELECTED, null);
            }
            Optional<EffectDescriptor> resolved = selection.getReady()
                    .or(() -> registry.resolve(selection.get(0), selection.get(1)));
            if (resolved.isEmpty()) {
                return CastResult.failed(CastResult.Status.INVALID_COMBO, null);
            }
            EffectDescriptor descriptor = resolved.get();

            if (!cooldowns.isReady(descriptor.getId(), now)) {
                log.debug("{} is cooling down ({} ms left)", descriptor.getName(),
                        cooldowns.remainingMillis(descriptor.getId(), now));
                return CastResult.failed(CastResult.Status.ON_COOLDOWN, descriptor);
            }
            if (!caster.spendMana(properties.getManaCost())) {
                log.debug("{} lacks mana for {}", caster.getId(), descriptor.getName());
                return CastResult.failed(CastResult.Status.INSUFFICIENT_MANA, descriptor);
            }

            execute(descriptor, caster, candidates, now);
            cooldowns.start(descriptor, now);
            log.info("{} cast {}", caster.getId(), descriptor.getName());
            return CastResult.cast(descriptor);
        } finally {
            selection.clear();
        }
    }

    private void execute(EffectDescriptor descriptor, Caster caster, Collection<? extends CombatEntity> candidates,
                         long now) {
        switch (descriptor.getKind()) {
            case PROJECTILE:
                projectiles.spawnSpell(caster, descriptor);
                break;
            case HEALING:
                combatService.healEntity(caster, descriptor.getHealing(), now);
                break;
            case SHIELD:
                effects.apply(ActiveEffectTracker.SHIELD, caster, now, descriptor.getDurationMillis());
                break;
            case AREA_ATTACK:
                areaResolver.resolve(caster, descriptor, candidates, now);
                break;
            case INVISIBILITY:
                effects.apply(ActiveEffectTracker.INVISIBILITY, caster, now, descriptor.getDurationMillis());
                break;
            default:
                throw new IllegalStateException("Unhandled effect kind " + descriptor.getKind());
        }
    }
}
