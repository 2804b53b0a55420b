package com.alchemist.service;

import com.alchemist.model.CastResult;
import com.alchemist.model.DamageType;
import com.alchemist.model.EffectDescriptor;
import com.alchemist.model.Element;
import com.alchemist.model.EnemyKind;
import com.alchemist.model.FeedbackColor;
import com.alchemist.model.FloatingFeedback;
import com.alchemist.model.Monster;
import com.alchemist.model.PlayerState;
import com.alchemist.model.Projectile;
import com.alchemist.model.ProjectileElement;
import com.alchemist.model.SelectionResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MagicServiceTest {

    private final CombatFixture fixture = new CombatFixture();
    private final MagicService magic = fixture.magic;
    private final PlayerState caster = new PlayerState("p1", 0, 0);

    private void select(Element first, Element second, long now) {
        magic.selectElement(caster, first, now);
        magic.selectElement(caster, second, now + 150);
    }

    @Test
    void fireTwiceLaunchesAFireballAlongTheFacing() {
        assertThat(magic.selectElement(caster, Element.FIRE, 0)).isEqualTo(SelectionResult.PENDING);
        assertThat(magic.selectElement(caster, Element.FIRE, 200)).isEqualTo(SelectionResult.READY);

        EffectDescriptor ready = caster.getSelection().getReady().orElseThrow();
        assertThat(ready.getName()).isEqualTo("Fireball");
        assertThat(ready.getDamage()).isEqualTo(25);
        assertThat(ready.getCooldownMillis()).isEqualTo(3000);

        Optional<EffectDescriptor> cast = magic.castMagic(caster, List.of(), 200);

        assertThat(cast).contains(ready);
        List<Projectile> projectiles = fixture.projectiles.getProjectiles();
        assertThat(projectiles).hasSize(1);
        Projectile fireball = projectiles.get(0);
        assertThat(fireball.getElement()).isEqualTo(ProjectileElement.FIRE);
        assertThat(fireball.getX()).isZero();
        assertThat(fireball.getY()).isZero();
        assertThat(fireball.getDirX()).isEqualTo(1.0);
        assertThat(fireball.getDirY()).isZero();
        assertThat(caster.getMana()).isEqualTo(90);
        assertThat(caster.getSelection().isEmpty()).isTrue();
    }

    @Test
    void duplicateInputIsDebounced() {
        magic.selectElement(caster, Element.FIRE, 0);

        assertThat(magic.selectElement(caster, Element.FIRE, 50)).isEqualTo(SelectionResult.IGNORED);
        assertThat(caster.getSelection().size()).isEqualTo(1);
    }

    @Test
    void unknownCombinationClearsTheSelection() {
        EffectRegistry empty = mock(EffectRegistry.class);
        when(empty.resolve(any(), any())).thenReturn(Optional.empty());
        MagicService strict = new MagicService(empty, fixture.effects, fixture.combat, fixture.projectiles,
                fixture.areaResolver, fixture.cooldowns, fixture.properties);

        strict.selectElement(caster, Element.FIRE, 0);
        assertThat(strict.selectElement(caster, Element.WATER, 10)).isEqualTo(SelectionResult.INVALID_COMBO);
        assertThat(caster.getSelection().isEmpty()).isTrue();

        caster.getSelection().push(Element.FIRE, 500, 100);
        caster.getSelection().push(Element.WATER, 501, 100);
        CastResult result = strict.cast(caster, List.of(), 502);
        assertThat(result.getStatus()).isEqualTo(CastResult.Status.INVALID_COMBO);
        assertThat(caster.getSelection().isEmpty()).isTrue();
    }

    @Test
    void insufficientManaAbortsButStillClears() {
        caster.setMana(5);
        select(Element.FIRE, Element.FIRE, 0);

        CastResult result = magic.cast(caster, List.of(), 200);

        assertThat(result.getStatus()).isEqualTo(CastResult.Status.INSUFFICIENT_MANA);
        assertThat(result.getEffect()).isEmpty();
        assertThat(caster.getMana()).isEqualTo(5);
        assertThat(fixture.projectiles.getProjectiles()).isEmpty();
        assertThat(caster.getSelection().isEmpty()).isTrue();
    }

    @Test
    void halfSelectionCastsNothingAndClears() {
        magic.selectElement(caster, Element.STONE, 0);

        assertThat(magic.cast(caster, List.of(), 10).getStatus()).isEqualTo(CastResult.Status.NOTHING_SELECTED);
        assertThat(caster.getSelection().isEmpty()).isTrue();
    }

    @Test
    void spellOnCooldownKeepsManaAndClears() {
        select(Element.FIRE, Element.FIRE, 0);
        magic.cast(caster, List.of(), 200);

        select(Element.FIRE, Element.FIRE, 1000);
        CastResult blocked = magic.cast(caster, List.of(), 1300);
        assertThat(blocked.getStatus()).isEqualTo(CastResult.Status.ON_COOLDOWN);
        assertThat(blocked.getAttempted()).isPresent();
        assertThat(caster.getMana()).isEqualTo(90);
        assertThat(caster.getSelection().isEmpty()).isTrue();

        select(Element.FIRE, Element.FIRE, 3100);
        assertThat(magic.cast(caster, List.of(), 3300).isSuccess()).isTrue();
    }

    @Test
    void healingPotionHealsUpToMax() {
        caster.takeDamage(30, DamageType.PHYSICAL, null);
        select(Element.FIRE, Element.WATER, 0);

        magic.castMagic(caster, List.of(), 200);

        assertThat(caster.getHealth()).isEqualTo(100);
        FloatingFeedback heal = fixture.feedback.getActive().get(0);
        assertThat(heal.getValue()).isEqualTo(30);
        assertThat(heal.getColor()).isEqualTo(FeedbackColor.HEAL);
    }

    @Test
    void stoneShieldProtectsTheCaster() {
        select(Element.STONE, Element.STONE, 0);
        magic.castMagic(caster, List.of(), 200);

        assertThat(fixture.effects.isShielded(caster, 2199)).isTrue();
        assertThat(fixture.effects.isShielded(caster, 2200)).isFalse();
    }

    @Test
    void waterAndStoneMakesTheCasterInvisible() {
        select(Element.WATER, Element.STONE, 0);
        Optional<EffectDescriptor> cast = magic.castMagic(caster, List.of(), 200);

        assertThat(cast).map(EffectDescriptor::getName).contains("Invisibility");
        assertThat(fixture.effects.isInvisible(caster, 200)).isTrue();
        assertThat(fixture.effects.get(ActiveEffectTracker.INVISIBILITY).orElseThrow().getDurationMillis())
                .isEqualTo(5000);
    }

    @Test
    void whirlwindHitsCandidatesAroundTheCaster() {
        PlayerState centred = new PlayerState("p2", 100, 100);
        Monster near = new Monster("near", EnemyKind.DEMON, 150, 100);
        Monster far = new Monster("far", EnemyKind.DEMON, 300, 100);
        centred.getSelection().push(Element.FIRE, 0, 100);
        centred.getSelection().push(Element.STONE, 1, 100);

        magic.castMagic(centred, List.of(near, far), 10);

        assertThat(near.getHealth()).isEqualTo(190);
        assertThat(far.getHealth()).isEqualTo(200);
    }
}
