package com.alchemist.service;

import com.alchemist.model.CombatEntity;
import com.alchemist.model.EffectDescriptor;
import com.alchemist.model.EffectKind;
import com.alchemist.model.Element;
import com.alchemist.model.EnemyKind;
import com.alchemist.model.Monster;
import com.alchemist.model.PlayerState;
import com.alchemist.model.Projectile;
import com.alchemist.model.ProjectileElement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProjectileSimulatorTest {

    private final CombatFixture fixture = new CombatFixture();
    private final ProjectileSimulator simulator = fixture.projectiles;
    private final EffectDescriptor fireball = fixture.registry.resolve(Element.FIRE, Element.FIRE).orElseThrow();
    private final EffectDescriptor waterOrb = fixture.registry.resolve(Element.WATER, Element.WATER).orElseThrow();

    @Test
    void spellProjectileFollowsTheCastersFacing() {
        PlayerState caster = new PlayerState("p1", 0, 0);

        Projectile right = simulator.spawnSpell(caster, fireball);
        caster.setFacingRight(false);
        Projectile left = simulator.spawnSpell(caster, fireball);

        assertThat(right.getElement()).isEqualTo(ProjectileElement.FIRE);
        assertThat(right.getDirX()).isEqualTo(1.0);
        assertThat(right.getDirY()).isEqualTo(0.0);
        assertThat(left.getDirX()).isEqualTo(-1.0);
        assertThat(simulator.getProjectiles()).hasSize(2);
    }

    @Test
    void projectileLeavingTheWorldBoundIsRemoved() {
        PlayerState caster = new PlayerState("p1", 2990, 0);
        Projectile projectile = simulator.spawnSpell(caster, fireball);

        simulator.update(0.1, caster, List.of(), 100);

        assertThat(projectile.isAlive()).isFalse();
        assertThat(simulator.getProjectiles()).isEmpty();
    }

    @Test
    void projectileAlreadyOutsideIsRemovedOnTheNextUpdate() {
        PlayerState caster = new PlayerState("p1", 0, 3100);
        Projectile projectile = simulator.spawnSpell(caster, fireball);

        simulator.update(0.001, caster, List.of(), 1);

        assertThat(projectile.isAlive()).isFalse();
    }

    @Test
    void fireIsWeakAgainstDemonsAndWaterIsStrong() {
        PlayerState caster = new PlayerState("p1", 0, 0);
        Monster first = new Monster("m1", EnemyKind.DEMON, 100, 0);
        simulator.spawnSpell(caster, fireball);
        simulator.update(0.5, caster, List.of(first), 500);
        assertThat(first.getHealth()).isEqualTo(190);

        Monster second = new Monster("m2", EnemyKind.DEMON, 100, 0);
        simulator.spawnSpell(caster, waterOrb);
        simulator.update(0.5, caster, List.of(second), 1000);
        assertThat(second.getHealth()).isEqualTo(150);
        assertThat(simulator.getProjectiles()).isEmpty();
    }

    @Test
    void fireIsStrongAgainstIceCreatures() {
        PlayerState caster = new PlayerState("p1", 0, 0);
        CombatEntity golem = mock(CombatEntity.class);
        when(golem.getTypeName()).thenReturn("IceGolem");

        Projectile projectile = simulator.spawnSpell(caster, fireball);

        assertThat(simulator.damageFor(projectile, golem)).isEqualTo(50);
    }

    @Test
    void untaggedProjectilesUseTheirFlatDamage() {
        PlayerState caster = new PlayerState("p1", 0, 0);
        EffectDescriptor vortex = EffectDescriptor.builder("vortex", EffectKind.PROJECTILE, Element.FIRE, Element.STONE)
                .damage(25).build();
        Projectile projectile = simulator.spawnSpell(caster, vortex);

        assertThat(projectile.getElement()).isEqualTo(ProjectileElement.VORTEX);
        assertThat(simulator.damageFor(projectile, new Monster("m", EnemyKind.DEMON, 0, 0))).isEqualTo(25);
    }

    @Test
    void hostileProjectileHitsOnlyThePlayer() {
        Monster worm = new Monster("worm", EnemyKind.FIRE_WORM, 0, 0);
        Monster bystander = new Monster("bystander", EnemyKind.DEMON, 50, 0);
        PlayerState player = new PlayerState("p1", 100, 0);

        simulator.spawnHostile(worm, player);
        simulator.update(0.5, player, List.of(worm, bystander), 500);

        assertThat(bystander.getHealth()).isEqualTo(200);
        assertThat(player.getHealth()).isEqualTo(70);
        assertThat(simulator.getProjectiles()).isEmpty();
    }

    @Test
    void shieldAbsorbsHostileProjectiles() {
        Monster worm = new Monster("worm", EnemyKind.FIRE_WORM, 0, 0);
        PlayerState player = new PlayerState("p1", 100, 0);
        fixture.effects.apply(ActiveEffectTracker.SHIELD, player, 0, 2000);

        simulator.spawnHostile(worm, player);
        simulator.update(0.5, player, List.of(worm), 500);

        assertThat(player.getHealth()).isEqualTo(100);
        assertThat(simulator.getProjectiles()).isEmpty();
    }
}
