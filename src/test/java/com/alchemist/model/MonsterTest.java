package com.alchemist.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MonsterTest {

    @Test
    void takesStatsFromItsKind() {
        Monster worm = new Monster("w", EnemyKind.FIRE_WORM, 10, 20);

        assertThat(worm.getHealth()).isEqualTo(200);
        assertThat(worm.getTypeName()).isEqualTo("FireWorm");
        assertThat(worm.getAttackRange()).isEqualTo(512);
        assertThat(worm.getHitbox().getCenterX()).isEqualTo(10);
    }

    @Test
    void beingHurtProvokesAndLinksAggro() {
        Monster dragon = new Monster("d", EnemyKind.DRAGON_LORD, 0, 0);
        PlayerState player = new PlayerState("p1", 50, 0);

        dragon.takeDamage(5, DamageType.FIRE, player);

        assertThat(dragon.isProvoked()).isTrue();
        assertThat(dragon.getAggroSource()).isSameAs(player);
    }

    @Test
    void fadesOutLinearlyAfterTheDeathAnimation() {
        Monster demon = new Monster("m", EnemyKind.DEMON, 0, 0);
        demon.enterState(EnemyState.DEAD, 1000);

        assertThat(demon.fadeAlpha(1500, 1200, 3000)).isEqualTo(255);
        assertThat(demon.fadeAlpha(3700, 1200, 3000)).isEqualTo(128);
        assertThat(demon.isFadedOut(5199, 1200, 3000)).isFalse();
        assertThat(demon.isFadedOut(5200, 1200, 3000)).isTrue();
        assertThat(demon.fadeAlpha(5200, 1200, 3000)).isZero();
    }

    @Test
    void lookupByTypeName() {
        assertThat(EnemyKind.fromName("FireWorm")).isEqualTo(EnemyKind.FIRE_WORM);
        assertThat(EnemyKind.fromName("dragon_lord")).isEqualTo(EnemyKind.DRAGON_LORD);
    }
}
