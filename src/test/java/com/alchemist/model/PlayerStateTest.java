package com.alchemist.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlayerStateTest {

    @Test
    void negativeDamageHealsUpToMaxHealth() {
        PlayerState player = new PlayerState("p1", 0, 0);
        player.takeDamage(30, DamageType.PHYSICAL, null);
        assertThat(player.getHealth()).isEqualTo(70);

        player.takeDamage(-20, DamageType.MAGICAL, null);
        assertThat(player.getHealth()).isEqualTo(90);

        player.takeDamage(-50, DamageType.MAGICAL, null);
        assertThat(player.getHealth()).isEqualTo(100);
    }

    @Test
    void deathIsTerminal() {
        PlayerState player = new PlayerState("p1", 0, 0);

        assertThat(player.takeDamage(250, DamageType.PHYSICAL, null)).isFalse();
        assertThat(player.getHealth()).isZero();
        assertThat(player.isAlive()).isFalse();

        player.takeDamage(-50, DamageType.MAGICAL, null);
        assertThat(player.getHealth()).isZero();
        assertThat(player.canAttack(10_000)).isFalse();
    }

    @Test
    void attackCooldownIsMeasuredInSimulationTime() {
        PlayerState player = new PlayerState("p1", 0, 0);
        assertThat(player.canAttack(0)).isTrue();

        player.recordAttack(1000);
        assertThat(player.canAttack(1500)).isFalse();
        assertThat(player.canAttack(2000)).isTrue();
    }

    @Test
    void manaRegeneratesFractionally() {
        PlayerState player = new PlayerState("p1", 0, 0);
        assertThat(player.spendMana(10)).isTrue();
        assertThat(player.getMana()).isEqualTo(90);

        player.regenerateMana(0.5);
        assertThat(player.getMana()).isEqualTo(91);
        player.regenerateMana(0.5);
        assertThat(player.getMana()).isEqualTo(93);
    }

    @Test
    void spendingMoreManaThanAvailableFails() {
        PlayerState player = new PlayerState("p1", 0, 0);

        assertThat(player.spendMana(200)).isFalse();
        assertThat(player.getMana()).isEqualTo(100);
        assertThatThrownBy(() -> player.spendMana(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveMaxHealth() {
        assertThatThrownBy(() -> new PlayerState("p1", 0, 0, 0, 100, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
