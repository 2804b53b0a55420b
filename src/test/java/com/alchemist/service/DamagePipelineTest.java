package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.CombatModifier;
import com.alchemist.model.DamageRecord;
import com.alchemist.model.DamageType;
import com.alchemist.model.EnemyKind;
import com.alchemist.model.FeedbackColor;
import com.alchemist.model.FloatingFeedback;
import com.alchemist.model.Monster;
import com.alchemist.model.PlayerState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DamagePipelineTest {

    private final CombatFixture fixture = new CombatFixture();
    private final DamagePipeline pipeline = fixture.pipeline;
    private final PlayerState player = new PlayerState("p1", 0, 0);
    private final Monster demon = new Monster("demon", EnemyKind.DEMON, 50, 0);

    @Test
    void attackAppliesDamageRecordsHistoryAndFeedback() {
        assertThat(pipeline.processAttack(player, demon, DamageType.PHYSICAL, 0)).isTrue();

        assertThat(demon.getHealth()).isEqualTo(170);
        List<DamageRecord> history = pipeline.getDamageHistory(10);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getAmount()).isEqualTo(30);
        assertThat(history.get(0).isTargetSurvived()).isTrue();
        assertThat(fixture.feedback.getActive()).singleElement()
                .extracting(FloatingFeedback::getColor).isEqualTo(FeedbackColor.DAMAGE);
    }

    @Test
    void attackerOnCooldownDoesNothing() {
        pipeline.processAttack(player, demon, DamageType.PHYSICAL, 0);

        assertThat(pipeline.processAttack(player, demon, DamageType.PHYSICAL, 500)).isFalse();
        assertThat(demon.getHealth()).isEqualTo(170);
        assertThat(pipeline.processAttack(player, demon, DamageType.PHYSICAL, 1000)).isTrue();
        assertThat(demon.getHealth()).isEqualTo(140);
    }

    @Test
    void deadTargetIsRejectedWithoutSideEffects() {
        demon.takeDamage(1000, DamageType.PHYSICAL, null);

        assertThat(pipeline.processAttack(player, demon, DamageType.PHYSICAL, 0)).isFalse();
        assertThat(pipeline.getHistorySize()).isZero();
        assertThat(player.canAttack(0)).isTrue();
    }

    @Test
    void attackerModifiersApplyBeforeTargetModifiers() {
        pipeline.addModifier(player, CombatModifier.multiplier("rage", 1.5, 0), 0);
        pipeline.addModifier(demon, CombatModifier.reduction("hide", 0.5, 0), 0);

        pipeline.processAttack(player, demon, DamageType.PHYSICAL, 0);

        // 30 * 1.5 = 45, then halved and floored
        assertThat(demon.getHealth()).isEqualTo(178);
    }

    @Test
    void expiredModifiersArePurged() {
        pipeline.addModifier(player, CombatModifier.multiplier("haste", 2.0, 1000), 0);

        pipeline.purgeExpiredModifiers(999);
        assertThat(pipeline.getModifiers(player)).hasSize(1);

        pipeline.purgeExpiredModifiers(1000);
        assertThat(pipeline.getModifiers(player)).isEmpty();
    }

    @Test
    void modifiersCanBeRemovedByName() {
        pipeline.addModifier(player, CombatModifier.multiplier("rage", 1.5, 0), 0);

        assertThat(pipeline.removeModifier(player, "rage")).isTrue();
        assertThat(pipeline.removeModifier(player, "rage")).isFalse();
    }

    @Test
    void healReportsOnlyTheHealthActuallyGained() {
        player.takeDamage(40, DamageType.PHYSICAL, null);

        assertThat(pipeline.healEntity(player, 30, 0)).isEqualTo(30);
        assertThat(player.getHealth()).isEqualTo(90);

        assertThat(pipeline.healEntity(player, 30, 0)).isEqualTo(10);
        assertThat(player.getHealth()).isEqualTo(100);

        List<FloatingFeedback> feedback = fixture.feedback.getActive();
        assertThat(feedback).extracting(FloatingFeedback::getValue).containsExactly(30, 10);
        assertThat(feedback).allMatch(f -> f.getColor() == FeedbackColor.HEAL);
    }

    @Test
    void healAtFullHealthStillReportsZero() {
        assertThat(pipeline.healEntity(player, 25, 0)).isZero();
        assertThat(fixture.feedback.getActive()).singleElement()
                .extracting(FloatingFeedback::getValue).isEqualTo(0);
    }

    @Test
    void historyIsARingBuffer() {
        CombatProperties properties = new CombatProperties();
        properties.setHistoryCapacity(3);
        DamagePipeline small = new CombatFixture(properties).pipeline;

        for (int i = 1; i <= 5; i++) {
            small.applyDamage(player, demon, i, DamageType.MAGICAL, FeedbackColor.AREA, i);
        }

        assertThat(small.getHistorySize()).isEqualTo(3);
        assertThat(small.getDamageHistory(10)).extracting(DamageRecord::getAmount).containsExactly(3, 4, 5);
        assertThat(small.getDamageHistory(2)).extracting(DamageRecord::getAmount).containsExactly(4, 5);

        small.clearDamageHistory();
        assertThat(small.getHistorySize()).isZero();
    }

    @Test
    void flatDamageIsNeverNegative() {
        pipeline.applyDamage(player, demon, -40, DamageType.MAGICAL, FeedbackColor.AREA, 0);

        assertThat(demon.getHealth()).isEqualTo(200);
    }
}
