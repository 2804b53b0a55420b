package com.alchemist;

import com.alchemist.config.CombatProperties;
import com.alchemist.service.CombatWorldService;
import com.alchemist.service.EnemyService;
import com.alchemist.util.Pathfinder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "alchemist.combat.world.spawn-demo-encounter=false",
        "alchemist.combat.tick-millis=1000"
})
class AlchemistServerApplicationTest {

    @Autowired
    private CombatWorldService world;

    @Autowired
    private EnemyService enemies;

    @Autowired
    private CombatProperties properties;

    @Autowired
    private Optional<Pathfinder> pathfinder;

    @Test
    void contextWiresTheSimulation() {
        assertThat(world.getPlayer()).isNotNull();
        assertThat(enemies.size()).isZero();
        assertThat(properties.getTickMillis()).isEqualTo(1000);
        assertThat(properties.getVisuals().getIcons()).containsEntry("fireball", "icons/fireball");
        assertThat(pathfinder).isPresent();
        assertThat(properties.getSocket().getPath()).isEqualTo("/combat");
    }
}
