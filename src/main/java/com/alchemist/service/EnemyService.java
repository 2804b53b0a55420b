package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.CombatEntity;
import com.alchemist.model.EnemyKind;
import com.alchemist.model.EnemyState;
import com.alchemist.model.Monster;
import com.alchemist.util.ObstacleMap;
import com.alchemist.util.Pathfinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the live enemies and ticks their controllers once per frame.
 */
@Service
public class EnemyService {
    private static final Logger log = LoggerFactory.getLogger(EnemyService.class);

    private final Map<String, EnemyController> activeEnemies = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong();

    private final CombatProperties properties;
    private final ObstacleMap obstacles;
    private final CombatService combatService;
    private final ProjectileSimulator projectiles;
    private final ActiveEffectTracker effects;
    private final Optional<Pathfinder> pathfinder;

    public EnemyService(CombatProperties properties, ObstacleMap obstacles, CombatService combatService,
                        ProjectileSimulator projectiles, ActiveEffectTracker effects,
                        Optional<Pathfinder> pathfinder) {
        this.properties = properties;
        this.obstacles = obstacles;
        this.combatService = combatService;
        this.projectiles = projectiles;
        this.effects = effects;
        this.pathfinder = pathfinder;
    }

    public Optional<Monster> spawn(EnemyKind kind, double x, double y) {
        if (activeEnemies.size() >= properties.getWorld().getMaxEnemies()) {
            log.warn("Enemy cap {} reached, not spawning {}", properties.getWorld().getMaxEnemies(), kind);
            return Optional.empty();
        }
        Monster monster = new Monster("enemy_" + nextId.incrementAndGet(), kind, x, y);
        register(new EnemyController(monster, properties.getEnemy(), obstacles, combatService,
                projectiles, effects, pathfinder));
        log.info("Spawned {}", monster);
        return Optional.of(monster);
    }

    void register(EnemyController controller) {
        activeEnemies.put(controller.getMonster().getId(), controller);
    }

    /**
     * Ticks every enemy. A failure inside one controller is logged and does not stop the others.
     */
    public void updateAll(double dtSeconds, CombatEntity player, long now) {
        List<Monster> monsters = getMonsters();
        for (EnemyController controller : activeEnemies.values()) {
            try {
                controller.update(dtSeconds, player, monsters, now);
            } catch (RuntimeException e) {
                log.error("Enemy {} failed to update", controller.getMonster().getId(), e);
            }
        }
    }

    /** Removes dead enemies whose death animation and fade have both finished. */
    public int removeFaded(long now) {
        long deathMillis = properties.getEnemy().getDeathAnimationMillis();
        long fadeMillis = properties.getEnemy().getFadeOutMillis();
        int removed = 0;
        Iterator<EnemyController> it = activeEnemies.values().iterator();
        while (it.hasNext()) {
            Monster monster = it.next().getMonster();
            if (monster.isFadedOut(now, deathMillis, fadeMillis)) {
                it.remove();
                combatService.getPipeline().forget(monster);
                log.info("Removed {}", monster.getId());
                removed++;
            }
        }
        return removed;
    }

    public List<Monster> getMonsters() {
        List<Monster> monsters = new ArrayList<>();
        for (EnemyController controller : activeEnemies.values()) {
            monsters.add(controller.getMonster());
        }
        return monsters;
    }

    /** Live enemies, as offered to area effects. */
    public List<CombatEntity> getCandidates() {
        List<CombatEntity> candidates = new ArrayList<>();
        for (EnemyController controller : activeEnemies.values()) {
            if (controller.getMonster().isAlive()) candidates.add(controller.getMonster());
        }
        return candidates;
    }

    public Optional<Monster> getMonster(String id) {
        EnemyController controller = activeEnemies.get(id);
        return controller == null ? Optional.empty() : Optional.of(controller.getMonster());
    }

    public Optional<EnemyState> getState(String id) {
        return getMonster(id).map(Monster::getState);
    }

    public Map<String, EnemyController> getControllers() {
        return Collections.unmodifiableMap(activeEnemies);
    }

    public int size() { return activeEnemies.size(); }

    public void clear() { activeEnemies.clear(); }
}
