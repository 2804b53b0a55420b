package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.CombatEntity;
import com.alchemist.model.DamageType;
import com.alchemist.model.EnemyState;
import com.alchemist.model.Monster;
import com.alchemist.model.Rect;
import com.alchemist.model.Waypoint;
import com.alchemist.util.LineOfSight;
import com.alchemist.util.ObstacleMap;
import com.alchemist.util.Pathfinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Idle / pursue / attack / dead state machine for one enemy.
 * Every kind runs the same machine; ranged and provoked-only kinds branch on their flags.
 */
public class EnemyController {
    private static final Logger log = LoggerFactory.getLogger(EnemyController.class);

    private final Monster monster;
    private final CombatProperties.Enemy settings;
    private final ObstacleMap obstacles;
    private final CombatService combatService;
    private final ProjectileSimulator projectiles;
    private final ActiveEffectTracker effects;
    private final Optional<Pathfinder> pathfinder;

    // Path following
    private List<Waypoint> path = Collections.emptyList();
    private int pathCursor = 0;
    private long lastPathRequest = Monster.NEVER;
    private int blockedFrames = 0;

    public EnemyController(Monster monster, CombatProperties.Enemy settings, ObstacleMap obstacles,
                           CombatService combatService, ProjectileSimulator projectiles,
                           ActiveEffectTracker effects, Optional<Pathfinder> pathfinder) {
        this.monster = monster;
        this.settings = settings;
        this.obstacles = obstacles;
        this.combatService = combatService;
        this.projectiles = projectiles;
        this.effects = effects;
        this.pathfinder = pathfinder;
    }

    public void update(double dtSeconds, CombatEntity player, Collection<Monster> others, long now) {
        if (!monster.isAlive()) {
            if (monster.getState() != EnemyState.DEAD) {
                monster.enterState(EnemyState.DEAD, now);
                clearPath();
                log.info("{} died", monster);
            }
            return;
        }

        boolean targetValid = player != null && player.isAlive();
        boolean hidden = targetValid && effects.isInvisible(player, now);
        double distance = targetValid ? monster.distanceTo(player) : Double.MAX_VALUE;

        switch (monster.getState()) {
            case IDLE:
                if (targetValid && !hidden && distance <= aggroRange()) {
                    monster.enterState(EnemyState.PURSUING, now);
                    log.info("{} started pursuing {}", monster.getId(), player.getId());
                }
                break;

            case PURSUING:
                if (!targetValid || hidden) {
                    goIdle(now);
                } else if (distance > monster.getLeashRange()) {
                    log.debug("{} gave up on {} at distance {}", monster.getId(), player.getId(), Math.round(distance));
                    goIdle(now);
                } else {
                    face(player);
                    pursue(dtSeconds, player, distance, others, now);
                }
                break;

            case ATTACKING:
                if (now - monster.getStateChangedAt() >= settings.getAttackHoldMillis()) {
                    boolean keepChasing = targetValid && !hidden && distance <= monster.getLeashRange();
                    if (keepChasing) {
                        monster.enterState(EnemyState.PURSUING, now);
                    } else {
                        goIdle(now);
                    }
                }
                break;

            case DEAD:
            default:
                break;
        }
    }

    private double aggroRange() {
        if (monster.getKind().isProvokedOnly() && !monster.isProvoked()) {
            return -1;
        }
        // Once hit, an enemy reacts out to its leash range
        return monster.isProvoked()
                ? Math.max(monster.getDetectionRange(), monster.getLeashRange())
                : monster.getDetectionRange();
    }

    private void pursue(double dtSeconds, CombatEntity target, double distance, Collection<Monster> others, long now) {
        boolean ranged = monster.getKind().isRanged();
        boolean sight = hasLineOfSight(target);

        if (distance <= monster.getAttackRange() && (!ranged || sight)) {
            clearPath();
            if (monster.canAttack(now)) {
                attack(target, now);
            }
            return;
        }

        if (!path.isEmpty()) {
            if (sight && distance <= settings.getPathResumeDistance()) {
                clearPath();
            } else {
                followPath(dtSeconds, others);
                return;
            }
        }

        if ((!sight || blockedFrames >= settings.getBlockedFramesBeforePath()) && requestPath(target, now)) {
            followPath(dtSeconds, others);
            return;
        }
        moveToward(target.getX(), target.getY(), dtSeconds, others);
    }

    private void attack(CombatEntity target, long now) {
        monster.enterState(EnemyState.ATTACKING, now);
        if (monster.getKind().isRanged()) {
            projectiles.spawnHostile(monster, target);
        } else {
            combatService.processAttack(monster, target, DamageType.PHYSICAL, now);
        }
        // The swing counts even if a shield swallowed it
        monster.recordAttack(now);
    }

    private void goIdle(long now) {
        monster.enterState(EnemyState.IDLE, now);
        clearPath();
        blockedFrames = 0;
    }

    private void face(CombatEntity target) {
        if (target.getX() != monster.getX()) {
            monster.setFacingRight(target.getX() > monster.getX());
        }
    }

    // --- PATHING ---

    private boolean requestPath(CombatEntity target, long now) {
        if (pathfinder.isEmpty()) return false;
        if (lastPathRequest != Monster.NEVER && now - lastPathRequest < settings.getPathRetryMillis()) return false;
        lastPathRequest = now;

        try {
            List<Waypoint> found = pathfinder.get().findPath(monster.getX(), monster.getY(),
                    target.getX(), target.getY(), settings.getMaxSearchNodes());
            if (found == null || found.isEmpty()) return false;
            path = new ArrayList<>(found);
            pathCursor = 0;
            blockedFrames = 0;
            log.debug("{} following {} waypoints", monster.getId(), path.size());
            return true;
        } catch (RuntimeException e) {
            log.warn("Pathfinder failed for {}, pursuing directly: {}", monster.getId(), e.getMessage());
            return false;
        }
    }

    private void followPath(double dtSeconds, Collection<Monster> others) {
        Waypoint next = path.get(pathCursor);
        if (next.distanceTo(monster.getX(), monster.getY()) <= settings.getWaypointArrival()) {
            pathCursor++;
            if (pathCursor >= path.size()) {
                clearPath();
                return;
            }
            next = path.get(pathCursor);
        }
        moveToward(next.getX(), next.getY(), dtSeconds, others);
    }

    private void clearPath() {
        path = Collections.emptyList();
        pathCursor = 0;
    }

    // --- MOVEMENT ---

    /**
     * Steps towards (targetX, targetY). A blocked diagonal falls back to each axis alone
     * so the enemy slides along walls.
     */
    private void moveToward(double targetX, double targetY, double dtSeconds, Collection<Monster> others) {
        double dx = targetX - monster.getX();
        double dy = targetY - monster.getY();
        double length = Math.hypot(dx, dy);
        if (length < 1e-6) return;

        double step = Math.min(length, monster.getSpeed() * dtSeconds);
        double newX = monster.getX() + dx / length * step;
        double newY = monster.getY() + dy / length * step;

        if (isFree(newX, newY, others)) {
            monster.setPosition(newX, newY);
            blockedFrames = 0;
            return;
        }

        blockedFrames++;
        if (isFree(newX, monster.getY(), others)) {
            monster.setPosition(newX, monster.getY());
        } else if (isFree(monster.getX(), newY, others)) {
            monster.setPosition(monster.getX(), newY);
        }
    }

    private boolean isFree(double x, double y, Collection<Monster> others) {
        Rect box = monster.getHitboxAt(x, y);
        if (obstacles != null && obstacles.isBlocked(box)) return false;
        for (Monster other : others) {
            if (other == monster || !other.isAlive()) continue;
            if (box.intersects(other.getHitbox())) return false;
        }
        return true;
    }

    private boolean hasLineOfSight(CombatEntity target) {
        return LineOfSight.hasLineOfSight(monster.getX(), monster.getY(), target.getX(), target.getY(),
                obstacles, settings.getLosStep());
    }

    public Monster getMonster() { return monster; }
    public List<Waypoint> getPath() { return Collections.unmodifiableList(path); }
    public int getPathCursor() { return pathCursor; }
    public int getBlockedFrames() { return blockedFrames; }
}
