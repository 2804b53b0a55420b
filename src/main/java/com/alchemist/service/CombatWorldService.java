package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.CastResult;
import com.alchemist.model.EnemyKind;
import com.alchemist.model.Element;
import com.alchemist.model.PlayerState;
import com.alchemist.model.Rect;
import com.alchemist.model.SelectionResult;
import com.alchemist.util.ObstacleMap;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;

/**
 * Drives the frame loop and owns the player. Input from other threads is queued
 * and executed on the frame thread, so the simulation itself stays single-threaded.
 */
@Service
public class CombatWorldService {
    private static final Logger log = LoggerFactory.getLogger(CombatWorldService.class);

    private final CombatProperties properties;
    private final SimulationClock clock;
    private final MagicService magicService;
    private final EnemyService enemyService;
    private final ProjectileSimulator projectiles;
    private final AreaResolver areaResolver;
    private final FeedbackEmitter feedback;
    private final ActiveEffectTracker effects;
    private final SpellCooldownTracker cooldowns;
    private final DamagePipeline pipeline;
    private final ObstacleMap obstacles;

    private final Queue<Runnable> commands = new ConcurrentLinkedQueue<>();
    private volatile PlayerState player;

    public CombatWorldService(CombatProperties properties, SimulationClock clock, MagicService magicService,
                              EnemyService enemyService, ProjectileSimulator projectiles, AreaResolver areaResolver,
                              FeedbackEmitter feedback, ActiveEffectTracker effects, SpellCooldownTracker cooldowns,
                              DamagePipeline pipeline, ObstacleMap obstacles) {
        this.properties = properties;
        this.clock = clock;
        this.magicService = magicService;
        this.enemyService = enemyService;
        this.projectiles = projectiles;
        this.areaResolver = areaResolver;
        this.feedback = feedback;
        this.effects = effects;
        this.cooldowns = cooldowns;
        this.pipeline = pipeline;
        this.obstacles = obstacles;
        this.player = newPlayer(0, 0);
    }

    @PostConstruct
    public void init() {
        if (properties.getWorld().isSpawnDemoEncounter()) {
            loadDemoEncounter();
        }
    }

    private PlayerState newPlayer(double x, double y) {
        return new PlayerState("player", x, y, 100, properties.getManaMax(), properties.getManaRegenPerSecond());
    }

    private void loadDemoEncounter() {
        double tile = properties.getTileSize();
        obstacles.addAll(List.of(
                new Rect(3 * tile, -2 * tile, tile, 4 * tile),
                new Rect(-6 * tile, 3 * tile, 5 * tile, tile),
                new Rect(-2 * tile, -7 * tile, 4 * tile, tile)));
        enemyService.spawn(EnemyKind.DEMON, 8 * tile, 0);
        enemyService.spawn(EnemyKind.FIRE_WORM, -10 * tile, 6 * tile);
        enemyService.spawn(EnemyKind.DRAGON_LORD, 0, -10 * tile);
        log.info("Demo encounter loaded: {} obstacles, {} enemies",
                obstacles.getObstacles().size(), enemyService.size());
    }

    // --- FRAME LOOP (20 TPS by default) ---
    @Scheduled(fixedRateString = "${alchemist.combat.tick-millis:50}")
    public void gameLoop() {
        try {
            step(properties.getTickMillis() / 1000.0);
        } catch (RuntimeException e) {
            log.error("Frame {} failed", clock.getFrame(), e);
        }
    }

    /**
     * Advances the simulation by one frame. Expiry runs before queued input so an effect
     * cannot expire and be re-applied out of order within a frame.
     */
    public synchronized void step(double dtSeconds) {
        long now = clock.advance(dtSeconds);

        effects.expire(now);
        pipeline.purgeExpiredModifiers(now);
        cooldowns.expire(now);

        Runnable command;
        while ((command = commands.poll()) != null) {
            command.run();
        }

        player.regenerateMana(dtSeconds);
        enemyService.updateAll(dtSeconds, player, now);
        projectiles.update(dtSeconds, player, enemyService.getMonsters(), now);

        feedback.expire(now);
        areaResolver.expire(now);
        enemyService.removeFaded(now);
    }

    private <T> CompletableFuture<T> submit(Supplier<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        commands.add(() -> {
            try {
                result.complete(action.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    // --- INPUT COMMANDS ---

    public CompletableFuture<SelectionResult> selectElement(Element element) {
        return submit(() -> magicService.selectElement(player, element, clock.now()));
    }

    public CompletableFuture<CastResult> cast() {
        return submit(() -> magicService.cast(player, enemyService.getCandidates(), clock.now()));
    }

    public CompletableFuture<Boolean> clearSelection() {
        return submit(() -> {
            magicService.clearSelection(player);
            return true;
        });
    }

    public CompletableFuture<Boolean> face(boolean right) {
        return submit(() -> {
            player.setFacingRight(right);
            return right;
        });
    }

    public CompletableFuture<PlayerState> requestMove(double x, double y) {
        return submit(() -> processMove(x, y));
    }

    // --- MOVEMENT ---

    /**
     * Moves the player to the requested point, sliding along an axis when the full move is blocked.
     */
    PlayerState processMove(double requestedX, double requestedY) {
        if (!player.isAlive()) return player;
        double oldX = player.getX();
        if (isWalkable(requestedX, requestedY)) {
            player.setPosition(requestedX, requestedY);
        } else if (isWalkable(requestedX, player.getY())) {
            player.setPosition(requestedX, player.getY());
        } else if (isWalkable(player.getX(), requestedY)) {
            player.setPosition(player.getX(), requestedY);
        }
        if (player.getX() != oldX) {
            player.setFacingRight(player.getX() > oldX);
        }
        return player;
    }

    private boolean isWalkable(double x, double y) {
        double bound = properties.getProjectile().getWorldBound();
        if (Math.abs(x) > bound || Math.abs(y) > bound) return false;
        return !obstacles.isBlocked(player.getHitboxAt(x, y));
    }

    public PlayerState getPlayer() { return player; }
    public long getNow() { return clock.now(); }
    public int getPendingCommands() { return commands.size(); }
}
