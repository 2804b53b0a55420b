package com.alchemist.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Tunables for the combat simulation, bound from {@code alchemist.combat.*}.
 * Times are milliseconds of simulation time, distances are world units.
 */
@ConfigurationProperties(prefix = "alchemist.combat")
public class CombatProperties {

    private long tickMillis = 50;
    private int manaCost = 10;
    private int manaMax = 100;
    private double manaRegenPerSecond = 3.0;
    private long selectionDebounceMillis = 100;
    private int historyCapacity = 256;
    private long feedbackDurationMillis = 2500;
    private double tileSize = 64;

    private final Projectile projectile = new Projectile();
    private final Area area = new Area();
    private final Enemy enemy = new Enemy();
    private final Visuals visuals = new Visuals();
    private final Pathfinding pathfinding = new Pathfinding();
    private final World world = new World();
    private final Socket socket = new Socket();

    public long getTickMillis() { return tickMillis; }
    public void setTickMillis(long tickMillis) { this.tickMillis = tickMillis; }
    public int getManaCost() { return manaCost; }
    public void setManaCost(int manaCost) { this.manaCost = manaCost; }
    public int getManaMax() { return manaMax; }
    public void setManaMax(int manaMax) { this.manaMax = manaMax; }
    public double getManaRegenPerSecond() { return manaRegenPerSecond; }
    public void setManaRegenPerSecond(double manaRegenPerSecond) { this.manaRegenPerSecond = manaRegenPerSecond; }
    public long getSelectionDebounceMillis() { return selectionDebounceMillis; }
    public void setSelectionDebounceMillis(long selectionDebounceMillis) { this.selectionDebounceMillis = selectionDebounceMillis; }
    public int getHistoryCapacity() { return historyCapacity; }
    public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }
    public long getFeedbackDurationMillis() { return feedbackDurationMillis; }
    public void setFeedbackDurationMillis(long feedbackDurationMillis) { this.feedbackDurationMillis = feedbackDurationMillis; }
    public double getTileSize() { return tileSize; }
    public void setTileSize(double tileSize) { this.tileSize = tileSize; }

    public Projectile getProjectile() { return projectile; }
    public Area getArea() { return area; }
    public Enemy getEnemy() { return enemy; }
    public Visuals getVisuals() { return visuals; }
    public Pathfinding getPathfinding() { return pathfinding; }
    public World getWorld() { return world; }
    public Socket getSocket() { return socket; }

    public static class Projectile {
        private double speed = 150;
        private double worldBound = 3000;
        private double aimOffset = 500;
        private double size = 40;
        private int strongDamage = 50;
        private int weakDamage = 10;
        private double hostileSpeed = 200;

        public double getSpeed() { return speed; }
        public void setSpeed(double speed) { this.speed = speed; }
        public double getWorldBound() { return worldBound; }
        public void setWorldBound(double worldBound) { this.worldBound = worldBound; }
        public double getAimOffset() { return aimOffset; }
        public void setAimOffset(double aimOffset) { this.aimOffset = aimOffset; }
        public double getSize() { return size; }
        public void setSize(double size) { this.size = size; }
        public int getStrongDamage() { return strongDamage; }
        public void setStrongDamage(int strongDamage) { this.strongDamage = strongDamage; }
        public int getWeakDamage() { return weakDamage; }
        public void setWeakDamage(int weakDamage) { this.weakDamage = weakDamage; }
        public double getHostileSpeed() { return hostileSpeed; }
        public void setHostileSpeed(double hostileSpeed) { this.hostileSpeed = hostileSpeed; }
    }

    public static class Area {
        private long animationMillis = 3000;

        public long getAnimationMillis() { return animationMillis; }
        public void setAnimationMillis(long animationMillis) { this.animationMillis = animationMillis; }
    }

    public static class Enemy {
        private long attackHoldMillis = 600;
        private long deathAnimationMillis = 1200;
        private long fadeOutMillis = 3000;
        private int blockedFramesBeforePath = 8;
        private double waypointArrival = 12;
        private double pathResumeDistance = 192;
        private long pathRetryMillis = 500;
        private int maxSearchNodes = 5000;
        private double losStep = 16;

        public long getAttackHoldMillis() { return attackHoldMillis; }
        public void setAttackHoldMillis(long attackHoldMillis) { this.attackHoldMillis = attackHoldMillis; }
        public long getDeathAnimationMillis() { return deathAnimationMillis; }
        public void setDeathAnimationMillis(long deathAnimationMillis) { this.deathAnimationMillis = deathAnimationMillis; }
        public long getFadeOutMillis() { return fadeOutMillis; }
        public void setFadeOutMillis(long fadeOutMillis) { this.fadeOutMillis = fadeOutMillis; }
        public int getBlockedFramesBeforePath() { return blockedFramesBeforePath; }
        public void setBlockedFramesBeforePath(int blockedFramesBeforePath) { this.blockedFramesBeforePath = blockedFramesBeforePath; }
        public double getWaypointArrival() { return waypointArrival; }
        public void setWaypointArrival(double waypointArrival) { this.waypointArrival = waypointArrival; }
        public double getPathResumeDistance() { return pathResumeDistance; }
        public void setPathResumeDistance(double pathResumeDistance) { this.pathResumeDistance = pathResumeDistance; }
        public long getPathRetryMillis() { return pathRetryMillis; }
        public void setPathRetryMillis(long pathRetryMillis) { this.pathRetryMillis = pathRetryMillis; }
        public int getMaxSearchNodes() { return maxSearchNodes; }
        public void setMaxSearchNodes(int maxSearchNodes) { this.maxSearchNodes = maxSearchNodes; }
        public double getLosStep() { return losStep; }
        public void setLosStep(double losStep) { this.losStep = losStep; }
    }

    public static class Visuals {
        private String placeholder = "placeholder";
        // effect id or projectile element -> asset key
        private Map<String, String> icons = new HashMap<>();

        public String getPlaceholder() { return placeholder; }
        public void setPlaceholder(String placeholder) { this.placeholder = placeholder; }
        public Map<String, String> getIcons() { return icons; }
        public void setIcons(Map<String, String> icons) { this.icons = icons; }
    }

    public static class Pathfinding {
        private boolean enabled = true;
        private double originX = -3200;
        private double originY = -3200;
        private int columns = 100;
        private int rows = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public double getOriginX() { return originX; }
        public void setOriginX(double originX) { this.originX = originX; }
        public double getOriginY() { return originY; }
        public void setOriginY(double originY) { this.originY = originY; }
        public int getColumns() { return columns; }
        public void setColumns(int columns) { this.columns = columns; }
        public int getRows() { return rows; }
        public void setRows(int rows) { this.rows = rows; }
    }

    public static class World {
        private int maxEnemies = 32;
        private boolean spawnDemoEncounter = true;

        public int getMaxEnemies() { return maxEnemies; }
        public void setMaxEnemies(int maxEnemies) { this.maxEnemies = maxEnemies; }
        public boolean isSpawnDemoEncounter() { return spawnDemoEncounter; }
        public void setSpawnDemoEncounter(boolean spawnDemoEncounter) { this.spawnDemoEncounter = spawnDemoEncounter; }
    }

    public static class Socket {
        private String path = "/combat";
        private String[] allowedOrigins = {"*"};

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String[] getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(String[] allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }
}
