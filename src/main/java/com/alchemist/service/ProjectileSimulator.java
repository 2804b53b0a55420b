package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.Caster;
import com.alchemist.model.CombatEntity;
import com.alchemist.model.EffectDescriptor;
import com.alchemist.model.Projectile;
import com.alchemist.model.ProjectileElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class ProjectileSimulator {
    private static final Logger log = LoggerFactory.getLogger(ProjectileSimulator.class);

    private static final String[] WATER_KEYWORDS = {"water", "wasser", "ice", "eis"};
    private static final String[] FIRE_KEYWORDS = {"fire", "feuer", "fireworm", "demon", "flame", "lava"};

    private final CombatProperties.Projectile settings;
    private final CombatService combatService;

    private final List<Projectile> projectiles = new CopyOnWriteArrayList<>();
    private final AtomicLong nextId = new AtomicLong();

    public ProjectileSimulator(CombatProperties properties, CombatService combatService) {
        this.settings = properties.getProjectile();
        this.combatService = combatService;
    }

    /**
     * Spawns a spell projectile at the caster, travelling horizontally along its facing.
     */
    public Projectile spawnSpell(Caster caster, EffectDescriptor descriptor) {
        ProjectileElement element = ProjectileElement.forElements(descriptor.getElements());
        double aimX = caster.getX() + (caster.isFacingRight() ? settings.getAimOffset() : -settings.getAimOffset());
        Projectile projectile = new Projectile("proj_" + nextId.incrementAndGet(), caster, element, false,
                caster.getX(), caster.getY(), aimX, caster.getY(),
                settings.getSpeed(), descriptor.getDamage(), settings.getSize());
        projectiles.add(projectile);
        log.debug("{} projectile {} launched by {}", element, projectile.getId(), caster.getId());
        return projectile;
    }

    /**
     * Spawns an enemy projectile aimed at the target's current centre.
     */
    public Projectile spawnHostile(CombatEntity shooter, CombatEntity target) {
        Projectile projectile = new Projectile("proj_" + nextId.incrementAndGet(), shooter, ProjectileElement.EMBER, true,
                shooter.getX(), shooter.getY(), target.getX(), target.getY(),
                settings.getHostileSpeed(), shooter.getAttackDamage(), settings.getSize());
        projectiles.add(projectile);
        return projectile;
    }

    public void update(double dtSeconds, CombatEntity player, Collection<? extends CombatEntity> enemies, long now) {
        double bound = settings.getWorldBound();
        for (Projectile projectile : projectiles) {
            if (!projectile.isAlive()) continue;
            if (projectile.isOutside(bound)) {
                projectile.kill();
                continue;
            }

            projectile.advance(dtSeconds);

            if (projectile.isHostile()) {
                if (player != null && player.isAlive() && projectile.getHitbox().intersects(player.getHitbox())) {
                    hit(projectile, player, now);
                }
            } else {
                for (CombatEntity enemy : enemies) {
                    if (enemy.isAlive() && projectile.getHitbox().intersects(enemy.getHitbox())) {
                        hit(projectile, enemy, now);
                        break;
                    }
                }
            }

            if (projectile.isAlive() && projectile.isOutside(bound)) {
                projectile.kill();
            }
        }
        projectiles.removeIf(p -> !p.isAlive());
    }

    private void hit(Projectile projectile, CombatEntity target, long now) {
        ProjectileElement element = projectile.getElement();
        combatService.dealDamage(projectile.getOwner(), target, damageFor(projectile, target),
                element.getDamageType(), element.getFeedbackColor(), now);
        projectile.kill();
    }

    /**
     * Element-conditioned damage: fire is strong against water creatures, water against fire ones.
     */
    public int damageFor(Projectile projectile, CombatEntity target) {
        String type = target.getTypeName().toLowerCase(Locale.ROOT);
        switch (projectile.getElement()) {
            case FIRE:
                return matches(type, WATER_KEYWORDS) ? settings.getStrongDamage() : settings.getWeakDamage();
            case WATER:
                return matches(type, FIRE_KEYWORDS) ? settings.getStrongDamage() : settings.getWeakDamage();
            default:
                return projectile.getDamage();
        }
    }

    private static boolean matches(String type, String[] keywords) {
        for (String keyword : keywords) {
            if (type.contains(keyword)) return true;
        }
        return false;
    }

    public List<Projectile> getProjectiles() {
        return Collections.unmodifiableList(new ArrayList<>(projectiles));
    }

    public void clear() { projectiles.clear(); }
}
