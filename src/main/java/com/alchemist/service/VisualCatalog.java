package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.EffectDescriptor;
import com.alchemist.model.Projectile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps effects and projectiles to asset keys for the client. A missing entry yields the
 * placeholder key, so presentation gaps never reach the simulation.
 */
@Service
public class VisualCatalog {
    private static final Logger log = LoggerFactory.getLogger(VisualCatalog.class);

    private final Map<String, String> icons;
    private final String placeholder;
    private final Set<String> reportedMissing = ConcurrentHashMap.newKeySet();

    public VisualCatalog(CombatProperties properties) {
        this.icons = properties.getVisuals().getIcons();
        this.placeholder = properties.getVisuals().getPlaceholder();
    }

    public String iconFor(EffectDescriptor descriptor) {
        return lookup(descriptor.getId());
    }

    public String spriteFor(Projectile projectile) {
        return lookup(projectile.getElement().name().toLowerCase(Locale.ROOT));
    }

    private String lookup(String key) {
        String asset = icons.get(key);
        if (asset == null || asset.isBlank()) {
            if (reportedMissing.add(key)) {
                log.warn("No visual configured for '{}', using {}", key, placeholder);
            }
            return placeholder;
        }
        return asset;
    }
}
