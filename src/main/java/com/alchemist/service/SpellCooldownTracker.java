package com.alchemist.service;

import com.alchemist.model.EffectDescriptor;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-effect cooldown timers, keyed by descriptor id.
 */
@Service
public class SpellCooldownTracker {

    private final Map<String, Cooldown> cooldowns = new ConcurrentHashMap<>();

    public void start(EffectDescriptor descriptor, long now) {
        if (descriptor.getCooldownMillis() <= 0) return;
        cooldowns.put(descriptor.getId(), new Cooldown(now, descriptor.getCooldownMillis()));
    }

    public boolean isReady(String effectId, long now) {
        return remainingMillis(effectId, now) == 0;
    }

    public long remainingMillis(String effectId, long now) {
        Cooldown cooldown = cooldowns.get(effectId);
        if (cooldown == null) return 0;
        return Math.max(0, cooldown.startedAt + cooldown.durationMillis - now);
    }

    /** 0.0 right after a cast, 1.0 once ready again. */
    public double progress(String effectId, long now) {
        Cooldown cooldown = cooldowns.get(effectId);
        if (cooldown == null) return 1.0;
        double elapsed = now - cooldown.startedAt;
        return Math.max(0.0, Math.min(1.0, elapsed / cooldown.durationMillis));
    }

    public void expire(long now) {
        cooldowns.values().removeIf(c -> now - c.startedAt >= c.durationMillis);
    }

    public Map<String, Long> snapshot(long now) {
        Map<String, Long> remaining = new LinkedHashMap<>();
        for (String id : cooldowns.keySet()) {
            long left = remainingMillis(id, now);
            if (left > 0) remaining.put(id, left);
        }
        return Collections.unmodifiableMap(remaining);
    }

    public void reset() { cooldowns.clear(); }

    private static final class Cooldown {
        final long startedAt;
        final long durationMillis;

        Cooldown(long startedAt, long durationMillis) {
            this.startedAt = startedAt;
            this.durationMillis = durationMillis;
        }
    }
}
