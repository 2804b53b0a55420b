package com.alchemist.service;

import com.alchemist.config.CombatProperties;
import com.alchemist.model.CombatEntity;
import com.alchemist.model.FeedbackColor;
import com.alchemist.model.FloatingFeedback;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Floating damage and heal numbers. Logic only appends; rendering reads snapshots.
 */
@Service
public class FeedbackEmitter {
    private final List<FloatingFeedback> active = new CopyOnWriteArrayList<>();
    private final long durationMillis;

    public FeedbackEmitter(CombatProperties properties) {
        this.durationMillis = properties.getFeedbackDurationMillis();
    }

    public FloatingFeedback emit(int value, CombatEntity target, FeedbackColor color, long now) {
        FloatingFeedback feedback = new FloatingFeedback(value, target, now, durationMillis, color);
        active.add(feedback);
        return feedback;
    }

    public void expire(long now) {
        active.removeIf(f -> f.isExpired(now));
    }

    public List<FloatingFeedback> getActive() {
        return Collections.unmodifiableList(new ArrayList<>(active));
    }

    public void clear() { active.clear(); }
}
