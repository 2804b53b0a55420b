package com.alchemist.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered element selection of one caster. Holds at most two tokens; pushing onto a full
 * buffer starts a fresh selection. Identical tokens pushed again inside the debounce window
 * are dropped so that edge- and level-triggered input sources can feed the same buffer.
 */
public class SelectionBuffer {
    public static final int CAPACITY = 2;

    private final List<Element> tokens = new ArrayList<>(CAPACITY);
    private EffectDescriptor ready;

    private Element lastPushed;
    private long lastPushTime = CombatActor.NEVER;

    /**
     * @return false when the push was swallowed by the debounce window
     */
    public boolean push(Element element, long now, long debounceMillis) {
        if (element == lastPushed && lastPushTime != CombatActor.NEVER && now - lastPushTime < debounceMillis) {
            return false;
        }
        lastPushed = element;
        lastPushTime = now;

        if (tokens.size() >= CAPACITY) {
            clear();
        }
        tokens.add(element);
        return true;
    }

    public void clear() {
        tokens.clear();
        ready = null;
    }

    public boolean isFull() { return tokens.size() == CAPACITY; }
    public boolean isEmpty() { return tokens.isEmpty(); }
    public int size() { return tokens.size(); }

    public List<Element> getTokens() {
        return Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    public Element get(int index) { return tokens.get(index); }

    public Optional<EffectDescriptor> getReady() { return Optional.ofNullable(ready); }

    public void setReady(EffectDescriptor ready) { this.ready = ready; }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (Element token : tokens) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append(token.getLabel());
        }
        return sb.toString();
    }
}
