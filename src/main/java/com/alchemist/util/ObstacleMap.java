package com.alchemist.util;

import com.alchemist.model.Rect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Static collision geometry: a set of axis-aligned rectangles indexed by a spatial hash.
 */
public class ObstacleMap {
    private final SpatialHashGrid<Rect> index;
    private final Map<String, Rect> obstacles = new ConcurrentHashMap<>();
    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong nextId = new AtomicLong();

    public ObstacleMap(double cellSize) {
        this.index = new SpatialHashGrid<>(cellSize);
    }

    public String add(Rect obstacle) {
        String id = "obstacle_" + nextId.incrementAndGet();
        obstacles.put(id, obstacle);
        index.insert(id, obstacle, obstacle);
        fireChanged();
        return id;
    }

    public void addAll(List<Rect> rects) {
        for (Rect rect : rects) {
            String id = "obstacle_" + nextId.incrementAndGet();
            obstacles.put(id, rect);
            index.insert(id, rect, rect);
        }
        fireChanged();
    }

    public boolean remove(String id) {
        Rect removed = obstacles.remove(id);
        if (removed == null) return false;
        index.remove(id);
        fireChanged();
        return true;
    }

    public void clear() {
        obstacles.clear();
        index.clear();
        fireChanged();
    }

    public boolean isBlocked(Rect area) {
        return !index.query(area).isEmpty();
    }

    public boolean isBlocked(double x, double y) {
        return !index.queryPoint(x, y).isEmpty();
    }

    public boolean isEmpty() { return obstacles.isEmpty(); }

    public List<Rect> getObstacles() {
        return Collections.unmodifiableList(new ArrayList<>(obstacles.values()));
    }

    /** Listeners run after every mutation, e.g. to rebuild a navigation grid. */
    public void addChangeListener(Runnable listener) {
        changeListeners.add(listener);
    }

    private void fireChanged() {
        for (Runnable listener : changeListeners) {
            listener.run();
        }
    }
}
