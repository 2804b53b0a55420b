package com.alchemist.util;

import com.alchemist.model.Rect;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spatial hash for rectangle range queries. The world is cut into square cells
 * and every entry is filed under each cell its bounds touch.
 */
public class SpatialHashGrid<T> {
    private final double cellSize;
    // Map<"CellX_CellY", Set<EntryId>>
    private final Map<String, Set<String>> grid = new ConcurrentHashMap<>();
    private final Map<String, Entry<T>> entries = new ConcurrentHashMap<>();

    public SpatialHashGrid(double cellSize) {
        if (cellSize <= 0) {
            throw new IllegalArgumentException("cellSize must be positive: " + cellSize);
        }
        this.cellSize = cellSize;
    }

    private int cell(double coordinate) {
        return (int) Math.floor(coordinate / cellSize);
    }

    private static String key(int cellX, int cellY) {
        return cellX + "_" + cellY;
    }

    public void insert(String id, T value, Rect bounds) {
        remove(id);
        entries.put(id, new Entry<>(value, bounds));
        for (String key : cellsCovering(bounds)) {
            grid.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(id);
        }
    }

    public boolean remove(String id) {
        Entry<T> entry = entries.remove(id);
        if (entry == null) return false;
        for (String key : cellsCovering(entry.bounds)) {
            Set<String> bucket = grid.get(key);
            if (bucket != null) {
                bucket.remove(id);
                if (bucket.isEmpty()) {
                    grid.remove(key);
                }
            }
        }
        return true;
    }

    /**
     * Returns the values whose bounds overlap {@code area}.
     */
    public List<T> query(Rect area) {
        Set<String> seen = new HashSet<>();
        List<T> result = new ArrayList<>();
        for (String key : cellsCovering(area)) {
            Set<String> bucket = grid.get(key);
            if (bucket == null) continue;
            for (String id : bucket) {
                if (!seen.add(id)) continue;
                Entry<T> entry = entries.get(id);
                if (entry != null && entry.bounds.intersects(area)) {
                    result.add(entry.value);
                }
            }
        }
        return result;
    }

    public List<T> queryPoint(double x, double y) {
        Set<String> bucket = grid.get(key(cell(x), cell(y)));
        if (bucket == null) return Collections.emptyList();
        List<T> result = new ArrayList<>();
        for (String id : bucket) {
            Entry<T> entry = entries.get(id);
            if (entry != null && entry.bounds.contains(x, y)) {
                result.add(entry.value);
            }
        }
        return result;
    }

    private List<String> cellsCovering(Rect bounds) {
        int minX = cell(bounds.getX());
        int minY = cell(bounds.getY());
        // Right/bottom edges are exclusive
        int maxX = cell(Math.nextDown(bounds.getRight()));
        int maxY = cell(Math.nextDown(bounds.getBottom()));
        if (maxX < minX) maxX = minX;
        if (maxY < minY) maxY = minY;

        List<String> keys = new ArrayList<>();
        for (int cx = minX; cx <= maxX; cx++) {
            for (int cy = minY; cy <= maxY; cy++) {
                keys.add(key(cx, cy));
            }
        }
        return keys;
    }

    public int size() { return entries.size(); }
    public boolean isEmpty() { return entries.isEmpty(); }

    public void clear() {
        grid.clear();
        entries.clear();
    }

    private static final class Entry<T> {
        final T value;
        final Rect bounds;

        Entry(T value, Rect bounds) {
            this.value = value;
            this.bounds = bounds;
        }
    }
}
