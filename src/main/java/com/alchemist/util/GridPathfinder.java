package com.alchemist.util;

import com.alchemist.model.Rect;
import com.alchemist.model.Waypoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 4-neighbour A* over a tile grid rasterised from an {@link ObstacleMap}.
 * The grid spans {@code columns x rows} tiles starting at world point (originX, originY).
 */
public class GridPathfinder implements Pathfinder {
    private static final Logger log = LoggerFactory.getLogger(GridPathfinder.class);

    private static final int[][] NEIGHBOURS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};

    private final ObstacleMap obstacles;
    private final double tileSize;
    private final double originX;
    private final double originY;
    private final int columns;
    private final int rows;

    private volatile boolean[] blocked;

    public GridPathfinder(ObstacleMap obstacles, double tileSize, double originX, double originY,
                          int columns, int rows) {
        if (tileSize <= 0 || columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException("Grid needs a positive tile size and dimensions");
        }
        this.obstacles = obstacles;
        this.tileSize = tileSize;
        this.originX = originX;
        this.originY = originY;
        this.columns = columns;
        this.rows = rows;
        rebuild();
    }

    /** Re-rasterises the obstacle rectangles. Called whenever the obstacle map changes. */
    public void rebuild() {
        boolean[] grid = new boolean[columns * rows];
        for (Rect rect : obstacles.getObstacles()) {
            int minCol = Math.max(0, column(rect.getX()));
            int maxCol = Math.min(columns - 1, column(Math.nextDown(rect.getRight())));
            int minRow = Math.max(0, row(rect.getY()));
            int maxRow = Math.min(rows - 1, row(Math.nextDown(rect.getBottom())));
            for (int c = minCol; c <= maxCol; c++) {
                for (int r = minRow; r <= maxRow; r++) {
                    grid[index(c, r)] = true;
                }
            }
        }
        this.blocked = grid;
        log.debug("Navigation grid rebuilt from {} obstacles", obstacles.getObstacles().size());
    }

    @Override
    public List<Waypoint> findPath(double startX, double startY, double goalX, double goalY, int maxSearchNodes) {
        boolean[] grid = this.blocked;
        int start = nudge(grid, column(startX), row(startY));
        int goal = nudge(grid, column(goalX), row(goalY));
        if (start < 0 || goal < 0) return Collections.emptyList();
        if (start == goal) return List.of(centreOf(goal));

        int size = columns * rows;
        int[] cameFrom = new int[size];
        int[] gScore = new int[size];
        boolean[] closed = new boolean[size];
        Arrays.fill(cameFrom, -1);
        Arrays.fill(gScore, Integer.MAX_VALUE);

        PriorityQueue<int[]> open = new PriorityQueue<>((a, b) -> a[1] != b[1]
                ? Integer.compare(a[1], b[1])
                : Integer.compare(a[2], b[2]));
        gScore[start] = 0;
        open.add(new int[]{start, heuristic(start, goal), 0});

        int expanded = 0;
        while (!open.isEmpty()) {
            int current = open.poll()[0];
            if (closed[current]) continue;
            if (current == goal) {
                return reconstruct(cameFrom, goal);
            }
            closed[current] = true;
            if (++expanded >= maxSearchNodes) {
                log.debug("Path search gave up after {} nodes", expanded);
                return Collections.emptyList();
            }

            int cx = current % columns;
            int cy = current / columns;
            for (int[] offset : NEIGHBOURS) {
                int nx = cx + offset[0];
                int ny = cy + offset[1];
                if (!inBounds(nx, ny)) continue;
                int next = index(nx, ny);
                if (grid[next] || closed[next]) continue;

                int tentative = gScore[current] + 1;
                if (tentative < gScore[next]) {
                    gScore[next] = tentative;
                    cameFrom[next] = current;
                    int h = heuristic(next, goal);
                    open.add(new int[]{next, tentative + h, h});
                }
            }
        }
        return Collections.emptyList();
    }

    private List<Waypoint> reconstruct(int[] cameFrom, int goal) {
        List<Waypoint> path = new ArrayList<>();
        int node = goal;
        while (cameFrom[node] != -1) {
            path.add(centreOf(node));
            node = cameFrom[node];
        }
        // Start tile is where the mover already is
        Collections.reverse(path);
        return path;
    }

    // Moves a blocked or out-of-grid endpoint to the nearest free neighbouring tile.
    private int nudge(boolean[] grid, int col, int row) {
        if (inBounds(col, row) && !grid[index(col, row)]) return index(col, row);
        for (int radius = 1; radius <= 2; radius++) {
            for (int dx = -radius; dx <= radius; dx++) {
                for (int dy = -radius; dy <= radius; dy++) {
                    int c = col + dx;
                    int r = row + dy;
                    if (inBounds(c, r) && !grid[index(c, r)]) return index(c, r);
                }
            }
        }
        return -1;
    }

    private int heuristic(int from, int to) {
        return Math.abs(from % columns - to % columns) + Math.abs(from / columns - to / columns);
    }

    private Waypoint centreOf(int node) {
        return new Waypoint(originX + (node % columns + 0.5) * tileSize,
                originY + (node / columns + 0.5) * tileSize);
    }

    public boolean isTileBlocked(double x, double y) {
        int c = column(x);
        int r = row(y);
        return !inBounds(c, r) || blocked[index(c, r)];
    }

    private int column(double x) { return (int) Math.floor((x - originX) / tileSize); }
    private int row(double y) { return (int) Math.floor((y - originY) / tileSize); }
    private int index(int col, int row) { return row * columns + col; }
    private boolean inBounds(int col, int row) { return col >= 0 && row >= 0 && col < columns && row < rows; }
}
