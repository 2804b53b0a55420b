package com.alchemist.util;

public final class LineOfSight {

    private LineOfSight() {
    }

    /**
     * Checks if there is a clear line of sight between (x1, y1) and (x2, y2).
     * Samples the segment every {@code step} units; an empty obstacle map always sees.
     */
    public static boolean hasLineOfSight(double x1, double y1, double x2, double y2,
                                         ObstacleMap obstacles, double step) {
        if (obstacles == null || obstacles.isEmpty()) return true;
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }

        double distance = Math.hypot(x2 - x1, y2 - y1);
        if (distance == 0) return !obstacles.isBlocked(x1, y1);

        // Normalized direction
        double dx = (x2 - x1) / distance;
        double dy = (y2 - y1) / distance;

        int steps = (int) (distance / step);
        for (int i = 1; i <= steps; i++) {
            double sampleX = x1 + dx * step * i;
            double sampleY = y1 + dy * step * i;
            if (obstacles.isBlocked(sampleX, sampleY)) {
                return false;
            }
        }
        // The end point itself
        return !obstacles.isBlocked(x2, y2);
    }
}
